/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.constant;

public class CommonMessages {
    public static final String EMPTY_SERVICE = "service must not be empty";
    public static final String EMPTY_METRIC = "metric must not be empty";
    public static final String NON_FINITE_VALUE = "value must be a finite number";
    public static final String NO_MODEL_MSG = "No model found for ";
    public static final String NO_CHECKPOINT_MSG = "No checkpoint found for ";
    public static final String INVALID_FEATURE_DIMENSION = "Feature dimension is not correct, we expect %d but get %d";
    public static final String CHECKPOINT_TOO_LARGE = "Checkpoint of %s is too large: %d bytes";
    public static final String CHECKPOINT_PAIR_MISMATCH = "Checkpoint %s holds the model of %s, not %s";
}
