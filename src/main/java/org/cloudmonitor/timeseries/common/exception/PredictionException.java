/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.common.exception;

/**
 * A model could not score an input, e.g. a non-finite value or a feature vector of the wrong dimension.
 */
public class PredictionException extends TimeSeriesException {

    public PredictionException(String pairId, String message) {
        super(pairId, message);
    }

    public PredictionException(String pairId, String message, Throwable cause) {
        super(pairId, message, cause);
    }
}
