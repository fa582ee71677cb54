/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.cloudmonitor.timeseries.constant;

public class CommonName {

    // ======================================
    // Checkpoint
    // ======================================
    // used for detecting incompatible checkpoints
    public static final String SCHEMA_VERSION_FIELD = "schema_version";
    public static final String SERVICE_FIELD = "service";
    public static final String METRIC_FIELD = "metric";
    public static final String TIMESTAMP = "timestamp";
    public static final String FEATURE_NAMES_FIELD = "feature_names";
    public static final String THRESHOLD_FIELD = "threshold";
    public static final String CONTAMINATION_FIELD = "contamination";
    public static final String NUM_TREES_FIELD = "num_trees";
    public static final String SAMPLE_SIZE_FIELD = "sample_size";
    public static final String RANDOM_SEED_FIELD = "random_seed";
    public static final String BASELINE_FIELD = "baseline";
    public static final String CHECKPOINT_TIME_FIELD = "checkpoint_time";
    public static final String FIELD_MODELV2 = "modelV2";

    public static final String CHECKPOINT_FILE_SUFFIX = "_model.ckpt";

    // ======================================
    // Used in stats and tracking output
    // ======================================
    public static final String MODEL_ID_KEY = "model_id";
    public static final String SAMPLE_COUNT_KEY = "sample_count";
    public static final String MEAN_KEY = "mean";
    public static final String STD_KEY = "std";
    public static final String MIN_KEY = "min";
    public static final String MAX_KEY = "max";
    public static final String LAST_TRAINED_TIME_KEY = "last_trained_time";
    public static final String LAST_CHECKPOINT_TIME_KEY = "last_checkpoint_time";

    // ======================================
    // Features
    // ======================================
    public static final String VALUE_FEATURE = "value";
}
