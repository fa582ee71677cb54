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

package org.cloudmonitor.ad.stats;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Enum containing names of all stats the engine keeps.
 */
public enum StatNames {
    MODEL_COUNT("model_count"),
    TRAINING_RUN_COUNT("training_run_count"),
    PAIRS_TRAINED_COUNT("pairs_trained_count"),
    PAIRS_SKIPPED_COUNT("pairs_skipped_count"),
    TRAINING_FAILURE_COUNT("training_failure_count"),
    DETECTION_RUN_COUNT("detection_run_count"),
    PREDICTION_COUNT("prediction_count"),
    ANOMALY_COUNT("anomaly_count"),
    PREDICTION_FAILURE_COUNT("prediction_failure_count"),
    LAST_DETECTION_TIME("last_detection_time"),
    CHECKPOINT_WRITE_COUNT("checkpoint_write_count"),
    CHECKPOINT_FAILURE_COUNT("checkpoint_failure_count"),
    TRACKING_FAILURE_COUNT("tracking_failure_count"),
    EXPORT_FAILURE_COUNT("export_failure_count");

    private final String name;

    StatNames(String name) {
        this.name = name;
    }

    /**
     * Get stat name
     *
     * @return name
     */
    public String getName() {
        return name;
    }

    /**
     * Get set of stat names
     *
     * @return set of stat names
     */
    public static Set<String> getNames() {
        Set<String> names = new LinkedHashSet<>();

        for (StatNames statName : StatNames.values()) {
            names.add(statName.getName());
        }
        return names;
    }
}
