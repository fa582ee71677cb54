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

package org.cloudmonitor.ad.settings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;

/**
 * Settings of the anomaly detection engine. Keys follow the layout of config.yaml.
 */
public final class AnomalyDetectorSettings {

    private AnomalyDetectorSettings() {}

    public static final String DEFAULT_CONFIG_RESOURCE = "config.yaml";

    // ======================================
    // General
    // ======================================
    public static final Setting<String> MODELS_DIR = Setting.simpleString("general.models_dir", "./models", Setting.Property.NodeScope);

    // ======================================
    // Training
    // ======================================
    public static final Setting<Integer> MIN_TRAINING_SAMPLES = Setting
        .intSetting("ml.training.min_samples", 20, 1, Setting.Property.NodeScope);

    public static final Setting<Boolean> PERSIST_MODELS = Setting.boolSetting("ml.training.persist_models", true, Setting.Property.NodeScope);

    // ======================================
    // Model parameters
    // ======================================
    // expected share of anomalies in training data; 0 itself is rejected when the trainer is built
    public static final Setting<Double> CONTAMINATION = Setting
        .doubleSetting("ml.isolation_forest.contamination", 0.1, 0, 0.5, Setting.Property.NodeScope);

    public static final Setting<Integer> NUM_TREES = Setting
        .intSetting("ml.isolation_forest.n_estimators", 100, 1, 1000, Setting.Property.NodeScope);

    // points kept by each tree
    public static final Setting<Integer> NUM_SAMPLES_PER_TREE = Setting
        .intSetting("ml.isolation_forest.max_samples", 256, 16, 2048, Setting.Property.NodeScope);

    public static final Setting<Long> RANDOM_SEED = Setting
        .longSetting("ml.isolation_forest.random_state", 42L, Long.MIN_VALUE, Setting.Property.NodeScope);

    // ======================================
    // Severity
    // ======================================
    // |z| below low is LOW, [low, high) is MEDIUM, high and above is HIGH
    public static final Setting<Double> SEVERITY_LOW_THRESHOLD = Setting
        .doubleSetting("ml.detection.severity_thresholds.low", 0.8, 0, Setting.Property.NodeScope);

    public static final Setting<Double> SEVERITY_HIGH_THRESHOLD = Setting
        .doubleSetting("ml.detection.severity_thresholds.high", 1.5, 0, Setting.Property.NodeScope);

    // ======================================
    // Remediation
    // ======================================
    // remediation.actions.<metric>.<severity> = template with a {service} placeholder
    public static final String REMEDIATION_ACTIONS_PREFIX = "remediation.actions.";

    // ======================================
    // Checkpoint setting
    // ======================================
    // we won't accept a checkpoint larger than 30MB. Or we risk OOM.
    public static final int MAX_CHECKPOINT_BYTES = 30_000_000;

    // Sets the cap on the number of buffer that can be allocated by the rcf serialization
    // buffer pool. Each buffer is of 512 bytes. Memory occupied by 20 buffers is 10.24 KB.
    public static final int MAX_TOTAL_RCF_SERIALIZATION_BUFFERS = 20;

    // the size of the buffer used for rcf serialization
    public static final int SERIALIZATION_BUFFER_BYTES = 512;

    // bump when the checkpoint layout changes
    public static final int CHECKPOINT_SCHEMA_VERSION = 1;

    public static List<Setting<?>> getSettings() {
        return Collections
            .unmodifiableList(
                Arrays
                    .asList(
                        MODELS_DIR,
                        MIN_TRAINING_SAMPLES,
                        PERSIST_MODELS,
                        CONTAMINATION,
                        NUM_TREES,
                        NUM_SAMPLES_PER_TREE,
                        RANDOM_SEED,
                        SEVERITY_LOW_THRESHOLD,
                        SEVERITY_HIGH_THRESHOLD
                    )
            );
    }

    /**
     * Loads settings from a YAML or JSON file.
     *
     * @param path config file
     * @return settings
     * @throws IOException when the file cannot be read or parsed
     */
    public static Settings load(Path path) throws IOException {
        return Settings.builder().loadFromPath(path).build();
    }

    /**
     * Loads the bundled config.yaml.
     *
     * @return settings
     * @throws IOException when the resource is missing or cannot be parsed
     */
    public static Settings loadDefault() throws IOException {
        try (InputStream in = AnomalyDetectorSettings.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing resource " + DEFAULT_CONFIG_RESOURCE);
            }
            return Settings.builder().loadFromStream(DEFAULT_CONFIG_RESOURCE, in, false).build();
        }
    }
}
