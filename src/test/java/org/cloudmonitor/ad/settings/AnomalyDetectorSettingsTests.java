/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.settings;

import static org.cloudmonitor.timeseries.AbstractTimeSeriesTest.expectThrows;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.opensearch.common.settings.Settings;

public class AnomalyDetectorSettingsTests {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDefaults() {
        Settings settings = Settings.EMPTY;
        assertEquals("./models", AnomalyDetectorSettings.MODELS_DIR.get(settings));
        assertEquals(20, (int) AnomalyDetectorSettings.MIN_TRAINING_SAMPLES.get(settings));
        assertTrue(AnomalyDetectorSettings.PERSIST_MODELS.get(settings));
        assertEquals(0.8, AnomalyDetectorSettings.SEVERITY_LOW_THRESHOLD.get(settings), 0);
        assertEquals(1.5, AnomalyDetectorSettings.SEVERITY_HIGH_THRESHOLD.get(settings), 0);
    }

    @Test
    public void testLoadBundledConfig() throws IOException {
        Settings settings = AnomalyDetectorSettings.loadDefault();
        assertEquals(0.1, AnomalyDetectorSettings.CONTAMINATION.get(settings), 0);
        assertEquals(100, (int) AnomalyDetectorSettings.NUM_TREES.get(settings));
        assertEquals(42L, (long) AnomalyDetectorSettings.RANDOM_SEED.get(settings));
        assertEquals(20, (int) AnomalyDetectorSettings.MIN_TRAINING_SAMPLES.get(settings));
        assertEquals("Scale up {service} instances by 50%", settings.get("remediation.actions.cpu_usage.high"));
    }

    @Test
    public void testLoadFromFile() throws IOException {
        Path config = folder.newFile("config.yml").toPath();
        String yaml = "general:\n"
            + "  models_dir: /var/lib/models\n"
            + "ml:\n"
            + "  training:\n"
            + "    min_samples: 50\n"
            + "    persist_models: false\n"
            + "  detection:\n"
            + "    severity_thresholds:\n"
            + "      low: 1.0\n"
            + "      high: 2.0\n";
        Files.write(config, yaml.getBytes(StandardCharsets.UTF_8));

        Settings settings = AnomalyDetectorSettings.load(config);

        assertEquals("/var/lib/models", AnomalyDetectorSettings.MODELS_DIR.get(settings));
        assertEquals(50, (int) AnomalyDetectorSettings.MIN_TRAINING_SAMPLES.get(settings));
        assertEquals(false, AnomalyDetectorSettings.PERSIST_MODELS.get(settings));
        assertEquals(2.0, AnomalyDetectorSettings.SEVERITY_HIGH_THRESHOLD.get(settings), 0);
        // unset keys keep their defaults
        assertEquals(256, (int) AnomalyDetectorSettings.NUM_SAMPLES_PER_TREE.get(settings));
    }

    @Test
    public void testOutOfRangeValueRejected() {
        Settings settings = Settings.builder().put(AnomalyDetectorSettings.NUM_SAMPLES_PER_TREE.getKey(), 4).build();
        expectThrows(IllegalArgumentException.class, () -> AnomalyDetectorSettings.NUM_SAMPLES_PER_TREE.get(settings));

        Settings contamination = Settings.builder().put(AnomalyDetectorSettings.CONTAMINATION.getKey(), 0.7).build();
        expectThrows(IllegalArgumentException.class, () -> AnomalyDetectorSettings.CONTAMINATION.get(contamination));
    }

    @Test
    public void testMissingFile() {
        expectThrows(IOException.class, () -> AnomalyDetectorSettings.load(folder.getRoot().toPath().resolve("missing.yml")));
    }
}
