/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.tracking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.core.Logger;
import org.cloudmonitor.TestHelpers;
import org.cloudmonitor.ad.ml.ForestParameters;
import org.cloudmonitor.ad.ml.StatBaseline;
import org.cloudmonitor.ad.model.RunSummary;
import org.cloudmonitor.timeseries.AbstractTimeSeriesTest;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

public class LoggingExperimentTrackerTests extends AbstractTimeSeriesTest {
    private Pair<TestAppender, Logger> tracking;
    private LoggingExperimentTracker tracker;

    @Before
    public void setUp() {
        tracking = getLog4jAppenderForJUnit(LoggingExperimentTracker.TRACKING_LOGGER, false);
        tracker = new LoggingExperimentTracker(TestHelpers.gson());
    }

    @After
    public void tearDown() {
        tearDownLog4jForJUnit(tracking.getLeft(), tracking.getRight());
    }

    private JsonObject lastLine() {
        TestAppender appender = tracking.getLeft();
        assertTrue(appender.messages.size() > 0);
        return JsonParser.parseString(appender.messages.get(appender.messages.size() - 1)).getAsJsonObject();
    }

    @Test
    public void testRecordTrainingRun() {
        TrainingRunMetadata metadata = TrainingRunMetadata
            .builder()
            .runId("run-1")
            .startTime(TestHelpers.START)
            .durationMillis(12)
            .hyperparameters(new ForestParameters(0.1, 100, 256, 42L).toMap())
            .dataPoints(45)
            .trained(MetricPair.of("api-gateway", "cpu_usage"), new StatBaseline(new double[] { 180, 220 }))
            .skipped(MetricPair.of("database", "cpu_usage"), 5)
            .build();

        tracker.recordTrainingRun(metadata);

        JsonObject json = lastLine();
        assertEquals("train", json.get("type").getAsString());
        assertEquals("run-1", json.get("run_id").getAsString());
        assertEquals(TestHelpers.START.toString(), json.get("start_time").getAsString());
        assertEquals(45, json.get("data_points").getAsInt());
        assertEquals(1, json.get("models_trained").getAsInt());
        assertEquals("random_cut_forest", json.getAsJsonObject("params").get("algorithm").getAsString());
        assertEquals(200.0, json.getAsJsonObject("pairs").getAsJsonObject("api-gateway/cpu_usage").get("mean").getAsDouble(), 1e-9);
        assertEquals(5, json.getAsJsonObject("skipped").get("database/cpu_usage").getAsInt());
    }

    @Test
    public void testRecordDetectionRun() {
        tracker.recordDetectionRun(new RunSummary("run-2", TestHelpers.START, 4, 1));

        JsonObject json = lastLine();
        assertEquals("detect", json.get("type").getAsString());
        assertEquals(4, json.get("total_predictions").getAsInt());
        assertEquals(1, json.get("total_anomalies").getAsInt());
        assertEquals(0.25, json.get("anomaly_rate").getAsDouble(), 0);
    }
}
