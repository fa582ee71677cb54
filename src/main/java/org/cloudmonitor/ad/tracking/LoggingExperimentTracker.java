/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.tracking;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudmonitor.ad.model.RunSummary;

import com.google.gson.Gson;

/**
 * Writes one JSON line per run to the {@code cloudmonitor.tracking} logger, which log4j2.xml can
 * route to its own file.
 */
public class LoggingExperimentTracker implements ExperimentTracker {
    public static final String TRACKING_LOGGER = "cloudmonitor.tracking";

    private static final Logger trackingLogger = LogManager.getLogger(TRACKING_LOGGER);

    private final Gson gson;

    public LoggingExperimentTracker(Gson gson) {
        this.gson = gson;
    }

    @Override
    public void recordTrainingRun(TrainingRunMetadata metadata) {
        Map<String, Object> run = new LinkedHashMap<>();
        run.put("type", "train");
        run.put("run_id", metadata.getRunId());
        run.put("start_time", metadata.getStartTime() == null ? null : metadata.getStartTime().toString());
        run.put("duration_ms", metadata.getDurationMillis());
        run.put("params", metadata.getHyperparameters());
        run.put("data_points", metadata.getDataPoints());
        run.put("models_trained", metadata.getTrainedPairs().size());
        run.put("pairs", metadata.getTrainedPairs());
        run.put("skipped", metadata.getSkippedPairs());
        run.put("failed", metadata.getFailedPairs());
        trackingLogger.info(gson.toJson(run));
    }

    @Override
    public void recordDetectionRun(RunSummary summary) {
        Map<String, Object> run = new LinkedHashMap<>();
        run.put("type", "detect");
        run.put("run_id", summary.getRunId());
        run.put("start_time", summary.getStartTime() == null ? null : summary.getStartTime().toString());
        run.put("total_predictions", summary.getTotalPredictions());
        run.put("total_anomalies", summary.getTotalAnomalies());
        run.put("anomaly_rate", summary.getAnomalyRate());
        trackingLogger.info(gson.toJson(run));
    }
}
