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

package org.cloudmonitor.ad.ml;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.cloudmonitor.ad.model.AnomalyRecord;
import org.cloudmonitor.ad.model.DataPoint;
import org.cloudmonitor.ad.model.RunSummary;
import org.cloudmonitor.ad.model.Severity;
import org.cloudmonitor.ad.stats.ADStats;
import org.cloudmonitor.ad.stats.MetricsExporter;
import org.cloudmonitor.ad.stats.StatNames;
import org.cloudmonitor.ad.tracking.ExperimentTracker;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.cloudmonitor.timeseries.util.ErrorBoundary;
import org.opensearch.common.UUIDs;

/**
 * Runs detection over a batch of new points.
 *
 * Only the most recent point of each pair is scored. Pairs without a model are skipped, and a
 * failure on one pair never affects the others. Scoring does not change any model, so the same
 * batch against the same registry always yields the same records.
 */
public class MetricAnomalyDetector {
    private static final Logger logger = LogManager.getLogger(MetricAnomalyDetector.class);

    private final ModelRegistry registry;
    private final SeverityScorer scorer;
    private final RunTracker runTracker;
    private final MetricsExporter exporter;
    private final ExperimentTracker tracker;
    private final Executor sideEffectExecutor;
    private final ADStats stats;
    private final Clock clock;

    public MetricAnomalyDetector(
        ModelRegistry registry,
        SeverityScorer scorer,
        RunTracker runTracker,
        MetricsExporter exporter,
        ExperimentTracker tracker,
        Executor sideEffectExecutor,
        ADStats stats,
        Clock clock
    ) {
        this.registry = registry;
        this.scorer = scorer;
        this.runTracker = runTracker;
        this.exporter = exporter;
        this.tracker = tracker;
        this.sideEffectExecutor = sideEffectExecutor;
        this.stats = stats;
        this.clock = clock;
    }

    /**
     * Scores the latest point of every pair in the batch.
     *
     * @param points new points of any number of pairs
     * @return anomalies in order of each pair's first appearance in the batch
     */
    public List<AnomalyRecord> detect(List<DataPoint> points) {
        Instant startTime = clock.instant();
        String runId = UUIDs.base64UUID();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        int predictions = 0;
        for (DataPoint point : latestPerPair(points).values()) {
            MetricPair pair = point.getPair();
            Optional<ModelState> state = registry.getState(pair);
            if (!state.isPresent()) {
                logger.debug("No model for {}, skipping", pair);
                continue;
            }
            try {
                ThresholdingResult result = state.get().getModel().predict(new double[] { point.getValue() });
                predictions++;
                if (result.isAnomaly()) {
                    Severity severity = scorer.severity(state.get().getBaseline(), point.getValue());
                    anomalies.add(new AnomalyRecord(point.getTimestamp(), pair, point.getValue(), severity));
                    logger
                        .info(
                            "Anomaly on {} at {}: value {} score {} threshold {} severity {}",
                            pair,
                            point.getTimestamp(),
                            point.getValue(),
                            result.getRcfScore(),
                            result.getThreshold(),
                            severity.getName()
                        );
                }
            } catch (RuntimeException e) {
                logger.warn(new ParameterizedMessage("Prediction failed for [{}]", pair), e);
                stats.increment(StatNames.PREDICTION_FAILURE_COUNT);
            }
        }

        RunSummary summary = new RunSummary(runId, startTime, predictions, anomalies.size());
        runTracker.record(summary);
        stats.increment(StatNames.DETECTION_RUN_COUNT);
        stats.add(StatNames.PREDICTION_COUNT, predictions);
        stats.add(StatNames.ANOMALY_COUNT, anomalies.size());
        stats.getStat(StatNames.LAST_DETECTION_TIME).setValue(startTime.toEpochMilli());
        logger.info("Detection run {}: {} predictions, {} anomalies", runId, predictions, anomalies.size());

        List<AnomalyRecord> result = Collections.unmodifiableList(anomalies);
        ErrorBoundary
            .runQuietly(
                "Exporting detection run " + runId,
                stats.getStat(StatNames.EXPORT_FAILURE_COUNT),
                () -> exporter.onDetection(result, summary)
            );
        // a run that predicted nothing is not an experiment
        if (predictions > 0) {
            ErrorBoundary
                .submitQuietly(
                    sideEffectExecutor,
                    "Recording detection run " + runId,
                    stats.getStat(StatNames.TRACKING_FAILURE_COUNT),
                    () -> tracker.recordDetectionRun(summary)
                );
        }
        return result;
    }

    /**
     * @param points batch
     * @return the point with the greatest timestamp per pair, the later one in the batch on ties
     */
    private Map<MetricPair, DataPoint> latestPerPair(List<DataPoint> points) {
        Map<MetricPair, DataPoint> latest = new LinkedHashMap<>();
        for (DataPoint point : points) {
            DataPoint current = latest.get(point.getPair());
            if (current == null || !point.getTimestamp().isBefore(current.getTimestamp())) {
                latest.put(point.getPair(), point);
            }
        }
        return latest;
    }

    public RunTracker getRunTracker() {
        return runTracker;
    }
}
