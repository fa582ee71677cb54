/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.evaluation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudmonitor.timeseries.model.MetricPair;

import com.google.common.collect.ImmutableList;

/**
 * Compares predicted anomaly labels with known ground truth and keeps a running confusion
 * matrix. Thread-safe.
 */
public class DetectionEvaluator {
    private static final Logger logger = LogManager.getLogger(DetectionEvaluator.class);

    private final List<EvaluationRecord> history = new ArrayList<>();
    private long truePositives;
    private long falsePositives;
    private long trueNegatives;
    private long falseNegatives;

    /**
     * Records one labelled prediction.
     *
     * @param predictedAnomaly whether the engine flagged the point
     * @param actualAnomaly whether the point really was anomalous
     * @param pair pair of the point
     * @param timestamp time of the point
     * @param value value of the point
     * @return metrics including this prediction
     */
    public synchronized DetectionMetrics recordPrediction(
        boolean predictedAnomaly,
        boolean actualAnomaly,
        MetricPair pair,
        Instant timestamp,
        double value
    ) {
        EvaluationRecord record = new EvaluationRecord(timestamp, pair, value, predictedAnomaly, actualAnomaly);
        switch (record.getOutcome()) {
            case TRUE_POSITIVE:
                truePositives++;
                break;
            case FALSE_POSITIVE:
                falsePositives++;
                break;
            case FALSE_NEGATIVE:
                falseNegatives++;
                break;
            default:
                trueNegatives++;
                break;
        }
        history.add(record);
        logger.debug("Recorded {} for {} at {}", record.getOutcome().getName(), pair, timestamp);
        return calculateMetrics();
    }

    public synchronized DetectionMetrics calculateMetrics() {
        return new DetectionMetrics(truePositives, falsePositives, trueNegatives, falseNegatives);
    }

    public synchronized List<EvaluationRecord> getHistory() {
        return ImmutableList.copyOf(history);
    }

    public synchronized void reset() {
        history.clear();
        truePositives = 0;
        falsePositives = 0;
        trueNegatives = 0;
        falseNegatives = 0;
    }
}
