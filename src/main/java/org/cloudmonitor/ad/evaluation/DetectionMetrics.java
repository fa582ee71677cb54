/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Accuracy, precision, recall and F1 over a confusion matrix. Every ratio divides by at least
 * {@link #EPSILON}, so an empty matrix yields zeros instead of NaN.
 */
public class DetectionMetrics {
    public static final double EPSILON = 1e-10;

    private final long truePositives;
    private final long falsePositives;
    private final long trueNegatives;
    private final long falseNegatives;

    public DetectionMetrics(long truePositives, long falsePositives, long trueNegatives, long falseNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.trueNegatives = trueNegatives;
        this.falseNegatives = falseNegatives;
    }

    public double getAccuracy() {
        return (truePositives + trueNegatives) / Math.max(EPSILON, truePositives + trueNegatives + falsePositives + falseNegatives);
    }

    public double getPrecision() {
        return truePositives / Math.max(EPSILON, truePositives + falsePositives);
    }

    public double getRecall() {
        return truePositives / Math.max(EPSILON, truePositives + falseNegatives);
    }

    public double getF1Score() {
        double precision = getPrecision();
        double recall = getRecall();
        return 2 * precision * recall / Math.max(EPSILON, precision + recall);
    }

    public long getTruePositives() {
        return truePositives;
    }

    public long getFalsePositives() {
        return falsePositives;
    }

    public long getTrueNegatives() {
        return trueNegatives;
    }

    public long getFalseNegatives() {
        return falseNegatives;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("true_positives", truePositives);
        counts.put("false_positives", falsePositives);
        counts.put("true_negatives", trueNegatives);
        counts.put("false_negatives", falseNegatives);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("accuracy", getAccuracy());
        metrics.put("precision", getPrecision());
        metrics.put("recall", getRecall());
        metrics.put("f1_score", getF1Score());
        metrics.put("counts", counts);
        return metrics;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("tp", truePositives)
            .append("fp", falsePositives)
            .append("tn", trueNegatives)
            .append("fn", falseNegatives)
            .toString();
    }
}
