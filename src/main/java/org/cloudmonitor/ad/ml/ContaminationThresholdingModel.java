/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Places the threshold at the (1 - contamination) quantile of the training scores, so that the
 * expected share of training points flagged as anomalous equals the contamination fraction.
 * Quantiles use linear interpolation between the two closest ranks.
 */
public class ContaminationThresholdingModel implements ThresholdingModel {
    private final double contamination;
    private double threshold;
    private boolean trained;

    public ContaminationThresholdingModel(double contamination) {
        Preconditions.checkArgument(contamination > 0 && contamination < 1, "contamination must be in (0, 1)");
        this.contamination = contamination;
        this.threshold = Double.POSITIVE_INFINITY;
        this.trained = false;
    }

    /**
     * Restores a trained model from its threshold.
     *
     * @param contamination contamination fraction the threshold was trained with
     * @param threshold trained threshold
     */
    public ContaminationThresholdingModel(double contamination, double threshold) {
        this(contamination);
        this.threshold = threshold;
        this.trained = true;
    }

    @Override
    public void train(double[] anomalyScores) {
        Preconditions.checkArgument(anomalyScores != null && anomalyScores.length > 0, "anomaly scores must not be empty");
        double[] sorted = Arrays.copyOf(anomalyScores, anomalyScores.length);
        Arrays.sort(sorted);
        double position = (1 - contamination) * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        this.threshold = sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
        this.trained = true;
    }

    @Override
    public double grade(double anomalyScore) {
        if (!trained || anomalyScore <= threshold) {
            return 0;
        }
        if (threshold <= 0) {
            return 1;
        }
        return Math.min(1, (anomalyScore - threshold) / anomalyScore);
    }

    @Override
    public double getThreshold() {
        return threshold;
    }

    public double getContamination() {
        return contamination;
    }

    public boolean isTrained() {
        return trained;
    }
}
