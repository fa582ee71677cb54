/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.cloudmonitor.timeseries.common.exception.PredictionException;
import org.cloudmonitor.timeseries.constant.CommonMessages;
import org.cloudmonitor.timeseries.model.MetricPair;

import com.amazon.randomcutforest.RandomCutForest;
import com.google.common.collect.ImmutableList;

/**
 * A fitted anomaly model bound to one (service, metric) pair: a random cut forest plus the
 * threshold that turns its scores into a normal / anomalous label.
 *
 * Scoring never updates the forest, so predictions are repeatable.
 */
public class PairModel {
    private final MetricPair pair;
    private final List<String> featureNames;
    private final RandomCutForest forest;
    private final ContaminationThresholdingModel thresholding;
    private final ForestParameters parameters;

    public PairModel(
        MetricPair pair,
        List<String> featureNames,
        RandomCutForest forest,
        ContaminationThresholdingModel thresholding,
        ForestParameters parameters
    ) {
        this.pair = pair;
        this.featureNames = ImmutableList.copyOf(featureNames);
        this.forest = forest;
        this.thresholding = thresholding;
        this.parameters = parameters;
    }

    /**
     * Scores a feature vector and labels it.
     *
     * @param features one value per feature name
     * @return score, threshold and label
     * @throws PredictionException when the vector has the wrong dimension or a non-finite value
     */
    public ThresholdingResult predict(double[] features) {
        double score = score(features);
        return new ThresholdingResult(thresholding.grade(score), score, thresholding.getThreshold());
    }

    /**
     * @param features one value per feature name
     * @return raw RCF anomaly score
     * @throws PredictionException when the vector has the wrong dimension or a non-finite value
     */
    public double score(double[] features) {
        validate(features);
        // RCF does not document concurrent reads as safe
        synchronized (forest) {
            return forest.getAnomalyScore(features);
        }
    }

    private void validate(double[] features) {
        if (features == null || features.length != featureNames.size()) {
            throw new PredictionException(
                pair.getModelId(),
                String.format(Locale.ROOT, CommonMessages.INVALID_FEATURE_DIMENSION, featureNames.size(), features == null ? 0 : features.length)
            );
        }
        for (int i = 0; i < features.length; i++) {
            if (!Double.isFinite(features[i])) {
                throw new PredictionException(pair.getModelId(), featureNames.get(i) + ": " + CommonMessages.NON_FINITE_VALUE);
            }
        }
    }

    public MetricPair getPair() {
        return pair;
    }

    public List<String> getFeatureNames() {
        return Collections.unmodifiableList(featureNames);
    }

    public RandomCutForest getForest() {
        return forest;
    }

    public ContaminationThresholdingModel getThresholding() {
        return thresholding;
    }

    public double getThreshold() {
        return thresholding.getThreshold();
    }

    public ForestParameters getParameters() {
        return parameters;
    }
}
