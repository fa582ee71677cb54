/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.timeseries.annotation.Generated;
import org.cloudmonitor.timeseries.common.exception.ValidationException;
import org.opensearch.common.settings.Settings;

import com.google.common.base.Objects;

/**
 * Hyperparameters of a pair model.
 */
public class ForestParameters {
    public static final String ALGORITHM = "random_cut_forest";

    private final double contamination;
    private final int numberOfTrees;
    private final int sampleSize;
    private final long randomSeed;

    public ForestParameters(double contamination, int numberOfTrees, int sampleSize, long randomSeed) {
        if (!(contamination > 0 && contamination < 1)) {
            throw new ValidationException(
                String.format(Locale.ROOT, "contamination must be in (0, 1), got %s", contamination),
                AnomalyDetectorSettings.CONTAMINATION.getKey()
            );
        }
        if (numberOfTrees < 1) {
            throw new ValidationException("number of trees must be at least 1", AnomalyDetectorSettings.NUM_TREES.getKey());
        }
        if (sampleSize < 1) {
            throw new ValidationException("sample size must be at least 1", AnomalyDetectorSettings.NUM_SAMPLES_PER_TREE.getKey());
        }
        this.contamination = contamination;
        this.numberOfTrees = numberOfTrees;
        this.sampleSize = sampleSize;
        this.randomSeed = randomSeed;
    }

    public static ForestParameters fromSettings(Settings settings) {
        return new ForestParameters(
            AnomalyDetectorSettings.CONTAMINATION.get(settings),
            AnomalyDetectorSettings.NUM_TREES.get(settings),
            AnomalyDetectorSettings.NUM_SAMPLES_PER_TREE.get(settings),
            AnomalyDetectorSettings.RANDOM_SEED.get(settings)
        );
    }

    public double getContamination() {
        return contamination;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("algorithm", ALGORITHM);
        params.put("contamination", contamination);
        params.put("n_estimators", numberOfTrees);
        params.put("max_samples", sampleSize);
        params.put("random_state", randomSeed);
        return params;
    }

    @Generated
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ForestParameters that = (ForestParameters) o;
        return Double.compare(contamination, that.contamination) == 0
            && numberOfTrees == that.numberOfTrees
            && sampleSize == that.sampleSize
            && randomSeed == that.randomSeed;
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(contamination, numberOfTrees, sampleSize, randomSeed);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("contamination", contamination)
            .append("numberOfTrees", numberOfTrees)
            .append("sampleSize", sampleSize)
            .append("randomSeed", randomSeed)
            .toString();
    }
}
