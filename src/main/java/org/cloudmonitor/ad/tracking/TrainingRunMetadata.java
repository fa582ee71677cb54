/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.tracking;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.ad.ml.StatBaseline;
import org.cloudmonitor.timeseries.model.MetricPair;

/**
 * What a training run did: hyperparameters, input size, and per pair either the baseline
 * statistics of the trained model or the sample count that was too small.
 */
public class TrainingRunMetadata {
    private final String runId;
    private final Instant startTime;
    private final long durationMillis;
    private final Map<String, Object> hyperparameters;
    private final int dataPoints;
    private final Map<String, Map<String, Object>> trainedPairs;
    private final Map<String, Integer> skippedPairs;
    private final Map<String, String> failedPairs;

    private TrainingRunMetadata(Builder builder) {
        this.runId = builder.runId;
        this.startTime = builder.startTime;
        this.durationMillis = builder.durationMillis;
        this.hyperparameters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hyperparameters));
        this.dataPoints = builder.dataPoints;
        this.trainedPairs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.trainedPairs));
        this.skippedPairs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skippedPairs));
        this.failedPairs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.failedPairs));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public Map<String, Object> getHyperparameters() {
        return hyperparameters;
    }

    public int getDataPoints() {
        return dataPoints;
    }

    /**
     * @return baseline statistics keyed by service/metric
     */
    public Map<String, Map<String, Object>> getTrainedPairs() {
        return trainedPairs;
    }

    /**
     * @return sample count keyed by service/metric
     */
    public Map<String, Integer> getSkippedPairs() {
        return skippedPairs;
    }

    /**
     * @return failure message keyed by service/metric
     */
    public Map<String, String> getFailedPairs() {
        return failedPairs;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("runId", runId)
            .append("startTime", startTime)
            .append("dataPoints", dataPoints)
            .append("trained", trainedPairs.keySet())
            .append("skipped", skippedPairs.keySet())
            .append("failed", failedPairs.keySet())
            .toString();
    }

    public static class Builder {
        private String runId;
        private Instant startTime;
        private long durationMillis;
        private Map<String, Object> hyperparameters = new LinkedHashMap<>();
        private int dataPoints;
        private final Map<String, Map<String, Object>> trainedPairs = new LinkedHashMap<>();
        private final Map<String, Integer> skippedPairs = new LinkedHashMap<>();
        private final Map<String, String> failedPairs = new LinkedHashMap<>();

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public Builder hyperparameters(Map<String, Object> hyperparameters) {
            this.hyperparameters = hyperparameters;
            return this;
        }

        public Builder dataPoints(int dataPoints) {
            this.dataPoints = dataPoints;
            return this;
        }

        public Builder trained(MetricPair pair, StatBaseline baseline) {
            trainedPairs.put(pair.getModelId(), baseline.toStat());
            return this;
        }

        public Builder skipped(MetricPair pair, int sampleCount) {
            skippedPairs.put(pair.getModelId(), sampleCount);
            return this;
        }

        public Builder failed(MetricPair pair, String reason) {
            failedPairs.put(pair.getModelId(), reason);
            return this;
        }

        public TrainingRunMetadata build() {
            return new TrainingRunMetadata(this);
        }
    }
}
