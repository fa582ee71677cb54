/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.evaluation;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.timeseries.model.MetricPair;

public class EvaluationRecord {
    private final Instant timestamp;
    private final MetricPair pair;
    private final double value;
    private final boolean predictedAnomaly;
    private final boolean actualAnomaly;
    private final EvaluationOutcome outcome;

    public EvaluationRecord(Instant timestamp, MetricPair pair, double value, boolean predictedAnomaly, boolean actualAnomaly) {
        this.timestamp = timestamp;
        this.pair = pair;
        this.value = value;
        this.predictedAnomaly = predictedAnomaly;
        this.actualAnomaly = actualAnomaly;
        this.outcome = EvaluationOutcome.of(predictedAnomaly, actualAnomaly);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MetricPair getPair() {
        return pair;
    }

    public double getValue() {
        return value;
    }

    public boolean isPredictedAnomaly() {
        return predictedAnomaly;
    }

    public boolean isActualAnomaly() {
        return actualAnomaly;
    }

    public EvaluationOutcome getOutcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("timestamp", timestamp)
            .append("pair", pair)
            .append("value", value)
            .append("outcome", outcome.getName())
            .toString();
    }
}
