/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.timeseries.annotation.Generated;
import org.cloudmonitor.timeseries.model.MetricPair;

import com.google.common.base.Objects;

/**
 * A positive detection. Handed to the caller; the engine does not keep it.
 */
public class AnomalyRecord {
    private final Instant timestamp;
    private final MetricPair pair;
    private final double value;
    private final Severity severity;

    public AnomalyRecord(Instant timestamp, MetricPair pair, double value, Severity severity) {
        this.timestamp = timestamp;
        this.pair = pair;
        this.value = value;
        this.severity = severity;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public MetricPair getPair() {
        return pair;
    }

    public String getService() {
        return pair.getService();
    }

    public String getMetric() {
        return pair.getMetric();
    }

    public double getValue() {
        return value;
    }

    public Severity getSeverity() {
        return severity;
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
        AnomalyRecord that = (AnomalyRecord) o;
        return Double.compare(value, that.value) == 0
            && Objects.equal(timestamp, that.timestamp)
            && Objects.equal(pair, that.pair)
            && severity == that.severity;
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(timestamp, pair, value, severity);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("timestamp", timestamp)
            .append("pair", pair)
            .append("value", value)
            .append("severity", severity)
            .toString();
    }
}
