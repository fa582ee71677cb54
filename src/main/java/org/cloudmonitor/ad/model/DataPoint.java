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
import com.google.common.base.Preconditions;

/**
 * One observed metric value of a service. Immutable.
 *
 * The value is not validated here: a non-finite value is a per-pair prediction failure,
 * not a reason to reject the whole batch.
 */
public class DataPoint {
    private final MetricPair pair;
    private final double value;
    private final Instant timestamp;

    public DataPoint(String service, String metric, double value, Instant timestamp) {
        this.pair = new MetricPair(service, metric);
        this.value = value;
        this.timestamp = Preconditions.checkNotNull(timestamp, "timestamp must not be null");
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

    public Instant getTimestamp() {
        return timestamp;
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
        DataPoint that = (DataPoint) o;
        return Double.compare(value, that.value) == 0 && Objects.equal(pair, that.pair) && Objects.equal(timestamp, that.timestamp);
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(pair, value, timestamp);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("pair", pair).append("value", value).append("timestamp", timestamp).toString();
    }
}
