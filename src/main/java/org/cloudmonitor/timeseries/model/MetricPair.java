/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.model;

import java.util.HashMap;
import java.util.Map;

import org.cloudmonitor.timeseries.annotation.Generated;
import org.cloudmonitor.timeseries.constant.CommonMessages;
import org.cloudmonitor.timeseries.constant.CommonName;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A (service, metric) combination: the unit of independent model and baseline state.
 */
public class MetricPair implements Comparable<MetricPair> {
    private static final String SEPARATOR = "/";

    private final String service;
    private final String metric;

    public MetricPair(String service, String metric) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(service), CommonMessages.EMPTY_SERVICE);
        Preconditions.checkArgument(!Strings.isNullOrEmpty(metric), CommonMessages.EMPTY_METRIC);
        this.service = service;
        this.metric = metric;
    }

    public static MetricPair of(String service, String metric) {
        return new MetricPair(service, metric);
    }

    public String getService() {
        return service;
    }

    public String getMetric() {
        return metric;
    }

    /**
     * Model id used in logs, stats and exceptions.
     *
     * @return service/metric
     */
    public String getModelId() {
        return service + SEPARATOR + metric;
    }

    public Map<String, Object> toStat() {
        Map<String, Object> stat = new HashMap<>();
        stat.put(CommonName.SERVICE_FIELD, service);
        stat.put(CommonName.METRIC_FIELD, metric);
        return stat;
    }

    @Override
    public int compareTo(MetricPair other) {
        int byService = service.compareTo(other.service);
        return byService != 0 ? byService : metric.compareTo(other.metric);
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
        MetricPair that = (MetricPair) o;
        return Objects.equal(service, that.service) && Objects.equal(metric, that.metric);
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(service, metric);
    }

    @Override
    public String toString() {
        return getModelId();
    }
}
