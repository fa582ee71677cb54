/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.nio.file.Path;
import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.timeseries.model.MetricPair;

/**
 * A checkpoint file found under the models directory. Service and metric are decoded from the
 * path.
 */
public class CheckpointInfo {
    private final String service;
    private final String metric;
    private final Path path;
    private final long sizeBytes;
    private final Instant lastModified;

    public CheckpointInfo(String service, String metric, Path path, long sizeBytes, Instant lastModified) {
        this.service = service;
        this.metric = metric;
        this.path = path;
        this.sizeBytes = sizeBytes;
        this.lastModified = lastModified;
    }

    public String getService() {
        return service;
    }

    public String getMetric() {
        return metric;
    }

    public MetricPair getPair() {
        return MetricPair.of(service, metric);
    }

    public Path getPath() {
        return path;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("service", service)
            .append("metric", metric)
            .append("path", path)
            .append("sizeBytes", sizeBytes)
            .append("lastModified", lastModified)
            .toString();
    }
}
