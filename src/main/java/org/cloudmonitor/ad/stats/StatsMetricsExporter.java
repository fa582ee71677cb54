/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.stats;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.cloudmonitor.ad.model.AnomalyRecord;
import org.cloudmonitor.ad.model.RunSummary;
import org.cloudmonitor.ad.model.Severity;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.cloudmonitor.timeseries.stats.suppliers.CounterSupplier;

/**
 * In-process exporter keeping one anomaly counter and the last anomalous value per pair, plus
 * the anomaly rate of the latest run. A scrape endpoint can render {@link #getAnomalyCounts()}.
 */
public class StatsMetricsExporter implements MetricsExporter {
    private final Map<MetricPair, CounterSupplier> anomalyCounters;
    private final Map<MetricPair, Double> lastAnomalousValues;
    private final Map<MetricPair, Severity> lastSeverities;
    private volatile double lastAnomalyRate;

    public StatsMetricsExporter() {
        this.anomalyCounters = new ConcurrentHashMap<>();
        this.lastAnomalousValues = new ConcurrentHashMap<>();
        this.lastSeverities = new ConcurrentHashMap<>();
        this.lastAnomalyRate = 0;
    }

    @Override
    public void onDetection(List<AnomalyRecord> anomalies, RunSummary summary) {
        for (AnomalyRecord anomaly : anomalies) {
            anomalyCounters.computeIfAbsent(anomaly.getPair(), pair -> new CounterSupplier()).increment();
            lastAnomalousValues.put(anomaly.getPair(), anomaly.getValue());
            lastSeverities.put(anomaly.getPair(), anomaly.getSeverity());
        }
        lastAnomalyRate = summary.getAnomalyRate();
    }

    public long getAnomalyCount(MetricPair pair) {
        CounterSupplier counter = anomalyCounters.get(pair);
        return counter == null ? 0 : counter.get();
    }

    /**
     * @return anomaly count per pair, sorted by pair
     */
    public Map<MetricPair, Long> getAnomalyCounts() {
        Map<MetricPair, Long> counts = new TreeMap<>();
        anomalyCounters.forEach((pair, counter) -> counts.put(pair, counter.get()));
        return Collections.unmodifiableMap(counts);
    }

    public Double getLastAnomalousValue(MetricPair pair) {
        return lastAnomalousValues.get(pair);
    }

    public Severity getLastSeverity(MetricPair pair) {
        return lastSeverities.get(pair);
    }

    public double getLastAnomalyRate() {
        return lastAnomalyRate;
    }
}
