/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.stats;

import java.util.List;

import org.cloudmonitor.ad.model.AnomalyRecord;
import org.cloudmonitor.ad.model.RunSummary;

/**
 * Receives the outcome of every detection run, e.g. to update scrape-able counters keyed by
 * (service, metric).
 */
public interface MetricsExporter {

    /**
     * @param anomalies anomalies of the run, possibly empty
     * @param summary counts of the run
     */
    void onDetection(List<AnomalyRecord> anomalies, RunSummary summary);
}
