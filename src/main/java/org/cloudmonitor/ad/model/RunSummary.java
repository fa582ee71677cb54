/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.timeseries.annotation.Generated;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Counts of one detection run.
 */
public class RunSummary {
    private final String runId;
    private final Instant startTime;
    private final int totalPredictions;
    private final int totalAnomalies;
    private final double anomalyRate;

    public RunSummary(String runId, Instant startTime, int totalPredictions, int totalAnomalies) {
        Preconditions.checkArgument(totalPredictions >= 0, "total predictions must not be negative");
        Preconditions
            .checkArgument(
                totalAnomalies >= 0 && totalAnomalies <= totalPredictions,
                "total anomalies must be between 0 and total predictions"
            );
        this.runId = runId;
        this.startTime = startTime;
        this.totalPredictions = totalPredictions;
        this.totalAnomalies = totalAnomalies;
        this.anomalyRate = anomalyRate(totalPredictions, totalAnomalies);
    }

    /**
     * @param totalPredictions predictions attempted
     * @param totalAnomalies anomalous predictions
     * @return anomalies / predictions, 0 when nothing was predicted
     */
    public static double anomalyRate(int totalPredictions, int totalAnomalies) {
        if (totalPredictions == 0) {
            return 0;
        }
        return (double) totalAnomalies / totalPredictions;
    }

    public String getRunId() {
        return runId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public int getTotalPredictions() {
        return totalPredictions;
    }

    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    public double getAnomalyRate() {
        return anomalyRate;
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
        RunSummary that = (RunSummary) o;
        return totalPredictions == that.totalPredictions
            && totalAnomalies == that.totalAnomalies
            && Objects.equal(runId, that.runId)
            && Objects.equal(startTime, that.startTime);
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hashCode(runId, startTime, totalPredictions, totalAnomalies);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
            .append("runId", runId)
            .append("startTime", startTime)
            .append("totalPredictions", totalPredictions)
            .append("totalAnomalies", totalAnomalies)
            .append("anomalyRate", anomalyRate)
            .toString();
    }
}
