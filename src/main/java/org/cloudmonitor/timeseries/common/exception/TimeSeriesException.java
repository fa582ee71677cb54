/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.cloudmonitor.timeseries.common.exception;

/**
 * Base exception for exceptions thrown.
 */
public class TimeSeriesException extends RuntimeException {

    private String pairId;
    // countedInStats will be used to tell whether the exception should be
    // counted in failure stats.
    private boolean countedInStats = true;

    public TimeSeriesException(String message) {
        super(message);
    }

    /**
     * Constructor with a pair ID and a message.
     *
     * @param pairId id of the (service, metric) pair, rendered as service/metric
     * @param message message of the exception
     */
    public TimeSeriesException(String pairId, String message) {
        super(message);
        this.pairId = pairId;
    }

    public TimeSeriesException(String pairId, String message, Throwable cause) {
        super(message, cause);
        this.pairId = pairId;
    }

    public TimeSeriesException(Throwable cause) {
        super(cause);
    }

    /**
     * Returns the ID of the pair the failure belongs to.
     *
     * @return pair ID, null when the failure is not tied to a pair
     */
    public String getPairId() {
        return this.pairId;
    }

    /**
     * Returns if the exception should be counted in stats.
     *
     * @return true if should count the exception in stats; otherwise return false
     */
    public boolean isCountedInStats() {
        return countedInStats;
    }

    /**
     * Set if the exception should be counted in stats.
     *
     * @param countInStats count the exception in stats
     * @return the exception itself
     */
    public TimeSeriesException countedInStats(boolean countInStats) {
        this.countedInStats = countInStats;
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(pairId);
        sb.append(' ');
        sb.append(super.toString());
        return sb.toString();
    }
}
