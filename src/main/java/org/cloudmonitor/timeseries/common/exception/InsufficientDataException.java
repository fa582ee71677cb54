/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.common.exception;

import java.util.Locale;

/**
 * A pair does not have enough samples to train a model.
 */
public class InsufficientDataException extends TimeSeriesException {
    private final int sampleCount;
    private final int requiredCount;

    public InsufficientDataException(String pairId, int sampleCount, int requiredCount) {
        super(pairId, String.format(Locale.ROOT, "insufficient data: %d samples, %d required", sampleCount, requiredCount));
        this.sampleCount = sampleCount;
        this.requiredCount = requiredCount;
        countedInStats(false);
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public int getRequiredCount() {
        return requiredCount;
    }
}
