/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.common.exception;

import java.util.Locale;

/**
 * The checkpoint was written with a schema version this build cannot read.
 */
public class IncompatibleCheckpointException extends PersistenceException {
    private final int foundVersion;
    private final int expectedVersion;

    public IncompatibleCheckpointException(String pairId, int foundVersion, int expectedVersion) {
        super(
            pairId,
            String.format(Locale.ROOT, "checkpoint schema version %d is not supported, expected %d", foundVersion, expectedVersion)
        );
        this.foundVersion = foundVersion;
        this.expectedVersion = expectedVersion;
    }

    public int getFoundVersion() {
        return foundVersion;
    }

    public int getExpectedVersion() {
        return expectedVersion;
    }
}
