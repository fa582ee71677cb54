/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.common.exception;

/**
 * Failure to write or read a model checkpoint. In-memory models stay authoritative.
 */
public class PersistenceException extends TimeSeriesException {

    public PersistenceException(String pairId, String message) {
        super(pairId, message);
    }

    public PersistenceException(String pairId, String message, Throwable cause) {
        super(pairId, message, cause);
    }
}
