/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.common.exception;

/**
 * The experiment tracking collaborator failed. Never propagated past the error boundary.
 */
public class TrackingException extends TimeSeriesException {

    public TrackingException(String message) {
        super(message);
    }

    public TrackingException(String message, Throwable cause) {
        super(null, message, cause);
    }
}
