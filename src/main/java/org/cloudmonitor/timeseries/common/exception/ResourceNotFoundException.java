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
 * This exception is thrown when a model or checkpoint is not found.
 */
public class ResourceNotFoundException extends TimeSeriesException {

    /**
     * Constructor with a pair ID and a message.
     *
     * @param pairId ID of the pair related to the resource
     * @param message explains which resource is not found
     */
    public ResourceNotFoundException(String pairId, String message) {
        super(pairId, message);
        countedInStats(false);
    }

    public ResourceNotFoundException(String message) {
        super(message);
        countedInStats(false);
    }
}
