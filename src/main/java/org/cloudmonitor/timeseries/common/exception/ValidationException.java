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
 * Invalid engine configuration.
 */
public class ValidationException extends TimeSeriesException {
    private final String settingKey;

    public ValidationException(String message, String settingKey) {
        super(message);
        this.settingKey = settingKey;
        countedInStats(false);
    }

    public String getSettingKey() {
        return settingKey;
    }

    @Override
    public String toString() {
        return "ValidationException [" + settingKey + "]: " + getMessage();
    }
}
