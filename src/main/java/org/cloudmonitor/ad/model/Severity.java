/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.model;

import java.util.Locale;

/**
 * Ordinal label for how anomalous a detected value is. Declaration order is the severity order.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * @return lower-case name used in configuration keys and tracking output
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Severity fromName(String name) {
        return Severity.valueOf(name.toUpperCase(Locale.ROOT));
    }

    public boolean atLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
