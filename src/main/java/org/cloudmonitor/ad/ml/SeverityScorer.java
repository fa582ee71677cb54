/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.Locale;
import java.util.Optional;

import org.cloudmonitor.ad.model.Severity;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.timeseries.common.exception.ValidationException;
import org.opensearch.common.settings.Settings;

/**
 * Maps the distance of a value from its pair's baseline, in standard deviations, to a severity.
 * Bands are closed on the left: {@code z < low} is LOW, {@code low <= z < high} is MEDIUM and
 * {@code z >= high} is HIGH.
 */
public class SeverityScorer {
    private final ModelRegistry registry;
    private final double lowThreshold;
    private final double highThreshold;

    public SeverityScorer(ModelRegistry registry, double lowThreshold, double highThreshold) {
        if (!(lowThreshold > 0 && lowThreshold < highThreshold)) {
            throw new ValidationException(
                String.format(Locale.ROOT, "severity thresholds must satisfy 0 < low < high, got low %s high %s", lowThreshold, highThreshold),
                AnomalyDetectorSettings.SEVERITY_LOW_THRESHOLD.getKey()
            );
        }
        this.registry = registry;
        this.lowThreshold = lowThreshold;
        this.highThreshold = highThreshold;
    }

    public static SeverityScorer fromSettings(ModelRegistry registry, Settings settings) {
        return new SeverityScorer(
            registry,
            AnomalyDetectorSettings.SEVERITY_LOW_THRESHOLD.get(settings),
            AnomalyDetectorSettings.SEVERITY_HIGH_THRESHOLD.get(settings)
        );
    }

    /**
     * @param service service name
     * @param metric metric name
     * @param value observed value
     * @return severity against the pair's baseline, MEDIUM when the pair has none
     */
    public Severity severity(String service, String metric, double value) {
        Optional<StatBaseline> baseline = registry.getBaseline(service, metric);
        if (!baseline.isPresent()) {
            return Severity.MEDIUM;
        }
        return severity(baseline.get(), value);
    }

    /**
     * @param baseline training values of the pair
     * @param value observed value
     * @return HIGH for a constant baseline, otherwise the band of the value's z-score
     */
    public Severity severity(StatBaseline baseline, double value) {
        double std = baseline.standardDeviation();
        if (std == 0) {
            return Severity.HIGH;
        }
        double zScore = Math.abs(value - baseline.mean()) / std;
        if (zScore < lowThreshold) {
            return Severity.LOW;
        } else if (zScore < highThreshold) {
            return Severity.MEDIUM;
        }
        return Severity.HIGH;
    }

    public double getLowThreshold() {
        return lowThreshold;
    }

    public double getHighThreshold() {
        return highThreshold;
    }
}
