/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.remediation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudmonitor.ad.model.AnomalyRecord;
import org.cloudmonitor.ad.model.Severity;
import org.cloudmonitor.ad.settings.AnomalyDetectorSettings;
import org.cloudmonitor.timeseries.common.exception.ValidationException;
import org.opensearch.common.settings.Settings;

/**
 * Picks the remediation action text for an anomaly from a metric x severity template table.
 * {@code {service}} in a template is replaced by the anomalous service. The action is only
 * described, never executed.
 */
public class RemediationSelector {
    private static final Logger logger = LogManager.getLogger(RemediationSelector.class);

    public static final String SERVICE_PLACEHOLDER = "{service}";

    private final Map<String, Map<Severity, String>> templates;

    public RemediationSelector(Map<String, Map<Severity, String>> templates) {
        Map<String, Map<Severity, String>> copy = new HashMap<>();
        for (Map.Entry<String, Map<Severity, String>> entry : templates.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableMap(new EnumMap<>(entry.getValue())));
        }
        this.templates = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads {@code remediation.actions.<metric>.<severity>} entries.
     *
     * @param settings engine settings
     * @return selector over the configured table, empty when none is configured
     * @throws ValidationException when a severity key is not low, medium or high
     */
    public static RemediationSelector fromSettings(Settings settings) {
        Map<String, Map<Severity, String>> templates = new HashMap<>();
        Map<String, Settings> metrics = settings.getGroups(AnomalyDetectorSettings.REMEDIATION_ACTIONS_PREFIX);
        for (Map.Entry<String, Settings> metric : metrics.entrySet()) {
            Map<Severity, String> actions = new EnumMap<>(Severity.class);
            Settings group = metric.getValue();
            for (String key : group.keySet()) {
                Severity severity;
                try {
                    severity = Severity.fromName(key);
                } catch (IllegalArgumentException e) {
                    throw new ValidationException(
                        "unknown severity [" + key + "]",
                        AnomalyDetectorSettings.REMEDIATION_ACTIONS_PREFIX + metric.getKey() + "." + key
                    );
                }
                actions.put(severity, group.get(key));
            }
            templates.put(metric.getKey(), actions);
        }
        return new RemediationSelector(templates);
    }

    /**
     * @param anomaly detected anomaly
     * @return the action text, empty when no template exists for the metric and severity
     */
    public Optional<String> select(AnomalyRecord anomaly) {
        Map<Severity, String> actions = templates.get(anomaly.getMetric());
        String template = actions == null ? null : actions.get(anomaly.getSeverity());
        if (template == null) {
            logger.warn("No action template for {}/{}", anomaly.getMetric(), anomaly.getSeverity().getName());
            return Optional.empty();
        }
        String action = template.replace(SERVICE_PLACEHOLDER, anomaly.getService());
        logger.info("Selected remediation for {}: {}", anomaly.getPair(), action);
        return Optional.of(action);
    }

    public Map<String, Map<Severity, String>> getTemplates() {
        return templates;
    }
}
