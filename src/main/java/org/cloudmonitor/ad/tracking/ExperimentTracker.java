/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.tracking;

import org.cloudmonitor.ad.model.RunSummary;
import org.cloudmonitor.timeseries.common.exception.TrackingException;

/**
 * Experiment tracking collaborator. Callers wrap every call in an error boundary, so an
 * implementation may throw freely.
 */
public interface ExperimentTracker {

    /**
     * @param metadata parameters and per-pair statistics of a training run
     * @throws TrackingException when the run cannot be recorded
     */
    void recordTrainingRun(TrainingRunMetadata metadata);

    /**
     * @param summary counts of a detection run
     * @throws TrackingException when the run cannot be recorded
     */
    void recordDetectionRun(RunSummary summary);
}
