/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.cloudmonitor.ad.model.RunSummary;

import com.google.common.collect.ImmutableList;

/**
 * Append-only history of detection runs.
 */
public class RunTracker {
    private final List<RunSummary> history = new ArrayList<>();

    public synchronized void record(RunSummary summary) {
        history.add(summary);
    }

    /**
     * @return snapshot of every recorded run, oldest first
     */
    public synchronized List<RunSummary> getHistory() {
        return ImmutableList.copyOf(history);
    }

    public synchronized Optional<RunSummary> getLatest() {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1));
    }

    public synchronized int size() {
        return history.size();
    }
}
