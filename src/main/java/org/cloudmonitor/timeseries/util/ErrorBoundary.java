/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.util;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.ParameterizedMessage;
import org.cloudmonitor.timeseries.function.ThrowingRunnable;
import org.cloudmonitor.timeseries.stats.TimeSeriesStat;

/**
 * Swallow-and-log boundary around side effects (experiment tracking, checkpoint writes) whose
 * failure must never reach the training or detection caller.
 */
public class ErrorBoundary {
    private static final Logger logger = LogManager.getLogger(ErrorBoundary.class);

    private ErrorBoundary() {}

    /**
     * Runs the action; any exception is logged and counted, never rethrown.
     *
     * @param description what the action does, used in the log line
     * @param failureStat stat incremented on failure, may be null
     * @param action side effect to run
     * @return true if the action completed normally
     */
    public static boolean runQuietly(String description, TimeSeriesStat<?> failureStat, ThrowingRunnable<? extends Exception> action) {
        try {
            action.run();
            return true;
        } catch (Exception e) {
            logger.warn(new ParameterizedMessage("{} failed, continuing", description), e);
            if (failureStat != null) {
                failureStat.increment();
            }
            return false;
        }
    }

    /**
     * Hands the action to the executor and applies {@link #runQuietly} when it runs. A rejected
     * submission is handled the same way as a failed action.
     *
     * @param executor executor for side effects
     * @param description what the action does, used in the log line
     * @param failureStat stat incremented on failure, may be null
     * @param action side effect to run
     */
    public static void submitQuietly(
        Executor executor,
        String description,
        TimeSeriesStat<?> failureStat,
        ThrowingRunnable<? extends Exception> action
    ) {
        try {
            executor.execute(() -> runQuietly(description, failureStat, action));
        } catch (RejectedExecutionException e) {
            logger.warn(new ParameterizedMessage("{} was rejected", description), e);
            if (failureStat != null) {
                failureStat.increment();
            }
        }
    }
}
