/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.timeseries.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.cloudmonitor.timeseries.AbstractTimeSeriesTest;
import org.cloudmonitor.timeseries.common.exception.TrackingException;
import org.cloudmonitor.timeseries.stats.TimeSeriesStat;
import org.cloudmonitor.timeseries.stats.suppliers.CounterSupplier;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.google.common.util.concurrent.MoreExecutors;

public class ErrorBoundaryTests extends AbstractTimeSeriesTest {
    private TimeSeriesStat<Long> failures;

    @Before
    public void setUp() {
        failures = new TimeSeriesStat<>(new CounterSupplier());
        setUpLog4jForJUnit(ErrorBoundary.class, true);
    }

    @After
    public void tearDown() {
        tearDownLog4jForJUnit();
    }

    @Test
    public void testRunQuietlySuccess() {
        AtomicBoolean ran = new AtomicBoolean();
        assertTrue(ErrorBoundary.runQuietly("noop", failures, () -> ran.set(true)));
        assertTrue(ran.get());
        assertEquals(0L, (long) failures.getValue());
        assertEquals(0, testAppender.messages.size());
    }

    @Test
    public void testRunQuietlySwallowsUncheckedException() {
        assertFalse(ErrorBoundary.runQuietly("Recording run 1", failures, () -> { throw new TrackingException("tracker down"); }));
        assertEquals(1L, (long) failures.getValue());
        assertTrue(testAppender.containsMessage("Recording run 1 failed, continuing"));
        assertTrue(testAppender.containExceptionMsg(TrackingException.class, "tracker down"));
    }

    @Test
    public void testRunQuietlySwallowsCheckedException() {
        assertFalse(ErrorBoundary.runQuietly("Writing file", failures, () -> { throw new IOException("disk full"); }));
        assertEquals(1L, (long) failures.getValue());
    }

    @Test
    public void testRunQuietlyWithoutStat() {
        assertFalse(ErrorBoundary.runQuietly("Writing file", null, () -> { throw new IOException("disk full"); }));
    }

    @Test
    public void testSubmitQuietlyRunsOnExecutor() {
        AtomicBoolean ran = new AtomicBoolean();
        ErrorBoundary.submitQuietly(MoreExecutors.directExecutor(), "noop", failures, () -> ran.set(true));
        assertTrue(ran.get());
        assertEquals(0L, (long) failures.getValue());
    }

    @Test
    public void testSubmitQuietlyCountsFailure() {
        ErrorBoundary.submitQuietly(MoreExecutors.directExecutor(), "Persisting", failures, () -> { throw new IOException("boom"); });
        assertEquals(1L, (long) failures.getValue());
    }

    @Test
    public void testSubmitQuietlyCountsRejection() {
        Executor rejecting = command -> { throw new RejectedExecutionException("shut down"); };
        AtomicBoolean ran = new AtomicBoolean();
        ErrorBoundary.submitQuietly(rejecting, "Persisting", failures, () -> ran.set(true));
        assertFalse(ran.get());
        assertEquals(1L, (long) failures.getValue());
        assertTrue(testAppender.containsMessage("Persisting was rejected"));
    }
}
