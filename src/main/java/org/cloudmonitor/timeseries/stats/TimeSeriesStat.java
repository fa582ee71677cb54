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

package org.cloudmonitor.timeseries.stats;

import java.util.function.Supplier;

import org.cloudmonitor.timeseries.stats.suppliers.CounterSupplier;
import org.cloudmonitor.timeseries.stats.suppliers.SettableSupplier;

/**
 * Class represents a stat the engine keeps track of
 */
public class TimeSeriesStat<T> {
    private Supplier<T> supplier;

    /**
     * Constructor
     *
     * @param supplier supplier that returns the stat's value
     */
    public TimeSeriesStat(Supplier<T> supplier) {
        this.supplier = supplier;
    }

    /**
     * Get the value of the statistic
     *
     * @return T value of the stat
     */
    public T getValue() {
        return supplier.get();
    }

    /**
     * Set the value of the statistic
     *
     * @param value set value
     */
    public void setValue(Long value) {
        if (supplier instanceof SettableSupplier) {
            ((SettableSupplier) supplier).set(value);
        }
    }

    /**
     * Increments the supplier if it can be incremented
     */
    public void increment() {
        if (supplier instanceof CounterSupplier) {
            ((CounterSupplier) supplier).increment();
        }
    }

    /**
     * Increments the supplier by delta if it can be incremented
     *
     * @param delta amount to add
     */
    public void add(long delta) {
        if (supplier instanceof CounterSupplier) {
            ((CounterSupplier) supplier).add(delta);
        }
    }

    /**
     * Decrease the supplier if it can be decreased.
     */
    public void decrement() {
        if (supplier instanceof CounterSupplier) {
            ((CounterSupplier) supplier).decrement();
        }
    }
}
