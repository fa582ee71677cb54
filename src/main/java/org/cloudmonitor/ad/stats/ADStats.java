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

package org.cloudmonitor.ad.stats;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.cloudmonitor.timeseries.stats.Stats;
import org.cloudmonitor.timeseries.stats.TimeSeriesStat;
import org.cloudmonitor.timeseries.stats.suppliers.CounterSupplier;
import org.cloudmonitor.timeseries.stats.suppliers.SettableSupplier;

public class ADStats extends Stats {

    public ADStats(Map<String, TimeSeriesStat<?>> stats) {
        super(stats);
    }

    /**
     * Builds the engine's stats: a gauge for the model count and a counter for everything else.
     *
     * @param modelCount supplier of the number of models in memory
     * @return stats with every {@link StatNames} entry
     */
    public static ADStats create(Supplier<Integer> modelCount) {
        Map<String, TimeSeriesStat<?>> stats = new LinkedHashMap<>();
        for (StatNames name : StatNames.values()) {
            switch (name) {
                case MODEL_COUNT:
                    stats.put(name.getName(), new TimeSeriesStat<>(modelCount));
                    break;
                case LAST_DETECTION_TIME:
                    stats.put(name.getName(), new TimeSeriesStat<>(new SettableSupplier()));
                    break;
                default:
                    stats.put(name.getName(), new TimeSeriesStat<>(new CounterSupplier()));
                    break;
            }
        }
        return new ADStats(stats);
    }

    public TimeSeriesStat<?> getStat(StatNames name) {
        return getStat(name.getName());
    }

    public void increment(StatNames name) {
        getStat(name).increment();
    }

    public void add(StatNames name, long delta) {
        getStat(name).add(delta);
    }

    /**
     * @param name stat name
     * @return the numeric value of the stat
     */
    public long getCount(StatNames name) {
        Object value = getStat(name).getValue();
        return value == null ? 0 : ((Number) value).longValue();
    }
}
