/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.cloudmonitor.timeseries.constant.CommonName;

import com.google.common.base.Preconditions;

/**
 * The training values of one pair in their original order. Statistics are derived on demand.
 *
 * Instances are immutable; a retrain installs a new baseline instead of merging into this one.
 */
public class StatBaseline {
    private final double[] values;

    public StatBaseline(double[] values) {
        Preconditions.checkArgument(values != null && values.length > 0, "baseline must have at least one value");
        this.values = Arrays.copyOf(values, values.length);
    }

    public int size() {
        return values.length;
    }

    /**
     * @return a copy of the training values
     */
    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double mean() {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divisor n).
     *
     * @return standard deviation of the training values
     */
    public double standardDeviation() {
        double mean = mean();
        double squares = 0;
        for (double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / values.length);
    }

    public double min() {
        return Arrays.stream(values).min().getAsDouble();
    }

    public double max() {
        return Arrays.stream(values).max().getAsDouble();
    }

    public Map<String, Object> toStat() {
        Map<String, Object> stat = new HashMap<>();
        stat.put(CommonName.SAMPLE_COUNT_KEY, size());
        stat.put(CommonName.MEAN_KEY, mean());
        stat.put(CommonName.STD_KEY, standardDeviation());
        stat.put(CommonName.MIN_KEY, min());
        stat.put(CommonName.MAX_KEY, max());
        return stat;
    }
}
