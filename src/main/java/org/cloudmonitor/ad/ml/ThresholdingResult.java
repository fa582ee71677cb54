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

package org.cloudmonitor.ad.ml;

import java.util.Objects;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.cloudmonitor.timeseries.annotation.Generated;

/**
 * Data object containing thresholding results.
 */
public class ThresholdingResult {

    private final double grade;
    private final double rcfScore;
    private final double threshold;

    /**
     * Constructor with all arguments.
     *
     * @param grade anomaly grade, non-zero for an anomaly
     * @param rcfScore RCF score
     * @param threshold threshold the score was compared with
     */
    public ThresholdingResult(double grade, double rcfScore, double threshold) {
        this.grade = grade;
        this.rcfScore = rcfScore;
        this.threshold = threshold;
    }

    /**
     * Returns the anomaly grade.
     *
     * @return the anomaly grade
     */
    public double getGrade() {
        return grade;
    }

    /**
     * Returns the RCF score for the particular point.
     *
     * @return the RCF score
     */
    public double getRcfScore() {
        return rcfScore;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @return true for the anomalous label, false for the normal one
     */
    public boolean isAnomaly() {
        return grade > 0;
    }

    @Generated
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ThresholdingResult that = (ThresholdingResult) o;
        return this.grade == that.grade && this.rcfScore == that.rcfScore && this.threshold == that.threshold;
    }

    @Generated
    @Override
    public int hashCode() {
        return Objects.hash(grade, rcfScore, threshold);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this).append("grade", grade).append("rcfScore", rcfScore).append("threshold", threshold).toString();
    }
}
