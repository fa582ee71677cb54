/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import static org.cloudmonitor.timeseries.AbstractTimeSeriesTest.expectThrows;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ContaminationThresholdingModelTests {

    @Test
    public void testThresholdIsInterpolatedQuantile() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1);
        model.train(new double[] { 10, 1, 9, 2, 8, 3, 7, 4, 6, 5 });
        // position 0.9 * 9 = 8.1 between 9 and 10
        assertEquals(9.1, model.getThreshold(), 1e-9);
        assertTrue(model.isTrained());
    }

    @Test
    public void testGrade() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1);
        model.train(new double[] { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 });
        assertEquals(0, model.grade(5), 0);
        assertEquals(0, model.grade(9.1), 0);
        assertEquals((10 - 9.1) / 10, model.grade(10), 1e-9);
    }

    @Test
    public void testUntrainedGradesNothing() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1);
        assertFalse(model.isTrained());
        assertEquals(0, model.grade(1000), 0);
    }

    @Test
    public void testZeroThresholdGradesPositiveScoresFully() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.2);
        model.train(new double[] { 0, 0, 0, 0 });
        assertEquals(0, model.getThreshold(), 0);
        assertEquals(1, model.grade(0.5), 0);
        assertEquals(0, model.grade(0), 0);
    }

    @Test
    public void testSingleScore() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1);
        model.train(new double[] { 2.5 });
        assertEquals(2.5, model.getThreshold(), 0);
    }

    @Test
    public void testRestoredThreshold() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1, 1.2);
        assertTrue(model.isTrained());
        assertEquals(1.2, model.getThreshold(), 0);
        assertTrue(model.grade(1.5) > 0);
    }

    @Test
    public void testInvalidContamination() {
        expectThrows(IllegalArgumentException.class, () -> new ContaminationThresholdingModel(0));
        expectThrows(IllegalArgumentException.class, () -> new ContaminationThresholdingModel(1));
    }

    @Test
    public void testEmptyScoresRejected() {
        ContaminationThresholdingModel model = new ContaminationThresholdingModel(0.1);
        expectThrows(IllegalArgumentException.class, () -> model.train(new double[0]));
    }
}
