/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.cloudmonitor.ad.ml;

import static org.cloudmonitor.timeseries.AbstractTimeSeriesTest.expectThrows;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.cloudmonitor.TestHelpers;
import org.cloudmonitor.timeseries.common.exception.PredictionException;
import org.cloudmonitor.timeseries.constant.CommonName;
import org.cloudmonitor.timeseries.model.MetricPair;
import org.junit.BeforeClass;
import org.junit.Test;

public class PairModelTests {
    private static final MetricPair PAIR = MetricPair.of("api-gateway", "response_time");

    private static PairModel model;

    @BeforeClass
    public static void setUpModel() {
        model = ModelTestUtil.fit(PAIR, TestHelpers.gaussianValues(256, 42));
    }

    @Test
    public void testFittedModel() {
        assertEquals(PAIR, model.getPair());
        assertThat(model.getFeatureNames(), contains(CommonName.VALUE_FEATURE));
        assertEquals(TestHelpers.SMALL_FOREST, model.getParameters());
        assertEquals(TestHelpers.SMALL_FOREST.getNumberOfTrees(), model.getForest().getNumberOfTrees());
        assertThat(model.getThreshold(), greaterThan(0.0));
    }

    @Test
    public void testNormalValueIsNotAnomalous() {
        ThresholdingResult result = model.predict(new double[] { 100 });
        assertFalse(result.isAnomaly());
        assertEquals(0, result.getGrade(), 0);
    }

    @Test
    public void testOutlierIsAnomalous() {
        ThresholdingResult result = model.predict(new double[] { 200 });
        assertTrue(result.isAnomaly());
        assertThat(result.getRcfScore(), greaterThan(result.getThreshold()));
    }

    @Test
    public void testPredictionDoesNotChangeModel() {
        long updates = model.getForest().getTotalUpdates();
        double first = model.score(new double[] { 180 });
        double second = model.score(new double[] { 180 });
        assertEquals(first, second, 0);
        assertEquals(updates, model.getForest().getTotalUpdates());
    }

    @Test
    public void testWrongDimension() {
        PredictionException e = expectThrows(PredictionException.class, () -> model.predict(new double[] { 1, 2 }));
        assertEquals(PAIR.getModelId(), e.getPairId());
        assertThat(e.getMessage(), containsString("expect 1 but get 2"));
    }

    @Test
    public void testNonFiniteValue() {
        expectThrows(PredictionException.class, () -> model.predict(new double[] { Double.NaN }));
        expectThrows(PredictionException.class, () -> model.predict(new double[] { Double.POSITIVE_INFINITY }));
    }
}
