package com.spreadsheet.calc.engine.functions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatisticsTest {

    private static final double DELTA = 1e-9;

    @Test
    void testBasicAggregates() {
        double[] values = {1, 2, 3, 4, 5};
        assertEquals(15d, Statistics.sum(values));
        assertEquals(3d, Statistics.mean(values));
        assertEquals(120d, Statistics.product(values));
        assertEquals(1d, Statistics.min(values));
        assertEquals(5d, Statistics.max(values));
    }

    @Test
    void testEmptyInputsGiveZero() {
        double[] empty = {};
        assertEquals(0d, Statistics.sum(empty));
        assertEquals(0d, Statistics.mean(empty));
        assertEquals(0d, Statistics.product(empty));
        assertEquals(0d, Statistics.min(empty));
        assertEquals(0d, Statistics.median(empty));
        assertEquals(0d, Statistics.mode(empty));
        assertEquals(0d, Statistics.percentile(empty, 0.5));
    }

    @Test
    void testMedian() {
        assertEquals(2.5d, Statistics.median(new double[]{1, 2, 3, 4}));
        assertEquals(2d, Statistics.median(new double[]{3, 1, 2}));
    }

    /**
     * Ties go to the value that reached the top count first.
     */
    @Test
    void testMode() {
        assertEquals(2d, Statistics.mode(new double[]{1, 2, 2, 3, 3}));
        assertEquals(3d, Statistics.mode(new double[]{3, 1, 2}));
    }

    @Test
    void testSampleVarianceAndStdev() {
        assertEquals(4d, Statistics.sampleVariance(new double[]{2, 4, 6}), DELTA);
        assertEquals(2d, Statistics.sampleStdev(new double[]{2, 4, 6}), DELTA);
        assertEquals(0d, Statistics.sampleVariance(new double[]{7}));
    }

    @Test
    void testCorrelation() {
        assertEquals(1d, Statistics.correlation(new double[]{1, 2, 3}, new double[]{2, 4, 6}), DELTA);
        assertEquals(-1d, Statistics.correlation(new double[]{1, 2, 3}, new double[]{3, 2, 1}), DELTA);
        assertEquals(0d, Statistics.correlation(new double[]{1, 2, 3}, new double[]{5, 5, 5}));
        assertEquals(0d, Statistics.correlation(new double[]{1, 2}, new double[]{1, 2, 3}));
    }

    @Test
    void testPercentileAndQuartile() {
        double[] values = {4, 1, 3, 2};
        assertEquals(2.5d, Statistics.percentile(values, 0.5), DELTA);
        assertEquals(1.75d, Statistics.percentile(values, 0.25), DELTA);
        assertEquals(1d, Statistics.percentile(values, 0));
        assertEquals(4d, Statistics.percentile(values, 1));
        assertEquals(0d, Statistics.percentile(values, 1.5));

        double[] five = {1, 2, 3, 4, 5};
        assertEquals(2d, Statistics.quartile(five, 1), DELTA);
        assertEquals(5d, Statistics.quartile(five, 4), DELTA);
        assertEquals(0d, Statistics.quartile(five, 5));
    }

    @Test
    void testRank() {
        double[] values = {1, 3, 5};
        assertEquals(2, Statistics.rank(3, values, false));
        assertEquals(1, Statistics.rank(5, values, false));
        assertEquals(3, Statistics.rank(5, values, true));
        assertEquals(4, Statistics.rank(4, values, true));
    }
}
