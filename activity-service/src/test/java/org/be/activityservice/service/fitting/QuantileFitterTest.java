package org.be.activityservice.service.fitting;

import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.model.ThresholdSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QuantileFitterTest {

    private final QuantileFitter fitter = new QuantileFitter();

    @Test
    void fit_returnsNonDecreasingThresholds() {
        double[] values = {3, 17, 0, 42, 8, 8, 25, 1, 0, 13, 99, 5, 61, 2, 7};

        ThresholdSet thresholds = fitter.fit(values, new double[]{0.70, 0.85, 0.92, 0.98});

        assertEquals(FitMethod.QUANTILE, thresholds.getMethod());
        assertEquals(4, thresholds.size());
        assertNonDecreasing(thresholds.getCeilings());
    }

    @Test
    void fit_interpolatesLinearlyBetweenOrderStatistics() {
        double[] values = {10, 20, 30, 40, 50};

        ThresholdSet thresholds = fitter.fit(values, new double[]{0.5, 0.7});

        assertEquals(30.0, thresholds.get(0), 1e-9);
        // (5 - 1) * 0.7 = 2.8 -> 30 + 0.8 * 10
        assertEquals(38.0, thresholds.get(1), 1e-9);
    }

    @Test
    void fit_includesZerosInSample() {
        // 0 을 빼면 중앙값이 20 이지만 전체 구간 기준으로는 10
        double[] values = {0, 0, 10, 20, 30};

        ThresholdSet thresholds = fitter.fit(values, new double[]{0.5});

        assertEquals(10.0, thresholds.get(0), 1e-9);
    }

    @Test
    void fit_emptySliceYieldsNaN() {
        ThresholdSet thresholds = fitter.fit(new double[0], new double[]{0.7, 0.9});

        assertTrue(Double.isNaN(thresholds.get(0)));
        assertTrue(Double.isNaN(thresholds.get(1)));
    }

    private static void assertNonDecreasing(double[] ceilings) {
        for (int i = 1; i < ceilings.length; i++) {
            assertTrue(ceilings[i] >= ceilings[i - 1], "ceilings " + java.util.Arrays.toString(ceilings));
        }
    }
}
