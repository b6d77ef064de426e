package org.be.activityservice.service.fitting;

import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.exception.FitFailedException;
import org.be.activityservice.model.ThresholdSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtremeValueFitterTest {

    private final ExtremeValueFitter fitter = new ExtremeValueFitter(5000);

    /**
     * loc=50, scale=10 Gumbel 분포의 균등 간격 분위수 표본
     */
    private static double[] gumbelSample(int n) {
        GevDistribution source = new GevDistribution(0.0, 50.0, 10.0);
        double[] sample = new double[n];
        for (int i = 0; i < n; i++) {
            sample[i] = source.inverseCumulative((i + 0.5) / n);
        }
        return sample;
    }

    @Test
    void estimate_recoversLocationAndScale() {
        GevDistribution fitted = fitter.estimate(gumbelSample(400));

        assertEquals(50.0, fitted.getLocation(), 2.0);
        assertEquals(10.0, fitted.getScale(), 2.0);
    }

    @Test
    void fit_returnsRoundedAscendingCeilings() {
        ThresholdSet thresholds = fitter.fit(gumbelSample(400), new double[]{0.70, 0.85, 0.92, 0.98});

        assertEquals(FitMethod.EXTREME_VALUE, thresholds.getMethod());
        assertNonDecreasing(thresholds.getCeilings());
        for (double ceiling : thresholds.getCeilings()) {
            assertEquals(Math.rint(ceiling), ceiling);
        }
        // 0.98 레벨 상한 = 분위수 0.99 ≈ 96
        assertTrue(thresholds.last() > 80 && thresholds.last() < 115, "last ceiling " + thresholds.last());
    }

    @Test
    void fit_ignoresZeroBuckets() {
        double[] sample = gumbelSample(200);
        double[] withZeros = new double[sample.length + 100];
        System.arraycopy(sample, 0, withZeros, 0, sample.length);

        ThresholdSet plain = fitter.fit(sample, new double[]{0.70, 0.98});
        ThresholdSet padded = fitter.fit(withZeros, new double[]{0.70, 0.98});

        assertEquals(plain, padded);
    }

    @Test
    void estimate_constantSampleFails() {
        double[] constant = new double[50];
        java.util.Arrays.fill(constant, 7.0);

        assertThrows(FitFailedException.class, () -> fitter.estimate(constant));
    }

    private static void assertNonDecreasing(double[] ceilings) {
        for (int i = 1; i < ceilings.length; i++) {
            assertTrue(ceilings[i] >= ceilings[i - 1], "ceilings " + java.util.Arrays.toString(ceilings));
        }
    }
}
