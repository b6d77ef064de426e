package org.be.activityservice.service.fitting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GevDistributionTest {

    @Test
    void inverseCumulative_gumbelCase() {
        GevDistribution gumbel = new GevDistribution(0.0, 50.0, 10.0);

        double expected = 50.0 - 10.0 * Math.log(-Math.log(0.99));
        assertEquals(expected, gumbel.inverseCumulative(0.99), 1e-9);
    }

    @Test
    void intervalUpper_usesUpperTailOfCentralInterval() {
        GevDistribution distribution = new GevDistribution(-0.2, 10.0, 3.0);

        assertEquals(distribution.inverseCumulative(0.96), distribution.intervalUpper(0.92), 1e-12);
    }

    @Test
    void logDensity_outsideSupportIsNegativeInfinity() {
        // c > 0 이면 상한 loc + scale / c 가 존재
        GevDistribution bounded = new GevDistribution(0.5, 0.0, 1.0);

        assertEquals(Double.NEGATIVE_INFINITY, bounded.logDensity(3.0));
        assertTrue(Double.isFinite(bounded.logDensity(1.0)));
    }

    @Test
    void inverseCumulative_isIncreasingInProbability() {
        GevDistribution distribution = new GevDistribution(-0.3, 20.0, 5.0);

        double previous = Double.NEGATIVE_INFINITY;
        for (double p = 0.05; p < 1.0; p += 0.05) {
            double quantile = distribution.inverseCumulative(p);
            assertTrue(quantile > previous);
            previous = quantile;
        }
    }
}
