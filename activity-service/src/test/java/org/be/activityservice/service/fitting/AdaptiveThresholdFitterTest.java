package org.be.activityservice.service.fitting;

import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.exception.FitFailedException;
import org.be.activityservice.model.ThresholdSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdaptiveThresholdFitterTest {

    private static final double[] LEVELS = {0.70, 0.85, 0.92, 0.98};

    @Mock
    private ThresholdFitter extremeValueFitter;

    @Mock
    private ThresholdFitter quantileFitter;

    private AdaptiveThresholdFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = new AdaptiveThresholdFitter(extremeValueFitter, quantileFitter, 30);
    }

    private static double[] series(int nonzero, int zeros) {
        double[] values = new double[nonzero + zeros];
        for (int i = 0; i < nonzero; i++) {
            values[i] = i + 1;
        }
        return values;
    }

    @Test
    void fit_usesExtremeValueWithEnoughNonzeroSamples() {
        ThresholdSet expected = ThresholdSet.of(FitMethod.EXTREME_VALUE, 10, 20, 30, 40);
        when(extremeValueFitter.fit(any(), any())).thenReturn(expected);

        ThresholdSet result = fitter.fit(series(30, 5), LEVELS);

        assertEquals(expected, result);
        verify(quantileFitter, never()).fit(any(), any());
    }

    @Test
    void fit_fallsBackBelowMinimumNonzeroCount() {
        ThresholdSet expected = ThresholdSet.of(FitMethod.QUANTILE, 1, 2, 3, 4);
        when(quantileFitter.fit(any(), any())).thenReturn(expected);

        // 전체 길이는 충분하지만 0이 아닌 값은 29개
        ThresholdSet result = fitter.fit(series(29, 100), LEVELS);

        assertEquals(expected, result);
        verify(extremeValueFitter, never()).fit(any(), any());
    }

    @Test
    void fit_fallsBackOnFitFailureWithFullSlice() {
        double[] values = series(40, 10);
        when(extremeValueFitter.fit(any(), any())).thenThrow(new FitFailedException("no convergence"));
        when(quantileFitter.fit(any(), any())).thenReturn(ThresholdSet.of(FitMethod.QUANTILE, 1, 2, 3, 4));

        ThresholdSet result = fitter.fit(values, LEVELS);

        assertEquals(FitMethod.QUANTILE, result.getMethod());
        ArgumentCaptor<double[]> captor = ArgumentCaptor.forClass(double[].class);
        verify(quantileFitter).fit(captor.capture(), any());
        // 분위수 경로는 0 을 포함한 원래 구간을 그대로 받는다
        assertArrayEquals(values, captor.getValue());
    }

    @Test
    void fit_zeroHeavySliceUsesQuantilesOverZeros() {
        AdaptiveThresholdFitter real = new AdaptiveThresholdFitter(
                new ExtremeValueFitter(5000), new QuantileFitter(), 30);
        double[] values = series(10, 90);

        ThresholdSet result = real.fit(values, new double[]{0.70, 0.85});

        assertEquals(FitMethod.QUANTILE, result.getMethod());
        assertEquals(0.0, result.get(0), 1e-9);
        assertEquals(0.0, result.get(1), 1e-9);
    }
}
