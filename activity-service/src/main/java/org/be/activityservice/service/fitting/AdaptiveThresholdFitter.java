package org.be.activityservice.service.fitting;

import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.exception.FitFailedException;
import org.be.activityservice.model.ThresholdSet;

/**
 * 표본 크기로 적합 방식을 고른다.
 * 0 이 아닌 샘플이 충분하면 극값 적합, 부족하거나 적합이 실패하면 경험적 분위수.
 * 분위수 경로는 0 을 포함한 전체 구간을 사용한다 (극값 경로와 다름, 기존 동작 유지).
 */
@Slf4j
public class AdaptiveThresholdFitter implements ThresholdFitter {

    private final ThresholdFitter extremeValueFitter;
    private final ThresholdFitter quantileFitter;
    private final int minNonzeroSamples;

    public AdaptiveThresholdFitter(ThresholdFitter extremeValueFitter,
                                   ThresholdFitter quantileFitter,
                                   int minNonzeroSamples) {
        this.extremeValueFitter = extremeValueFitter;
        this.quantileFitter = quantileFitter;
        this.minNonzeroSamples = minNonzeroSamples;
    }

    @Override
    public ThresholdSet fit(double[] values, double[] quantileLevels) {
        int nonzero = ExtremeValueFitter.nonzero(values).length;

        if (nonzero >= minNonzeroSamples) {
            try {
                return extremeValueFitter.fit(values, quantileLevels);
            } catch (FitFailedException e) {
                log.debug("극값 적합 실패, 분위수 방식으로 대체: {}", e.getMessage());
            }
        } else {
            log.debug("0이 아닌 샘플 부족 ({} < {}), 분위수 방식 사용", nonzero, minNonzeroSamples);
        }
        return quantileFitter.fit(values, quantileLevels);
    }
}
