package org.be.activityservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.service.fitting.AdaptiveThresholdFitter;
import org.be.activityservice.service.fitting.ExtremeValueFitter;
import org.be.activityservice.service.fitting.QuantileFitter;
import org.be.activityservice.service.fitting.ThresholdFitter;
import org.be.activityservice.service.series.SeriesAggregator;
import org.be.activityservice.service.state.ActivityStateClassifier;
import org.be.activityservice.service.state.AlertEngine;
import org.be.activityservice.service.state.StateSegmentExtractor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 상태 계산 엔진 구성요소. 설정값은 시작 시 한 번 검증한다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ActivityEngineConfig {

    private final ActivityProperties activityProperties;

    @Bean
    public ThresholdFitter thresholdFitter() {
        activityProperties.validate();
        log.info("활동 상태 엔진 설정: {}", activityProperties.getConfigSummary());

        return new AdaptiveThresholdFitter(
                new ExtremeValueFitter(activityProperties.getFit().getMaxEvaluations()),
                new QuantileFitter(),
                activityProperties.getMinNonzeroSamples());
    }

    @Bean
    public ActivityStateClassifier activityStateClassifier() {
        return new ActivityStateClassifier(
                activityProperties.getStateNames(),
                activityProperties.getExtremeMultiplier());
    }

    @Bean
    public AlertEngine alertEngine() {
        return new AlertEngine(activityProperties.getAlertMinStateIndex());
    }

    @Bean
    public SeriesAggregator seriesAggregator() {
        return new SeriesAggregator();
    }

    @Bean
    public StateSegmentExtractor stateSegmentExtractor() {
        return new StateSegmentExtractor();
    }
}
