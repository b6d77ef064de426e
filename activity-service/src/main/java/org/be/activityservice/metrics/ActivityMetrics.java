package org.be.activityservice.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.be.activityservice.enums.FitMethod;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class ActivityMetrics {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, Counter> fitCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> droppedRecordCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> alertCounters = new ConcurrentHashMap<>();
    private final Timer evaluationTimer;

    public ActivityMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.evaluationTimer = Timer.builder("activity.evaluation.duration")
                .description("Time taken to evaluate one series")
                .register(meterRegistry);
    }

    // === 임계값 적합 횟수 (방식별) ===
    public void recordFits(Map<FitMethod, Integer> fitCounts) {
        fitCounts.forEach((method, count) -> {
            Counter counter = fitCounters.computeIfAbsent(method.getTag(),
                    k -> Counter.builder("activity.fit.count")
                            .tag("method", method.getTag())
                            .description("Threshold fits by method")
                            .register(meterRegistry));
            counter.increment(count);
        });
    }

    // === 집계에서 제외된 레코드 ===
    public void recordDroppedRecords(String reason, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = droppedRecordCounters.computeIfAbsent(reason,
                k -> Counter.builder("activity.records.dropped")
                        .tag("reason", reason)
                        .description("Records dropped during aggregation")
                        .register(meterRegistry));
        counter.increment(count);
        log.debug("Dropped records recorded: reason={}, count={}", reason, count);
    }

    // === 윈도우별 알림 발생 수 ===
    public void incrementAlerts(String windowLabel, long count) {
        if (count <= 0) {
            return;
        }
        Counter counter = alertCounters.computeIfAbsent(windowLabel,
                k -> Counter.builder("activity.alerts.raised")
                        .tag("window", windowLabel)
                        .description("State change alerts raised")
                        .register(meterRegistry));
        counter.increment(count);
    }

    public void recordEvaluationTime(long timeInMillis) {
        evaluationTimer.record(timeInMillis, TimeUnit.MILLISECONDS);
    }
}
