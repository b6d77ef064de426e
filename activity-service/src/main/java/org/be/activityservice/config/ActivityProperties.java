package org.be.activityservice.config;

import lombok.Data;
import org.be.activityservice.model.StateWindow;
import org.be.activityservice.model.WindowSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Data
@Component
@ConfigurationProperties(prefix = "activity")
public class ActivityProperties {

    /**
     * 상태 경계 분위수 레벨 (오름차순, (0,1) 범위)
     */
    private List<Double> quantileLevels = new ArrayList<>(List.of(0.70, 0.85, 0.92, 0.98));

    /**
     * 상태 이름 (분위수 레벨 수 + 2, 마지막은 Extreme High)
     */
    private List<String> stateNames = new ArrayList<>(
            List.of("Very Low", "Low", "Moderate", "High", "Very High", "Extreme High"));

    /**
     * 워밍업 길이 (이 인덱스 이전에는 상태를 계산하지 않음)
     */
    private int startIdx = 360;

    /**
     * 재적합 주기 (샘플 수)
     */
    private int expandingWindow = 60;

    /**
     * 적합에 사용하는 최대 이력 길이
     */
    private int rollingWindow = 1460;

    /**
     * 상태 판정 윈도우 목록
     */
    private List<StateWindow> windows = new ArrayList<>(List.of(
            new StateWindow(14, "7 day"),
            new StateWindow(60, "30 day")));

    /**
     * 극값 분포 적합에 필요한 최소 0이 아닌 샘플 수
     */
    private int minNonzeroSamples = 30;

    /**
     * Extreme High 판정 배수 (마지막 임계값 대비)
     */
    private double extremeMultiplier = 3.0;

    /**
     * 알림 대상 최소 상태 인덱스 (3 = High)
     */
    private int alertMinStateIndex = 3;

    /**
     * 기본 집계 간격
     */
    private String defaultTimescale = "1D";

    private Records records = new Records();
    private Fit fit = new Fit();
    private Executor executor = new Executor();

    @Data
    public static class Records {
        private String timestampField = "datetime_of_article";
        private String weightField = "nummentions";
    }

    @Data
    public static class Fit {
        private int maxEvaluations = 5000;
    }

    @Data
    public static class Executor {
        private int poolSize = 4;
        private String threadNamePrefix = "activity-eval-";
    }

    // === 유효성 검사 ===

    public void validate() {
        if (quantileLevels == null || quantileLevels.isEmpty()) {
            throw new IllegalArgumentException("At least one quantile level is required");
        }
        for (int i = 0; i < quantileLevels.size(); i++) {
            double level = quantileLevels.get(i);
            if (level <= 0.0 || level >= 1.0) {
                throw new IllegalArgumentException("Quantile level must be in (0,1): " + level);
            }
            if (i > 0 && level <= quantileLevels.get(i - 1)) {
                throw new IllegalArgumentException("Quantile levels must be strictly ascending");
            }
        }
        if (stateNames == null || stateNames.size() != quantileLevels.size() + 2) {
            throw new IllegalArgumentException("State names must contain quantile levels + 2 entries");
        }
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("At least one state window is required");
        }
        Set<String> labels = new HashSet<>();
        for (StateWindow window : windows) {
            if (window.getLength() < 1) {
                throw new IllegalArgumentException("Window length must be at least 1: " + window);
            }
            if (window.getLabel() == null || window.getLabel().trim().isEmpty()) {
                throw new IllegalArgumentException("Window label is required: " + window);
            }
            if (!labels.add(window.getLabel())) {
                throw new IllegalArgumentException("Duplicate window label: " + window.getLabel());
            }
        }
        if (minNonzeroSamples < 1) {
            throw new IllegalArgumentException("minNonzeroSamples must be at least 1");
        }
        if (records.getTimestampField() == null || records.getTimestampField().trim().isEmpty()) {
            throw new IllegalArgumentException("Timestamp field name is required");
        }
        // WindowSpec 생성자가 나머지 범위를 검사한다
        toWindowSpec();
    }

    // === 편의 메서드 ===

    public WindowSpec toWindowSpec() {
        return new WindowSpec(startIdx, expandingWindow, rollingWindow);
    }

    public double[] quantileLevelArray() {
        return quantileLevels.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public String getConfigSummary() {
        return String.format(
                "Activity[levels=%s, start=%d, expanding=%d, rolling=%d, windows=%d]",
                quantileLevels,
                startIdx,
                expandingWindow,
                rollingWindow,
                windows.size()
        );
    }
}
