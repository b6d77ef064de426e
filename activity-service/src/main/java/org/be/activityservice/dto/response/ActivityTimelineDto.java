package org.be.activityservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityTimelineDto {

    /**
     * 대상 (국가 코드 등)
     */
    private String entity;

    /**
     * 집계 간격 코드 (1D 등)
     */
    private String timescale;

    /**
     * 집계 간격 표시 이름 (Daily 등)
     */
    private String timescaleLabel;

    /**
     * Mentions 또는 Events
     */
    private String metricType;

    private List<String> windowLabels;

    private List<ActivityRowDto> rows;

    /**
     * 윈도우 라벨별 연속 상태 구간
     */
    private Map<String, List<StateSegmentDto>> segments;

    /**
     * 윈도우 라벨별 알림 마커 (timestamp, value)
     */
    private Map<String, List<AlertPointDto>> alertPoints;

    private FitSummary fitSummary;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FitSummary {
        private int seriesLength;
        private int extremeValueFits;
        private int quantileFits;
        private int droppedRecords;
    }
}
