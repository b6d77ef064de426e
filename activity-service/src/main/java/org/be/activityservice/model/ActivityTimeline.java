package org.be.activityservice.model;

import lombok.Builder;
import lombok.Getter;
import org.be.activityservice.service.schedule.ThresholdTimeline;

import java.util.List;
import java.util.Map;

/**
 * 시계열 하나에 대한 평가 결과. 윈도우 라벨 순서는 설정 순서를 따른다.
 */
@Getter
@Builder
public class ActivityTimeline {

    private final String entity;
    private final ValueSeries series;
    private final ThresholdTimeline thresholds;
    private final Map<String, List<StateRow>> rowsByWindow;
    private final int droppedRecords;

    public List<StateRow> rows(String windowLabel) {
        List<StateRow> rows = rowsByWindow.get(windowLabel);
        if (rows == null) {
            throw new IllegalArgumentException("Unknown window label: " + windowLabel);
        }
        return rows;
    }
}
