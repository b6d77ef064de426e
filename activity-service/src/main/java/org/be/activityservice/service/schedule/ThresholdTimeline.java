package org.be.activityservice.service.schedule;

import org.be.activityservice.enums.FitMethod;
import org.be.activityservice.model.PinnedThresholds;
import org.be.activityservice.model.ThresholdSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 인덱스 → 고정 임계값 조회 테이블. 스케줄러 결과를 한 번만 펼쳐 둔다.
 */
public class ThresholdTimeline {

    private final List<ThresholdSet> byIndex;
    private final List<PinnedThresholds> spans;

    private ThresholdTimeline(List<ThresholdSet> byIndex, List<PinnedThresholds> spans) {
        this.byIndex = Collections.unmodifiableList(byIndex);
        this.spans = Collections.unmodifiableList(spans);
    }

    public static ThresholdTimeline materialize(Iterable<PinnedThresholds> schedule) {
        List<ThresholdSet> byIndex = new ArrayList<>();
        List<PinnedThresholds> spans = new ArrayList<>();
        for (PinnedThresholds pinned : schedule) {
            spans.add(pinned);
            for (int i = 0; i < pinned.getSpan(); i++) {
                byIndex.add(pinned.getThresholds());
            }
        }
        return new ThresholdTimeline(byIndex, spans);
    }

    public ThresholdSet at(int index) {
        return byIndex.get(index);
    }

    public int size() {
        return byIndex.size();
    }

    public List<PinnedThresholds> getSpans() {
        return spans;
    }

    /**
     * 적합 방식별 적합 횟수
     */
    public Map<FitMethod, Integer> fitCounts() {
        Map<FitMethod, Integer> counts = new EnumMap<>(FitMethod.class);
        for (PinnedThresholds pinned : spans) {
            counts.merge(pinned.getThresholds().getMethod(), 1, Integer::sum);
        }
        return counts;
    }
}
