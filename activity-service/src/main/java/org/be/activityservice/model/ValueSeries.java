package org.be.activityservice.model;

import lombok.Getter;
import org.be.activityservice.enums.MetricType;
import org.be.activityservice.enums.Timescale;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 고정 간격으로 집계된 시계열.
 * 타임스탬프는 엄격하게 증가하며 빈 구간은 0으로 채워진다.
 */
@Getter
public class ValueSeries {

    private final List<SeriesPoint> points;
    private final Timescale timescale;
    private final boolean usingMentions;

    public ValueSeries(List<SeriesPoint> points, Timescale timescale, boolean usingMentions) {
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).getTimestamp().isAfter(points.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException("Series timestamps must be strictly increasing at index " + i);
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.timescale = timescale;
        this.usingMentions = usingMentions;
    }

    public static ValueSeries empty(Timescale timescale, boolean usingMentions) {
        return new ValueSeries(List.of(), timescale, usingMentions);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double valueAt(int index) {
        return points.get(index).getValue();
    }

    public LocalDateTime timestampAt(int index) {
        return points.get(index).getTimestamp();
    }

    /**
     * [from, to) 구간의 값 배열
     */
    public double[] values(int from, int to) {
        double[] result = new double[to - from];
        for (int i = from; i < to; i++) {
            result[i - from] = points.get(i).getValue();
        }
        return result;
    }

    public MetricType getMetricType() {
        return usingMentions ? MetricType.MENTIONS : MetricType.EVENTS;
    }
}
