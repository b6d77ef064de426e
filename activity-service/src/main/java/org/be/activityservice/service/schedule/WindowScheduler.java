package org.be.activityservice.service.schedule;

import org.be.activityservice.model.PinnedThresholds;
import org.be.activityservice.model.ThresholdSet;
import org.be.activityservice.model.ValueSeries;
import org.be.activityservice.model.WindowSpec;
import org.be.activityservice.service.fitting.ThresholdFitter;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 확장/롤링 재적합 스케줄.
 * <p>
 * startIdx 까지의 첫 구간으로 한 번 적합한 뒤 expandingWindow 샘플마다 구간 끝을 늘려 다시 적합한다.
 * 구간 길이가 rollingWindow 를 넘으면 시작점을 밀어 길이를 rollingWindow 로 맞춘다.
 * 각 적합 결과는 자기 구간의 마지막 span 개 인덱스에 고정되며, span 합은 시계열 길이와 같다.
 * <p>
 * 커서 상태는 iterator 마다 따로 가지므로 같은 인스턴스를 여러 번 순회해도 결과가 같다.
 */
public class WindowScheduler implements Iterable<PinnedThresholds> {

    private final ValueSeries series;
    private final WindowSpec spec;
    private final ThresholdFitter fitter;
    private final double[] quantileLevels;

    public WindowScheduler(ValueSeries series, WindowSpec spec, ThresholdFitter fitter, double[] quantileLevels) {
        this.series = series;
        this.spec = spec;
        this.fitter = fitter;
        this.quantileLevels = quantileLevels.clone();
    }

    @Override
    public Iterator<PinnedThresholds> iterator() {
        return new SpanIterator();
    }

    private class SpanIterator implements Iterator<PinnedThresholds> {

        private final int length = series.size();
        private int windowStart = 0;
        private int windowEnd = spec.getStartIdx();
        private boolean first = true;
        private boolean last = false;
        private boolean done = spec.getStartIdx() > series.size();
        private int tailLength = 0;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public PinnedThresholds next() {
            if (done) {
                throw new NoSuchElementException();
            }
            ThresholdSet thresholds = fitter.fit(series.values(windowStart, windowEnd), quantileLevels);

            int span;
            if (first) {
                span = windowEnd - windowStart;
                first = false;
            } else if (last) {
                span = tailLength;
            } else {
                span = spec.getExpandingWindow();
            }

            if (last) {
                done = true;
            } else {
                advance();
            }
            return new PinnedThresholds(thresholds, span);
        }

        private void advance() {
            if (windowEnd + spec.getExpandingWindow() < length) {
                windowEnd += spec.getExpandingWindow();
            } else {
                tailLength = length - windowEnd;
                windowEnd = length;
                last = true;
            }

            if (windowEnd - windowStart > spec.getRollingWindow()) {
                windowStart = windowEnd - spec.getRollingWindow();
            }
        }
    }
}
