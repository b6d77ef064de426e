package org.be.activityservice.service.state;

import org.be.activityservice.model.ActivityState;
import org.be.activityservice.model.StateRow;
import org.be.activityservice.model.StateWindow;
import org.be.activityservice.model.ThresholdSet;
import org.be.activityservice.model.ValueSeries;
import org.be.activityservice.service.schedule.ThresholdTimeline;

import java.util.ArrayList;
import java.util.List;

/**
 * 최근 윈도우 값과 고정 임계값으로 6단계 활동 상태를 판정한다.
 */
public class ActivityStateClassifier {

    private static final int MIN_LEVELS_FOR_EXTREME = 4;

    private final List<String> stateNames;
    private final double extremeMultiplier;

    public ActivityStateClassifier(List<String> stateNames, double extremeMultiplier) {
        this.stateNames = List.copyOf(stateNames);
        this.extremeMultiplier = extremeMultiplier;
    }

    /**
     * 판정 규칙
     * <ol>
     *     <li>임계값이 4개 이상이고 윈도우 중 하나라도 마지막 임계값 x 배수 이상이면 마지막 상태 (Extreme High)</li>
     *     <li>윈도우의 모든 값이 임계값 미만인 첫 번째 상태</li>
     *     <li>어느 임계값도 만족하지 않으면 끝에서 두 번째 상태 (Very High)</li>
     * </ol>
     */
    public ActivityState classify(double[] window, ThresholdSet thresholds) {
        if (thresholds.size() >= MIN_LEVELS_FOR_EXTREME) {
            double extremeHigh = thresholds.last() * extremeMultiplier;
            for (double value : window) {
                if (value >= extremeHigh) {
                    return stateAt(stateNames.size() - 1);
                }
            }
        }

        for (int i = 0; i < thresholds.size(); i++) {
            if (allBelow(window, thresholds.get(i))) {
                return stateAt(i);
            }
        }

        return stateAt(stateNames.size() - 2);
    }

    /**
     * 윈도우 하나에 대해 시계열 전체의 상태 행을 만든다.
     * i 번째 루프는 [i - W, i) 구간을 보고 결과를 i - 1 위치에 기록한다.
     * 임계값은 윈도우의 마지막 샘플에 고정된 값을 쓴다.
     */
    public List<StateRow> classifySeries(ValueSeries series, ThresholdTimeline timeline,
                                         StateWindow window, int startIdx) {
        int length = series.size();
        ActivityState[] states = new ActivityState[length];

        for (int i = startIdx; i <= length; i++) {
            int from = i - window.getLength();
            if (from < 0) {
                continue;
            }
            states[i - 1] = classify(series.values(from, i), timeline.at(i - 1));
        }

        List<StateRow> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            rows.add(states[i] == null
                    ? StateRow.unset(series.timestampAt(i), series.valueAt(i), window.getLabel())
                    : StateRow.of(series.timestampAt(i), series.valueAt(i), window.getLabel(), states[i]));
        }
        return rows;
    }

    private ActivityState stateAt(int index) {
        return new ActivityState(stateNames.get(index), index);
    }

    private static boolean allBelow(double[] window, double threshold) {
        for (double value : window) {
            if (!(value < threshold)) {
                return false;
            }
        }
        return true;
    }
}
