package org.be.activityservice.service.state;

import org.be.activityservice.dto.response.AlertPointDto;
import org.be.activityservice.dto.response.StateSegmentDto;
import org.be.activityservice.model.ActivityState;
import org.be.activityservice.model.StateRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 같은 상태가 연속되는 구간으로 묶는다. 상태 미정 구간도 하나의 세그먼트가 된다.
 * 알림이 발생한 행은 마커 위치 목록으로 따로 뽑는다.
 */
public class StateSegmentExtractor {

    public List<StateSegmentDto> extract(List<StateRow> rows) {
        List<StateSegmentDto> segments = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= rows.size(); i++) {
            if (i == rows.size() || !sameState(rows.get(start), rows.get(i))) {
                segments.add(toSegment(rows, start, i));
                start = i;
            }
        }
        return segments;
    }

    public List<AlertPointDto> extractAlertPoints(List<StateRow> rows) {
        return rows.stream()
                .filter(StateRow::isAlert)
                .map(row -> new AlertPointDto(row.getTimestamp(), row.getValue()))
                .toList();
    }

    private StateSegmentDto toSegment(List<StateRow> rows, int from, int to) {
        StateRow first = rows.get(from);
        ActivityState state = first.getState().orElse(null);
        return StateSegmentDto.builder()
                .windowLabel(first.getWindowLabel())
                .stateName(state == null ? null : state.getName())
                .stateIndex(state == null ? null : state.getIndex())
                .start(first.getTimestamp())
                .end(rows.get(to - 1).getTimestamp())
                .length(to - from)
                .build();
    }

    private static boolean sameState(StateRow a, StateRow b) {
        return Objects.equals(a.getState().map(ActivityState::getName).orElse(null),
                b.getState().map(ActivityState::getName).orElse(null));
    }
}
