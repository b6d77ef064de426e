package org.be.activityservice.model;

import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * (타임스탬프, 윈도우 라벨) 단위의 판정 결과.
 * state 가 비어 있으면 이력 부족(워밍업)이며 "알림 없음"과는 다르다.
 */
@Value
public class StateRow {
    LocalDateTime timestamp;
    double value;
    String windowLabel;
    ActivityState state;
    @With
    boolean alert;

    public static StateRow unset(LocalDateTime timestamp, double value, String windowLabel) {
        return new StateRow(timestamp, value, windowLabel, null, false);
    }

    public static StateRow of(LocalDateTime timestamp, double value, String windowLabel, ActivityState state) {
        return new StateRow(timestamp, value, windowLabel, state, false);
    }

    public Optional<ActivityState> getState() {
        return Optional.ofNullable(state);
    }

    public boolean isSet() {
        return state != null;
    }
}
