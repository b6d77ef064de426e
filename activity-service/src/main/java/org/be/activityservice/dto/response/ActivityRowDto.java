package org.be.activityservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.activityservice.model.ActivityState;
import org.be.activityservice.model.StateRow;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRowDto {

    private LocalDateTime timestamp;

    /**
     * 집계된 원시 값 (멘션 수 또는 이벤트 수)
     */
    private double value;

    private String windowLabel;

    /**
     * 상태 이름 (워밍업 구간은 null)
     */
    private String stateName;

    private Integer stateIndex;

    private boolean alert;

    public static ActivityRowDto from(StateRow row) {
        ActivityState state = row.getState().orElse(null);
        return ActivityRowDto.builder()
                .timestamp(row.getTimestamp())
                .value(row.getValue())
                .windowLabel(row.getWindowLabel())
                .stateName(state == null ? null : state.getName())
                .stateIndex(state == null ? null : state.getIndex())
                .alert(row.isAlert())
                .build();
    }
}
