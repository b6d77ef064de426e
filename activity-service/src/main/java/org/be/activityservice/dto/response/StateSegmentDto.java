package org.be.activityservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateSegmentDto {

    private String windowLabel;

    /**
     * 상태 이름 (null 이면 이력 부족 구간)
     */
    private String stateName;

    private Integer stateIndex;

    private LocalDateTime start;

    private LocalDateTime end;

    /**
     * 세그먼트에 포함된 버킷 수
     */
    private int length;
}
