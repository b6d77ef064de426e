package org.be.activityservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 알림 마커 위치
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertPointDto {

    private LocalDateTime timestamp;

    private double value;
}
