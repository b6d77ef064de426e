package org.be.activityservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertEvent {
    private String id;
    private String type; // state_change
    private String entity;
    private String windowLabel;
    private String stateName;
    private int stateIndex;
    private Integer previousStateIndex;
    private String title;
    private String content;
    private LocalDateTime bucket;
    private double value;
    private Map<String, Object> metadata;
    private LocalDateTime timestamp;
    private double severity; // 0.0 ~ 1.0
}
