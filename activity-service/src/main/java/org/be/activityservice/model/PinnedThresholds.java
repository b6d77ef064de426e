package org.be.activityservice.model;

import lombok.Value;

/**
 * 한 번 적합한 임계값과 그 값이 고정되는 연속 인덱스 수
 */
@Value
public class PinnedThresholds {
    ThresholdSet thresholds;
    int span;
}
