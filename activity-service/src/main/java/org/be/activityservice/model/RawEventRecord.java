package org.be.activityservice.model;

import lombok.Value;

/**
 * 집계 전 원시 레코드. weight 가 null 이면 해당 레코드는 가중치 합산에서 0으로 취급된다.
 * timestamp 는 소스에서 읽은 값 그대로 (LocalDateTime 또는 문자열).
 */
@Value
public class RawEventRecord {
    Object timestamp;
    Double weight;

    public static RawEventRecord event(Object timestamp) {
        return new RawEventRecord(timestamp, null);
    }
}
