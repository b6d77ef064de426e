package org.be.activityservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상태 판정에 쓰는 look-back 윈도우 (예: 14 샘플 = "7 day")
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateWindow {
    private int length;
    private String label;
}
