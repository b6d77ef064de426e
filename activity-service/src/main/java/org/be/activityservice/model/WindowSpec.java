package org.be.activityservice.model;

import lombok.Value;

/**
 * 재적합 스케줄 설정.
 * startIdx 이전은 워밍업, expandingWindow 마다 재적합, 적합 입력은 최대 rollingWindow 길이.
 */
@Value
public class WindowSpec {
    int startIdx;
    int expandingWindow;
    int rollingWindow;

    public WindowSpec(int startIdx, int expandingWindow, int rollingWindow) {
        if (startIdx < 0) {
            throw new IllegalArgumentException("startIdx must not be negative");
        }
        if (expandingWindow < 1) {
            throw new IllegalArgumentException("expandingWindow must be at least 1");
        }
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("rollingWindow must be at least 1");
        }
        this.startIdx = startIdx;
        this.expandingWindow = expandingWindow;
        this.rollingWindow = rollingWindow;
    }
}
