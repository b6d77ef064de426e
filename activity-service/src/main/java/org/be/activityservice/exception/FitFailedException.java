package org.be.activityservice.exception;

/**
 * 분포 적합 실패. 적합 전략 내부에서만 쓰이며 항상 분위수 방식으로 대체된다.
 */
public class FitFailedException extends ActivityException {

    public FitFailedException(String message) {
        super(message);
    }

    public FitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
