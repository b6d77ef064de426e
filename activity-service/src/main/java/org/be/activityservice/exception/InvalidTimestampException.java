package org.be.activityservice.exception;

public class InvalidTimestampException extends ActivityException {

    private final String rawValue;

    public InvalidTimestampException(String rawValue, Throwable cause) {
        super("Cannot parse timestamp: " + rawValue, cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
