package org.be.activityservice.exception;

/**
 * 입력 레코드에 필수 필드가 없을 때. 집계 시작 전에 던져진다.
 */
public class InvalidSchemaException extends ActivityException {

    public InvalidSchemaException(String message) {
        super(message);
    }
}
