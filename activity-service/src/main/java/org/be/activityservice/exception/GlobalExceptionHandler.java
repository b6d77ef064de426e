package org.be.activityservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidSchemaException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSchemaException(InvalidSchemaException e) {
        log.warn("입력 레코드 스키마 오류: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "INVALID_SCHEMA", e.getMessage());
    }

    @ExceptionHandler(CountryNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleCountryNotFoundException(CountryNotFoundException e) {
        log.warn("국가 데이터를 찾을 수 없음: {}", e.getMessage());
        return errorResponse(HttpStatus.NOT_FOUND, "COUNTRY_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("잘못된 요청: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadableRequest(Exception e) {
        log.warn("요청 본문 검증 실패: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "요청 본문이 올바르지 않습니다");
    }

    @ExceptionHandler(ActivityException.class)
    public ResponseEntity<Map<String, Object>> handleActivityException(ActivityException e) {
        log.error("활동 상태 계산 중 예외 발생", e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "ACTIVITY_ERROR", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneralException(Exception e) {
        log.error("예상치 못한 예외 발생", e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "내부 서버 오류가 발생했습니다");
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(status).body(errorResponse);
    }
}
