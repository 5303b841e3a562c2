package com.potatoregistry.web;

import com.potatoregistry.error.ErrorKind;
import com.potatoregistry.error.RegistryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> handleRegistry(RegistryException e) {
        HttpStatus status = statusOf(e.kind());
        if (status.is5xxServerError()) {
            log.warn("storage failure: {}", e.getMessage(), e);
        }
        ResponseEntity.BodyBuilder res = ResponseEntity.status(status);
        if (e.kind().retryable()) {
            res.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return res.body(body(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT, INVALID_STATE -> HttpStatus.CONFLICT;
            case INTEGRITY -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSIENT_STORAGE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static Map<String, Object> body(String error, String message) {
        return Map.of("ok", false, "error", error, "message", message == null ? "" : message);
    }
}
