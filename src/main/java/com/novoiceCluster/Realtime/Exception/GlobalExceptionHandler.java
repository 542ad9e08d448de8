package com.novoiceCluster.Realtime.Exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exceptions thrown by REST controllers, returned as
 * {@code {timestamp, status, error, message, path}}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RealtimeException.class)
    public ResponseEntity<Map<String, Object>> handleRealtime(RealtimeException ex, WebRequest request) {
        HttpStatus status = statusOf(ex.getKind());
        log.warn("🚫 {} request: {}", ex.getKind().wireName(), ex.getMessage());

        return ResponseEntity.status(status)
                .body(buildErrorResponse(status, status.getReasonPhrase(), ex.getMessage(), request.getDescription(false)));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex, WebRequest request) {
        log.error("🚫 Access denied: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(buildErrorResponse(HttpStatus.FORBIDDEN, "Access Denied", ex.getMessage(), request.getDescription(false)));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex, WebRequest request) {
        log.warn("⚠️ Bad request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(buildErrorResponse(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request.getDescription(false)));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleRedisFailure(DataAccessException ex, WebRequest request) {
        log.error("🔴 Redis unavailable: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(buildErrorResponse(
                        HttpStatus.SERVICE_UNAVAILABLE,
                        "Service Temporarily Unavailable",
                        "Unable to reach the data store. Please try again later.",
                        request.getDescription(false)
                ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(Exception ex, WebRequest request) {
        log.error("💥 Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(
                        HttpStatus.INTERNAL_SERVER_ERROR,
                        "Internal Server Error",
                        "An unexpected error occurred. Please try again later.",
                        request.getDescription(false)
                ));
    }

    static HttpStatus statusOf(FailureKind kind) {
        switch (kind) {
            case AUTHENTICATION:
                return HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case CAPACITY:
                return HttpStatus.TOO_MANY_REQUESTS;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case VALIDATION:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private Map<String, Object> buildErrorResponse(HttpStatus status, String error, String message, String path) {
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", path.replace("uri=", ""));
        return errorResponse;
    }
}
