package com.kincircle.trust.config;

import com.kincircle.trust.service.error.AssistantUnavailableException;
import com.kincircle.trust.service.error.AuthenticationFailureException;
import com.kincircle.trust.service.error.LockedOutException;
import com.kincircle.trust.service.error.PermissionDeniedException;
import com.kincircle.trust.service.error.RateLimitedException;
import com.kincircle.trust.service.error.TrustException;
import com.kincircle.trust.service.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("invalid request");
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, req);
    }

    @ExceptionHandler(ValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadCredentialInput(ValidationException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(AuthenticationFailureException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleAuthFailure(AuthenticationFailureException ex, HttpServletRequest req) {
        Map<String, Object> m = body(HttpStatus.UNAUTHORIZED, ex.getCode(), ex.getMessage(), req);
        m.put("failedAttempts", ex.getFailedAttempts());
        return m;
    }

    @ExceptionHandler(LockedOutException.class)
    public ResponseEntity<Map<String, Object>> handleLockedOut(LockedOutException ex, HttpServletRequest req) {
        Map<String, Object> m = body(HttpStatus.LOCKED, ex.getCode(), ex.getMessage(), req);
        m.put("retryAfterSeconds", ex.getRemainingSeconds());
        return ResponseEntity.status(HttpStatus.LOCKED)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRemainingSeconds()))
                .body(m);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleDenied(PermissionDeniedException ex, HttpServletRequest req) {
        return body(HttpStatus.FORBIDDEN, ex.getCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitedException ex, HttpServletRequest req) {
        long retryAfter = (ex.getResetInMs() + 999) / 1000;
        Map<String, Object> m = body(HttpStatus.TOO_MANY_REQUESTS, ex.getCode(), ex.getMessage(), req);
        m.put("retryAfterSeconds", retryAfter);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter))
                .body(m);
    }

    @ExceptionHandler(AssistantUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleAssistantDown(AssistantUnavailableException ex, HttpServletRequest req) {
        log.warn("Assistant proxy unavailable on {}: {}", req.getRequestURI(), ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(TrustException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleOtherTrust(TrustException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(body(status, status.name(), ex.getReason(), req));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), req);
    }

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleSql(DataAccessException ex, HttpServletRequest req) {
        log.error("Store failure on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR",
                ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleAny(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", ex.getMessage(), req);
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("timestamp", Instant.now());
        m.put("status", status.value());
        m.put("error", code);
        m.put("message", message);
        m.put("path", req.getRequestURI());
        return m;
    }
}
