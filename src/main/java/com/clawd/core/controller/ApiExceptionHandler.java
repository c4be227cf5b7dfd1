package com.clawd.core.controller;

import com.clawd.core.exception.ClawdException;
import com.clawd.core.exception.LimiterUnavailableException;
import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.ProvidersExhaustedException;
import com.clawd.core.exception.RateLimitExceededException;
import com.clawd.core.exception.RetriesExhaustedException;
import com.clawd.core.exception.StoreUnavailableException;
import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the core's error taxonomy to HTTP responses with a small JSON error body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(PermanentRequestException.class)
    public ResponseEntity<Map<String, Object>> handlePermanent(PermanentRequestException ex) {
        HttpStatus status = ex.getReason() == PermanentRequestException.Reason.MALFORMED_REQUEST
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.BAD_GATEWAY;
        return error(status, ex.getReason().name().toLowerCase(), ex.getMessage());
    }

    @ExceptionHandler(UnsupportedCapabilityException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupported(UnsupportedCapabilityException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "unsupported_capability", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimited(RateLimitExceededException ex) {
        long retryAfterSeconds = Math.max(1, (ex.getRetryAfter().toMillis() + 999) / 1000);
        Map<String, Object> body = body("rate_limited", ex.getMessage());
        body.put("resource", ex.getResource());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(body);
    }

    @ExceptionHandler(ProvidersExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleProvidersExhausted(ProvidersExhaustedException ex) {
        log.error("Providers exhausted: {}", ex.getMessage());
        Map<String, Object> body = body("providers_exhausted", ex.getMessage());
        body.put("tier", ex.getTier());
        body.put("failures", ex.getFailures());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler({LimiterUnavailableException.class, StoreUnavailableException.class})
    public ResponseEntity<Map<String, Object>> handleStoreDown(ClawdException ex) {
        log.error("Backing store unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", ex.getMessage());
    }

    @ExceptionHandler(RetriesExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleRetriesExhausted(RetriesExhaustedException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "retries_exhausted", ex.getMessage());
    }

    @ExceptionHandler(TransientIOException.class)
    public ResponseEntity<Map<String, Object>> handleTransient(TransientIOException ex) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "upstream_unavailable", ex.getMessage());
    }

    @ExceptionHandler(ClawdException.class)
    public ResponseEntity<Map<String, Object>> handleClawd(ClawdException ex) {
        log.error("Unhandled core error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(code, message));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
