package com.example.securitycore.http;

import com.example.securitycore.service.RateLimitExceededException;
import com.example.securitycore.service.SecurityCoreException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to status codes. Bodies carry only the error code and a fixed message;
 * key ids, chain positions and other detail stay in the logs and the audit ledger.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badReq(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("BAD_REQUEST"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> invalid(MethodArgumentNotValidException ex) {
        return ResponseEntity.badRequest().body(body("BAD_REQUEST"));
    }

    @ExceptionHandler(SecurityCoreException.class)
    public ResponseEntity<Map<String, Object>> domainError(SecurityCoreException ex) {
        HttpStatus status = statusOf(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", ex.getCode(), ex.getMessage(), ex);
        } else {
            log.info("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
        }
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (ex instanceof RateLimitExceededException limited) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(limited.getRetryAfterSeconds()));
        }
        return response.body(body(ex.getCode().name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> boom(Exception ex) {
        log.error("Unexpected error handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("INTERNAL_ERROR"));
    }

    static HttpStatus statusOf(SecurityCoreException.Code code) {
        return switch (code) {
            case DECRYPTION_FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case KEY_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case KEY_UNAVAILABLE, KEY_LIFECYCLE_VIOLATION, SESSION_LIMIT_EXCEEDED,
                 CHAIN_INTEGRITY_VIOLATION -> HttpStatus.CONFLICT;
            case SESSION_EXPIRED, SESSION_ANOMALY, AUTHENTICATION_REQUIRED,
                 INVALID_CREDENTIALS -> HttpStatus.UNAUTHORIZED;
            case ACCESS_DENIED, IP_BLOCKED, CSRF_VIOLATION -> HttpStatus.FORBIDDEN;
            case RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case AUDIT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    static Map<String, Object> body(String code) {
        return Map.of("code", code, "message", messageOf(code));
    }

    private static String messageOf(String code) {
        return switch (code) {
            case "BAD_REQUEST" -> "The request is invalid";
            case "DECRYPTION_FAILED" -> "The encrypted value could not be decrypted";
            case "KEY_NOT_FOUND" -> "The requested key does not exist";
            case "KEY_UNAVAILABLE" -> "The key is no longer available";
            case "KEY_LIFECYCLE_VIOLATION" -> "The key cannot make this transition";
            case "SESSION_EXPIRED", "SESSION_ANOMALY" -> "The session is no longer valid";
            case "SESSION_LIMIT_EXCEEDED" -> "Too many concurrent sessions";
            case "AUTHENTICATION_REQUIRED" -> "Authentication is required";
            case "INVALID_CREDENTIALS" -> "Invalid credentials";
            case "ACCESS_DENIED", "IP_BLOCKED", "CSRF_VIOLATION" -> "Access denied";
            case "RATE_LIMIT_EXCEEDED" -> "Too many requests";
            case "CHAIN_INTEGRITY_VIOLATION" -> "Audit ledger integrity check failed";
            case "AUDIT_UNAVAILABLE" -> "Service temporarily unavailable";
            default -> "Internal error";
        };
    }
}
