package com.orgsuite.docflow.exception;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps workflow failures and framework exceptions to JSON error bodies.
 * Stack traces are never exposed in responses.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String CORRELATION_ID_KEY = "correlationId";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = baseBody(HttpStatus.BAD_REQUEST, WorkflowErrorKind.INVALID_REQUEST.name());
        body.put("message", "Validation failed");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Map<String, Object> body = baseBody(HttpStatus.BAD_REQUEST, WorkflowErrorKind.INVALID_REQUEST.name());
        body.put("message", "Malformed request body");
        log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<Map<String, Object>> handleWorkflowException(WorkflowException ex) {
        WorkflowErrorKind kind = ex.getKind();
        Map<String, Object> body = baseBody(kind.getHttpStatus(), kind.name());
        body.put("message", ex.getMessage());
        body.put("retryable", kind.isRetryable());

        if (kind == WorkflowErrorKind.PERMISSION_DENIED) {
            log.warn("Permission denied: {}", ex.getMessage());
        } else {
            log.info("Workflow request refused [{}]: {}", kind, ex.getMessage());
        }
        return ResponseEntity.status(kind.getHttpStatus()).body(body);
    }

    /**
     * Version-counter mismatches, lock timeouts and unique-key races all mean
     * another writer got there first.
     */
    @ExceptionHandler({ OptimisticLockingFailureException.class, PessimisticLockingFailureException.class,
            DataIntegrityViolationException.class })
    public ResponseEntity<Map<String, Object>> handleConcurrencyConflict(Exception ex) {
        return handleWorkflowException(
                WorkflowException.concurrentModification("Concurrent modification, please retry", ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        Map<String, Object> body = baseBody(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR");
        body.put("message", "An unexpected error occurred. Please reference correlationId for support.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private Map<String, Object> baseBody(HttpStatus status, String error) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("correlationId", MDC.get(CORRELATION_ID_KEY));
        return body;
    }
}
