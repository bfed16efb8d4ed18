package com.orgsuite.docflow.exception;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Each workflow error kind maps to its own status and error code")
    void workflowErrorsAreTyped() {
        assertEquals(HttpStatus.CONFLICT, status(WorkflowException.invalidTransition("x")));
        assertEquals(HttpStatus.GONE, status(WorkflowException.expiredOrConsumed("x")));
        assertEquals(HttpStatus.CONFLICT, status(WorkflowException.duplicateMembership("x")));
        assertEquals(HttpStatus.FORBIDDEN, status(WorkflowException.permissionDenied("x")));
        assertEquals(HttpStatus.NOT_FOUND, status(WorkflowException.notFound("x")));
        assertEquals(HttpStatus.BAD_REQUEST, status(WorkflowException.invalidRequest("x")));

        ResponseEntity<Map<String, Object>> response = handler
                .handleWorkflowException(WorkflowException.duplicateMembership("already a verifier"));
        assertEquals("DUPLICATE_MEMBERSHIP", response.getBody().get("error"));
        assertEquals("already a verifier", response.getBody().get("message"));
        assertEquals(false, response.getBody().get("retryable"));
    }

    @Test
    @DisplayName("Optimistic lock failures surface as a retryable concurrent modification")
    void optimisticLockIsRetryable() {
        MDC.put("correlationId", "corr-123");

        ResponseEntity<Map<String, Object>> response = handler.handleConcurrencyConflict(
                new OptimisticLockingFailureException("row was updated"));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("CONCURRENT_MODIFICATION", response.getBody().get("error"));
        assertEquals(true, response.getBody().get("retryable"));
        assertEquals("corr-123", response.getBody().get("correlationId"));
    }

    @Test
    @DisplayName("A lost unique-key race is also a concurrent modification")
    void uniqueKeyRace() {
        ResponseEntity<Map<String, Object>> response = handler.handleConcurrencyConflict(
                new DataIntegrityViolationException("uk_contributor_document_user_team"));

        assertEquals("CONCURRENT_MODIFICATION", response.getBody().get("error"));
    }

    @Test
    @DisplayName("Unexpected errors hide their message")
    void genericErrorIsOpaque() {
        ResponseEntity<Map<String, Object>> response = handler.handleGenericException(
                new IllegalStateException("connection string with password"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().get("message").toString().contains("password"));
    }

    private HttpStatus status(WorkflowException ex) {
        return HttpStatus.valueOf(handler.handleWorkflowException(ex).getStatusCode().value());
    }
}
