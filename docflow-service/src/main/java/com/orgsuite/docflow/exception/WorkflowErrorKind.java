package com.orgsuite.docflow.exception;

import org.springframework.http.HttpStatus;

/**
 * Closed set of workflow failure kinds, each mapped to one HTTP status.
 */
public enum WorkflowErrorKind {

    INVALID_TRANSITION(HttpStatus.CONFLICT),
    EXPIRED_OR_CONSUMED_INVITATION(HttpStatus.GONE),
    DUPLICATE_MEMBERSHIP(HttpStatus.CONFLICT),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    /** Lost a race on a document or invitation row; safe to retry. */
    CONCURRENT_MODIFICATION(HttpStatus.CONFLICT),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus httpStatus;

    WorkflowErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return this == CONCURRENT_MODIFICATION;
    }
}
