package com.orgsuite.docflow.exception;

import lombok.Getter;

/**
 * Thrown by every workflow operation that refuses a request.
 * A thrown exception always rolls back the surrounding transaction, so no
 * partial mutation survives it.
 */
@Getter
public class WorkflowException extends RuntimeException {

    private final WorkflowErrorKind kind;

    public WorkflowException(WorkflowErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WorkflowException(WorkflowErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static WorkflowException invalidTransition(String message) {
        return new WorkflowException(WorkflowErrorKind.INVALID_TRANSITION, message);
    }

    public static WorkflowException expiredOrConsumed(String message) {
        return new WorkflowException(WorkflowErrorKind.EXPIRED_OR_CONSUMED_INVITATION, message);
    }

    public static WorkflowException duplicateMembership(String message) {
        return new WorkflowException(WorkflowErrorKind.DUPLICATE_MEMBERSHIP, message);
    }

    public static WorkflowException permissionDenied(String message) {
        return new WorkflowException(WorkflowErrorKind.PERMISSION_DENIED, message);
    }

    public static WorkflowException notFound(String message) {
        return new WorkflowException(WorkflowErrorKind.NOT_FOUND, message);
    }

    public static WorkflowException invalidRequest(String message) {
        return new WorkflowException(WorkflowErrorKind.INVALID_REQUEST, message);
    }

    public static WorkflowException concurrentModification(String message, Throwable cause) {
        return new WorkflowException(WorkflowErrorKind.CONCURRENT_MODIFICATION, message, cause);
    }
}
