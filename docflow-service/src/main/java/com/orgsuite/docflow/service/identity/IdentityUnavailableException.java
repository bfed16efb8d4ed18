package com.orgsuite.docflow.service.identity;

/**
 * Thrown when the identity service is unreachable or its circuit is open.
 */
public class IdentityUnavailableException extends RuntimeException {

    public IdentityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
