package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-contributor signature status. {@code SIGNED} and {@code REJECTED} are terminal.
 */
public enum SignatureStatus {

    /** Member of the team, document not yet published. */
    JOINED("joined"),
    /** Signature window open. */
    PENDING("pending"),
    SIGNED("signed"),
    REJECTED("rejected");

    private final String value;

    SignatureStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == SIGNED || this == REJECTED;
    }
}
