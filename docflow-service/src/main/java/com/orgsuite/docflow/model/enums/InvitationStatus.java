package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Invitation states. Only {@code PENDING} is actionable; every other state is final.
 */
public enum InvitationStatus {

    PENDING("pending"),
    ACCEPTED("accepted"),
    DECLINED("declined"),
    EXPIRED("expired"),
    /** Withdrawn by the inviter or a document admin. */
    CANCELLED("cancelled");

    private final String value;

    InvitationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
