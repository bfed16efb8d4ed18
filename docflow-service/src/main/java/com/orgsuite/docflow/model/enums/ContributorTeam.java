package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Contributor teams, in review order.
 */
public enum ContributorTeam {

    AUTHORS("authors", "Authors"),
    VERIFIERS("verifiers", "Verifiers"),
    VALIDATORS("validators", "Validators");

    private final String value;
    private final String displayName;

    ContributorTeam(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Signature type a member of this team produces. */
    public SignatureType signatureType() {
        return switch (this) {
            case AUTHORS -> SignatureType.AUTHOR;
            case VERIFIERS -> SignatureType.VERIFIER;
            case VALIDATORS -> SignatureType.VALIDATOR;
        };
    }

    @JsonCreator
    public static ContributorTeam fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown team: " + value));
    }
}
