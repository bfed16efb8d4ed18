package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Workflow status of a document, declared in forward order.
 * <p>
 * {@code ordinal()} is the position in the review pipeline; automatic
 * transitions only ever move to a higher ordinal.
 * </p>
 */
public enum DocumentStatus {

    DRAFT("draft", null),
    AUTHOR_REVIEW("author_review", ContributorTeam.AUTHORS),
    AUTHOR_SIGNED("author_signed", null),
    VERIFIER_REVIEW("verifier_review", ContributorTeam.VERIFIERS),
    VERIFIER_SIGNED("verifier_signed", null),
    VALIDATOR_REVIEW("validator_review", ContributorTeam.VALIDATORS),
    APPROVED("approved", null),
    ARCHIVED("archived", null);

    private final String value;
    private final ContributorTeam reviewingTeam;

    DocumentStatus(String value, ContributorTeam reviewingTeam) {
        this.value = value;
        this.reviewingTeam = reviewingTeam;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** The team whose signatures gate this stage, if this is a review stage. */
    public Optional<ContributorTeam> reviewingTeam() {
        return Optional.ofNullable(reviewingTeam);
    }

    public boolean isReviewStage() {
        return reviewingTeam != null;
    }

    /** Approved and archived documents no longer accept content edits. */
    public boolean isLocked() {
        return this == APPROVED || this == ARCHIVED;
    }

    public boolean isAfter(DocumentStatus other) {
        return ordinal() > other.ordinal();
    }

    @JsonCreator
    public static DocumentStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown document status: " + value));
    }
}
