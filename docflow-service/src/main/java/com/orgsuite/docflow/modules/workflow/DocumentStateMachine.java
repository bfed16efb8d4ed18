package com.orgsuite.docflow.modules.workflow;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Document status rules.
 * <pre>
 * draft → author_review → author_signed → verifier_review → verifier_signed
 *       → validator_review → approved → archived
 * </pre>
 * Operates on an already-locked document and its full contributor list and
 * mutates both in place; persisting them is the caller's job. Holds no state.
 */
@Component
public class DocumentStateMachine {

    /**
     * {@code draft → author_review}. Opens signing for every team member that has joined.
     *
     * @throws WorkflowException INVALID_TRANSITION when not a draft or there is no author
     */
    public StatusTransition publish(Document document, List<Contributor> contributors, OffsetDateTime now) {
        if (document.getStatus() != DocumentStatus.DRAFT) {
            throw WorkflowException.invalidTransition(
                    "Only draft documents can be published (status: " + document.getStatus().getValue() + ")");
        }
        boolean hasAuthor = contributors.stream().anyMatch(c -> c.getTeam() == ContributorTeam.AUTHORS);
        if (!hasAuthor) {
            throw WorkflowException.invalidTransition("A document needs at least one author before publishing");
        }

        for (Contributor contributor : contributors) {
            if (contributor.getStatus() == SignatureStatus.JOINED) {
                contributor.setStatus(SignatureStatus.PENDING);
            }
        }
        return move(document, DocumentStatus.AUTHOR_REVIEW, now);
    }

    /**
     * Applies every automatic transition the current ledger allows, in order,
     * until none applies. Returns the transitions applied; empty when nothing
     * changed, which makes a second call on the same data a no-op.
     */
    public List<StatusTransition> evaluate(Document document, List<Contributor> contributors, OffsetDateTime now) {
        List<StatusTransition> applied = new ArrayList<>();
        StatusTransition next = nextAutomatic(document, contributors, now);
        while (next != null) {
            applied.add(next);
            next = nextAutomatic(document, contributors, now);
        }
        return applied;
    }

    /**
     * {@code approved → archived}.
     */
    public StatusTransition archive(Document document, OffsetDateTime now) {
        if (document.getStatus() != DocumentStatus.APPROVED) {
            throw WorkflowException.invalidTransition(
                    "Only approved documents can be archived (status: " + document.getStatus().getValue() + ")");
        }
        return move(document, DocumentStatus.ARCHIVED, now);
    }

    /**
     * Sends an in-flight document back to draft and reopens the ledger. Signature
     * rows already written stay untouched.
     */
    public StatusTransition reset(Document document, List<Contributor> contributors, OffsetDateTime now) {
        DocumentStatus status = document.getStatus();
        if (status == DocumentStatus.DRAFT || status.isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Cannot reset a document in status " + status.getValue());
        }

        for (Contributor contributor : contributors) {
            contributor.setStatus(SignatureStatus.JOINED);
            contributor.setSignatureDate(null);
            contributor.setRejectionReason(null);
            contributor.setRejectedAt(null);
        }
        return move(document, DocumentStatus.DRAFT, now);
    }

    /** True when at least one member of the team under review has rejected. */
    public boolean isBlocked(Document document, List<Contributor> contributors) {
        return document.getStatus().reviewingTeam()
                .map(team -> contributors.stream()
                        .anyMatch(c -> c.getTeam() == team && c.getStatus() == SignatureStatus.REJECTED))
                .orElse(false);
    }

    private StatusTransition nextAutomatic(Document document, List<Contributor> contributors, OffsetDateTime now) {
        return switch (document.getStatus()) {
            case AUTHOR_REVIEW, VERIFIER_REVIEW, VALIDATOR_REVIEW -> {
                ContributorTeam team = document.getStatus().reviewingTeam().orElseThrow();
                yield teamComplete(team, contributors)
                        ? move(document, completedStatus(document.getStatus()), now)
                        : null;
            }
            case AUTHOR_SIGNED -> {
                activate(ContributorTeam.VERIFIERS, contributors);
                yield move(document, DocumentStatus.VERIFIER_REVIEW, now);
            }
            case VERIFIER_SIGNED -> {
                activate(ContributorTeam.VALIDATORS, contributors);
                yield move(document, DocumentStatus.VALIDATOR_REVIEW, now);
            }
            case DRAFT, APPROVED, ARCHIVED -> null;
        };
    }

    // An empty team never completes; a rejected member is not signed, so rejection blocks too.
    private boolean teamComplete(ContributorTeam team, List<Contributor> contributors) {
        List<Contributor> members = contributors.stream().filter(c -> c.getTeam() == team).toList();
        return !members.isEmpty() && members.stream().allMatch(c -> c.getStatus() == SignatureStatus.SIGNED);
    }

    private DocumentStatus completedStatus(DocumentStatus reviewStatus) {
        return switch (reviewStatus) {
            case AUTHOR_REVIEW -> DocumentStatus.AUTHOR_SIGNED;
            case VERIFIER_REVIEW -> DocumentStatus.VERIFIER_SIGNED;
            case VALIDATOR_REVIEW -> DocumentStatus.APPROVED;
            default -> throw new IllegalArgumentException("Not a review stage: " + reviewStatus);
        };
    }

    private void activate(ContributorTeam team, List<Contributor> contributors) {
        for (Contributor contributor : contributors) {
            if (contributor.getTeam() == team && contributor.getStatus() == SignatureStatus.JOINED) {
                contributor.setStatus(SignatureStatus.PENDING);
            }
        }
    }

    private StatusTransition move(Document document, DocumentStatus to, OffsetDateTime now) {
        StatusTransition transition = new StatusTransition(document.getStatus(), to);
        document.setStatus(to);
        document.setUpdatedAt(now);
        if (to == DocumentStatus.APPROVED) {
            document.setApprovedAt(now);
        }
        return transition;
    }
}
