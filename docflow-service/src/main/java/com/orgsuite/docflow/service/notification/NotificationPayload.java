package com.orgsuite.docflow.service.notification;

import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.NotificationKind;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Template data for one notification kind.
 */
public interface NotificationPayload {

    NotificationKind kind();

    /**
     * The accept link embeds the invitation token; this payload is the only
     * place the token leaves the service.
     */
    record InvitationSent(UUID invitationId, String documentTitle, ContributorTeam team, String inviterName,
            String message, String acceptUrl, OffsetDateTime expiresAt) implements NotificationPayload {
        @Override
        public NotificationKind kind() {
            return NotificationKind.INVITATION_SENT;
        }

        @Override
        public String toString() {
            return "InvitationSent[invitationId=" + invitationId + ", team=" + team + "]";
        }
    }

    record SignatureRequested(String documentTitle, String documentReference, ContributorTeam team)
            implements NotificationPayload {
        @Override
        public NotificationKind kind() {
            return NotificationKind.SIGNATURE_REQUESTED;
        }
    }

    record StageAdvanced(String documentTitle, String documentReference, DocumentStatus from, DocumentStatus to)
            implements NotificationPayload {
        @Override
        public NotificationKind kind() {
            return NotificationKind.DOCUMENT_STAGE_ADVANCED;
        }
    }

    record DocumentRejected(String documentTitle, String documentReference, ContributorTeam team,
            String rejectedBy, String reason) implements NotificationPayload {
        @Override
        public NotificationKind kind() {
            return NotificationKind.DOCUMENT_REJECTED;
        }
    }
}
