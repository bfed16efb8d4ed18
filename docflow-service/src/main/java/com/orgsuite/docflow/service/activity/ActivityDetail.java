package com.orgsuite.docflow.service.activity;

import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;

import java.util.UUID;

/**
 * Structured detail attached to an activity log entry, one record type per
 * kind of event. Serialized to JSON with a {@code kind} discriminator.
 */
public interface ActivityDetail {

    /** Discriminator written alongside the record's fields. */
    String kind();

    record DocumentChanged(String reference, String versionLabel, Integer versionSequence) implements ActivityDetail {
        @Override
        public String kind() {
            return "document_changed";
        }
    }

    record StatusChanged(DocumentStatus from, DocumentStatus to) implements ActivityDetail {
        @Override
        public String kind() {
            return "status_changed";
        }
    }

    record SignatureRecorded(UUID contributorUserId, ContributorTeam team, UUID signatureId)
            implements ActivityDetail {
        @Override
        public String kind() {
            return "signature_recorded";
        }
    }

    record Rejected(UUID contributorUserId, ContributorTeam team, String reason) implements ActivityDetail {
        @Override
        public String kind() {
            return "rejected";
        }
    }

    record ContributorChanged(UUID contributorUserId, ContributorTeam team) implements ActivityDetail {
        @Override
        public String kind() {
            return "contributor_changed";
        }
    }

    record InvitationChanged(UUID invitationId, UUID documentId, ContributorTeam team) implements ActivityDetail {
        @Override
        public String kind() {
            return "invitation_changed";
        }
    }

    record PermissionChanged(UUID userId, PermissionLevel previous, PermissionLevel level) implements ActivityDetail {
        @Override
        public String kind() {
            return "permission_changed";
        }
    }

    record InvitationsExpired(int count) implements ActivityDetail {
        @Override
        public String kind() {
            return "invitations_expired";
        }
    }

    /** Attached to refused operations. */
    record Refused(String errorKind, String message) implements ActivityDetail {
        @Override
        public String kind() {
            return "refused";
        }
    }
}
