package com.orgsuite.docflow.modules.invitation.dto;

import com.orgsuite.docflow.model.entity.Invitation;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Invitation as returned by every read and write endpoint. Never carries the token.
 */
@Getter
@Builder
public class InvitationResponse {

    private UUID id;
    private UUID documentId;
    private UUID invitedBy;
    private String invitedEmail;
    private UUID invitedUserId;
    private ContributorTeam team;
    private InvitationStatus status;
    private String message;
    private OffsetDateTime sentAt;
    private OffsetDateTime expiresAt;
    private OffsetDateTime acceptedAt;
    private OffsetDateTime declinedAt;
    private String declineReason;
    private OffsetDateTime cancelledAt;

    public static InvitationResponse from(Invitation invitation) {
        return InvitationResponse.builder()
                .id(invitation.getId())
                .documentId(invitation.getDocumentId())
                .invitedBy(invitation.getInvitedBy())
                .invitedEmail(invitation.getInvitedEmail())
                .invitedUserId(invitation.getInvitedUserId())
                .team(invitation.getTeam())
                .status(invitation.getStatus())
                .message(invitation.getMessage())
                .sentAt(invitation.getSentAt())
                .expiresAt(invitation.getExpiresAt())
                .acceptedAt(invitation.getAcceptedAt())
                .declinedAt(invitation.getDeclinedAt())
                .declineReason(invitation.getDeclineReason())
                .cancelledAt(invitation.getCancelledAt())
                .build();
    }
}
