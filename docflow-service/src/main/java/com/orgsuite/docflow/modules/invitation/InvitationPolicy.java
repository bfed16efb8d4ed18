package com.orgsuite.docflow.modules.invitation;

import com.orgsuite.docflow.model.entity.Invitation;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;

/**
 * Invitation lifecycle rules, evaluated at the time of the attempt. An invitation
 * past its expiry is unusable even if the sweep has not flipped it yet.
 */
@Component
public class InvitationPolicy {

    public boolean isExpired(Invitation invitation, OffsetDateTime now) {
        return !now.isBefore(invitation.getExpiresAt());
    }

    public boolean canAccept(Invitation invitation, OffsetDateTime now) {
        return invitation.getStatus() == InvitationStatus.PENDING && !isExpired(invitation, now);
    }

    public boolean canDecline(Invitation invitation, OffsetDateTime now) {
        return canAccept(invitation, now);
    }

    /** Resending also revives a pending invitation whose time ran out. */
    public boolean canResend(Invitation invitation) {
        return invitation.getStatus() == InvitationStatus.PENDING;
    }

    public boolean canCancel(Invitation invitation) {
        return invitation.getStatus() == InvitationStatus.PENDING;
    }
}
