package com.orgsuite.docflow.modules.invitation;

import com.orgsuite.docflow.config.DocflowProperties;
import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Invitation;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.ledger.SignatureLedgerService;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.InvitationRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.IdentityService;
import com.orgsuite.docflow.service.notification.Notification;
import com.orgsuite.docflow.service.notification.NotificationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Invitation lifecycle: issue, accept, decline, resend, cancel.
 * <ul>
 * <li>Tokens are single use; accept and decline lock the invitation row</li>
 * <li>Accepting creates the contributor in the same transaction, or nothing at all</li>
 * <li>Tokens are only ever handed to the notification dispatcher</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvitationService {

    private final InvitationRepository invitationRepository;
    private final ContributorRepository contributorRepository;
    private final DocumentLocator documentLocator;
    private final PermissionResolver permissionResolver;
    private final SignatureLedgerService ledgerService;
    private final IdentityService identityService;
    private final InvitationTokenGenerator tokenGenerator;
    private final InvitationPolicy policy;
    private final WorkflowEventPublisher eventPublisher;
    private final DocflowProperties properties;
    private final Clock clock;

    // ================================================================
    // Issue
    // ================================================================

    @Transactional
    public Invitation invite(UUID documentId, ContributorTeam team, String email, String message, Actor actor) {
        if (team == null || email == null || email.isBlank()) {
            throw WorkflowException.invalidRequest("team and email are required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        UUID invitedUserId = identityService.findUserIdByEmail(normalizedEmail).orElse(null);

        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.WRITE);
        if (document.getStatus().isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Cannot invite to a " + document.getStatus().getValue() + " document");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (invitationRepository.existsActionable(documentId, normalizedEmail, InvitationStatus.PENDING, now)) {
            throw WorkflowException.duplicateMembership("A pending invitation already exists for this address");
        }
        if (invitedUserId != null
                && contributorRepository.existsByDocumentIdAndUserIdAndTeam(documentId, invitedUserId, team)) {
            throw WorkflowException.duplicateMembership(
                    "User is already a member of " + team.getValue() + " on document " + document.getReference());
        }

        Invitation invitation = invitationRepository.save(Invitation.builder()
                .documentId(documentId)
                .invitedBy(actor.userId())
                .invitedEmail(normalizedEmail)
                .invitedUserId(invitedUserId)
                .token(tokenGenerator.newToken())
                .team(team)
                .status(InvitationStatus.PENDING)
                .message(message)
                .sentAt(now)
                .expiresAt(now.plusDays(properties.getInvitation().getTtlDays()))
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Invitation {} sent for document {} ({})", invitation.getId(), document.getReference(),
                team.getValue());
        eventPublisher.publish(WorkflowEvent.onInvitation(actor.userId(), ActivityAction.INVITATION_SENT,
                invitation.getId(), new ActivityDetail.InvitationChanged(invitation.getId(), documentId, team),
                List.of(invitationNotification(invitation, document, actor))));
        return invitation;
    }

    // ================================================================
    // Consume
    // ================================================================

    @Transactional
    public Contributor accept(String token, Actor actor) {
        Invitation invitation = lockByToken(token);
        try {
            requireInvitee(invitation, actor);
            OffsetDateTime now = OffsetDateTime.now(clock);
            if (!policy.canAccept(invitation, now)) {
                throw WorkflowException.expiredOrConsumed("Invitation is no longer valid");
            }

            Document document = documentLocator.lockForUpdate(invitation.getDocumentId());
            if (document.getStatus().isLocked()) {
                throw WorkflowException.invalidTransition(
                        "Document is " + document.getStatus().getValue() + " and accepts no new contributors");
            }

            Contributor contributor = ledgerService.enroll(document, actor.userId(), invitation.getTeam(),
                    actor.displayName(), null, null);

            invitation.setStatus(InvitationStatus.ACCEPTED);
            invitation.setAcceptedAt(now);
            invitation.setInvitedUserId(actor.userId());
            invitation.setUpdatedAt(now);
            invitationRepository.save(invitation);

            log.info("Invitation {} accepted by {}", invitation.getId(), actor.userId());
            eventPublisher.publish(WorkflowEvent.onInvitation(actor.userId(), ActivityAction.INVITATION_ACCEPTED,
                    invitation.getId(), new ActivityDetail.InvitationChanged(invitation.getId(),
                            invitation.getDocumentId(), invitation.getTeam()),
                    ledgerService.signatureRequestFor(document, contributor)));
            return contributor;
        } catch (WorkflowException e) {
            eventPublisher.publishRefusal(actor.userId(), ActivityAction.INVITATION_ACCEPTED,
                    WorkflowEvent.TARGET_INVITATION, invitation.getId().toString(), e);
            throw e;
        }
    }

    @Transactional
    public Invitation decline(String token, String reason, Actor actor) {
        Invitation invitation = lockByToken(token);
        try {
            requireInvitee(invitation, actor);
            OffsetDateTime now = OffsetDateTime.now(clock);
            if (!policy.canDecline(invitation, now)) {
                throw WorkflowException.expiredOrConsumed("Invitation is no longer valid");
            }

            invitation.setStatus(InvitationStatus.DECLINED);
            invitation.setDeclinedAt(now);
            invitation.setDeclineReason(reason);
            invitation.setInvitedUserId(actor.userId());
            invitation.setUpdatedAt(now);
            Invitation saved = invitationRepository.save(invitation);

            log.info("Invitation {} declined by {}", invitation.getId(), actor.userId());
            eventPublisher.publish(WorkflowEvent.onInvitation(actor.userId(), ActivityAction.INVITATION_DECLINED,
                    invitation.getId(), new ActivityDetail.InvitationChanged(invitation.getId(),
                            invitation.getDocumentId(), invitation.getTeam()),
                    List.of()));
            return saved;
        } catch (WorkflowException e) {
            eventPublisher.publishRefusal(actor.userId(), ActivityAction.INVITATION_DECLINED,
                    WorkflowEvent.TARGET_INVITATION, invitation.getId().toString(), e);
            throw e;
        }
    }

    // ================================================================
    // Inviter actions
    // ================================================================

    /**
     * Re-sends a pending invitation with a fresh expiry. The token stays the same
     * unless {@code docflow.invitation.rotate-token-on-resend} is set.
     */
    @Transactional
    public Invitation resend(UUID invitationId, Actor actor) {
        Invitation invitation = lockById(invitationId);
        Document document = documentLocator.get(invitation.getDocumentId());
        requireInviterOrAdmin(invitation, document, actor);
        if (!policy.canResend(invitation)) {
            throw WorkflowException.expiredOrConsumed(
                    "Only pending invitations can be resent (status: " + invitation.getStatus().getValue() + ")");
        }
        if (document.getStatus().isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Cannot invite to a " + document.getStatus().getValue() + " document");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (properties.getInvitation().isRotateTokenOnResend()) {
            invitation.setToken(tokenGenerator.newToken());
        }
        invitation.setSentAt(now);
        invitation.setExpiresAt(now.plusDays(properties.getInvitation().getTtlDays()));
        invitation.setUpdatedAt(now);
        Invitation saved = invitationRepository.save(invitation);

        log.info("Invitation {} resent by {}", invitation.getId(), actor.userId());
        eventPublisher.publish(WorkflowEvent.onInvitation(actor.userId(), ActivityAction.INVITATION_RESENT,
                invitation.getId(), new ActivityDetail.InvitationChanged(invitation.getId(),
                        invitation.getDocumentId(), invitation.getTeam()),
                List.of(invitationNotification(saved, document, actor))));
        return saved;
    }

    @Transactional
    public Invitation cancel(UUID invitationId, Actor actor) {
        Invitation invitation = lockById(invitationId);
        Document document = documentLocator.get(invitation.getDocumentId());
        requireInviterOrAdmin(invitation, document, actor);
        if (!policy.canCancel(invitation)) {
            throw WorkflowException.expiredOrConsumed(
                    "Only pending invitations can be cancelled (status: " + invitation.getStatus().getValue() + ")");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        invitation.setStatus(InvitationStatus.CANCELLED);
        invitation.setCancelledAt(now);
        invitation.setUpdatedAt(now);
        Invitation saved = invitationRepository.save(invitation);

        log.info("Invitation {} cancelled by {}", invitation.getId(), actor.userId());
        eventPublisher.publish(WorkflowEvent.onInvitation(actor.userId(), ActivityAction.INVITATION_CANCELLED,
                invitation.getId(), new ActivityDetail.InvitationChanged(invitation.getId(),
                        invitation.getDocumentId(), invitation.getTeam()),
                List.of()));
        return saved;
    }

    // ================================================================
    // Read
    // ================================================================

    @Transactional(readOnly = true)
    public List<Invitation> listForDocument(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return invitationRepository.findByDocumentIdOrderByCreatedAtDesc(documentId);
    }

    /** The caller's invitations that can still be accepted. */
    @Transactional(readOnly = true)
    public List<Invitation> listMine(Actor actor) {
        if (actor.email() == null || actor.email().isBlank()) {
            return List.of();
        }
        return invitationRepository.findActionableByEmail(actor.email().trim(), InvitationStatus.PENDING,
                OffsetDateTime.now(clock));
    }

    // ================================================================
    // Helpers
    // ================================================================

    private Invitation lockByToken(String token) {
        if (token == null || token.isBlank()) {
            throw WorkflowException.invalidRequest("token is required");
        }
        return invitationRepository.findByTokenForUpdate(token.trim())
                .orElseThrow(() -> WorkflowException.notFound("Invitation not found"));
    }

    private Invitation lockById(UUID invitationId) {
        return invitationRepository.findByIdForUpdate(invitationId)
                .orElseThrow(() -> WorkflowException.notFound("Invitation not found: " + invitationId));
    }

    private void requireInvitee(Invitation invitation, Actor actor) {
        boolean byEmail = actor.hasEmail(invitation.getInvitedEmail());
        boolean byUserId = invitation.getInvitedUserId() != null
                && invitation.getInvitedUserId().equals(actor.userId());
        if (!byEmail && !byUserId) {
            throw WorkflowException.permissionDenied("This invitation was issued to someone else");
        }
    }

    private void requireInviterOrAdmin(Invitation invitation, Document document, Actor actor) {
        if (!actor.userId().equals(invitation.getInvitedBy())
                && !permissionResolver.canAdmin(document, actor)) {
            throw WorkflowException.permissionDenied("Only the inviter or a document admin can do this");
        }
    }

    private Notification invitationNotification(Invitation invitation, Document document, Actor inviter) {
        String acceptUrl = properties.getFrontendUrl() + "/invitations/accept?token=" + invitation.getToken();
        List<UUID> recipients = new ArrayList<>();
        if (invitation.getInvitedUserId() != null) {
            recipients.add(invitation.getInvitedUserId());
        }
        return new Notification(recipients, invitation.getInvitedEmail(), document.getId(),
                new NotificationPayload.InvitationSent(invitation.getId(), document.getTitle(), invitation.getTeam(),
                        inviter.displayName(), invitation.getMessage(), acceptUrl, invitation.getExpiresAt()));
    }
}
