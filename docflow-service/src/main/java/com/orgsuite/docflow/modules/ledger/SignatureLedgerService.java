package com.orgsuite.docflow.modules.ledger;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Signature;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.ledger.dto.AddContributorRequest;
import com.orgsuite.docflow.modules.ledger.dto.SignOutcomeResponse;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.modules.workflow.StatusTransition;
import com.orgsuite.docflow.modules.workflow.WorkflowNotifications;
import com.orgsuite.docflow.modules.workflow.WorkflowService;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.SignatureRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.notification.Notification;
import com.orgsuite.docflow.service.notification.NotificationPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Contributor membership and the signature ledger.
 * <p>
 * Sign and reject run under the document row lock and re-evaluate the state
 * machine in the same transaction, so concurrent signers of one team are
 * serialized and a team completion fires exactly once.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignatureLedgerService {

    private final DocumentLocator documentLocator;
    private final ContributorRepository contributorRepository;
    private final SignatureRepository signatureRepository;
    private final PermissionResolver permissionResolver;
    private final WorkflowService workflowService;
    private final WorkflowNotifications notifications;
    private final WorkflowEventPublisher eventPublisher;
    private final Clock clock;

    // ================================================================
    // Sign / reject
    // ================================================================

    @Transactional
    public SignOutcomeResponse sign(UUID documentId, String signatureData, String comments, UUID onBehalfOf,
            String ipAddress, String userAgent, Actor actor) {
        try {
            if (signatureData == null || signatureData.isBlank()) {
                throw WorkflowException.invalidRequest("signatureData is required");
            }
            Document document = documentLocator.lockForUpdate(documentId);
            Contributor contributor = resolveTurn(document, onBehalfOf, actor);
            OffsetDateTime now = OffsetDateTime.now(clock);

            Signature signature = signatureRepository.save(Signature.builder()
                    .documentId(documentId)
                    .userId(contributor.getUserId())
                    .type(contributor.getTeam().signatureType())
                    .signatureData(signatureData)
                    .comments(comments)
                    .documentVersionLabel(document.getVersionLabel())
                    .ipAddress(ipAddress)
                    .userAgent(userAgent)
                    .signedAt(now)
                    .build());

            contributor.setStatus(SignatureStatus.SIGNED);
            contributor.setSignatureDate(now);
            contributorRepository.save(contributor);

            log.info("Contributor {} signed document {} as {}", contributor.getUserId(), document.getReference(),
                    contributor.getTeam().getValue());
            eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_SIGNED,
                    documentId, new ActivityDetail.SignatureRecorded(contributor.getUserId(), contributor.getTeam(),
                            signature.getId()),
                    List.of()));

            List<Contributor> contributors = withCurrent(contributorRepository.findByDocumentId(documentId),
                    contributor);
            List<StatusTransition> transitions = workflowService.advance(document, contributors, actor);

            return outcome(document, contributor, signature.getId(), transitions);
        } catch (WorkflowException e) {
            eventPublisher.publishRefusal(actor.userId(), ActivityAction.DOCUMENT_SIGNED,
                    WorkflowEvent.TARGET_DOCUMENT, documentId.toString(), e);
            throw e;
        }
    }

    /**
     * Records a rejection. The document stays in its review stage; only a reset
     * or removing the rejecting contributor can unblock it.
     */
    @Transactional
    public SignOutcomeResponse reject(UUID documentId, String reason, UUID onBehalfOf, Actor actor) {
        try {
            if (reason == null || reason.isBlank()) {
                throw WorkflowException.invalidRequest("reason is required");
            }
            Document document = documentLocator.lockForUpdate(documentId);
            Contributor contributor = resolveTurn(document, onBehalfOf, actor);

            contributor.setStatus(SignatureStatus.REJECTED);
            contributor.setRejectionReason(reason.trim());
            contributor.setRejectedAt(OffsetDateTime.now(clock));
            contributorRepository.save(contributor);

            List<Contributor> contributors = withCurrent(contributorRepository.findByDocumentId(documentId),
                    contributor);
            String rejectedBy = contributor.getDisplayName() != null ? contributor.getDisplayName()
                    : contributor.getUserId().toString();

            log.info("Contributor {} rejected document {}", contributor.getUserId(), document.getReference());
            eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_REJECTED,
                    documentId, new ActivityDetail.Rejected(contributor.getUserId(), contributor.getTeam(),
                            contributor.getRejectionReason()),
                    List.of(notifications.forRejection(document, contributors, contributor.getTeam(), rejectedBy,
                            contributor.getRejectionReason()))));

            return outcome(document, contributor, null, List.of());
        } catch (WorkflowException e) {
            eventPublisher.publishRefusal(actor.userId(), ActivityAction.DOCUMENT_REJECTED,
                    WorkflowEvent.TARGET_DOCUMENT, documentId.toString(), e);
            throw e;
        }
    }

    @Transactional(readOnly = true)
    public List<Signature> listSignatures(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return signatureRepository.findByDocumentIdOrderBySignedAtAsc(documentId);
    }

    // ================================================================
    // Membership
    // ================================================================

    @Transactional(readOnly = true)
    public List<Contributor> listContributors(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return contributorRepository.findByDocumentId(documentId);
    }

    @Transactional
    public Contributor addContributor(UUID documentId, AddContributorRequest request, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);
        if (document.getStatus().isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Cannot change contributors of a " + document.getStatus().getValue() + " document");
        }

        Contributor contributor = enroll(document, request.getUserId(), request.getTeam(),
                request.getDisplayName(), request.getTitle(), request.getDepartment());

        log.info("Contributor {} added to {} of document {}", contributor.getUserId(),
                contributor.getTeam().getValue(), document.getReference());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.CONTRIBUTOR_ADDED,
                documentId, new ActivityDetail.ContributorChanged(contributor.getUserId(), contributor.getTeam()),
                signatureRequestFor(document, contributor)));
        return contributor;
    }

    /**
     * Creates a membership: {@code joined} while the document is a draft,
     * {@code pending} once it has been published.
     *
     * @throws WorkflowException DUPLICATE_MEMBERSHIP when the user is already in that team
     */
    @Transactional
    public Contributor enroll(Document document, UUID userId, ContributorTeam team, String displayName,
            String title, String department) {
        if (contributorRepository.existsByDocumentIdAndUserIdAndTeam(document.getId(), userId, team)) {
            throw WorkflowException.duplicateMembership(
                    "User is already a member of " + team.getValue() + " on document " + document.getReference());
        }
        return contributorRepository.save(Contributor.builder()
                .documentId(document.getId())
                .userId(userId)
                .displayName(displayName)
                .title(title)
                .department(department)
                .team(team)
                .status(document.getStatus() == DocumentStatus.DRAFT ? SignatureStatus.JOINED
                        : SignatureStatus.PENDING)
                .invitedAt(OffsetDateTime.now(clock))
                .build());
    }

    /**
     * Removes a membership and re-evaluates; removing the only rejecter or the
     * last unsigned member can let the document advance.
     */
    @Transactional
    public List<StatusTransition> removeContributor(UUID documentId, UUID contributorId, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);
        if (document.getStatus().isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Cannot change contributors of a " + document.getStatus().getValue() + " document");
        }

        Contributor contributor = contributorRepository.findById(contributorId)
                .filter(c -> c.getDocumentId().equals(documentId))
                .orElseThrow(() -> WorkflowException.notFound("Contributor not found: " + contributorId));
        contributorRepository.delete(contributor);

        log.info("Contributor {} removed from {} of document {}", contributor.getUserId(),
                contributor.getTeam().getValue(), document.getReference());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.CONTRIBUTOR_REMOVED,
                documentId, new ActivityDetail.ContributorChanged(contributor.getUserId(), contributor.getTeam()),
                List.of()));

        List<Contributor> remaining = contributorRepository.findByDocumentId(documentId).stream()
                .filter(c -> !c.getId().equals(contributorId))
                .toList();
        return workflowService.advance(document, remaining, actor);
    }

    /** SIGNATURE_REQUESTED for a contributor who joins a team while it is under review. */
    public List<Notification> signatureRequestFor(Document document, Contributor contributor) {
        boolean activeTeam = document.getStatus().reviewingTeam()
                .map(team -> team == contributor.getTeam())
                .orElse(false);
        if (!activeTeam) {
            return List.of();
        }
        return List.of(new Notification(List.of(contributor.getUserId()), null, document.getId(),
                new NotificationPayload.SignatureRequested(document.getTitle(), document.getReference(),
                        contributor.getTeam())));
    }

    // ================================================================
    // Helpers
    // ================================================================

    /**
     * Finds the membership that may act now. A delegate (admin level) may act
     * for a named contributor.
     */
    private Contributor resolveTurn(Document document, UUID onBehalfOf, Actor actor) {
        UUID signerId = actor.userId();
        if (onBehalfOf != null && !onBehalfOf.equals(actor.userId())) {
            permissionResolver.require(document, actor, PermissionLevel.ADMIN);
            signerId = onBehalfOf;
        }

        List<Contributor> memberships = contributorRepository.findByDocumentIdAndUserId(document.getId(), signerId);
        if (memberships.isEmpty()) {
            throw WorkflowException.permissionDenied("Not a contributor of document " + document.getReference());
        }

        DocumentStatus status = document.getStatus();
        ContributorTeam team = status.reviewingTeam()
                .orElseThrow(() -> WorkflowException.invalidTransition(
                        "Document is not open for signing (status: " + status.getValue() + ")"));

        Contributor contributor = memberships.stream()
                .filter(c -> c.getTeam() == team)
                .findFirst()
                .orElseThrow(() -> WorkflowException.invalidTransition(
                        "Out of turn: " + team.getValue() + " are reviewing this document"));

        if (contributor.getStatus().isTerminal()) {
            throw WorkflowException.invalidTransition(
                    "Contributor has already " + contributor.getStatus().getValue());
        }
        return contributor;
    }

    // The ledger query may return a separate instance in tests or a detached context; keep ours.
    private List<Contributor> withCurrent(List<Contributor> contributors, Contributor current) {
        return contributors.stream()
                .map(c -> c.getId() != null && c.getId().equals(current.getId()) ? current : c)
                .toList();
    }

    private SignOutcomeResponse outcome(Document document, Contributor contributor, UUID signatureId,
            List<StatusTransition> transitions) {
        return new SignOutcomeResponse(document.getId(), contributor.getId(), contributor.getStatus(), signatureId,
                document.getStatus(), transitions.stream().map(StatusTransition::to).toList());
    }
}
