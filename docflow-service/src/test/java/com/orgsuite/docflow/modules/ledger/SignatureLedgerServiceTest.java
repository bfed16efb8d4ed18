package com.orgsuite.docflow.modules.ledger;

import com.orgsuite.docflow.exception.WorkflowErrorKind;
import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Signature;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.model.enums.SignatureType;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.ledger.dto.AddContributorRequest;
import com.orgsuite.docflow.modules.ledger.dto.SignOutcomeResponse;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.modules.workflow.StatusTransition;
import com.orgsuite.docflow.modules.workflow.WorkflowNotifications;
import com.orgsuite.docflow.modules.workflow.WorkflowService;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.SignatureRepository;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.notification.Notification;
import com.orgsuite.docflow.service.notification.NotificationPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class SignatureLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock
    private DocumentLocator documentLocator;

    @Mock
    private ContributorRepository contributorRepository;

    @Mock
    private SignatureRepository signatureRepository;

    @Mock
    private PermissionResolver permissionResolver;

    @Mock
    private WorkflowService workflowService;

    @Mock
    private WorkflowNotifications notifications;

    @Mock
    private WorkflowEventPublisher eventPublisher;

    private SignatureLedgerService ledgerService;

    private Document document;
    private Actor actor;

    @BeforeEach
    void setUp() {
        ledgerService = new SignatureLedgerService(documentLocator, contributorRepository, signatureRepository,
                permissionResolver, workflowService, notifications, eventPublisher,
                Clock.fixed(NOW, ZoneOffset.UTC));
        document = Document.builder()
                .id(UUID.randomUUID())
                .reference("POL-001")
                .title("Travel policy")
                .versionLabel("1.2")
                .status(DocumentStatus.AUTHOR_REVIEW)
                .createdBy(UUID.randomUUID())
                .build();
        actor = new Actor(UUID.randomUUID(), "alice@example.com", "Alice", false);
    }

    private Contributor membership(UUID userId, ContributorTeam team, SignatureStatus status) {
        return Contributor.builder()
                .id(UUID.randomUUID())
                .documentId(document.getId())
                .userId(userId)
                .displayName("Alice")
                .team(team)
                .status(status)
                .build();
    }

    @Test
    @DisplayName("Signing records the signature, marks the contributor and re-evaluates under the lock")
    void signSuccess() {
        Contributor author = membership(actor.userId(), ContributorTeam.AUTHORS, SignatureStatus.PENDING);
        UUID signatureId = UUID.randomUUID();
        List<StatusTransition> advanced = List.of(
                new StatusTransition(DocumentStatus.AUTHOR_REVIEW, DocumentStatus.AUTHOR_SIGNED),
                new StatusTransition(DocumentStatus.AUTHOR_SIGNED, DocumentStatus.VERIFIER_REVIEW));

        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(author));
        when(signatureRepository.save(any(Signature.class))).thenAnswer(inv -> {
            Signature s = inv.getArgument(0);
            ReflectionTestUtils.setField(s, "id", signatureId);
            return s;
        });
        when(contributorRepository.findByDocumentId(document.getId())).thenReturn(List.of(author));
        when(workflowService.advance(eq(document), anyList(), eq(actor))).thenReturn(advanced);

        SignOutcomeResponse outcome = ledgerService.sign(document.getId(), "sig-payload", "ok", null,
                "10.0.0.1", "JUnit", actor);

        assertEquals(SignatureStatus.SIGNED, author.getStatus());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), author.getSignatureDate());
        assertEquals(signatureId, outcome.signatureId());
        assertEquals(List.of(DocumentStatus.AUTHOR_SIGNED, DocumentStatus.VERIFIER_REVIEW), outcome.transitions());

        ArgumentCaptor<Signature> captor = ArgumentCaptor.forClass(Signature.class);
        verify(signatureRepository).save(captor.capture());
        assertEquals(SignatureType.AUTHOR, captor.getValue().getType());
        assertEquals("1.2", captor.getValue().getDocumentVersionLabel());
        verify(documentLocator).lockForUpdate(document.getId());
        verify(eventPublisher).publish(any(WorkflowEvent.class));
        verify(eventPublisher, never()).publishRefusal(any(), any(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Signing twice is an invalid transition and writes nothing")
    void doubleSignRejected() {
        Contributor author = membership(actor.userId(), ContributorTeam.AUTHORS, SignatureStatus.SIGNED);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(author));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "sig", null, null, null, null, actor));

        assertEquals(WorkflowErrorKind.INVALID_TRANSITION, ex.getKind());
        verify(signatureRepository, never()).save(any());
        verify(workflowService, never()).advance(any(), anyList(), any());
        verify(eventPublisher).publishRefusal(eq(actor.userId()), eq(ActivityAction.DOCUMENT_SIGNED),
                eq(WorkflowEvent.TARGET_DOCUMENT), eq(document.getId().toString()), eq(ex));
    }

    @Test
    @DisplayName("A verifier cannot sign while authors are reviewing")
    void outOfTurnRejected() {
        Contributor verifier = membership(actor.userId(), ContributorTeam.VERIFIERS, SignatureStatus.PENDING);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(verifier));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "sig", null, null, null, null, actor));

        assertEquals(WorkflowErrorKind.INVALID_TRANSITION, ex.getKind());
        assertEquals(SignatureStatus.PENDING, verifier.getStatus());
        verify(signatureRepository, never()).save(any());
    }

    @Test
    @DisplayName("Non-contributors are denied")
    void nonContributorDenied() {
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of());

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "sig", null, null, null, null, actor));

        assertEquals(WorkflowErrorKind.PERMISSION_DENIED, ex.getKind());
    }

    @Test
    @DisplayName("Drafts are not open for signing")
    void draftNotSignable() {
        document.setStatus(DocumentStatus.DRAFT);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(membership(actor.userId(), ContributorTeam.AUTHORS, SignatureStatus.JOINED)));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "sig", null, null, null, null, actor));

        assertEquals(WorkflowErrorKind.INVALID_TRANSITION, ex.getKind());
    }

    @Test
    @DisplayName("Blank signature payload is refused before the document is locked")
    void blankPayloadRejected() {
        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "  ", null, null, null, null, actor));

        assertEquals(WorkflowErrorKind.INVALID_REQUEST, ex.getKind());
        verifyNoInteractions(documentLocator);
    }

    @Test
    @DisplayName("An admin may sign on behalf of a named contributor")
    void delegatedSign() {
        UUID onBehalfOf = UUID.randomUUID();
        Contributor author = membership(onBehalfOf, ContributorTeam.AUTHORS, SignatureStatus.PENDING);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), onBehalfOf))
                .thenReturn(List.of(author));
        when(signatureRepository.save(any(Signature.class))).thenAnswer(inv -> inv.getArgument(0));
        when(contributorRepository.findByDocumentId(document.getId())).thenReturn(List.of(author));
        when(workflowService.advance(eq(document), anyList(), eq(actor))).thenReturn(List.of());

        SignOutcomeResponse outcome = ledgerService.sign(document.getId(), "sig", null, onBehalfOf, null, null,
                actor);

        verify(permissionResolver).require(document, actor, PermissionLevel.ADMIN);
        assertEquals(SignatureStatus.SIGNED, outcome.contributorStatus());
        assertTrue(outcome.transitions().isEmpty());
    }

    @Test
    @DisplayName("Delegated signing without admin level is denied")
    void delegatedSignWithoutAdminDenied() {
        UUID onBehalfOf = UUID.randomUUID();
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        doThrow(WorkflowException.permissionDenied("no")).when(permissionResolver)
                .require(document, actor, PermissionLevel.ADMIN);

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.sign(document.getId(), "sig", null, onBehalfOf, null, null, actor));

        assertEquals(WorkflowErrorKind.PERMISSION_DENIED, ex.getKind());
        verify(contributorRepository, never()).findByDocumentIdAndUserId(any(), any());
    }

    @Test
    @DisplayName("Rejection records the reason, notifies and does not advance")
    void rejectRecordsReason() {
        Contributor author = membership(actor.userId(), ContributorTeam.AUTHORS, SignatureStatus.PENDING);
        Notification notification = new Notification(List.of(document.getCreatedBy()), null, document.getId(),
                new NotificationPayload.DocumentRejected("Travel policy", "POL-001", ContributorTeam.AUTHORS,
                        "Alice", "Wrong figures"));
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(author));
        when(contributorRepository.findByDocumentId(document.getId())).thenReturn(List.of(author));
        when(notifications.forRejection(eq(document), anyList(), eq(ContributorTeam.AUTHORS), eq("Alice"),
                eq("Wrong figures"))).thenReturn(notification);

        SignOutcomeResponse outcome = ledgerService.reject(document.getId(), " Wrong figures ", null, actor);

        assertEquals(SignatureStatus.REJECTED, author.getStatus());
        assertEquals("Wrong figures", author.getRejectionReason());
        assertEquals(DocumentStatus.AUTHOR_REVIEW, outcome.documentStatus());
        verify(workflowService, never()).advance(any(), anyList(), any());

        ArgumentCaptor<WorkflowEvent> captor = ArgumentCaptor.forClass(WorkflowEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertEquals(ActivityAction.DOCUMENT_REJECTED, captor.getValue().action());
        assertEquals(List.of(notification), captor.getValue().notifications());
    }

    @Test
    @DisplayName("Rejecting after signing is an invalid transition")
    void rejectAfterSignFails() {
        Contributor author = membership(actor.userId(), ContributorTeam.AUTHORS, SignatureStatus.SIGNED);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), actor.userId()))
                .thenReturn(List.of(author));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.reject(document.getId(), "late", null, actor));

        assertEquals(WorkflowErrorKind.INVALID_TRANSITION, ex.getKind());
        assertEquals(SignatureStatus.SIGNED, author.getStatus());
    }

    @Test
    @DisplayName("Enrolling into a draft joins; into a published document opens signing")
    void enrollStatusDependsOnDocument() {
        when(contributorRepository.save(any(Contributor.class))).thenAnswer(inv -> inv.getArgument(0));
        UUID userId = UUID.randomUUID();

        document.setStatus(DocumentStatus.DRAFT);
        Contributor joined = ledgerService.enroll(document, userId, ContributorTeam.VERIFIERS, "Bob", null, null);
        assertEquals(SignatureStatus.JOINED, joined.getStatus());

        document.setStatus(DocumentStatus.AUTHOR_REVIEW);
        Contributor pending = ledgerService.enroll(document, UUID.randomUUID(), ContributorTeam.VERIFIERS, "Carol",
                null, null);
        assertEquals(SignatureStatus.PENDING, pending.getStatus());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), pending.getInvitedAt());
    }

    @Test
    @DisplayName("Enrolling a user twice into the same team is a duplicate membership")
    void enrollDuplicate() {
        UUID userId = UUID.randomUUID();
        when(contributorRepository.existsByDocumentIdAndUserIdAndTeam(document.getId(), userId,
                ContributorTeam.AUTHORS)).thenReturn(true);

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.enroll(document, userId, ContributorTeam.AUTHORS, "Bob", null, null));

        assertEquals(WorkflowErrorKind.DUPLICATE_MEMBERSHIP, ex.getKind());
        verify(contributorRepository, never()).save(any());
    }

    @Test
    @DisplayName("Joining the team under review triggers a signature request")
    void signatureRequestForActiveTeamOnly() {
        Contributor author = membership(UUID.randomUUID(), ContributorTeam.AUTHORS, SignatureStatus.PENDING);
        Contributor validator = membership(UUID.randomUUID(), ContributorTeam.VALIDATORS, SignatureStatus.PENDING);

        assertEquals(1, ledgerService.signatureRequestFor(document, author).size());
        assertTrue(ledgerService.signatureRequestFor(document, validator).isEmpty());
    }

    // ================================================================
    // Membership
    // ================================================================

    @Test
    @DisplayName("Adding a contributor to the team under review opens signing and requests a signature")
    void addContributorToActiveTeam() {
        AddContributorRequest request = new AddContributorRequest();
        request.setUserId(UUID.randomUUID());
        request.setTeam(ContributorTeam.AUTHORS);
        request.setDisplayName("Carol");
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.save(any(Contributor.class))).thenAnswer(inv -> inv.getArgument(0));

        Contributor added = ledgerService.addContributor(document.getId(), request, actor);

        assertEquals(SignatureStatus.PENDING, added.getStatus());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), added.getInvitedAt());
        verify(permissionResolver).require(document, actor, PermissionLevel.ADMIN);

        ArgumentCaptor<WorkflowEvent> captor = ArgumentCaptor.forClass(WorkflowEvent.class);
        verify(eventPublisher).publish(captor.capture());
        assertEquals(ActivityAction.CONTRIBUTOR_ADDED, captor.getValue().action());
        assertEquals(1, captor.getValue().notifications().size());
    }

    @Test
    @DisplayName("Approved documents take no new contributors")
    void addContributorToApprovedDocument() {
        document.setStatus(DocumentStatus.APPROVED);
        AddContributorRequest request = new AddContributorRequest();
        request.setUserId(UUID.randomUUID());
        request.setTeam(ContributorTeam.VALIDATORS);
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.addContributor(document.getId(), request, actor));

        assertEquals(WorkflowErrorKind.INVALID_TRANSITION, ex.getKind());
        verify(contributorRepository, never()).save(any());
    }

    @Test
    @DisplayName("Removing the rejecting contributor re-evaluates the stage without them")
    void removeRejecterReevaluates() {
        document.setStatus(DocumentStatus.VERIFIER_REVIEW);
        Contributor signedVerifier = membership(UUID.randomUUID(), ContributorTeam.VERIFIERS, SignatureStatus.SIGNED);
        Contributor rejecter = membership(UUID.randomUUID(), ContributorTeam.VERIFIERS, SignatureStatus.REJECTED);
        List<StatusTransition> advanced = List.of(
                new StatusTransition(DocumentStatus.VERIFIER_REVIEW, DocumentStatus.VERIFIER_SIGNED));
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findById(rejecter.getId())).thenReturn(Optional.of(rejecter));
        when(contributorRepository.findByDocumentId(document.getId())).thenReturn(List.of(signedVerifier, rejecter));
        when(workflowService.advance(eq(document), anyList(), eq(actor))).thenReturn(advanced);

        List<StatusTransition> transitions = ledgerService.removeContributor(document.getId(), rejecter.getId(),
                actor);

        assertEquals(advanced, transitions);
        verify(contributorRepository).delete(rejecter);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Contributor>> remaining = ArgumentCaptor.forClass(List.class);
        verify(workflowService).advance(eq(document), remaining.capture(), eq(actor));
        assertEquals(List.of(signedVerifier), remaining.getValue());
    }

    @Test
    @DisplayName("A contributor of another document is not found")
    void removeContributorOfOtherDocument() {
        Contributor foreign = Contributor.builder().id(UUID.randomUUID()).documentId(UUID.randomUUID())
                .userId(UUID.randomUUID()).team(ContributorTeam.AUTHORS).status(SignatureStatus.PENDING).build();
        when(documentLocator.lockForUpdate(document.getId())).thenReturn(document);
        when(contributorRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> ledgerService.removeContributor(document.getId(), foreign.getId(), actor));

        assertEquals(WorkflowErrorKind.NOT_FOUND, ex.getKind());
        verify(contributorRepository, never()).delete(any());
        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("Listing signatures requires read access and returns the ledger in signing order")
    void listSignaturesRequiresRead() {
        Signature first = Signature.builder().documentId(document.getId()).type(SignatureType.AUTHOR).build();
        when(documentLocator.get(document.getId())).thenReturn(document);
        when(signatureRepository.findByDocumentIdOrderBySignedAtAsc(document.getId())).thenReturn(List.of(first));

        assertEquals(List.of(first), ledgerService.listSignatures(document.getId(), actor));
        verify(permissionResolver).require(document, actor, PermissionLevel.READ);
    }
}
