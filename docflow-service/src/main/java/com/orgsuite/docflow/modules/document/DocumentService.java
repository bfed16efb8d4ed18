package com.orgsuite.docflow.modules.document;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.ActivityLog;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.DocumentVersion;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.document.dto.CreateDocumentRequest;
import com.orgsuite.docflow.modules.document.dto.DocumentResponse;
import com.orgsuite.docflow.modules.document.dto.UpdateDocumentRequest;
import com.orgsuite.docflow.modules.ledger.SignatureLedgerService;
import com.orgsuite.docflow.modules.ledger.dto.ContributorResponse;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.modules.version.VersionSnapshotManager;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.DocumentRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.activity.ActivityLogService;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
import com.orgsuite.docflow.service.identity.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Document create, read and update. Every update that is not an autosave
 * produces a version snapshot in the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private static final String INITIAL_VERSION_NOTE = "Initial version";
    private static final int REFERENCE_MAX_LENGTH = 100;
    private static final int TITLE_MAX_LENGTH = 500;

    private final DocumentRepository documentRepository;
    private final ContributorRepository contributorRepository;
    private final DocumentLocator documentLocator;
    private final PermissionResolver permissionResolver;
    private final SignatureLedgerService ledgerService;
    private final VersionSnapshotManager versionManager;
    private final ActivityLogService activityLogService;
    private final WorkflowEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Document create(CreateDocumentRequest request, Actor actor) {
        String reference = request.getReference().trim();
        if (documentRepository.existsByReference(reference)) {
            throw WorkflowException.invalidRequest("Document reference already exists: " + reference);
        }

        String displayName = request.getCreatorDisplayName() != null ? request.getCreatorDisplayName()
                : actor.displayName();
        Document document = startDraft(reference, request.getTitle().trim(), request.getDescription(),
                request.getVersionLabel() == null ? "1.0" : request.getVersionLabel(), request.getContent(),
                displayName, INITIAL_VERSION_NOTE, ActivityAction.DOCUMENT_CREATED, actor);

        log.info("Document {} created by {}", reference, actor.userId());
        return document;
    }

    /**
     * Starts a new draft from the current state of an existing document. Only
     * the content travels: the copy gets its own reference, label 1.0, the
     * caller as sole author and a fresh version history. The source is untouched.
     */
    @Transactional
    public Document duplicate(UUID sourceId, Actor actor) {
        Document source = documentLocator.get(sourceId);
        permissionResolver.require(source, actor, PermissionLevel.READ);

        String reference = copyReference(source.getReference());
        Document copy = startDraft(reference, copyTitle(source.getTitle()), source.getDescription(), "1.0",
                source.getContent(), actor.displayName(), "Duplicated from " + source.getReference(),
                ActivityAction.DOCUMENT_DUPLICATED, actor);

        log.info("Document {} duplicated as {} by {}", source.getReference(), reference, actor.userId());
        return copy;
    }

    @Transactional(readOnly = true)
    public Document get(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return document;
    }

    @Transactional(readOnly = true)
    public List<Document> listMine(Actor actor) {
        return documentRepository.findAccessibleBy(actor.userId());
    }

    /**
     * Applies the non-null fields of the request. Approved and archived
     * documents are read-only.
     */
    @Transactional
    public Document update(UUID documentId, UpdateDocumentRequest request, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.WRITE);
        if (document.getStatus().isLocked()) {
            throw WorkflowException.invalidTransition(
                    "Document is " + document.getStatus().getValue() + " and can no longer be edited");
        }

        String previousLabel = document.getVersionLabel();
        if (request.getTitle() != null) {
            if (request.getTitle().isBlank()) {
                throw WorkflowException.invalidRequest("title cannot be blank");
            }
            document.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            document.setDescription(request.getDescription());
        }
        if (request.getVersionLabel() != null) {
            document.setVersionLabel(request.getVersionLabel());
        }
        if (request.getContent() != null) {
            document.setContent(request.getContent());
        }
        document.setUpdatedAt(OffsetDateTime.now(clock));
        Document saved = documentRepository.save(document);

        if (request.isAutosave()) {
            log.debug("Autosaved document {}", document.getReference());
            return saved;
        }

        String changeNote = request.getChangeNote();
        if (changeNote == null && !Objects.equals(previousLabel, document.getVersionLabel())) {
            changeNote = "Updated to version " + document.getVersionLabel();
        }
        DocumentVersion version = versionManager.snapshot(document,
                contributorRepository.findByDocumentId(documentId), actor.userId(), changeNote);

        log.info("Document {} updated by {} (version #{})", document.getReference(), actor.userId(),
                version.getSequenceNumber());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_UPDATED,
                documentId, new ActivityDetail.DocumentChanged(document.getReference(), document.getVersionLabel(),
                        version.getSequenceNumber()),
                List.of()));
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ActivityLog> activity(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return activityLogService.listFor(WorkflowEvent.TARGET_DOCUMENT, documentId.toString());
    }

    /** Full view with contributors grouped by team. */
    @Transactional(readOnly = true)
    public DocumentResponse toResponse(Document document) {
        List<Contributor> contributors = contributorRepository.findByDocumentId(document.getId());
        return DocumentResponse.builder()
                .id(document.getId())
                .reference(document.getReference())
                .title(document.getTitle())
                .description(document.getDescription())
                .versionLabel(document.getVersionLabel())
                .content(document.getContent())
                .status(document.getStatus())
                .createdBy(document.getCreatedBy())
                .createdAt(document.getCreatedAt())
                .updatedAt(document.getUpdatedAt())
                .approvedAt(document.getApprovedAt())
                .contributors(new DocumentResponse.Contributors(
                        team(contributors, ContributorTeam.AUTHORS),
                        team(contributors, ContributorTeam.VERIFIERS),
                        team(contributors, ContributorTeam.VALIDATORS)))
                .build();
    }

    private Document startDraft(String reference, String title, String description, String versionLabel,
            String content, String ownerDisplayName, String initialNote, ActivityAction action, Actor actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Document document = documentRepository.save(Document.builder()
                .reference(reference)
                .title(title)
                .description(description)
                .versionLabel(versionLabel)
                .content(content)
                .status(DocumentStatus.DRAFT)
                .createdBy(actor.userId())
                .createdAt(now)
                .updatedAt(now)
                .build());

        Contributor owner = ledgerService.enroll(document, actor.userId(), ContributorTeam.AUTHORS,
                ownerDisplayName, null, null);
        DocumentVersion initial = versionManager.snapshot(document, List.of(owner), actor.userId(), initialNote);

        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), action, document.getId(),
                new ActivityDetail.DocumentChanged(reference, versionLabel, initial.getSequenceNumber()),
                List.of()));
        return document;
    }

    // <source>-COPY, then <source>-COPY-2, -3 ... until free
    private String copyReference(String sourceReference) {
        String base = sourceReference;
        if (base.length() > REFERENCE_MAX_LENGTH - 10) {
            base = base.substring(0, REFERENCE_MAX_LENGTH - 10);
        }
        base = base + "-COPY";
        String candidate = base;
        for (int n = 2; documentRepository.existsByReference(candidate); n++) {
            candidate = base + "-" + n;
        }
        return candidate;
    }

    private String copyTitle(String sourceTitle) {
        String suffix = " (Copy)";
        String title = sourceTitle.length() > TITLE_MAX_LENGTH - suffix.length()
                ? sourceTitle.substring(0, TITLE_MAX_LENGTH - suffix.length())
                : sourceTitle;
        return title + suffix;
    }

    private List<ContributorResponse> team(List<Contributor> contributors, ContributorTeam team) {
        return contributors.stream()
                .filter(c -> c.getTeam() == team)
                .map(ContributorResponse::from)
                .toList();
    }
}
