package com.orgsuite.docflow.modules.version;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.DocumentVersion;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.repository.DocumentVersionRepository;
import com.orgsuite.docflow.service.identity.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only document versions. Snapshots are taken inside the update's
 * transaction, under the document lock, so sequence numbers never collide.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionSnapshotManager {

    private final DocumentVersionRepository versionRepository;
    private final DocumentLocator documentLocator;
    private final PermissionResolver permissionResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public DocumentVersion snapshot(Document document, List<Contributor> contributors, UUID actorId,
            String changeNote) {
        int sequence = versionRepository.findLatestSequenceNumber(document.getId()) + 1;

        String data;
        try {
            data = objectMapper.writeValueAsString(DocumentSnapshot.of(document, contributors));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize document snapshot", e);
        }

        DocumentVersion version = DocumentVersion.builder()
                .documentId(document.getId())
                .sequenceNumber(sequence)
                .versionLabel(document.getVersionLabel())
                .data(data)
                .createdBy(actorId)
                .createdAt(OffsetDateTime.now(clock))
                .changeNote(changeNote == null ? "" : changeNote)
                .build();

        DocumentVersion saved = versionRepository.save(version);
        log.debug("Snapshot #{} of document {} taken", sequence, document.getReference());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<DocumentVersion> list(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return versionRepository.findByDocumentIdOrderBySequenceNumberDesc(documentId);
    }

    @Transactional(readOnly = true)
    public DocumentVersion get(UUID documentId, UUID versionId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return versionRepository.findByIdAndDocumentId(versionId, documentId)
                .orElseThrow(() -> WorkflowException.notFound("Version not found: " + versionId));
    }
}
