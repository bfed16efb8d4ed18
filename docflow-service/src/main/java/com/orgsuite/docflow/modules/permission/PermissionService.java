package com.orgsuite.docflow.modules.permission;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Permission;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.repository.PermissionRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
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
import java.util.UUID;

/**
 * Explicit per-user grants. A grant replaces any previous grant for the same
 * user (last writer wins); it never stacks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionService {

    private final PermissionRepository permissionRepository;
    private final PermissionResolver permissionResolver;
    private final DocumentLocator documentLocator;
    private final WorkflowEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Permission grant(UUID documentId, UUID userId, PermissionLevel level, Actor actor) {
        if (level == null) {
            throw WorkflowException.invalidRequest("level is required");
        }
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);

        OffsetDateTime now = OffsetDateTime.now(clock);
        Permission permission = permissionRepository.findByDocumentIdAndUserId(documentId, userId)
                .orElseGet(() -> Permission.builder()
                        .documentId(documentId)
                        .userId(userId)
                        .grantedAt(now)
                        .build());
        PermissionLevel previous = permission.getLevel();

        permission.setLevel(level);
        permission.setGrantedBy(actor.userId());
        permission.setUpdatedAt(now);
        Permission saved = permissionRepository.save(permission);

        log.info("Permission on document {} for user {}: {} -> {}", documentId, userId, previous, level);
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.PERMISSION_GRANTED,
                documentId, new ActivityDetail.PermissionChanged(userId, previous, level), List.of()));
        return saved;
    }

    @Transactional
    public void revoke(UUID documentId, UUID userId, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);

        Permission permission = permissionRepository.findByDocumentIdAndUserId(documentId, userId)
                .orElseThrow(() -> WorkflowException.notFound("No permission for user " + userId));
        permissionRepository.delete(permission);

        log.info("Permission on document {} revoked for user {}", documentId, userId);
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.PERMISSION_REVOKED,
                documentId, new ActivityDetail.PermissionChanged(userId, permission.getLevel(), null), List.of()));
    }

    @Transactional(readOnly = true)
    public List<Permission> list(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        permissionResolver.require(document, actor, PermissionLevel.READ);
        return permissionRepository.findByDocumentIdOrderByGrantedAtAsc(documentId);
    }

    @Transactional(readOnly = true)
    public PermissionLevel effectiveLevel(UUID documentId, Actor actor) {
        Document document = documentLocator.get(documentId);
        return permissionResolver.effectiveLevel(document, actor)
                .orElseThrow(() -> WorkflowException.permissionDenied("No access to document " + documentId));
    }
}
