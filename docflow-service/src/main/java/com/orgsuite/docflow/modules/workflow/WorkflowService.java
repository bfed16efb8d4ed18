package com.orgsuite.docflow.modules.workflow;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.DocumentRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
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
 * Manual status operations (publish, archive, reset) and the automatic
 * re-evaluation that follows every ledger change.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowService {

    private final DocumentLocator documentLocator;
    private final DocumentRepository documentRepository;
    private final ContributorRepository contributorRepository;
    private final PermissionResolver permissionResolver;
    private final DocumentStateMachine stateMachine;
    private final WorkflowNotifications notifications;
    private final WorkflowEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public Document publish(UUID documentId, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.WRITE);

        List<Contributor> contributors = contributorRepository.findByDocumentId(documentId);
        StatusTransition transition = stateMachine.publish(document, contributors, OffsetDateTime.now(clock));

        contributorRepository.saveAll(contributors);
        Document saved = documentRepository.save(document);

        log.info("Document {} published by {}", document.getReference(), actor.userId());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_PUBLISHED,
                documentId, new ActivityDetail.StatusChanged(transition.from(), transition.to()),
                notifications.forTransition(document, contributors, transition)));
        return saved;
    }

    @Transactional
    public Document archive(UUID documentId, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);

        StatusTransition transition = stateMachine.archive(document, OffsetDateTime.now(clock));
        Document saved = documentRepository.save(document);

        log.info("Document {} archived by {}", document.getReference(), actor.userId());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_ARCHIVED,
                documentId, new ActivityDetail.StatusChanged(transition.from(), transition.to()), List.of()));
        return saved;
    }

    @Transactional
    public Document reset(UUID documentId, Actor actor) {
        Document document = documentLocator.lockForUpdate(documentId);
        permissionResolver.require(document, actor, PermissionLevel.ADMIN);

        List<Contributor> contributors = contributorRepository.findByDocumentId(documentId);
        StatusTransition transition = stateMachine.reset(document, contributors, OffsetDateTime.now(clock));

        contributorRepository.saveAll(contributors);
        Document saved = documentRepository.save(document);

        log.warn("Document {} reset from {} to draft by {}", document.getReference(),
                transition.from().getValue(), actor.userId());
        eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_RESET,
                documentId, new ActivityDetail.StatusChanged(transition.from(), transition.to()), List.of()));
        return saved;
    }

    /**
     * Applies whatever automatic transitions the ledger now allows. Joins the
     * caller's transaction, which must already hold the document lock.
     *
     * @return the transitions applied, empty if none
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<StatusTransition> advance(Document document, List<Contributor> contributors, Actor actor) {
        List<StatusTransition> transitions = stateMachine.evaluate(document, contributors,
                OffsetDateTime.now(clock));
        if (transitions.isEmpty()) {
            return transitions;
        }

        contributorRepository.saveAll(contributors);
        documentRepository.save(document);

        for (StatusTransition transition : transitions) {
            log.info("Document {} advanced {} -> {}", document.getReference(), transition.from().getValue(),
                    transition.to().getValue());
            eventPublisher.publish(WorkflowEvent.onDocument(actor.userId(), ActivityAction.DOCUMENT_STATUS_CHANGED,
                    document.getId(), new ActivityDetail.StatusChanged(transition.from(), transition.to()),
                    notifications.forTransition(document, contributors, transition)));
        }
        return transitions;
    }
}
