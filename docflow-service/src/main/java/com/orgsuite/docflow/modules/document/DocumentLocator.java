package com.orgsuite.docflow.modules.document;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.repository.DocumentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Document lookups shared by the workflow services.
 */
@Component
@RequiredArgsConstructor
public class DocumentLocator {

    private final DocumentRepository documentRepository;

    public Document get(UUID documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> WorkflowException.notFound("Document not found: " + documentId));
    }

    /**
     * Loads the document under a row lock. Must be called inside a transaction;
     * the lock is held until it ends.
     */
    public Document lockForUpdate(UUID documentId) {
        return documentRepository.findByIdForUpdate(documentId)
                .orElseThrow(() -> WorkflowException.notFound("Document not found: " + documentId));
    }
}
