package com.orgsuite.docflow.modules.document.dto;

import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.enums.DocumentStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * List item for GET /documents.
 */
public record DocumentSummaryResponse(UUID id, String reference, String title, String versionLabel,
        DocumentStatus status, UUID createdBy, OffsetDateTime updatedAt) {

    public static DocumentSummaryResponse from(Document document) {
        return new DocumentSummaryResponse(document.getId(), document.getReference(), document.getTitle(),
                document.getVersionLabel(), document.getStatus(), document.getCreatedBy(), document.getUpdatedAt());
    }
}
