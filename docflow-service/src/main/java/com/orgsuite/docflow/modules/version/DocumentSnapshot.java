package com.orgsuite.docflow.modules.version;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.SignatureStatus;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Stored form of a document version. Field names are part of the persisted
 * format; add fields, do not rename them.
 */
public record DocumentSnapshot(UUID id, String reference, String title, String description, String versionLabel,
        String content, DocumentStatus status, UUID createdBy, OffsetDateTime createdAt, OffsetDateTime updatedAt,
        OffsetDateTime approvedAt, List<ContributorSnapshot> contributors) {

    public record ContributorSnapshot(UUID userId, String displayName, String title, String department,
            ContributorTeam team, SignatureStatus status, OffsetDateTime signatureDate, String rejectionReason) {
    }

    public static DocumentSnapshot of(Document document, List<Contributor> contributors) {
        List<ContributorSnapshot> members = contributors.stream()
                .sorted(Comparator.comparing(Contributor::getTeam)
                        .thenComparing(Contributor::getInvitedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(c -> new ContributorSnapshot(c.getUserId(), c.getDisplayName(), c.getTitle(),
                        c.getDepartment(), c.getTeam(), c.getStatus(), c.getSignatureDate(),
                        c.getRejectionReason()))
                .toList();
        return new DocumentSnapshot(document.getId(), document.getReference(), document.getTitle(),
                document.getDescription(), document.getVersionLabel(), document.getContent(), document.getStatus(),
                document.getCreatedBy(), document.getCreatedAt(), document.getUpdatedAt(),
                document.getApprovedAt(), members);
    }
}
