package com.orgsuite.docflow.model.entity;

import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Membership of one user in one team of one document.
 * The {@code status} column is the authoritative signing state; {@link Signature}
 * rows are the audit trail behind it.
 */
@Entity
@Table(name = "contributors", uniqueConstraints = @UniqueConstraint(name = "uk_contributor_document_user_team", columnNames = {
        "document_id", "user_id", "team" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Contributor {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "display_name", length = 500)
    private String displayName;

    @Column(name = "title")
    private String title;

    @Column(name = "department")
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(name = "team", length = 20, nullable = false, updatable = false)
    private ContributorTeam team;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private SignatureStatus status;

    @Column(name = "signature_date")
    private OffsetDateTime signatureDate;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    @Column(name = "invited_at")
    private OffsetDateTime invitedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = SignatureStatus.JOINED;
    }
}
