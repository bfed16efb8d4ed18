package com.orgsuite.docflow.model.entity;

import com.orgsuite.docflow.model.enums.DocumentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "reference", unique = true, nullable = false, length = 100)
    private String reference;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "version_label", length = 20)
    private String versionLabel;

    /** Structured content, stored as raw JSON and never interpreted by the workflow. */
    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 30, nullable = false)
    private DocumentStatus status;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Version
    @Column(name = "lock_version")
    private Long lockVersion;

    /** Timestamps are stamped by the services from the shared {@code Clock}. */
    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = DocumentStatus.DRAFT;
    }
}
