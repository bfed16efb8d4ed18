package com.orgsuite.docflow.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "document_versions", uniqueConstraints = @UniqueConstraint(name = "uk_document_version_sequence", columnNames = {
        "document_id", "sequence_number" }))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private Integer sequenceNumber;

    @Column(name = "version_label", length = 20, updatable = false)
    private String versionLabel;

    /** Full document snapshot, stored as raw JSON and parsed when requested. */
    @Column(name = "data", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String data;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "change_note", columnDefinition = "TEXT", updatable = false)
    private String changeNote;
}
