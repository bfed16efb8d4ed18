package com.orgsuite.docflow.model.entity;

import com.orgsuite.docflow.model.enums.SignatureType;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only signing record. Rows are inserted once and never updated or deleted.
 */
@Entity
@Table(name = "signatures")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Signature {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 20, nullable = false, updatable = false)
    private SignatureType type;

    /** Opaque payload: base64 signature image or a client-side hash. */
    @Column(name = "signature_data", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String signatureData;

    @Column(name = "comments", columnDefinition = "TEXT", updatable = false)
    private String comments;

    @Column(name = "document_version_label", length = 20, updatable = false)
    private String documentVersionLabel;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;

    @Column(name = "signed_at", nullable = false, updatable = false)
    private OffsetDateTime signedAt;
}
