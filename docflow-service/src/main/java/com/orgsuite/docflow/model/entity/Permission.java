package com.orgsuite.docflow.model.entity;

import com.orgsuite.docflow.model.enums.PermissionLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Explicit grant. At most one row per (document, user); a new grant overwrites the level.
 */
@Entity
@Table(name = "permissions", uniqueConstraints = @UniqueConstraint(name = "uk_permission_document_user", columnNames = {
        "document_id", "user_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Permission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", length = 10, nullable = false)
    private PermissionLevel level;

    @Column(name = "granted_by")
    private UUID grantedBy;

    @Column(name = "granted_at")
    private OffsetDateTime grantedAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
