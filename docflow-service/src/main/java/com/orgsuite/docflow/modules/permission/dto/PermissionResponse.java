package com.orgsuite.docflow.modules.permission.dto;

import com.orgsuite.docflow.model.entity.Permission;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Builder
public class PermissionResponse {

    private UUID documentId;
    private UUID userId;
    private PermissionLevel level;
    private UUID grantedBy;
    private OffsetDateTime grantedAt;
    private OffsetDateTime updatedAt;

    public static PermissionResponse from(Permission permission) {
        return PermissionResponse.builder()
                .documentId(permission.getDocumentId())
                .userId(permission.getUserId())
                .level(permission.getLevel())
                .grantedBy(permission.getGrantedBy())
                .grantedAt(permission.getGrantedAt())
                .updatedAt(permission.getUpdatedAt())
                .build();
    }
}
