package com.orgsuite.docflow.modules.permission.dto;

import com.orgsuite.docflow.model.enums.PermissionLevel;

import java.util.UUID;

/**
 * The caller's own effective level, for the client to enable or hide actions.
 */
public record EffectivePermissionResponse(UUID documentId, UUID userId, PermissionLevel level) {
}
