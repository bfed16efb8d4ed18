package com.orgsuite.docflow.modules.permission.dto;

import com.orgsuite.docflow.model.enums.PermissionLevel;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * Request body for PUT /documents/{id}/permissions/{userId}.
 */
@Getter
@Setter
public class PermissionRequest {

    @NotNull(message = "level is required")
    private PermissionLevel level;
}
