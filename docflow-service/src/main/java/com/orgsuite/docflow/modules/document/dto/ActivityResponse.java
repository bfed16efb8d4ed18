package com.orgsuite.docflow.modules.document.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.orgsuite.docflow.model.entity.ActivityLog;
import com.orgsuite.docflow.model.enums.ActivityAction;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Activity log entry of a document. {@code detail} is the stored JSON, passed through.
 */
public record ActivityResponse(Long id, UUID actorId, ActivityAction action, boolean success,
        @JsonRawValue String detail, OffsetDateTime createdAt) {

    public static ActivityResponse from(ActivityLog entry) {
        return new ActivityResponse(entry.getId(), entry.getActorId(), entry.getAction(),
                Boolean.TRUE.equals(entry.getSuccess()), entry.getDetail(), entry.getCreatedAt());
    }
}
