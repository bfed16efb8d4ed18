package com.orgsuite.docflow.modules.version.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.orgsuite.docflow.model.entity.DocumentVersion;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A document version. {@code data} is only filled when a single version is fetched.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VersionResponse {

    private UUID id;
    private UUID documentId;
    private int sequenceNumber;
    private String versionLabel;
    private UUID createdBy;
    private OffsetDateTime createdAt;
    private String changeNote;

    @JsonRawValue
    private String data;

    public static VersionResponse summary(DocumentVersion version) {
        return base(version).build();
    }

    public static VersionResponse full(DocumentVersion version) {
        return base(version).data(version.getData()).build();
    }

    private static VersionResponseBuilder base(DocumentVersion version) {
        return VersionResponse.builder()
                .id(version.getId())
                .documentId(version.getDocumentId())
                .sequenceNumber(version.getSequenceNumber())
                .versionLabel(version.getVersionLabel())
                .createdBy(version.getCreatedBy())
                .createdAt(version.getCreatedAt())
                .changeNote(version.getChangeNote());
    }
}
