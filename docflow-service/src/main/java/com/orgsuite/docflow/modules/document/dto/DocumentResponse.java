package com.orgsuite.docflow.modules.document.dto;

import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.modules.ledger.dto.ContributorResponse;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Getter
@Builder
public class DocumentResponse {

    private UUID id;
    private String reference;
    private String title;
    private String description;
    private String versionLabel;
    private String content;
    private DocumentStatus status;
    private UUID createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private OffsetDateTime approvedAt;
    private Contributors contributors;

    public record Contributors(List<ContributorResponse> authors, List<ContributorResponse> verifiers,
            List<ContributorResponse> validators) {
    }
}
