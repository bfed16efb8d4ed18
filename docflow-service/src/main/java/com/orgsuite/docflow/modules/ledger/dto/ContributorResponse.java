package com.orgsuite.docflow.modules.ledger.dto;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Builder
public class ContributorResponse {

    private UUID id;
    private UUID userId;
    private String displayName;
    private String title;
    private String department;
    private ContributorTeam team;
    private SignatureStatus status;
    private OffsetDateTime signatureDate;
    private String rejectionReason;
    private OffsetDateTime rejectedAt;
    private OffsetDateTime invitedAt;

    public static ContributorResponse from(Contributor contributor) {
        return ContributorResponse.builder()
                .id(contributor.getId())
                .userId(contributor.getUserId())
                .displayName(contributor.getDisplayName())
                .title(contributor.getTitle())
                .department(contributor.getDepartment())
                .team(contributor.getTeam())
                .status(contributor.getStatus())
                .signatureDate(contributor.getSignatureDate())
                .rejectionReason(contributor.getRejectionReason())
                .rejectedAt(contributor.getRejectedAt())
                .invitedAt(contributor.getInvitedAt())
                .build();
    }
}
