package com.orgsuite.docflow.modules.ledger.dto;

import com.orgsuite.docflow.model.enums.ContributorTeam;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Request body for POST /documents/{id}/contributors.
 */
@Getter
@Setter
public class AddContributorRequest {

    @NotNull(message = "userId is required")
    private UUID userId;

    @NotNull(message = "team is required")
    private ContributorTeam team;

    @Size(max = 500)
    private String displayName;

    @Size(max = 255)
    private String title;

    @Size(max = 255)
    private String department;
}
