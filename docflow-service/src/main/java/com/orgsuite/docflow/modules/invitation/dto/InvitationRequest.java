package com.orgsuite.docflow.modules.invitation.dto;

import com.orgsuite.docflow.model.enums.ContributorTeam;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Request body for POST /documents/{id}/invitations.
 */
@Getter
@Setter
public class InvitationRequest {

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    private String email;

    @NotNull(message = "team is required")
    private ContributorTeam team;

    @Size(max = 2000)
    private String message;
}
