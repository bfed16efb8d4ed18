package com.orgsuite.docflow.modules.invitation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Request body for POST /invitations/accept and /invitations/decline.
 * The token travels in the body so it never lands in access logs.
 */
@Getter
@Setter
@ToString(exclude = "token")
public class TokenRequest {

    @NotBlank(message = "token is required")
    @Size(max = 128)
    private String token;

    /** Decline only. */
    @Size(max = 2000)
    private String reason;
}
