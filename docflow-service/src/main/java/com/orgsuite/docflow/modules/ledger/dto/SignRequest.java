package com.orgsuite.docflow.modules.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Request body for POST /documents/{id}/signatures.
 */
@Getter
@Setter
public class SignRequest {

    /** Opaque signature payload (drawn signature image, PIN attestation...). */
    @NotBlank(message = "signatureData is required")
    private String signatureData;

    @Size(max = 2000)
    private String comments;

    /** Sign on behalf of this contributor; requires admin level. */
    private UUID contributorUserId;
}
