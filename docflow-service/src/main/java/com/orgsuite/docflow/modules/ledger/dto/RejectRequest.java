package com.orgsuite.docflow.modules.ledger.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Request body for POST /documents/{id}/rejections.
 */
@Getter
@Setter
public class RejectRequest {

    @NotBlank(message = "reason is required")
    @Size(max = 2000)
    private String reason;

    private UUID contributorUserId;
}
