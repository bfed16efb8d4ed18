package com.orgsuite.docflow.modules.document.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Request body for POST /documents.
 */
@Getter
@Setter
public class CreateDocumentRequest {

    @NotBlank(message = "reference is required")
    @Size(max = 100)
    @Pattern(regexp = "[A-Za-z0-9_.\\-]+", message = "reference may only contain letters, digits, '_', '.', '-'")
    private String reference;

    @NotBlank(message = "title is required")
    @Size(max = 500)
    private String title;

    private String description;

    @Size(max = 20)
    private String versionLabel = "1.0";

    /** Raw JSON content. */
    private String content;

    @Size(max = 500)
    private String creatorDisplayName;
}
