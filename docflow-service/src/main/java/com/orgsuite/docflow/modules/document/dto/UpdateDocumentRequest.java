package com.orgsuite.docflow.modules.document.dto;

import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * Request body for PUT /documents/{id}. Null fields are left unchanged.
 */
@Getter
@Setter
public class UpdateDocumentRequest {

    @Size(max = 500)
    private String title;

    private String description;

    @Size(max = 20)
    private String versionLabel;

    private String content;

    /** Periodic editor save: applied, but no version snapshot and no events. */
    private boolean autosave;

    @Size(max = 1000)
    private String changeNote;
}
