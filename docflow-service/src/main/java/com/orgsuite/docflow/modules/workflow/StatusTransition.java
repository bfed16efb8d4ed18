package com.orgsuite.docflow.modules.workflow;

import com.orgsuite.docflow.model.enums.DocumentStatus;

/**
 * One applied status change.
 */
public record StatusTransition(DocumentStatus from, DocumentStatus to) {

    /** True when this transition opened a review stage for a team. */
    public boolean opensReview() {
        return to.isReviewStage();
    }
}
