package com.orgsuite.docflow.model.enums;

/**
 * Templates understood by the notification dispatcher.
 */
public enum NotificationKind {
    INVITATION_SENT,
    SIGNATURE_REQUESTED,
    DOCUMENT_STAGE_ADVANCED,
    DOCUMENT_REJECTED
}
