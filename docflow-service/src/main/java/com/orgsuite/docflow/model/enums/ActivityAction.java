package com.orgsuite.docflow.model.enums;

/**
 * Action kinds written to the activity log.
 */
public enum ActivityAction {

    DOCUMENT_CREATED,
    DOCUMENT_DUPLICATED,
    DOCUMENT_UPDATED,
    DOCUMENT_PUBLISHED,
    DOCUMENT_STATUS_CHANGED,
    DOCUMENT_ARCHIVED,
    DOCUMENT_RESET,
    DOCUMENT_SIGNED,
    DOCUMENT_REJECTED,
    CONTRIBUTOR_ADDED,
    CONTRIBUTOR_REMOVED,
    INVITATION_SENT,
    INVITATION_RESENT,
    INVITATION_ACCEPTED,
    INVITATION_DECLINED,
    INVITATION_CANCELLED,
    INVITATIONS_EXPIRED,
    PERMISSION_GRANTED,
    PERMISSION_REVOKED
}
