package com.orgsuite.docflow.service.events;

import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.notification.Notification;

import java.util.List;
import java.util.UUID;

/**
 * Side effects of one workflow step: an activity entry plus the notifications
 * it triggers. Successful events fire after commit; refused ones after rollback.
 */
public record WorkflowEvent(UUID actorId, ActivityAction action, String targetType, String targetId,
        boolean success, ActivityDetail detail, List<Notification> notifications) {

    public static final String TARGET_DOCUMENT = "document";
    public static final String TARGET_INVITATION = "invitation";

    public WorkflowEvent {
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static WorkflowEvent onDocument(UUID actorId, ActivityAction action, UUID documentId,
            ActivityDetail detail, List<Notification> notifications) {
        return new WorkflowEvent(actorId, action, TARGET_DOCUMENT, documentId.toString(), true, detail,
                notifications);
    }

    public static WorkflowEvent onInvitation(UUID actorId, ActivityAction action, UUID invitationId,
            ActivityDetail detail, List<Notification> notifications) {
        return new WorkflowEvent(actorId, action, TARGET_INVITATION, invitationId.toString(), true, detail,
                notifications);
    }

    public static WorkflowEvent refused(UUID actorId, ActivityAction action, String targetType, String targetId,
            ActivityDetail detail) {
        return new WorkflowEvent(actorId, action, targetType, targetId, false, detail, List.of());
    }
}
