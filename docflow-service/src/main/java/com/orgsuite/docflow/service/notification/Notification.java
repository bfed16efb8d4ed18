package com.orgsuite.docflow.service.notification;

import com.orgsuite.docflow.model.enums.NotificationKind;

import java.util.List;
import java.util.UUID;

/**
 * One fire-and-forget notification request.
 *
 * @param recipientUserIds registered users to notify
 * @param recipientEmail   address for users not (yet) registered, may be null
 * @param documentId       document the notification is about
 * @param payload          template data; {@link NotificationPayload#kind()} selects the template
 */
public record Notification(List<UUID> recipientUserIds, String recipientEmail, UUID documentId,
        NotificationPayload payload) {

    public Notification {
        recipientUserIds = recipientUserIds == null ? List.of() : List.copyOf(recipientUserIds);
    }

    public NotificationKind kind() {
        return payload.kind();
    }

    public boolean hasRecipients() {
        return !recipientUserIds.isEmpty() || (recipientEmail != null && !recipientEmail.isBlank());
    }
}
