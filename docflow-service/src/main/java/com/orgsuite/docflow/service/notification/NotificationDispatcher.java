package com.orgsuite.docflow.service.notification;

/**
 * Contract to the platform's notification delivery (push, e-mail).
 * Implementations must not throw; delivery failures are theirs to log.
 */
public interface NotificationDispatcher {

    void dispatch(Notification notification);
}
