package com.orgsuite.docflow.service.events;

import com.orgsuite.docflow.service.activity.ActivityLogService;
import com.orgsuite.docflow.service.notification.Notification;
import com.orgsuite.docflow.service.notification.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Fans workflow events out to the activity log and the notification dispatcher
 * on the {@code workflowEventExecutor} pool. Nothing here can fail the
 * operation that produced the event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowEventListener {

    private final ActivityLogService activityLogService;
    private final NotificationDispatcher notificationDispatcher;

    @Async("workflowEventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true,
            condition = "#event.success()")
    public void onCommitted(WorkflowEvent event) {
        activityLogService.record(event.actorId(), event.action(), event.targetType(), event.targetId(),
                true, event.detail());

        for (Notification notification : event.notifications()) {
            try {
                notificationDispatcher.dispatch(notification);
            } catch (RuntimeException e) {
                log.error("Notification {} for {} {} failed: {}", notification.kind(), event.targetType(),
                        event.targetId(), e.getMessage());
            }
        }
    }

    @Async("workflowEventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK, fallbackExecution = true,
            condition = "!#event.success()")
    public void onRefused(WorkflowEvent event) {
        activityLogService.record(event.actorId(), event.action(), event.targetType(), event.targetId(),
                false, event.detail());
    }
}
