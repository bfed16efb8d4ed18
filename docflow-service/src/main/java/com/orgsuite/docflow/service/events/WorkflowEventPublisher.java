package com.orgsuite.docflow.service.events;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Thin wrapper over {@link ApplicationEventPublisher} so services publish
 * typed workflow events only.
 */
@Component
@RequiredArgsConstructor
public class WorkflowEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(WorkflowEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    /** Records a refused attempt; delivered once the transaction has rolled back. */
    public void publishRefusal(UUID actorId, ActivityAction action, String targetType, String targetId,
            WorkflowException cause) {
        publish(WorkflowEvent.refused(actorId, action, targetType, targetId,
                new ActivityDetail.Refused(cause.getKind().name(), cause.getMessage())));
    }
}
