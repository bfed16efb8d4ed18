package com.orgsuite.docflow.modules.invitation;

import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.repository.InvitationRepository;
import com.orgsuite.docflow.service.activity.ActivityDetail;
import com.orgsuite.docflow.service.events.WorkflowEvent;
import com.orgsuite.docflow.service.events.WorkflowEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Flips pending invitations past their expiry to EXPIRED. Accept and decline
 * check expiry themselves, so this only keeps stored status honest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvitationExpiryScheduler {

    private final InvitationRepository invitationRepository;
    private final WorkflowEventPublisher eventPublisher;
    private final Clock clock;

    @Scheduled(fixedRateString = "${docflow.invitation.sweep-interval-ms:300000}")
    public void expireStaleInvitations() {
        int count = invitationRepository.expireStaleInvitations(OffsetDateTime.now(clock));
        if (count > 0) {
            log.info("Expired {} stale invitation(s)", count);
            eventPublisher.publish(new WorkflowEvent(null, ActivityAction.INVITATIONS_EXPIRED,
                    WorkflowEvent.TARGET_INVITATION, "sweep", true, new ActivityDetail.InvitationsExpired(count),
                    List.of()));
        }
    }
}
