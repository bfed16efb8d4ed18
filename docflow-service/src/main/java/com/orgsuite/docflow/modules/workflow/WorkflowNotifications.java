package com.orgsuite.docflow.modules.workflow;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.service.notification.Notification;
import com.orgsuite.docflow.service.notification.NotificationPayload;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the notifications that follow status changes and rejections.
 */
@Component
public class WorkflowNotifications {

    public List<Notification> forTransition(Document document, List<Contributor> contributors,
            StatusTransition transition) {
        List<Notification> notifications = new ArrayList<>();

        notifications.add(new Notification(List.copyOf(everyone(document, contributors)), null, document.getId(),
                new NotificationPayload.StageAdvanced(document.getTitle(), document.getReference(),
                        transition.from(), transition.to())));

        transition.to().reviewingTeam().ifPresent(team -> {
            List<UUID> signers = contributors.stream()
                    .filter(c -> c.getTeam() == team && c.getStatus() == SignatureStatus.PENDING)
                    .map(Contributor::getUserId)
                    .distinct()
                    .toList();
            if (!signers.isEmpty()) {
                notifications.add(new Notification(signers, null, document.getId(),
                        new NotificationPayload.SignatureRequested(document.getTitle(), document.getReference(),
                                team)));
            }
        });
        return notifications;
    }

    public Notification forRejection(Document document, List<Contributor> contributors, ContributorTeam team,
            String rejectedBy, String reason) {
        return new Notification(List.copyOf(everyone(document, contributors)), null, document.getId(),
                new NotificationPayload.DocumentRejected(document.getTitle(), document.getReference(), team,
                        rejectedBy, reason));
    }

    private Set<UUID> everyone(Document document, List<Contributor> contributors) {
        Set<UUID> recipients = new LinkedHashSet<>();
        if (document.getCreatedBy() != null) {
            recipients.add(document.getCreatedBy());
        }
        contributors.forEach(c -> recipients.add(c.getUserId()));
        return recipients;
    }
}
