package com.orgsuite.docflow.service.activity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.orgsuite.docflow.model.entity.ActivityLog;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.repository.ActivityLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Activity log sink. Called after the workflow transaction has committed;
 * a failure here is logged and never reaches the caller of the workflow operation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    private final ActivityLogRepository activityLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Record an activity entry.
     *
     * @param actorId    the user performing the action (null for system actions)
     * @param action     what happened
     * @param targetType e.g. "document", "invitation"
     * @param targetId   id of the affected entity
     * @param success    false for refused attempts
     * @param detail     structured detail, may be null
     */
    public void record(UUID actorId, ActivityAction action, String targetType, String targetId,
            boolean success, ActivityDetail detail) {
        try {
            ActivityLog entry = ActivityLog.builder()
                    .actorId(actorId)
                    .action(action)
                    .targetType(targetType)
                    .targetId(targetId)
                    .success(success)
                    .detail(serialize(action, detail))
                    .createdAt(OffsetDateTime.now(clock))
                    .build();

            activityLogRepository.save(entry);
            log.debug("Activity logged: action={}, target={}:{}, actor={}", action, targetType, targetId, actorId);
        } catch (RuntimeException e) {
            log.error("Failed to record activity action={} target={}:{}: {}", action, targetType, targetId,
                    e.getMessage());
        }
    }

    public List<ActivityLog> listFor(String targetType, String targetId) {
        return activityLogRepository.findByTargetTypeAndTargetIdOrderByCreatedAtDesc(targetType, targetId);
    }

    private String serialize(ActivityAction action, ActivityDetail detail) {
        if (detail == null) {
            return null;
        }
        try {
            ObjectNode node = objectMapper.valueToTree(detail);
            node.put("kind", detail.kind());
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // keep the entry, drop the detail
            log.error("Failed to serialize activity detail for action={}: {}", action, e.getMessage());
            return null;
        }
    }
}
