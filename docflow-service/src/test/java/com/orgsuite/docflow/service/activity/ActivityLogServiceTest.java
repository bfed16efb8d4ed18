package com.orgsuite.docflow.service.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgsuite.docflow.model.entity.ActivityLog;
import com.orgsuite.docflow.model.enums.ActivityAction;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.repository.ActivityLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class ActivityLogServiceTest {

    @Mock
    private ActivityLogRepository activityLogRepository;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private ActivityLogService activityLogService;

    @BeforeEach
    void setUp() {
        activityLogService = new ActivityLogService(activityLogRepository, objectMapper,
                Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Detail is stored as JSON tagged with its kind")
    void detailSerialized() throws Exception {
        UUID actorId = UUID.randomUUID();

        activityLogService.record(actorId, ActivityAction.DOCUMENT_STATUS_CHANGED, "document", "doc-1", true,
                new ActivityDetail.StatusChanged(DocumentStatus.AUTHOR_REVIEW, DocumentStatus.AUTHOR_SIGNED));

        ArgumentCaptor<ActivityLog> captor = ArgumentCaptor.forClass(ActivityLog.class);
        verify(activityLogRepository).save(captor.capture());
        ActivityLog entry = captor.getValue();
        assertEquals(actorId, entry.getActorId());
        assertTrue(entry.getSuccess());

        JsonNode detail = objectMapper.readTree(entry.getDetail());
        assertEquals("author_review", detail.get("from").asText());
        assertEquals("author_signed", detail.get("to").asText());
        assertTrue(detail.hasNonNull("kind"));
    }

    @Test
    @DisplayName("Repository failures are swallowed into the log, never thrown")
    void repositoryFailureContained() {
        when(activityLogRepository.save(any(ActivityLog.class)))
                .thenThrow(new DataAccessResourceFailureException("db down"));

        assertDoesNotThrow(() -> activityLogService.record(null, ActivityAction.INVITATIONS_EXPIRED, "invitation",
                "sweep", true, new ActivityDetail.InvitationsExpired(2)));
    }
}
