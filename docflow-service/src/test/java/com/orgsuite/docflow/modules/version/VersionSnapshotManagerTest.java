package com.orgsuite.docflow.modules.version;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgsuite.docflow.exception.WorkflowErrorKind;
import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.DocumentVersion;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.modules.document.DocumentLocator;
import com.orgsuite.docflow.modules.permission.PermissionResolver;
import com.orgsuite.docflow.repository.DocumentVersionRepository;
import com.orgsuite.docflow.service.identity.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class VersionSnapshotManagerTest {

    @Mock
    private DocumentVersionRepository versionRepository;

    @Mock
    private DocumentLocator documentLocator;

    @Mock
    private PermissionResolver permissionResolver;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private VersionSnapshotManager versionManager;

    private Document document;

    @BeforeEach
    void setUp() {
        versionManager = new VersionSnapshotManager(versionRepository, documentLocator, permissionResolver,
                objectMapper, Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC));
        document = Document.builder()
                .id(UUID.randomUUID())
                .reference("POL-001")
                .title("Travel policy")
                .versionLabel("2.0")
                .content("{\"sections\":[]}")
                .status(DocumentStatus.DRAFT)
                .build();
    }

    @Test
    @DisplayName("Snapshots take the next sequence number and capture the whole document")
    void snapshotCapturesDocument() throws Exception {
        Contributor author = Contributor.builder().userId(UUID.randomUUID()).displayName("Alice")
                .team(ContributorTeam.AUTHORS).status(SignatureStatus.JOINED).build();
        when(versionRepository.findLatestSequenceNumber(document.getId())).thenReturn(4);
        when(versionRepository.save(any(DocumentVersion.class))).thenAnswer(inv -> inv.getArgument(0));

        DocumentVersion version = versionManager.snapshot(document, List.of(author), author.getUserId(),
                "Rewrote section 2");

        assertEquals(5, version.getSequenceNumber().intValue());
        assertEquals("2.0", version.getVersionLabel());
        assertEquals("Rewrote section 2", version.getChangeNote());

        JsonNode data = objectMapper.readTree(version.getData());
        assertEquals("Travel policy", data.get("title").asText());
        assertEquals("draft", data.get("status").asText());
        assertEquals("Alice", data.get("contributors").get(0).get("displayName").asText());
    }

    @Test
    @DisplayName("The first snapshot of a document is number 1 and a missing note is stored empty")
    void firstSnapshot() {
        when(versionRepository.findLatestSequenceNumber(document.getId())).thenReturn(0);
        when(versionRepository.save(any(DocumentVersion.class))).thenAnswer(inv -> inv.getArgument(0));

        DocumentVersion version = versionManager.snapshot(document, List.of(), null, null);

        assertEquals(1, version.getSequenceNumber().intValue());
        assertEquals("", version.getChangeNote());
    }

    @Test
    @DisplayName("Reading a version of another document is not found")
    void getFromOtherDocument() {
        Actor reader = new Actor(UUID.randomUUID(), "bob@example.com", "Bob", false);
        UUID versionId = UUID.randomUUID();
        when(documentLocator.get(document.getId())).thenReturn(document);
        when(versionRepository.findByIdAndDocumentId(versionId, document.getId())).thenReturn(Optional.empty());

        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> versionManager.get(document.getId(), versionId, reader));

        assertEquals(WorkflowErrorKind.NOT_FOUND, ex.getKind());
        verify(permissionResolver).require(document, reader, PermissionLevel.READ);
    }
}
