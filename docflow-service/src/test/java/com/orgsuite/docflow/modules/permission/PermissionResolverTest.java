package com.orgsuite.docflow.modules.permission;

import com.orgsuite.docflow.exception.WorkflowErrorKind;
import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Permission;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.InvitationRepository;
import com.orgsuite.docflow.repository.PermissionRepository;
import com.orgsuite.docflow.service.identity.Actor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class PermissionResolverTest {

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private ContributorRepository contributorRepository;

    @Mock
    private InvitationRepository invitationRepository;

    @InjectMocks
    private PermissionResolver permissionResolver;

    private Document document;
    private Actor user;

    @BeforeEach
    void setUp() {
        document = Document.builder()
                .id(UUID.randomUUID())
                .reference("POL-001")
                .status(DocumentStatus.AUTHOR_REVIEW)
                .createdBy(UUID.randomUUID())
                .build();
        user = new Actor(UUID.randomUUID(), "bob@example.com", "Bob", false);
    }

    private Contributor membership(ContributorTeam team) {
        return Contributor.builder().userId(user.userId()).team(team).status(SignatureStatus.PENDING).build();
    }

    @Test
    @DisplayName("Creator and platform admins are document admins")
    void creatorAndPlatformAdmin() {
        Actor creator = new Actor(document.getCreatedBy(), "owner@example.com", "Owner", false);
        Actor platformAdmin = new Actor(UUID.randomUUID(), "root@example.com", "Root", true);

        assertEquals(Optional.of(PermissionLevel.ADMIN), permissionResolver.effectiveLevel(document, creator));
        assertEquals(Optional.of(PermissionLevel.ADMIN), permissionResolver.effectiveLevel(document, platformAdmin));
        verifyNoInteractions(permissionRepository, contributorRepository, invitationRepository);
    }

    @Test
    @DisplayName("Contributors of the team under review may sign")
    void activeTeamGetsSign() {
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of(membership(ContributorTeam.AUTHORS)));

        assertEquals(Optional.of(PermissionLevel.SIGN), permissionResolver.effectiveLevel(document, user));
    }

    @Test
    @DisplayName("Contributors of a team not yet under review are read-only")
    void inactiveTeamGetsRead() {
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of(membership(ContributorTeam.VALIDATORS)));

        assertEquals(Optional.of(PermissionLevel.READ), permissionResolver.effectiveLevel(document, user));
    }

    @Test
    @DisplayName("An explicit grant above the contributor floor wins")
    void explicitGrantRaisesLevel() {
        when(permissionRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(Optional.of(Permission.builder().level(PermissionLevel.WRITE).build()));
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of(membership(ContributorTeam.VALIDATORS)));

        assertEquals(Optional.of(PermissionLevel.WRITE), permissionResolver.effectiveLevel(document, user));
    }

    @Test
    @DisplayName("A READ grant does not take signing away from an active contributor")
    void contributorFloorBeatsLowerGrant() {
        when(permissionRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(Optional.of(Permission.builder().level(PermissionLevel.READ).build()));
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of(membership(ContributorTeam.AUTHORS)));

        assertTrue(permissionResolver.canSign(document, user));
        assertTrue(permissionResolver.canWrite(document, user));
        assertTrue(permissionResolver.canRead(document, user));
        assertFalse(permissionResolver.canAdmin(document, user));
    }

    @Test
    @DisplayName("Each capability implies every lower one, for every grant level")
    void capabilitiesAreOrdered() {
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of());

        for (PermissionLevel granted : PermissionLevel.values()) {
            when(permissionRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                    .thenReturn(Optional.of(Permission.builder().level(granted).build()));

            boolean admin = permissionResolver.canAdmin(document, user);
            boolean sign = permissionResolver.canSign(document, user);
            boolean write = permissionResolver.canWrite(document, user);
            boolean read = permissionResolver.canRead(document, user);

            assertTrue(!admin || sign, granted + ": admin without sign");
            assertTrue(!sign || write, granted + ": sign without write");
            assertTrue(!write || read, granted + ": write without read");
            assertTrue(read, granted + ": any grant allows reading");
            assertEquals(granted == PermissionLevel.ADMIN, admin);
        }
    }

    @Test
    @DisplayName("An accepted invitation alone grants read access")
    void acceptedInvitationGrantsRead() {
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of());
        when(invitationRepository.existsByDocumentIdAndInvitedUserIdAndStatus(document.getId(), user.userId(),
                InvitationStatus.ACCEPTED)).thenReturn(true);

        assertEquals(Optional.of(PermissionLevel.READ), permissionResolver.effectiveLevel(document, user));
    }

    @Test
    @DisplayName("Strangers have no access and require() refuses them")
    void strangerDenied() {
        when(contributorRepository.findByDocumentIdAndUserId(document.getId(), user.userId()))
                .thenReturn(List.of());

        assertTrue(permissionResolver.effectiveLevel(document, user).isEmpty());
        WorkflowException ex = assertThrows(WorkflowException.class,
                () -> permissionResolver.require(document, user, PermissionLevel.READ));
        assertEquals(WorkflowErrorKind.PERMISSION_DENIED, ex.getKind());
    }
}
