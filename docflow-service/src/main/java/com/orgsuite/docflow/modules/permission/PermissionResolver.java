package com.orgsuite.docflow.modules.permission;

import com.orgsuite.docflow.exception.WorkflowException;
import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.model.entity.Permission;
import com.orgsuite.docflow.model.enums.ContributorTeam;
import com.orgsuite.docflow.model.enums.InvitationStatus;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.repository.ContributorRepository;
import com.orgsuite.docflow.repository.InvitationRepository;
import com.orgsuite.docflow.repository.PermissionRepository;
import com.orgsuite.docflow.service.identity.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Computes a user's effective access level on a document.
 * <p>
 * The effective level is the highest of:
 * </p>
 * <ul>
 * <li>the explicit grant, if any</li>
 * <li>{@code ADMIN} for platform administrators and for the document creator</li>
 * <li>{@code SIGN} for a contributor of the team currently under review</li>
 * <li>{@code READ} for any other contributor and for users holding an accepted invitation</li>
 * </ul>
 * Empty means no access at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PermissionResolver {

    private final PermissionRepository permissionRepository;
    private final ContributorRepository contributorRepository;
    private final InvitationRepository invitationRepository;

    public Optional<PermissionLevel> effectiveLevel(Document document, Actor actor) {
        if (actor.admin() || actor.userId().equals(document.getCreatedBy())) {
            return Optional.of(PermissionLevel.ADMIN);
        }

        PermissionLevel level = permissionRepository.findByDocumentIdAndUserId(document.getId(), actor.userId())
                .map(Permission::getLevel)
                .orElse(null);

        level = PermissionLevel.max(level, contributorFloor(document, actor));

        if (level == null && invitationRepository.existsByDocumentIdAndInvitedUserIdAndStatus(
                document.getId(), actor.userId(), InvitationStatus.ACCEPTED)) {
            level = PermissionLevel.READ;
        }
        return Optional.ofNullable(level);
    }

    public boolean has(Document document, Actor actor, PermissionLevel required) {
        return effectiveLevel(document, actor).map(l -> l.atLeast(required)).orElse(false);
    }

    public boolean canRead(Document document, Actor actor) {
        return has(document, actor, PermissionLevel.READ);
    }

    public boolean canWrite(Document document, Actor actor) {
        return has(document, actor, PermissionLevel.WRITE);
    }

    public boolean canSign(Document document, Actor actor) {
        return has(document, actor, PermissionLevel.SIGN);
    }

    public boolean canAdmin(Document document, Actor actor) {
        return has(document, actor, PermissionLevel.ADMIN);
    }

    /**
     * @throws WorkflowException PERMISSION_DENIED when the actor's level is below {@code required}
     */
    public void require(Document document, Actor actor, PermissionLevel required) {
        if (!has(document, actor, required)) {
            log.warn("User {} lacks {} on document {}", actor.userId(), required, document.getId());
            throw WorkflowException.permissionDenied(
                    "Requires " + required.getValue() + " access to document " + document.getReference());
        }
    }

    private PermissionLevel contributorFloor(Document document, Actor actor) {
        List<Contributor> memberships = contributorRepository.findByDocumentIdAndUserId(document.getId(),
                actor.userId());
        if (memberships.isEmpty()) {
            return null;
        }
        Optional<ContributorTeam> activeTeam = document.getStatus().reviewingTeam();
        boolean inActiveTeam = activeTeam.isPresent()
                && memberships.stream().anyMatch(c -> c.getTeam() == activeTeam.get());
        return inActiveTeam ? PermissionLevel.SIGN : PermissionLevel.READ;
    }
}
