package com.orgsuite.docflow.modules.permission;

import com.orgsuite.docflow.model.entity.Permission;
import com.orgsuite.docflow.model.enums.PermissionLevel;
import com.orgsuite.docflow.modules.permission.dto.EffectivePermissionResponse;
import com.orgsuite.docflow.modules.permission.dto.PermissionRequest;
import com.orgsuite.docflow.modules.permission.dto.PermissionResponse;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Explicit document permissions.
 * <ul>
 * <li>GET /documents/{id}/permissions: list grants (read)</li>
 * <li>GET /documents/{id}/permissions/me: caller's effective level</li>
 * <li>PUT /documents/{id}/permissions/{userId}: grant or replace (admin)</li>
 * <li>DELETE /documents/{id}/permissions/{userId}: revoke (admin)</li>
 * </ul>
 */
@RestController
@RequestMapping("/documents/{documentId}/permissions")
@RequiredArgsConstructor
public class PermissionController {

    private final PermissionService permissionService;

    @GetMapping
    public ResponseEntity<List<PermissionResponse>> list(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(permissionService.list(documentId, actor).stream()
                .map(PermissionResponse::from)
                .toList());
    }

    @GetMapping("/me")
    public ResponseEntity<EffectivePermissionResponse> mine(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        PermissionLevel level = permissionService.effectiveLevel(documentId, actor);
        return ResponseEntity.ok(new EffectivePermissionResponse(documentId, actor.userId(), level));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<PermissionResponse> grant(@PathVariable UUID documentId, @PathVariable UUID userId,
            @Valid @RequestBody PermissionRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Permission permission = permissionService.grant(documentId, userId, request.getLevel(), actor);
        return ResponseEntity.ok(PermissionResponse.from(permission));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> revoke(@PathVariable UUID documentId, @PathVariable UUID userId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        permissionService.revoke(documentId, userId, actor);
        return ResponseEntity.noContent().build();
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
