package com.orgsuite.docflow.modules.version;

import com.orgsuite.docflow.modules.version.dto.VersionResponse;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/documents/{documentId}/versions")
@RequiredArgsConstructor
public class VersionController {

    private final VersionSnapshotManager versionManager;

    /** Newest first, without snapshot data. */
    @GetMapping
    public ResponseEntity<List<VersionResponse>> list(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(versionManager.list(documentId, actor).stream()
                .map(VersionResponse::summary)
                .toList());
    }

    @GetMapping("/{versionId}")
    public ResponseEntity<VersionResponse> get(@PathVariable UUID documentId, @PathVariable UUID versionId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(VersionResponse.full(versionManager.get(documentId, versionId, actor)));
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
