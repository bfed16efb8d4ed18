package com.orgsuite.docflow.modules.workflow;

import com.orgsuite.docflow.modules.document.DocumentService;
import com.orgsuite.docflow.modules.document.dto.DocumentResponse;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Manual status changes: POST /documents/{id}/publish, /archive, /reset.
 */
@RestController
@RequestMapping("/documents/{documentId}")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowService workflowService;
    private final DocumentService documentService;

    @PostMapping("/publish")
    public ResponseEntity<DocumentResponse> publish(@PathVariable UUID documentId, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.toResponse(workflowService.publish(documentId, actor)));
    }

    @PostMapping("/archive")
    public ResponseEntity<DocumentResponse> archive(@PathVariable UUID documentId, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.toResponse(workflowService.archive(documentId, actor)));
    }

    @PostMapping("/reset")
    public ResponseEntity<DocumentResponse> reset(@PathVariable UUID documentId, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.toResponse(workflowService.reset(documentId, actor)));
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
