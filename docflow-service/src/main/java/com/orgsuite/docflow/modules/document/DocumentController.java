package com.orgsuite.docflow.modules.document;

import com.orgsuite.docflow.model.entity.Document;
import com.orgsuite.docflow.modules.document.dto.ActivityResponse;
import com.orgsuite.docflow.modules.document.dto.CreateDocumentRequest;
import com.orgsuite.docflow.modules.document.dto.DocumentResponse;
import com.orgsuite.docflow.modules.document.dto.DocumentSummaryResponse;
import com.orgsuite.docflow.modules.document.dto.UpdateDocumentRequest;
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
 * Document endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /documents: create a draft</li>
 * <li>GET /documents: documents the caller created or contributes to</li>
 * <li>GET /documents/{id}: full document with contributors</li>
 * <li>PUT /documents/{id}: update; snapshots a version unless autosave</li>
 * <li>POST /documents/{id}/duplicate: new draft copied from this one</li>
 * <li>GET /documents/{id}/activity: activity log</li>
 * </ul>
 */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @PostMapping
    public ResponseEntity<DocumentResponse> create(@Valid @RequestBody CreateDocumentRequest request,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Document document = documentService.create(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(documentService.toResponse(document));
    }

    @GetMapping
    public ResponseEntity<List<DocumentSummaryResponse>> listMine(HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.listMine(actor).stream()
                .map(DocumentSummaryResponse::from)
                .toList());
    }

    @GetMapping("/{documentId}")
    public ResponseEntity<DocumentResponse> get(@PathVariable UUID documentId, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.toResponse(documentService.get(documentId, actor)));
    }

    @PutMapping("/{documentId}")
    public ResponseEntity<DocumentResponse> update(@PathVariable UUID documentId,
            @Valid @RequestBody UpdateDocumentRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Document document = documentService.update(documentId, request, actor);
        return ResponseEntity.ok(documentService.toResponse(document));
    }

    @PostMapping("/{documentId}/duplicate")
    public ResponseEntity<DocumentResponse> duplicate(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Document copy = documentService.duplicate(documentId, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(documentService.toResponse(copy));
    }

    @GetMapping("/{documentId}/activity")
    public ResponseEntity<List<ActivityResponse>> activity(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(documentService.activity(documentId, actor).stream()
                .map(ActivityResponse::from)
                .toList());
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
