package com.orgsuite.docflow.modules.ledger;

import com.orgsuite.docflow.modules.ledger.dto.RejectRequest;
import com.orgsuite.docflow.modules.ledger.dto.SignOutcomeResponse;
import com.orgsuite.docflow.modules.ledger.dto.SignRequest;
import com.orgsuite.docflow.modules.ledger.dto.SignatureResponse;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Signing endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /documents/{id}/signatures: sign for the team under review</li>
 * <li>POST /documents/{id}/rejections: reject with a reason</li>
 * <li>GET /documents/{id}/signatures: signature audit trail</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/documents/{documentId}")
@RequiredArgsConstructor
public class SignatureController {

    private final SignatureLedgerService ledgerService;

    // ================================================================
    // POST /documents/{id}/signatures
    // ================================================================

    @PostMapping("/signatures")
    public ResponseEntity<SignOutcomeResponse> sign(@PathVariable UUID documentId,
            @Valid @RequestBody SignRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        SignOutcomeResponse outcome = ledgerService.sign(documentId, request.getSignatureData(),
                request.getComments(), request.getContributorUserId(), clientIp(httpRequest),
                httpRequest.getHeader("User-Agent"), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(outcome);
    }

    // ================================================================
    // POST /documents/{id}/rejections
    // ================================================================

    @PostMapping("/rejections")
    public ResponseEntity<SignOutcomeResponse> reject(@PathVariable UUID documentId,
            @Valid @RequestBody RejectRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(
                ledgerService.reject(documentId, request.getReason(), request.getContributorUserId(), actor));
    }

    // ================================================================
    // GET /documents/{id}/signatures
    // ================================================================

    @GetMapping("/signatures")
    public ResponseEntity<List<SignatureResponse>> list(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(ledgerService.listSignatures(documentId, actor).stream()
                .map(SignatureResponse::from)
                .toList());
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }

    private String clientIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
