package com.orgsuite.docflow.modules.invitation;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.model.entity.Invitation;
import com.orgsuite.docflow.modules.invitation.dto.InvitationRequest;
import com.orgsuite.docflow.modules.invitation.dto.InvitationResponse;
import com.orgsuite.docflow.modules.invitation.dto.TokenRequest;
import com.orgsuite.docflow.modules.ledger.dto.ContributorResponse;
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
 * Invitation endpoints.
 *
 * <h3>Endpoints:</h3>
 * <ul>
 * <li>POST /documents/{id}/invitations: invite by e-mail into a team</li>
 * <li>GET /documents/{id}/invitations: invitations of a document</li>
 * <li>GET /invitations/mine: caller's open invitations</li>
 * <li>POST /invitations/accept, /invitations/decline: consume a token</li>
 * <li>POST /invitations/{id}/resend, /invitations/{id}/cancel</li>
 * </ul>
 */
@RestController
@RequiredArgsConstructor
public class InvitationController {

    private final InvitationService invitationService;

    // ================================================================
    // Document-scoped
    // ================================================================

    @PostMapping("/documents/{documentId}/invitations")
    public ResponseEntity<InvitationResponse> invite(@PathVariable UUID documentId,
            @Valid @RequestBody InvitationRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Invitation invitation = invitationService.invite(documentId, request.getTeam(), request.getEmail(),
                request.getMessage(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(InvitationResponse.from(invitation));
    }

    @GetMapping("/documents/{documentId}/invitations")
    public ResponseEntity<List<InvitationResponse>> listForDocument(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(invitationService.listForDocument(documentId, actor).stream()
                .map(InvitationResponse::from)
                .toList());
    }

    // ================================================================
    // Invitee
    // ================================================================

    @GetMapping("/invitations/mine")
    public ResponseEntity<List<InvitationResponse>> mine(HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(invitationService.listMine(actor).stream()
                .map(InvitationResponse::from)
                .toList());
    }

    @PostMapping("/invitations/accept")
    public ResponseEntity<ContributorResponse> accept(@Valid @RequestBody TokenRequest request,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Contributor contributor = invitationService.accept(request.getToken(), actor);
        return ResponseEntity.ok(ContributorResponse.from(contributor));
    }

    @PostMapping("/invitations/decline")
    public ResponseEntity<InvitationResponse> decline(@Valid @RequestBody TokenRequest request,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Invitation invitation = invitationService.decline(request.getToken(), request.getReason(), actor);
        return ResponseEntity.ok(InvitationResponse.from(invitation));
    }

    // ================================================================
    // Inviter
    // ================================================================

    @PostMapping("/invitations/{invitationId}/resend")
    public ResponseEntity<InvitationResponse> resend(@PathVariable UUID invitationId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(InvitationResponse.from(invitationService.resend(invitationId, actor)));
    }

    @PostMapping("/invitations/{invitationId}/cancel")
    public ResponseEntity<InvitationResponse> cancel(@PathVariable UUID invitationId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(InvitationResponse.from(invitationService.cancel(invitationId, actor)));
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
