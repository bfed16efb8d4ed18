package com.orgsuite.docflow.modules.ledger;

import com.orgsuite.docflow.model.entity.Contributor;
import com.orgsuite.docflow.modules.ledger.dto.AddContributorRequest;
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

@RestController
@RequestMapping("/documents/{documentId}/contributors")
@RequiredArgsConstructor
public class ContributorController {

    private final SignatureLedgerService ledgerService;

    @GetMapping
    public ResponseEntity<List<ContributorResponse>> list(@PathVariable UUID documentId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(ledgerService.listContributors(documentId, actor).stream()
                .map(ContributorResponse::from)
                .toList());
    }

    @PostMapping
    public ResponseEntity<ContributorResponse> add(@PathVariable UUID documentId,
            @Valid @RequestBody AddContributorRequest request, HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Contributor contributor = ledgerService.addContributor(documentId, request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ContributorResponse.from(contributor));
    }

    @DeleteMapping("/{contributorId}")
    public ResponseEntity<Void> remove(@PathVariable UUID documentId, @PathVariable UUID contributorId,
            HttpServletRequest httpRequest) {
        Actor actor = getCurrentActor(httpRequest);
        if (actor == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        ledgerService.removeContributor(documentId, contributorId, actor);
        return ResponseEntity.noContent().build();
    }

    private Actor getCurrentActor(HttpServletRequest request) {
        return (Actor) request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE);
    }
}
