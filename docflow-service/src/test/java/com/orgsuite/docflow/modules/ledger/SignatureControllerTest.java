package com.orgsuite.docflow.modules.ledger;

import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.SignatureStatus;
import com.orgsuite.docflow.modules.ledger.dto.SignOutcomeResponse;
import com.orgsuite.docflow.modules.ledger.dto.SignRequest;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for SignatureController: request plumbing only, rules live in the ledger service.
 */
@ExtendWith(MockitoExtension.class)
class SignatureControllerTest {

    @Mock
    private SignatureLedgerService ledgerService;

    @InjectMocks
    private SignatureController controller;

    private static SignRequest signRequest() {
        SignRequest request = new SignRequest();
        request.setSignatureData("data:image/png;base64,AAAA");
        request.setComments("Looks good");
        return request;
    }

    @Test
    void signWithoutSessionIsUnauthorized() {
        ResponseEntity<SignOutcomeResponse> result = controller.sign(UUID.randomUUID(), signRequest(),
                new MockHttpServletRequest());

        assertEquals(401, result.getStatusCode().value());
        verifyNoInteractions(ledgerService);
    }

    @Test
    void signPassesClientMetadataToLedger() {
        UUID documentId = UUID.randomUUID();
        Actor actor = new Actor(UUID.randomUUID(), "alice@example.com", "Alice", false);
        MockHttpServletRequest httpRequest = new MockHttpServletRequest();
        httpRequest.setAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE, actor);
        httpRequest.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        httpRequest.addHeader("User-Agent", "JUnit");

        SignOutcomeResponse outcome = new SignOutcomeResponse(documentId, UUID.randomUUID(),
                SignatureStatus.SIGNED, UUID.randomUUID(), DocumentStatus.AUTHOR_REVIEW, List.of());
        when(ledgerService.sign(documentId, "data:image/png;base64,AAAA", "Looks good", null, "203.0.113.7",
                "JUnit", actor)).thenReturn(outcome);

        ResponseEntity<SignOutcomeResponse> result = controller.sign(documentId, signRequest(), httpRequest);

        assertEquals(201, result.getStatusCode().value());
        assertSame(outcome, result.getBody());
    }
}
