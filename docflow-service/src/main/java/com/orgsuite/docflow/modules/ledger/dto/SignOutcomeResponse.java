package com.orgsuite.docflow.modules.ledger.dto;

import com.orgsuite.docflow.model.enums.DocumentStatus;
import com.orgsuite.docflow.model.enums.SignatureStatus;

import java.util.List;
import java.util.UUID;

/**
 * Result of a sign or reject call: the contributor's new state and the
 * document status after re-evaluation.
 *
 * @param signatureId    null for rejections
 * @param transitions    status values passed through, in order
 */
public record SignOutcomeResponse(UUID documentId, UUID contributorId, SignatureStatus contributorStatus,
        UUID signatureId, DocumentStatus documentStatus, List<DocumentStatus> transitions) {
}
