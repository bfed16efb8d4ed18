package com.orgsuite.docflow.modules.ledger.dto;

import com.orgsuite.docflow.model.entity.Signature;
import com.orgsuite.docflow.model.enums.SignatureType;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Signature event as exposed to clients. The raw signature payload and the
 * signer's network details are not returned.
 */
@Getter
@Builder
public class SignatureResponse {

    private UUID id;
    private UUID documentId;
    private UUID userId;
    private SignatureType type;
    private String comments;
    private String documentVersionLabel;
    private OffsetDateTime signedAt;

    public static SignatureResponse from(Signature signature) {
        return SignatureResponse.builder()
                .id(signature.getId())
                .documentId(signature.getDocumentId())
                .userId(signature.getUserId())
                .type(signature.getType())
                .comments(signature.getComments())
                .documentVersionLabel(signature.getDocumentVersionLabel())
                .signedAt(signature.getSignedAt())
                .build();
    }
}
