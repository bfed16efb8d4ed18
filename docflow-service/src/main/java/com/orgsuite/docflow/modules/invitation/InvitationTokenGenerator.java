package com.orgsuite.docflow.modules.invitation;

import com.orgsuite.docflow.config.DocflowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Generates invitation tokens: {@code docflow.invitation.token-bytes} random
 * bytes from {@link SecureRandom}, hex encoded (64 chars by default).
 */
@Component
@RequiredArgsConstructor
public class InvitationTokenGenerator {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final DocflowProperties properties;

    public String newToken() {
        byte[] bytes = new byte[Math.max(16, properties.getInvitation().getTokenBytes())];
        SECURE_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
