package com.orgsuite.docflow.service.identity;

import java.util.UUID;

/**
 * The authenticated caller of a workflow operation, as resolved by the identity service.
 *
 * @param userId      platform user id
 * @param email       primary e-mail, matched case-insensitively against invitations
 * @param displayName name shown on contributor cards
 * @param admin       holds the platform administrator role
 */
public record Actor(UUID userId, String email, String displayName, boolean admin) {

    public boolean hasEmail(String candidate) {
        return email != null && candidate != null && email.equalsIgnoreCase(candidate.trim());
    }
}
