package com.orgsuite.docflow.service.identity;

import java.util.Optional;
import java.util.UUID;

/**
 * Narrow contract to the platform's authentication service. Login, OTP and
 * session issuance live there; this service only asks who a token belongs to.
 */
public interface IdentityService {

    /**
     * @param sessionToken opaque session cookie value or bearer token
     * @return the caller, or empty when the token is unknown or expired
     * @throws IdentityUnavailableException when the identity service cannot be reached
     */
    Optional<Actor> resolveSession(String sessionToken);

    /** Registered user id for an e-mail, when one exists. */
    Optional<UUID> findUserIdByEmail(String email);
}
