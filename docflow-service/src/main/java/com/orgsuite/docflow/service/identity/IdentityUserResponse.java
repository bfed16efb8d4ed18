package com.orgsuite.docflow.service.identity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.UUID;

/**
 * User payload returned by the identity service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdentityUserResponse(UUID userId, String email, String displayName, List<String> roles) {
}
