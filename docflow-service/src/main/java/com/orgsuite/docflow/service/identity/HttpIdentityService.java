package com.orgsuite.docflow.service.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgsuite.docflow.config.DocflowProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * REST client for the identity service.
 * <ul>
 * <li>Resolved sessions are cached in Redis under a SHA-256 of the token</li>
 * <li>401/404 from the identity service means "no such session"</li>
 * <li>Circuit breaker {@code identity}: transport failures surface as
 * {@link IdentityUnavailableException}</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpIdentityService implements IdentityService {

    private static final String SESSION_KEY_PREFIX = "docflow:session:";

    private final RestTemplate restTemplate;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final DocflowProperties properties;

    @Override
    @CircuitBreaker(name = "identity", fallbackMethod = "resolveSessionFallback")
    public Optional<Actor> resolveSession(String sessionToken) {
        String cacheKey = SESSION_KEY_PREFIX + sha256(sessionToken);
        Optional<Actor> cached = readCached(cacheKey);
        if (cached.isPresent()) {
            return cached;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(sessionToken);
        IdentityUserResponse user;
        try {
            ResponseEntity<IdentityUserResponse> response = restTemplate.exchange(
                    properties.getIdentity().getSessionUrl(), HttpMethod.GET,
                    new HttpEntity<>(headers), IdentityUserResponse.class);
            user = response.getBody();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.UNAUTHORIZED || e.getStatusCode() == HttpStatus.NOT_FOUND) {
                return Optional.empty();
            }
            throw e;
        }

        if (user == null || user.userId() == null) {
            return Optional.empty();
        }

        boolean admin = user.roles() != null && user.roles().contains(properties.getIdentity().getAdminRole());
        Actor actor = new Actor(user.userId(), user.email(), user.displayName(), admin);
        writeCached(cacheKey, actor);
        return Optional.of(actor);
    }

    @Override
    @CircuitBreaker(name = "identity", fallbackMethod = "findUserIdByEmailFallback")
    public Optional<UUID> findUserIdByEmail(String email) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getIdentity().getUserLookupUrl())
                .queryParam("email", email)
                .toUriString();
        try {
            IdentityUserResponse user = restTemplate.getForObject(url, IdentityUserResponse.class);
            return Optional.ofNullable(user).map(IdentityUserResponse::userId);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    private Optional<Actor> resolveSessionFallback(String sessionToken, Throwable t) {
        log.error("Identity service unavailable (circuit breaker): {}", t.getMessage());
        throw new IdentityUnavailableException("Identity service temporarily unavailable", t);
    }

    /** Invitee resolution is best effort; the invitation still works by e-mail. */
    private Optional<UUID> findUserIdByEmailFallback(String email, Throwable t) {
        log.warn("User lookup failed, inviting by e-mail only: {}", t.getMessage());
        return Optional.empty();
    }

    private Optional<Actor> readCached(String key) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, Actor.class));
        } catch (Exception e) {
            log.warn("Session cache read failed (falling through to identity service): {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCached(String key, Actor actor) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(actor),
                    properties.getIdentity().getSessionCacheSeconds(), TimeUnit.SECONDS);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize actor for session cache: {}", e.getMessage());
        } catch (Exception e) {
            log.warn("Session cache write failed: {}", e.getMessage());
        }
    }

    private static String sha256(String value) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
