package com.orgsuite.docflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.orgsuite.docflow.service.identity.Actor;
import com.orgsuite.docflow.service.identity.ActorAuthFilter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Sliding-window rate limiter backed by a Redis sorted set per caller and rule.
 * Only POSTs on the token-consuming, signing and invitation routes are counted.
 * Token routes are keyed by client IP, the others by user.
 */
@Slf4j
@Component
public class RateLimitFilter extends OncePerRequestFilter {

    enum Rule {
        INVITE_CONSUME("invite_consume", "^/invitations/(accept|decline)$", 10, 60, true),
        DOC_SIGN("doc_sign", "^/documents/[^/]+/(signatures|rejections)$", 30, 300, false),
        INVITE_SEND("invite_send", "^/documents/[^/]+/invitations$", 50, 3600, false);

        private final String key;
        private final Pattern path;
        private final int limit;
        private final int windowSeconds;
        private final boolean perIp;

        Rule(String key, String path, int limit, int windowSeconds, boolean perIp) {
            this.key = key;
            this.path = Pattern.compile(path);
            this.limit = limit;
            this.windowSeconds = windowSeconds;
            this.perIp = perIp;
        }

        static Optional<Rule> forPath(String uri) {
            return Arrays.stream(values()).filter(r -> r.path.matcher(uri).matches()).findFirst();
        }
    }

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${rate-limit.enabled:true}")
    private boolean enabled;

    public RateLimitFilter(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !enabled || !"POST".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {
        Optional<Rule> rule = Rule.forPath(request.getRequestURI());
        if (rule.isPresent() && !tryAcquire(rule.get(), callerKey(request, rule.get()))) {
            reject(response, rule.get());
            return;
        }
        chain.doFilter(request, response);
    }

    /** Records the hit and returns false when the window is already full. Fails open. */
    private boolean tryAcquire(Rule rule, String caller) {
        String bucket = "ratelimit:" + rule.key + ":" + caller;
        long nowMillis = Instant.now().toEpochMilli();
        try {
            ZSetOperations<String, String> hits = redisTemplate.opsForZSet();
            hits.removeRangeByScore(bucket, 0, nowMillis - rule.windowSeconds * 1000L);

            Long inWindow = hits.zCard(bucket);
            if (inWindow != null && inWindow >= rule.limit) {
                log.warn("Rate limit {} exceeded by {}", rule.key, caller);
                return false;
            }

            hits.add(bucket, Long.toString(nowMillis), nowMillis);
            redisTemplate.expire(bucket, Duration.ofSeconds(rule.windowSeconds + 10L));
            return true;
        } catch (Exception e) {
            log.warn("Rate limit check for {} skipped, Redis unavailable: {}", rule.key, e.getMessage());
            return true;
        }
    }

    private String callerKey(HttpServletRequest request, Rule rule) {
        if (!rule.perIp && request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE) instanceof Actor actor) {
            return actor.userId().toString();
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        return forwarded != null && !forwarded.isBlank() ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
    }

    private void reject(HttpServletResponse response, Rule rule) throws IOException {
        response.setStatus(429);
        response.setHeader("Retry-After", String.valueOf(rule.windowSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(Map.of(
                "error", "RATE_LIMITED",
                "message", "Too many requests. Try again later.",
                "retryAfterSeconds", rule.windowSeconds)));
    }
}
