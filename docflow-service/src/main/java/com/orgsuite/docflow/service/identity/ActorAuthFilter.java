package com.orgsuite.docflow.service.identity;

import com.orgsuite.docflow.config.DocflowProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates every API request against the identity service.
 * <ul>
 * <li>Reads the session cookie, or an {@code Authorization: Bearer} header</li>
 * <li>Sets SecurityContext with the user id as principal</li>
 * <li>Exposes the {@link Actor} as request attribute {@value #ACTOR_ATTRIBUTE}</li>
 * <li>Returns 401 JSON (never a redirect); 503 when identity is down</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActorAuthFilter extends OncePerRequestFilter {

    public static final String ACTOR_ATTRIBUTE = "currentActor";

    private final IdentityService identityService;
    private final DocflowProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/public/") || path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        String sessionToken = extractToken(request);
        if (sessionToken == null) {
            sendError(response, HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized", "No session");
            return;
        }

        Optional<Actor> actorOpt;
        try {
            actorOpt = identityService.resolveSession(sessionToken);
        } catch (IdentityUnavailableException e) {
            sendError(response, HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Service Unavailable",
                    "Identity service unavailable");
            return;
        }

        if (actorOpt.isEmpty()) {
            sendError(response, HttpServletResponse.SC_UNAUTHORIZED, "Unauthorized", "Invalid session");
            return;
        }

        Actor actor = actorOpt.get();
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (actor.admin()) {
            authorities.add(new SimpleGrantedAuthority("ROLE_PLATFORM_ADMIN"));
        }
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                actor.userId().toString(), null, authorities);
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(ACTOR_ATTRIBUTE, actor);

        filterChain.doFilter(request, response);
    }

    private String extractToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith("Bearer ") && header.length() > 7) {
            return header.substring(7).trim();
        }
        if (request.getCookies() == null)
            return null;
        String cookieName = properties.getIdentity().getSessionCookieName();
        return Arrays.stream(request.getCookies())
                .filter(c -> cookieName.equals(c.getName()))
                .map(Cookie::getValue)
                .findFirst()
                .orElse(null);
    }

    private void sendError(HttpServletResponse response, int status, String error, String message)
            throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"status\":" + status + ",\"error\":\"" + error + "\",\"message\":\"" + message + "\"}");
    }
}
