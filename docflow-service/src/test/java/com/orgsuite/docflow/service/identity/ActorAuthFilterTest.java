package com.orgsuite.docflow.service.identity;

import com.orgsuite.docflow.config.DocflowProperties;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@SuppressWarnings("null")
class ActorAuthFilterTest {

    @Mock
    private IdentityService identityService;

    private ActorAuthFilter filter;

    @BeforeEach
    void setUp() {
        filter = new ActorAuthFilter(identityService, new DocflowProperties());
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("A valid session cookie exposes the actor and continues the chain")
    void sessionCookieAuthenticates() throws Exception {
        Actor actor = new Actor(UUID.randomUUID(), "alice@example.com", "Alice", true);
        when(identityService.resolveSession("sess-1")).thenReturn(Optional.of(actor));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/documents");
        request.setCookies(new Cookie("DOCFLOW_SESSION", "sess-1"));
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertSame(actor, request.getAttribute(ActorAuthFilter.ACTOR_ATTRIBUTE));
        assertNotNull(chain.getRequest());
        assertTrue(SecurityContextHolder.getContext().getAuthentication().getAuthorities().stream()
                .anyMatch(a -> a.getAuthority().equals("ROLE_PLATFORM_ADMIN")));
    }

    @Test
    @DisplayName("Missing credentials are a 401 without reaching the identity service")
    void noTokenUnauthorized() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(new MockHttpServletRequest("GET", "/documents"), response, chain);

        assertEquals(401, response.getStatus());
        assertNull(chain.getRequest());
        verifyNoInteractions(identityService);
    }

    @Test
    @DisplayName("An unreachable identity service is a 503, not a 401")
    void identityDownIsUnavailable() throws Exception {
        when(identityService.resolveSession("abc")).thenThrow(new IdentityUnavailableException("down", null));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/documents");
        request.addHeader("Authorization", "Bearer abc");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertEquals(503, response.getStatus());
    }
}
