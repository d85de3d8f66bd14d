package com.studioledger.backup.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtAuthenticationFilter")
class JwtAuthenticationFilterTest {

    private static final String SECRET = "test-jwt-secret-that-is-at-least-32-characters-long";

    private JwtTokenProvider jwtTokenProvider;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtTokenProvider = new JwtTokenProvider();
        ReflectionTestUtils.setField(jwtTokenProvider, "jwtSecret", SECRET);
        jwtTokenProvider.init();
        filter = new JwtAuthenticationFilter(jwtTokenProvider);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("should authenticate an active user with a role authority")
    void shouldAuthenticate() throws Exception {
        UUID userId = UUID.randomUUID();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request(TestTokens.userToken(SECRET, userId, "owner@studio.test", "admin", true)),
                new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_ADMIN");
        AuthenticatedUser principal = (AuthenticatedUser) authentication.getPrincipal();
        assertThat(principal.id()).isEqualTo(userId);
        assertThat(principal.isAdmin()).isTrue();
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("should ignore tokens of deactivated users")
    void shouldIgnoreInactiveUser() throws Exception {
        filter.doFilter(request(TestTokens.userToken(SECRET, UUID.randomUUID(), "x@studio.test", "admin", false)),
                new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("should continue unauthenticated with an invalid token")
    void shouldIgnoreInvalidToken() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request("garbage"), new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }

    private static MockHttpServletRequest request(String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/backups");
        request.addHeader("Authorization", "Bearer " + token);
        return request;
    }
}
