package com.investorportal.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.investorportal.backend.modules.auth.application.AuthService;
import com.investorportal.backend.modules.auth.application.JwtTokenService;
import com.investorportal.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.investorportal.backend.support.TestAuthProperties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private AuthService authService;

    private JwtTokenService jwtTokenService;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(TestAuthProperties.defaults()),
                TestAuthProperties.defaults(), Clock.system(ZoneOffset.UTC));
        filter = new JwtAuthenticationFilter(jwtTokenService, authService);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void validTokenPopulatesSecurityContext() throws Exception {
        UUID userId = UUID.randomUUID();
        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(userId, "ada@example.com",
                Set.of("INVESTOR"), Set.of("VIEW_PORTFOLIO"), true);
        when(authService.validatePrincipal(userId)).thenReturn(Optional.of(principal));

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(bearer(jwtTokenService.issueAccessToken(userId, "ada@example.com").token()),
                new MockHttpServletResponse(), chain);

        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo(principal);
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactlyInAnyOrder("ROLE_INVESTOR", "VIEW_PORTFOLIO");
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void deactivatedSubjectLeavesRequestAnonymous() throws Exception {
        UUID userId = UUID.randomUUID();
        when(authService.validatePrincipal(userId)).thenReturn(Optional.empty());

        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(bearer(jwtTokenService.issueAccessToken(userId, "ada@example.com").token()),
                new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void invalidTokenContinuesChainWithoutWritingResponse() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(bearer("garbage.token.value"), response, chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(response.getContentAsString()).isEmpty();
        assertThat(chain.getRequest()).isNotNull();
        verify(authService, never()).validatePrincipal(any());
    }

    @Test
    void requestWithoutBearerHeaderIsUntouched() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader("Authorization", "Basic YWRhOnNlY3JldA==");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        verify(authService, never()).validatePrincipal(any());
    }

    private static MockHttpServletRequest bearer(String token) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/auth/me");
        request.addHeader("Authorization", "Bearer " + token);
        return request;
    }
}
