package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.service.KeycloakService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Bearer 토큰(또는 WebSocket 의 token 쿼리 파라미터)으로 SecurityContext 를 채운다.
 * Keycloak 이 켜져 있으면 Keycloak 검증을 먼저 시도하고, 실패하면 대시보드 JWT 로 검증한다.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";
    static final String TOKEN_PARAM = "token";

    private final JwtTokenProvider jwtTokenProvider;
    private final KeycloakService keycloakService;

    public JwtAuthenticationFilter(JwtTokenProvider jwtTokenProvider, KeycloakService keycloakService) {
        this.jwtTokenProvider = jwtTokenProvider;
        this.keycloakService = keycloakService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String token = resolveToken(request);
        if (token != null) {
            authenticate(token).ifPresent(principal -> {
                UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + principal.getRole())));
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Authenticated request: user={}, keycloak={}", principal.getUsername(), principal.isKeycloak());
            });
        }
        chain.doFilter(request, response);
    }

    Optional<DashboardPrincipal> authenticate(String token) {
        if (keycloakService.isEnabled()) {
            Optional<DashboardPrincipal> principal = keycloakService.authenticatePrincipal(token);
            if (principal.isPresent()) {
                return principal;
            }
        }
        return jwtTokenProvider.parse(token);
    }

    public static String resolveToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (header != null && header.startsWith(BEARER_PREFIX) && header.length() > BEARER_PREFIX.length()) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        String param = request.getParameter(TOKEN_PARAM);
        if (param != null && !param.isBlank()) {
            return param;
        }
        return null;
    }
}
