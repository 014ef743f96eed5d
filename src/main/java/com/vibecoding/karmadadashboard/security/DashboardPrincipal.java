package com.vibecoding.karmadadashboard.security;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 인증된 요청의 사용자 정보 (대시보드 JWT 또는 Keycloak 토큰)
 */
@Getter
@Builder
@ToString(exclude = "token")
public class DashboardPrincipal {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_BASIC_USER = "basic_user";

    private final String username;
    private final String role;
    @Builder.Default
    private final List<String> roles = List.of();
    private final boolean keycloak;
    private final String email;
    private final String token;

    /**
     * Keycloak 토큰의 admin / dashboard-admin 역할 (대소문자 무시)
     */
    public boolean hasKeycloakAdminRole() {
        return roles.stream().anyMatch(r -> "admin".equalsIgnoreCase(r) || "dashboard-admin".equalsIgnoreCase(r));
    }
}
