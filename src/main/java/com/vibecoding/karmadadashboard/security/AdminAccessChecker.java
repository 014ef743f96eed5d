package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.service.AuthorizationService;
import com.vibecoding.karmadadashboard.service.KeycloakService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 대시보드 관리자 확인
 * - Keycloak 사용 시 토큰의 admin / dashboard-admin 역할
 * - 그 외에는 OpenFGA (user, admin, dashboard:dashboard)
 */
@Component
@RequiredArgsConstructor
public class AdminAccessChecker {

    private static final Logger log = LoggerFactory.getLogger(AdminAccessChecker.class);

    private final KeycloakService keycloakService;
    private final AuthorizationService authorizationService;

    /**
     * @param subject 메시지에 쓰이는 대상 (예: "management cluster")
     */
    public void requireAdmin(DashboardPrincipal principal, String subject) {
        if (principal == null || principal.getUsername() == null || principal.getUsername().isEmpty()) {
            log.info("No authenticated user for {} access", subject);
            throw new DashboardAccessException(401, "Authentication required for " + subject + " access");
        }

        boolean admin;
        if (keycloakService.isEnabled() && principal.isKeycloak()) {
            admin = principal.hasKeycloakAdminRole();
        } else {
            if (!authorizationService.isEnabled()) {
                log.error("Authorization service not available");
                throw new DashboardAccessException(500, "Authorization service unavailable");
            }
            try {
                admin = authorizationService.isDashboardAdmin(principal.getUsername());
            } catch (AuthorizationException e) {
                log.error("Failed to check if user is admin: {}", principal.getUsername(), e);
                throw new DashboardAccessException(500, "Failed to verify administrator permissions", e);
            }
        }

        if (!admin) {
            log.info("User is not admin: {}", principal.getUsername());
            throw new DashboardAccessException(403, "Administrator permissions required for " + subject + " access");
        }
    }
}
