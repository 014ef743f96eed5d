package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.service.AuthorizationService;
import com.vibecoding.karmadadashboard.service.KeycloakService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AdminAccessCheckerTest {

    private KeycloakService keycloakService;
    private AuthorizationService authorizationService;
    private AdminAccessChecker checker;

    @BeforeEach
    void setUp() {
        keycloakService = mock(KeycloakService.class);
        authorizationService = mock(AuthorizationService.class);
        checker = new AdminAccessChecker(keycloakService, authorizationService);
    }

    private static DashboardPrincipal user(String name) {
        return DashboardPrincipal.builder().username(name).build();
    }

    @Test
    void missingPrincipalIsUnauthorized() {
        DashboardAccessException ex = assertThrows(DashboardAccessException.class,
            () -> checker.requireAdmin(null, "management cluster"));

        assertEquals(401, ex.getCode());
        assertEquals("Authentication required for management cluster access", ex.getMessage());
    }

    @Test
    void fgaAdminPasses() {
        when(authorizationService.isEnabled()).thenReturn(true);
        when(authorizationService.isDashboardAdmin("admin")).thenReturn(true);

        assertDoesNotThrow(() -> checker.requireAdmin(user("admin"), "management cluster"));
    }

    @Test
    void nonAdminIsForbidden() {
        when(authorizationService.isEnabled()).thenReturn(true);
        when(authorizationService.isDashboardAdmin("bob")).thenReturn(false);

        DashboardAccessException ex = assertThrows(DashboardAccessException.class,
            () -> checker.requireAdmin(user("bob"), "management cluster"));

        assertEquals(403, ex.getCode());
        assertEquals("Administrator permissions required for management cluster access", ex.getMessage());
    }

    @Test
    void disabledFgaIsServerError() {
        when(authorizationService.isEnabled()).thenReturn(false);

        DashboardAccessException ex = assertThrows(DashboardAccessException.class,
            () -> checker.requireAdmin(user("bob"), "user management"));

        assertEquals(500, ex.getCode());
        assertEquals("Authorization service unavailable", ex.getMessage());
    }

    @Test
    void fgaFailureIsServerError() {
        when(authorizationService.isEnabled()).thenReturn(true);
        when(authorizationService.isDashboardAdmin("bob")).thenThrow(new AuthorizationException("boom"));

        DashboardAccessException ex = assertThrows(DashboardAccessException.class,
            () -> checker.requireAdmin(user("bob"), "user management"));

        assertEquals(500, ex.getCode());
        assertEquals("Failed to verify administrator permissions", ex.getMessage());
    }

    @Test
    void keycloakRolesDecideWithoutFga() {
        when(keycloakService.isEnabled()).thenReturn(true);
        DashboardPrincipal admin = DashboardPrincipal.builder()
            .username("kc-admin")
            .keycloak(true)
            .roles(List.of("Dashboard-Admin"))
            .build();
        DashboardPrincipal viewer = DashboardPrincipal.builder()
            .username("kc-viewer")
            .keycloak(true)
            .roles(List.of("viewer"))
            .build();

        assertDoesNotThrow(() -> checker.requireAdmin(admin, "management cluster"));
        DashboardAccessException ex = assertThrows(DashboardAccessException.class,
            () -> checker.requireAdmin(viewer, "management cluster"));
        assertEquals(403, ex.getCode());
        verify(authorizationService, never()).isDashboardAdmin("kc-admin");
    }
}
