package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.model.auth.KeycloakSettings;
import com.vibecoding.karmadadashboard.model.auth.KeycloakUser;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KeycloakServiceTest {

    private DashboardProperties properties;
    private JwtDecoder decoder;
    private KeycloakService service;

    @BeforeEach
    void setUp() {
        properties = new DashboardProperties();
        properties.getKeycloak().setEnabled(true);
        properties.getKeycloak().setRealm("platform");
        properties.getKeycloak().setFrontendUrl("https://dashboard.example.com");
        decoder = mock(JwtDecoder.class);
        service = new KeycloakService(properties, decoder);
    }

    private static Jwt jwt(Map<String, Object> claims) {
        Jwt.Builder builder = Jwt.withTokenValue("token").header("alg", "RS256");
        claims.forEach(builder::claim);
        return builder.build();
    }

    @Test
    void settingsDisabledWithoutDecoder() {
        KeycloakSettings settings = new KeycloakService(properties, (JwtDecoder) null).getSettings();

        assertFalse(settings.isEnabled());
        assertNull(settings.getRealm());
    }

    @Test
    void settingsCarryRedirectUris() {
        KeycloakSettings settings = service.getSettings();

        assertTrue(settings.isEnabled());
        assertEquals("platform", settings.getRealm());
        assertEquals("https://dashboard.example.com/callback", settings.getRedirectUri());
        assertEquals("https://dashboard.example.com/sign-out", settings.getLogoutRedirectUri());
    }

    @Test
    void rolesFromRealmAndClients() {
        List<String> roles = KeycloakService.extractRoles(Map.of(
            "realm_access", Map.of("roles", List.of("offline_access", "admin")),
            "resource_access", Map.of("dashboard", Map.of("roles", List.of("viewer")))));

        assertTrue(roles.containsAll(List.of("offline_access", "admin", "viewer")));
        assertEquals(3, roles.size());
        assertTrue(KeycloakService.extractRoles(Map.of("realm_access", "broken")).isEmpty());
    }

    @Test
    void validTokenBecomesAdminPrincipal() {
        when(decoder.decode("token")).thenReturn(jwt(Map.of(
            "preferred_username", "alice",
            "email", "alice@example.com",
            "realm_access", Map.of("roles", List.of("dashboard-admin")))));

        DashboardPrincipal principal = service.authenticatePrincipal("token").orElseThrow();

        assertEquals("alice", principal.getUsername());
        assertEquals(DashboardPrincipal.ROLE_ADMIN, principal.getRole());
        assertTrue(principal.isKeycloak());
    }

    @Test
    void usernameFallsBackToEmail() {
        when(decoder.decode("token")).thenReturn(jwt(Map.of("email", "bob@example.com")));

        KeycloakUser user = service.validate("token");

        assertEquals("bob@example.com", user.getUsername());
        assertFalse(user.isAdmin());
    }

    @Test
    void invalidTokenIsUnauthorized() {
        when(decoder.decode("bad")).thenThrow(new BadJwtException("expired"));

        DashboardAuthException e = assertThrows(DashboardAuthException.class, () -> service.validate("bad"));
        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
        assertTrue(service.authenticate("").isEmpty());
    }
}
