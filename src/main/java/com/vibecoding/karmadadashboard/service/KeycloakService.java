package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.model.auth.KeycloakSettings;
import com.vibecoding.karmadadashboard.model.auth.KeycloakUser;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keycloak 토큰 검증 및 프론트엔드 설정 제공
 */
@Service
public class KeycloakService {

    private static final Logger log = LoggerFactory.getLogger(KeycloakService.class);

    private final DashboardProperties properties;
    private final JwtDecoder jwtDecoder;

    public KeycloakService(DashboardProperties properties, ObjectProvider<JwtDecoder> jwtDecoder) {
        this(properties, jwtDecoder.getIfAvailable());
    }

    KeycloakService(DashboardProperties properties, JwtDecoder jwtDecoder) {
        this.properties = properties;
        this.jwtDecoder = jwtDecoder;
    }

    public boolean isEnabled() {
        return jwtDecoder != null;
    }

    public KeycloakSettings getSettings() {
        if (!isEnabled()) {
            return KeycloakSettings.builder().enabled(false).build();
        }
        DashboardProperties.Keycloak keycloak = properties.getKeycloak();
        String frontendUrl = keycloak.getFrontendUrl();
        return KeycloakSettings.builder()
            .enabled(true)
            .url(keycloak.getUrl())
            .realm(keycloak.getRealm())
            .clientId(keycloak.getClientId())
            .redirectUri(frontendUrl + "/callback")
            .logoutRedirectUri(frontendUrl + "/sign-out")
            .build();
    }

    /**
     * 서명 / 만료를 검증한 토큰의 사용자 정보. 실패하면 401
     */
    public KeycloakUser validate(String token) {
        if (!isEnabled()) {
            throw new DashboardAuthException(HttpStatus.INTERNAL_SERVER_ERROR, "Keycloak authentication not configured");
        }
        return authenticate(token)
            .orElseThrow(() -> DashboardAuthException.unauthorized("Invalid or expired token"));
    }

    public Optional<KeycloakUser> authenticate(String token) {
        if (!isEnabled() || token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Jwt jwt = jwtDecoder.decode(token);
            List<String> roles = extractRoles(jwt.getClaims());
            String username = jwt.getClaimAsString("preferred_username");
            if (username == null || username.isEmpty()) {
                username = jwt.getClaimAsString("email");
            }
            return Optional.of(KeycloakUser.builder()
                .username(username)
                .email(jwt.getClaimAsString("email"))
                .roles(roles)
                .admin(roles.contains("admin") || roles.contains("dashboard-admin"))
                .build());
        } catch (JwtException e) {
            log.debug("Keycloak token validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<DashboardPrincipal> authenticatePrincipal(String token) {
        return authenticate(token).map(user -> DashboardPrincipal.builder()
            .username(user.getUsername())
            .email(user.getEmail())
            .roles(user.getRoles())
            .role(user.isAdmin() ? DashboardPrincipal.ROLE_ADMIN : DashboardPrincipal.ROLE_BASIC_USER)
            .keycloak(true)
            .token(token)
            .build());
    }

    /**
     * realm_access.roles 와 resource_access.*.roles
     */
    @SuppressWarnings("unchecked")
    static List<String> extractRoles(Map<String, Object> claims) {
        List<String> roles = new ArrayList<>();
        Object realmAccess = claims.get("realm_access");
        if (realmAccess instanceof Map) {
            addRoles(roles, ((Map<String, Object>) realmAccess).get("roles"));
        }
        Object resourceAccess = claims.get("resource_access");
        if (resourceAccess instanceof Map) {
            for (Object client : ((Map<String, Object>) resourceAccess).values()) {
                if (client instanceof Map) {
                    addRoles(roles, ((Map<String, Object>) client).get("roles"));
                }
            }
        }
        return roles;
    }

    private static void addRoles(List<String> roles, Object value) {
        if (value instanceof Collection) {
            for (Object role : (Collection<?>) value) {
                if (role != null) {
                    roles.add(role.toString());
                }
            }
        }
    }
}
