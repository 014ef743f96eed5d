package com.vibecoding.karmadadashboard.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;

/**
 * Keycloak realm 의 JWKS 로 토큰 서명을 검증하는 JwtDecoder
 */
@Configuration
@ConditionalOnProperty(prefix = "dashboard.keycloak", name = "enabled", havingValue = "true")
public class KeycloakConfig {

    private static final Logger log = LoggerFactory.getLogger(KeycloakConfig.class);

    @Bean
    public JwtDecoder keycloakJwtDecoder(DashboardProperties properties) {
        String jwkSetUri = properties.getKeycloak().getJwkSetUri();
        log.info("Keycloak token verification enabled: {}", jwkSetUri);
        return NimbusJwtDecoder.withJwkSetUri(jwkSetUri).build();
    }
}
