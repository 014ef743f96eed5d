package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JwtTokenProviderTest {

    private static DashboardProperties properties(String secret, String issuer) {
        DashboardProperties properties = new DashboardProperties();
        properties.getAuth().setJwtSecret(secret);
        properties.getAuth().setIssuer(issuer);
        return properties;
    }

    @Test
    void issuedTokenParsesBackToPrincipal() {
        JwtTokenProvider provider = new JwtTokenProvider(properties("short-secret", "karmada-dashboard-api"));

        String token = provider.generateToken("alice", "admin");
        Optional<DashboardPrincipal> principal = provider.parse(token);

        assertTrue(principal.isPresent());
        assertEquals("alice", principal.get().getUsername());
        assertEquals("admin", principal.get().getRole());
        assertEquals(token, principal.get().getToken());
    }

    @Test
    void tokenSignedWithOtherSecretIsRejected() {
        JwtTokenProvider issuer = new JwtTokenProvider(properties("first-secret", "karmada-dashboard-api"));
        JwtTokenProvider verifier = new JwtTokenProvider(properties("second-secret", "karmada-dashboard-api"));

        assertTrue(verifier.parse(issuer.generateToken("alice", "admin")).isEmpty());
    }

    @Test
    void tokenFromOtherIssuerIsRejected() {
        JwtTokenProvider other = new JwtTokenProvider(properties("same-secret", "someone-else"));
        JwtTokenProvider verifier = new JwtTokenProvider(properties("same-secret", "karmada-dashboard-api"));

        assertTrue(verifier.parse(other.generateToken("alice", "admin")).isEmpty());
    }

    @Test
    void garbageIsRejected() {
        JwtTokenProvider provider = new JwtTokenProvider(new DashboardProperties());

        assertTrue(provider.parse("not-a-jwt").isEmpty());
        assertTrue(provider.parse("").isEmpty());
    }

    @Test
    void shortSecretIsStretchedToHmacKeyLength() {
        assertEquals(32, JwtTokenProvider.signingKey("abc").getEncoded().length);
    }
}
