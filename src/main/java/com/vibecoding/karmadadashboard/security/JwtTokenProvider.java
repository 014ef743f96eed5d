package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Date;
import java.util.Optional;

/**
 * 대시보드 JWT 발급 / 검증 (HS256)
 */
@Component
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLE = "role";

    private final SecretKey signingKey;
    private final String issuer;
    private final Duration ttl;

    public JwtTokenProvider(DashboardProperties properties) {
        DashboardProperties.Auth auth = properties.getAuth();
        this.signingKey = signingKey(auth.getJwtSecret());
        this.issuer = auth.getIssuer();
        this.ttl = Duration.ofHours(auth.getTokenTtlHours());
    }

    public String generateToken(String username, String role) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
            .setSubject(username)
            .claim(CLAIM_USERNAME, username)
            .claim(CLAIM_ROLE, role)
            .setIssuer(issuer)
            .setIssuedAt(new Date(now))
            .setNotBefore(new Date(now))
            .setExpiration(new Date(now + ttl.toMillis()))
            .signWith(signingKey, SignatureAlgorithm.HS256)
            .compact();
    }

    /**
     * 서명 / 만료 / 발급자를 검증하고 사용자 정보를 반환. 유효하지 않으면 empty
     */
    public Optional<DashboardPrincipal> parse(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(issuer)
                .build()
                .parseClaimsJws(token)
                .getBody();
            String username = claims.get(CLAIM_USERNAME, String.class);
            if (username == null || username.isEmpty()) {
                username = claims.getSubject();
            }
            return Optional.of(DashboardPrincipal.builder()
                .username(username)
                .role(claims.get(CLAIM_ROLE, String.class))
                .token(token)
                .build());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid dashboard token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * HS256 은 256bit 이상의 키가 필요하므로 짧은 secret 은 SHA-256 으로 늘린다
     */
    static SecretKey signingKey(String secret) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            try {
                bytes = MessageDigest.getInstance("SHA-256").digest(bytes);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 is not available", e);
            }
        }
        return Keys.hmacShaKeyFor(bytes);
    }
}
