package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.model.auth.InitTokenResponse;
import com.vibecoding.karmadadashboard.model.auth.LoginRequest;
import com.vibecoding.karmadadashboard.model.auth.LoginResponse;
import com.vibecoding.karmadadashboard.model.auth.MeResponse;
import com.vibecoding.karmadadashboard.model.auth.User;
import com.vibecoding.karmadadashboard.repository.KeyValueStore;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import com.vibecoding.karmadadashboard.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 로그인 / 현재 사용자 / Karmada 서비스 어카운트 토큰 초기화
 */
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String SERVICE_ACCOUNT_TOKEN_KEY = "karmada-dashboard/service-account-token";
    public static final String ADMIN_USERNAME = "admin";
    static final String ADMIN_EMAIL = "admin@example.com";

    private final DashboardProperties properties;
    private final UserRepository userRepository;
    private final KeyValueStore keyValueStore;
    private final JwtTokenProvider jwtTokenProvider;
    private final AuthorizationService authorizationService;
    private final ClusterClientService clusterClientService;

    /**
     * admin 사용자가 없으면 생성하고 대시보드 admin 권한을 부여
     */
    @EventListener(ApplicationReadyEvent.class)
    public void bootstrapAdmin() {
        try {
            if (!userRepository.exists(ADMIN_USERNAME)) {
                userRepository.create(ADMIN_USERNAME, properties.getAuth().getAdminPassword(), ADMIN_EMAIL,
                    DashboardPrincipal.ROLE_ADMIN);
                log.info("Admin user created");
            } else {
                log.info("Admin user already exists");
            }
        } catch (StoreException e) {
            log.error("Failed to initialize admin user: {}", e.getMessage());
            return;
        }

        if (!authorizationService.isEnabled()) {
            log.info("OpenFGA is disabled, skipping admin permission setup");
            return;
        }
        try {
            authorizationService.grantDashboardAdmin(ADMIN_USERNAME);
            log.info("Granted dashboard admin role to admin user");
        } catch (AuthorizationException e) {
            log.warn("Failed to grant dashboard admin role to admin user: {}", e.getMessage());
        }
    }

    public LoginResponse login(LoginRequest request) {
        if (request == null || isBlank(request.getUsername()) || isBlank(request.getPassword())) {
            throw new DashboardAuthException(HttpStatus.BAD_REQUEST, "No valid authentication method provided");
        }
        String username = request.getUsername();
        User user;
        try {
            user = userRepository.get(username);
            if (!userRepository.verifyPassword(username, request.getPassword())) {
                throw DashboardAuthException.unauthorized("Invalid username or password");
            }
        } catch (StoreException e) {
            log.error("Authentication failed: {}", username, e);
            throw DashboardAuthException.unauthorized("Invalid username or password");
        }
        log.info("User logged in: {}", username);
        return new LoginResponse(jwtTokenProvider.generateToken(username, user.getRole()));
    }

    public MeResponse me(DashboardPrincipal principal) {
        if (principal == null) {
            throw DashboardAuthException.unauthorized("Missing authentication token");
        }
        if (principal.isKeycloak()) {
            return MeResponse.builder()
                .name(principal.getUsername())
                .authenticated(true)
                .role(principal.getRole())
                .initToken(true)
                .build();
        }

        String role = principal.getRole();
        if (isBlank(role)) {
            role = findUser(principal.getUsername()).map(User::getRole).orElse(null);
        }
        return MeResponse.builder()
            .name(principal.getUsername())
            .authenticated(true)
            .role(role)
            .initToken(isServiceAccountTokenValid())
            .build();
    }

    /**
     * Karmada API 서버로 검증한 뒤 etcd 에 저장. 실패해도 HTTP 200 에 success=false 로 응답
     */
    public InitTokenResponse initToken(String token) {
        if (isBlank(token)) {
            return new InitTokenResponse(false, "Invalid token: token is required");
        }
        try {
            clusterClientService.verifyKarmadaToken(token);
        } catch (K8sApiException e) {
            log.error("Failed to validate service account token", e);
            return new InitTokenResponse(false, "Invalid token: " + e.getMessage());
        }
        try {
            keyValueStore.put(SERVICE_ACCOUNT_TOKEN_KEY, token);
        } catch (StoreException e) {
            log.error("Failed to save service account token to etcd", e);
            return new InitTokenResponse(false, "Failed to save token: " + e.getMessage());
        }
        log.info("Successfully initialized Karmada API server service account token");
        return new InitTokenResponse(true, "Token successfully initialized and stored");
    }

    boolean isServiceAccountTokenValid() {
        Optional<String> token;
        try {
            token = keyValueStore.get(SERVICE_ACCOUNT_TOKEN_KEY);
        } catch (StoreException e) {
            log.warn("Failed to get service account token from etcd: {}", e.getMessage());
            return false;
        }
        if (token.isEmpty() || token.get().isBlank()) {
            return false;
        }
        try {
            clusterClientService.verifyKarmadaToken(token.get());
            return true;
        } catch (K8sApiException e) {
            return false;
        }
    }

    private Optional<User> findUser(String username) {
        try {
            return userRepository.find(username);
        } catch (StoreException e) {
            log.warn("Failed to get user details from etcd: {}", username);
            return Optional.empty();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
