package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.PorchException;
import io.fabric8.kubernetes.api.model.authentication.TokenRequest;
import io.fabric8.kubernetes.api.model.authentication.TokenRequestBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * TokenRequest API 로 발급한 ServiceAccount 토큰 캐시 (namespace/name 단위)
 */
@Component
public class ServiceAccountTokenCache {

    private static final Logger log = LoggerFactory.getLogger(ServiceAccountTokenCache.class);

    static final Duration REFRESH_BUFFER = Duration.ofMinutes(5);
    static final String AUDIENCE = "https://kubernetes.default.svc.cluster.local";

    private final ClusterClientService clusterClientService;
    private final DashboardProperties properties;
    private final Clock clock;

    private final Map<String, CachedToken> tokens = new HashMap<>();

    @Autowired
    public ServiceAccountTokenCache(ClusterClientService clusterClientService, DashboardProperties properties) {
        this(clusterClientService, properties, Clock.systemUTC());
    }

    ServiceAccountTokenCache(ClusterClientService clusterClientService, DashboardProperties properties, Clock clock) {
        this.clusterClientService = clusterClientService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 만료까지 5분 넘게 남은 캐시 토큰이 있으면 재사용, 아니면 새로 발급
     */
    public synchronized String getToken(String namespace, String name) {
        String key = namespace + "/" + name;
        Instant now = clock.instant();
        CachedToken cached = tokens.get(key);
        if (cached != null && now.plus(REFRESH_BUFFER).isBefore(cached.expiration)) {
            log.debug("Using cached service account token: {} (expires {})", key, cached.expiration);
            return cached.token;
        }

        long lifetime = properties.getPorch().getTokenLifetimeSeconds();
        TokenRequest request = new TokenRequestBuilder()
            .withNewSpec()
                .withAudiences(AUDIENCE)
                .withExpirationSeconds(lifetime)
            .endSpec()
            .build();
        TokenRequest issued;
        try {
            issued = clusterClientService.getManagementClient().serviceAccounts()
                .inNamespace(namespace)
                .withName(name)
                .tokenRequest(request);
        } catch (KubernetesClientException e) {
            log.error("Failed to create token for service account {}", key, e);
            throw new PorchException("Failed to get service account token", e);
        }
        if (issued == null || issued.getStatus() == null || issued.getStatus().getToken() == null) {
            throw new PorchException("Failed to get service account token: empty token for " + key);
        }

        Instant expiration = now.plusSeconds(lifetime);
        tokens.put(key, new CachedToken(issued.getStatus().getToken(), expiration));
        log.info("Cached new service account token: {} (expires {})", key, expiration);
        return issued.getStatus().getToken();
    }

    private static class CachedToken {
        private final String token;
        private final Instant expiration;

        CachedToken(String token, Instant expiration) {
            this.token = token;
            this.expiration = expiration;
        }
    }
}
