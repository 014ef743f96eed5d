package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.PorchException;
import io.fabric8.kubernetes.api.model.authentication.TokenRequest;
import io.fabric8.kubernetes.api.model.authentication.TokenRequestBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient
class ServiceAccountTokenCacheTest {

    private static final String TOKEN_PATH = "/api/v1/namespaces/karmada-system/serviceaccounts/karmada-dashboard/token";
    private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    KubernetesMockServer server;
    KubernetesClient client;

    private Clock clock;
    private ServiceAccountTokenCache cache;

    @BeforeEach
    void setUp() {
        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getManagementClient()).thenReturn(client);
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(START);
        cache = new ServiceAccountTokenCache(clusterClientService, new DashboardProperties(), clock);
    }

    private static TokenRequest issued(String token) {
        return new TokenRequestBuilder()
            .withNewStatus().withToken(token).endStatus()
            .build();
    }

    @Test
    void reusesTokenUntilCloseToExpiry() {
        server.expect().post().withPath(TOKEN_PATH).andReturn(201, issued("first")).once();
        server.expect().post().withPath(TOKEN_PATH).andReturn(201, issued("second")).once();

        assertEquals("first", cache.getToken("karmada-system", "karmada-dashboard"));

        when(clock.instant()).thenReturn(START.plusSeconds(3600 - 301));
        assertEquals("first", cache.getToken("karmada-system", "karmada-dashboard"));

        when(clock.instant()).thenReturn(START.plusSeconds(3600 - 299));
        assertEquals("second", cache.getToken("karmada-system", "karmada-dashboard"));
    }

    @Test
    void apiFailureIsPorchError() {
        server.expect().post().withPath(TOKEN_PATH).andReturn(403, "forbidden").once();

        PorchException ex = assertThrows(PorchException.class,
            () -> cache.getToken("karmada-system", "karmada-dashboard"));
        assertEquals(500, ex.getCode());
    }
}
