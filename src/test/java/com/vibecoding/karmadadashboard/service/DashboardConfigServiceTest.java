package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.model.overview.MetricsDashboard;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class DashboardConfigServiceTest {

    private static final String NAMESPACE = "karmada-system";
    private static final String NAME = "karmada-dashboard-configmap";

    KubernetesClient client;

    private DashboardConfigService service;

    @BeforeEach
    void setUp() {
        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getManagementClient()).thenReturn(client);
        DashboardProperties properties = new DashboardProperties();
        properties.setEnvName("dev");
        service = new DashboardConfigService(clusterClientService, properties);
    }

    private ConfigMap configMap() {
        return client.configMaps().inNamespace(NAMESPACE).withName(NAME).get();
    }

    @Test
    void missingConfigMapMeansNoDashboards() {
        assertTrue(service.getMetricsDashboards().isEmpty());
    }

    @Test
    void addCreatesConfigMapUnderEnvironmentKey() {
        service.addMetricsDashboard(new MetricsDashboard("Cluster", "http://grafana/d/cluster"));

        ConfigMap configMap = configMap();
        assertTrue(configMap.getData().get("dev.yaml").contains("metrics_dashboards"));
        assertEquals(List.of(new MetricsDashboard("Cluster", "http://grafana/d/cluster")),
            service.getMetricsDashboards());
    }

    @Test
    void addKeepsOtherConfigKeys() {
        client.configMaps().inNamespace(NAMESPACE).resource(new ConfigMapBuilder()
            .withNewMetadata().withName(NAME).withNamespace(NAMESPACE).endMetadata()
            .addToData("dev.yaml", "menu:\n  - overview\nmetrics_dashboards:\n  - name: Nodes\n    url: http://grafana/d/nodes\n")
            .addToData("prod.yaml", "untouched: true\n")
            .build()).create();

        service.addMetricsDashboard(new MetricsDashboard("Pods", "http://grafana/d/pods"));

        ConfigMap configMap = configMap();
        assertTrue(configMap.getData().get("dev.yaml").contains("overview"));
        assertEquals("untouched: true\n", configMap.getData().get("prod.yaml"));
        assertEquals(2, service.getMetricsDashboards().size());
    }

    @Test
    void duplicateNameIsRejected() {
        service.addMetricsDashboard(new MetricsDashboard("Cluster", "http://a"));

        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.addMetricsDashboard(new MetricsDashboard("Cluster", "http://b")));
        assertEquals("dashboard with name 'Cluster' already exists", ex.getMessage());
    }

    @Test
    void addRequiresNameAndUrl() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.addMetricsDashboard(new MetricsDashboard("", "http://a")));
        assertEquals("name and url are required", ex.getMessage());
    }

    @Test
    void deleteMatchesNameAndUrl() {
        service.addMetricsDashboard(new MetricsDashboard("Cluster", "http://a"));

        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.deleteMetricsDashboard("Cluster", "http://other"));
        assertEquals("dashboard with name 'Cluster' and url 'http://other' not found", ex.getMessage());

        service.deleteMetricsDashboard("Cluster", "http://a");
        assertTrue(service.getMetricsDashboards().isEmpty());
    }
}
