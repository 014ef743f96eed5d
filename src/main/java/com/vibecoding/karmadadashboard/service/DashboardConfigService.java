package com.vibecoding.karmadadashboard.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.model.overview.MetricsDashboard;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 관리 클러스터 configmap 에 저장된 대시보드 설정 (<env>.yaml)
 */
@Service
@RequiredArgsConstructor
public class DashboardConfigService {

    private static final Logger log = LoggerFactory.getLogger(DashboardConfigService.class);

    static final String METRICS_DASHBOARDS_KEY = "metrics_dashboards";

    private static final ObjectMapper YAML = new YAMLMapper();

    private final ClusterClientService clusterClientService;
    private final DashboardProperties properties;

    public List<MetricsDashboard> getMetricsDashboards() {
        Object raw = readConfig().get(METRICS_DASHBOARDS_KEY);
        if (raw == null) {
            return new ArrayList<>();
        }
        return YAML.convertValue(raw, new TypeReference<List<MetricsDashboard>>() {});
    }

    public void addMetricsDashboard(MetricsDashboard dashboard) {
        if (isBlank(dashboard.getName()) || isBlank(dashboard.getUrl())) {
            throw new BadRequestException("name and url are required");
        }
        List<MetricsDashboard> dashboards = getMetricsDashboards();
        for (MetricsDashboard existing : dashboards) {
            if (existing.getName().equals(dashboard.getName())) {
                throw new BadRequestException(
                    String.format("dashboard with name '%s' already exists", dashboard.getName()));
            }
        }
        dashboards.add(dashboard);
        writeMetricsDashboards(dashboards);
        log.info("Added metrics dashboard: {}", dashboard.getName());
    }

    public void deleteMetricsDashboard(String name, String url) {
        if (isBlank(name) || isBlank(url)) {
            throw new BadRequestException("name and url parameters are required");
        }
        List<MetricsDashboard> dashboards = getMetricsDashboards();
        boolean removed = dashboards.removeIf(d -> name.equals(d.getName()) && url.equals(d.getUrl()));
        if (!removed) {
            throw new BadRequestException(
                String.format("dashboard with name '%s' and url '%s' not found", name, url));
        }
        writeMetricsDashboards(dashboards);
        log.info("Deleted metrics dashboard: {}", name);
    }

    // ========== ConfigMap ==========

    private Map<String, Object> readConfig() {
        ConfigMap configMap = findConfigMap();
        if (configMap == null || configMap.getData() == null) {
            return new LinkedHashMap<>();
        }
        String content = configMap.getData().get(properties.getDashboardConfigKey());
        if (isBlank(content)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> config = YAML.readValue(content, new TypeReference<LinkedHashMap<String, Object>>() {});
            return config != null ? config : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            log.error("Failed to parse dashboard config key: {}", properties.getDashboardConfigKey(), e);
            throw new K8sApiException("Failed to parse dashboard config", e);
        }
    }

    private void writeMetricsDashboards(List<MetricsDashboard> dashboards) {
        DashboardProperties.DashboardConfigMap target = properties.getDashboardConfig();
        Map<String, Object> config = readConfig();
        config.put(METRICS_DASHBOARDS_KEY, dashboards);
        String content;
        try {
            content = YAML.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new K8sApiException("Failed to serialize dashboard config", e);
        }

        KubernetesClient client = clusterClientService.getManagementClient();
        try {
            ConfigMap existing = findConfigMap();
            if (existing == null) {
                ConfigMap created = new ConfigMapBuilder()
                    .withNewMetadata()
                        .withName(target.getName())
                        .withNamespace(target.getNamespace())
                    .endMetadata()
                    .addToData(properties.getDashboardConfigKey(), content)
                    .build();
                client.configMaps().inNamespace(target.getNamespace()).resource(created).create();
            } else {
                Map<String, String> data = existing.getData() != null
                    ? new LinkedHashMap<>(existing.getData()) : new LinkedHashMap<>();
                data.put(properties.getDashboardConfigKey(), content);
                existing.setData(data);
                client.configMaps().inNamespace(target.getNamespace()).resource(existing).update();
            }
        } catch (KubernetesClientException e) {
            log.error("Failed to update dashboard configmap: {}/{}", target.getNamespace(), target.getName(), e);
            throw new K8sApiException("Failed to update dashboard configmap", e);
        }
    }

    private ConfigMap findConfigMap() {
        DashboardProperties.DashboardConfigMap target = properties.getDashboardConfig();
        try {
            return clusterClientService.getManagementClient().configMaps()
                .inNamespace(target.getNamespace())
                .withName(target.getName())
                .get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get dashboard configmap: {}/{}", target.getNamespace(), target.getName(), e);
            throw new K8sApiException("Failed to get dashboard configmap", e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
