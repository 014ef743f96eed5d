package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.repository.ClusterClientRepository;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Karmada / 관리 / 멤버 클러스터용 KubernetesClient 생성 및 조회
 */
@Service
@RequiredArgsConstructor
public class ClusterClientService {

    private static final Logger log = LoggerFactory.getLogger(ClusterClientService.class);

    private final DashboardProperties properties;
    private final ClusterClientRepository clusterClientRepository;

    /**
     * 애플리케이션 시작 시 Karmada / 관리 클러스터 클라이언트 생성
     */
    @PostConstruct
    public void initializeClients() {
        log.info("Initializing Kubernetes clients...");
        clusterClientRepository.saveKarmadaClient(createKubernetesClient(properties.getKarmada(), "karmada"));
        clusterClientRepository.saveManagementClient(createKubernetesClient(properties.getManagement(), "management"));
        log.info("Kubernetes client initialization completed");
    }

    public KubernetesClient getKarmadaClient() {
        return clusterClientRepository.findKarmadaClient()
            .orElseThrow(() -> new K8sApiException("Failed to get karmada client"));
    }

    public KubernetesClient getManagementClient() {
        return clusterClientRepository.findManagementClient()
            .orElseThrow(() -> new K8sApiException("Failed to get management cluster client"));
    }

    /**
     * Karmada cluster proxy 를 통해 멤버 클러스터에 접근하는 클라이언트
     */
    public KubernetesClient getMemberClient(String clusterName) {
        if (ClusterTarget.MGMT_CLUSTER_NAME.equals(clusterName)) {
            return getManagementClient();
        }
        return clusterClientRepository.computeMemberClientIfAbsent(clusterName, this::createMemberClient);
    }

    public KubernetesClient getClient(ClusterTarget target) {
        switch (target.getScope()) {
            case MGMT:
                return getManagementClient();
            case MEMBER:
                return getMemberClient(target.getClusterName());
            default:
                return getKarmadaClient();
        }
    }

    /**
     * 삭제된 멤버 클러스터의 캐시된 클라이언트 제거
     */
    public void evictMemberClient(String clusterName) {
        clusterClientRepository.deleteMemberClient(clusterName);
    }

    /**
     * 주어진 bearer 토큰으로 Karmada API 서버 /version 을 호출해 토큰을 검증
     */
    public VersionInfo verifyKarmadaToken(String token) {
        Config karmadaConfig = getKarmadaClient().getConfiguration();
        Config tokenConfig = new ConfigBuilder(karmadaConfig)
            .withOauthToken(token)
            .withUsername(null)
            .withPassword(null)
            .withClientCertData(null)
            .withClientCertFile(null)
            .withClientKeyData(null)
            .withClientKeyFile(null)
            .build();
        try (KubernetesClient client = new KubernetesClientBuilder().withConfig(tokenConfig).build()) {
            return client.getKubernetesVersion();
        } catch (KubernetesClientException e) {
            log.warn("Karmada token verification failed: {}", e.getMessage());
            throw new K8sApiException("Failed to get Karmada server version", e);
        }
    }

    static String memberProxyUrl(String karmadaMasterUrl, String clusterName) {
        String base = karmadaMasterUrl.endsWith("/") ? karmadaMasterUrl : karmadaMasterUrl + "/";
        return base + "apis/cluster.karmada.io/v1alpha1/clusters/" + clusterName + "/proxy/";
    }

    /**
     * Karmada 에 등록된 Cluster 에 대해서만 클라이언트를 만든다. 없으면 캐시하지 않고 예외
     */
    private KubernetesClient createMemberClient(String clusterName) {
        KubernetesClient karmadaClient = getKarmadaClient();
        GenericKubernetesResource cluster;
        try {
            cluster = karmadaClient.genericKubernetesResources(GroupVersionResource.CLUSTER.toContext())
                .withName(clusterName)
                .get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get cluster: {}", clusterName, e);
            throw new K8sApiException("Failed to get cluster " + clusterName, e);
        }
        if (cluster == null) {
            throw new K8sResourceNotFoundException("Cluster", null, clusterName);
        }
        Config karmadaConfig = karmadaClient.getConfiguration();
        Config memberConfig = new ConfigBuilder(karmadaConfig)
            .withMasterUrl(memberProxyUrl(karmadaConfig.getMasterUrl(), clusterName))
            .build();
        log.info("Created member cluster client: {} -> {}", clusterName, memberConfig.getMasterUrl());
        return new KubernetesClientBuilder().withConfig(memberConfig).build();
    }

    /**
     * kubeconfig 경로가 있으면 파일에서, 없으면 자동 설정(in-cluster / ~/.kube/config)으로 클라이언트 생성
     */
    private KubernetesClient createKubernetesClient(DashboardProperties.Kube kube, String name) {
        try {
            Config config;
            if (kube.getKubeconfig() != null && !kube.getKubeconfig().isBlank()) {
                String contents = Files.readString(Path.of(kube.getKubeconfig()));
                config = Config.fromKubeconfig(kube.getContext(), contents, kube.getKubeconfig());
            } else {
                config = Config.autoConfigure(kube.getContext());
            }

            Config k8sConfig = new ConfigBuilder(config)
                .withTrustCerts(kube.isSkipTlsVerify() || config.isTrustCerts())
                .withRequestTimeout(kube.getRequestTimeout())
                .withConnectionTimeout(kube.getConnectionTimeout())
                .build();

            return new KubernetesClientBuilder()
                .withConfig(k8sConfig)
                .build();
        } catch (IOException e) {
            log.error("Failed to read {} kubeconfig: {}", name, kube.getKubeconfig(), e);
            throw new IllegalStateException("Invalid " + name + " kubeconfig: " + e.getMessage(), e);
        }
    }
}
