package com.vibecoding.karmadadashboard.repository;

import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Kubernetes 클라이언트 저장소 (인메모리)
 * - Karmada 컨트롤 플레인 / 관리 클러스터 클라이언트
 * - 멤버 클러스터 클라이언트 (클러스터 이름 -> KubernetesClient, Karmada 프록시 경유)
 */
@Repository
public class ClusterClientRepository {

    private static final Logger log = LoggerFactory.getLogger(ClusterClientRepository.class);

    private volatile KubernetesClient karmadaClient;
    private volatile KubernetesClient managementClient;

    private final Map<String, KubernetesClient> memberClients = new ConcurrentHashMap<>();

    public void saveKarmadaClient(KubernetesClient client) {
        this.karmadaClient = client;
        log.info("Saved Karmada client: {}", client.getMasterUrl());
    }

    public void saveManagementClient(KubernetesClient client) {
        this.managementClient = client;
        log.info("Saved management cluster client: {}", client.getMasterUrl());
    }

    public Optional<KubernetesClient> findKarmadaClient() {
        return Optional.ofNullable(karmadaClient);
    }

    public Optional<KubernetesClient> findManagementClient() {
        return Optional.ofNullable(managementClient);
    }

    /**
     * 멤버 클러스터 클라이언트가 없으면 생성해서 저장
     */
    public KubernetesClient computeMemberClientIfAbsent(String clusterName,
                                                        Function<String, KubernetesClient> factory) {
        return memberClients.computeIfAbsent(clusterName, factory);
    }

    /**
     * 멤버 클러스터 클라이언트 삭제 (클라이언트 종료 포함)
     */
    public void deleteMemberClient(String clusterName) {
        KubernetesClient client = memberClients.remove(clusterName);
        if (client != null) {
            try {
                client.close();
                log.info("Closed member cluster client: {}", clusterName);
            } catch (Exception e) {
                log.warn("Failed to close member cluster client: {}", clusterName, e);
            }
        }
    }

    @PreDestroy
    public void closeAll() {
        memberClients.keySet().forEach(this::deleteMemberClient);
        closeQuietly(karmadaClient, "karmada");
        closeQuietly(managementClient, "management");
    }

    private void closeQuietly(KubernetesClient client, String name) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (Exception e) {
            log.warn("Failed to close {} client", name, e);
        }
    }
}
