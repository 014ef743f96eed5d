package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.ListMeta;
import com.vibecoding.karmadadashboard.model.cluster.Cluster;
import com.vibecoding.karmadadashboard.model.cluster.ClusterDetail;
import com.vibecoding.karmadadashboard.model.cluster.ClusterList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterMapper;
import com.vibecoding.karmadadashboard.model.cluster.PostClusterRequest;
import com.vibecoding.karmadadashboard.model.cluster.PutClusterRequest;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceBuilder;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_MEMBER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_OWNER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.TYPE_CLUSTER;

/**
 * Karmada 멤버 클러스터 조회 / join / 수정 / 삭제
 */
@Service
@RequiredArgsConstructor
public class ClusterService {

    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    static final String CLUSTER_SECRET_NAMESPACE = "karmada-cluster";
    static final String SYNC_MODE_PUSH = "Push";
    static final String SYNC_MODE_PULL = "Pull";

    private final ClusterClientService clusterClientService;
    private final AuthorizationService authorizationService;

    private Duration deletePollInterval = Duration.ofSeconds(1);
    private Duration deleteTimeout = Duration.ofSeconds(60);

    // ========== List / Get ==========

    /**
     * 사용자에게 보이는 클러스터 목록
     * - 사용자 없음 / FGA 비활성: 전체
     * - 대시보드 admin: 전체 + 관리 클러스터
     * - 그 외: owner / member 관계가 있는 클러스터
     */
    public ClusterList listClusters(String username, DataSelectQuery query) {
        List<GenericKubernetesResource> clusters = visibleClusters(username);
        DataSelectQuery.Page<GenericKubernetesResource> page = query.apply(clusters, GenericKubernetesResource::getMetadata);
        List<Cluster> items = page.getItems().stream()
            .map(ClusterMapper::toCluster)
            .collect(Collectors.toList());
        return new ClusterList(new ListMeta(page.getTotalItems()), items, new ArrayList<>());
    }

    public List<GenericKubernetesResource> visibleClusters(String username) {
        List<GenericKubernetesResource> all = listClusterResources();
        if (username == null || username.isEmpty()) {
            log.info("No username provided, returning all clusters");
            return all;
        }
        if (!authorizationService.isEnabled()) {
            log.info("OpenFGA is disabled, returning all clusters: {}", username);
            return all;
        }

        try {
            if (authorizationService.isDashboardAdmin(username)) {
                List<GenericKubernetesResource> withMgmt = new ArrayList<>();
                withMgmt.add(managementCluster());
                withMgmt.addAll(all);
                return withMgmt;
            }
        } catch (AuthorizationException e) {
            log.error("Failed to check if user is admin: {}", username, e);
        }

        List<GenericKubernetesResource> authorized = new ArrayList<>();
        for (GenericKubernetesResource cluster : all) {
            String name = cluster.getMetadata().getName();
            try {
                if (authorizationService.hasClusterRelation(username, RELATION_OWNER, name)
                    || authorizationService.hasClusterRelation(username, RELATION_MEMBER, name)) {
                    authorized.add(cluster);
                }
            } catch (AuthorizationException e) {
                log.error("Failed to check cluster permission: {} {}", username, name, e);
            }
        }
        log.debug("Filtered clusters by permissions: user={}, total={}, authorized={}",
            username, all.size(), authorized.size());
        return authorized;
    }

    public List<GenericKubernetesResource> listClusterResources() {
        try {
            return clusters().list().getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list clusters", e);
            throw new K8sApiException("Failed to list clusters", e);
        }
    }

    public GenericKubernetesResource getClusterResource(String name) {
        GenericKubernetesResource cluster;
        try {
            cluster = clusters().withName(name).get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get cluster: {}", name, e);
            throw new K8sApiException("Failed to get cluster " + name, e);
        }
        if (cluster == null) {
            throw new K8sResourceNotFoundException("Cluster", null, name);
        }
        return cluster;
    }

    public ClusterDetail getClusterDetail(String name) {
        return ClusterMapper.toClusterDetail(getClusterResource(name));
    }

    /**
     * 관리자에게 보이는 가상의 관리 클러스터
     */
    static GenericKubernetesResource managementCluster() {
        Map<String, Object> condition = new LinkedHashMap<>();
        condition.put("type", ClusterMapper.CONDITION_READY);
        condition.put("status", ClusterMapper.STATUS_TRUE);
        condition.put("reason", "MgmtClusterReady");
        condition.put("message", "Management cluster is ready");
        condition.put("lastTransitionTime", Instant.now().toString());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("kubernetesVersion", "v1.27.0");
        status.put("conditions", List.of(condition));
        status.put("nodeSummary", Map.of("totalNum", 3, "readyNum", 3));
        status.put("resourceSummary", Map.of(
            "allocatable", Map.of("cpu", "4000m", "memory", "8Gi", "pods", "110"),
            "allocated", Map.of("cpu", "1600m", "memory", "4Gi", "pods", "30")));

        return new GenericKubernetesResourceBuilder()
            .withApiVersion(GroupVersionResource.CLUSTER.getApiVersion())
            .withKind(GroupVersionResource.CLUSTER.getKind())
            .withNewMetadata()
            .withName(ClusterTarget.MGMT_CLUSTER_NAME)
            .withCreationTimestamp(Instant.now().toString())
            .withLabels(Map.of("management", "true"))
            .endMetadata()
            .addToAdditionalProperties("spec", Map.of("syncMode", SYNC_MODE_PUSH))
            .addToAdditionalProperties("status", status)
            .build();
    }

    // ========== Join ==========

    /**
     * Push 모드 join: kubeconfig 를 karmada-cluster 네임스페이스의 Secret 으로 저장하고 Cluster 를 생성
     */
    public void joinCluster(PostClusterRequest request, String creator) {
        String name = request.getMemberClusterName();
        if (SYNC_MODE_PULL.equals(request.getSyncMode())) {
            throw new BadRequestException("pull mode is not supported");
        }
        if (!SYNC_MODE_PUSH.equals(request.getSyncMode())) {
            throw new BadRequestException("unknown sync mode " + request.getSyncMode());
        }

        String endpoint = request.getMemberClusterEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            endpoint = parseEndpointFromKubeconfig(request.getMemberClusterKubeConfig());
        }
        log.info("Joining cluster in push mode: {} ({})", name, endpoint);

        KubernetesClient karmada = clusterClientService.getKarmadaClient();
        try {
            if (karmada.namespaces().withName(CLUSTER_SECRET_NAMESPACE).get() == null) {
                karmada.namespaces().resource(new NamespaceBuilder()
                    .withNewMetadata().withName(CLUSTER_SECRET_NAMESPACE).endMetadata()
                    .build()).create();
            }
            karmada.secrets().inNamespace(CLUSTER_SECRET_NAMESPACE).resource(new SecretBuilder()
                .withNewMetadata()
                .withName(name)
                .withNamespace(CLUSTER_SECRET_NAMESPACE)
                .endMetadata()
                .addToStringData("kubeconfig", request.getMemberClusterKubeConfig())
                .build()).createOrReplace();

            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("syncMode", SYNC_MODE_PUSH);
            spec.put("apiEndpoint", endpoint);
            spec.put("secretRef", Map.of("namespace", CLUSTER_SECRET_NAMESPACE, "name", name));
            clusters().resource(new GenericKubernetesResourceBuilder()
                .withApiVersion(GroupVersionResource.CLUSTER.getApiVersion())
                .withKind(GroupVersionResource.CLUSTER.getKind())
                .withNewMetadata().withName(name).endMetadata()
                .addToAdditionalProperties("spec", spec)
                .build()).create();
        } catch (KubernetesClientException e) {
            log.error("Failed to join cluster: {}", name, e);
            throw new K8sApiException("Failed to join cluster " + name, e);
        }

        if (creator != null && !creator.isEmpty()) {
            authorizationService.tryWrite(creator, RELATION_OWNER, TYPE_CLUSTER, name);
        }
        log.info("Cluster joined: {}", name);
    }

    static String parseEndpointFromKubeconfig(String kubeconfig) {
        try {
            return Config.fromKubeconfig(kubeconfig).getMasterUrl();
        } catch (KubernetesClientException e) {
            throw new BadRequestException("invalid member cluster kubeconfig: " + e.getMessage());
        }
    }

    // ========== Update ==========

    public void updateCluster(String name, PutClusterRequest request) {
        GenericKubernetesResource cluster = getClusterResource(name);
        if (request.getLabels() != null) {
            Map<String, String> labels = new HashMap<>();
            for (PutClusterRequest.LabelItem item : request.getLabels()) {
                labels.put(item.getKey(), item.getValue());
            }
            cluster.getMetadata().setLabels(labels);
        }
        if (request.getTaints() != null) {
            List<Map<String, Object>> taints = new ArrayList<>();
            for (PutClusterRequest.TaintItem item : request.getTaints()) {
                Map<String, Object> taint = new LinkedHashMap<>();
                taint.put("key", item.getKey());
                taint.put("value", item.getValue());
                taint.put("effect", item.getEffect());
                taints.add(taint);
            }
            spec(cluster).put("taints", taints);
        }
        try {
            clusters().resource(cluster).update();
        } catch (KubernetesClientException e) {
            log.error("Failed to update cluster: {}", name, e);
            throw new K8sApiException("Failed to update cluster " + name, e);
        }
        log.info("Cluster updated: {}", name);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> spec(GenericKubernetesResource cluster) {
        Object spec = cluster.getAdditionalProperties().get("spec");
        if (spec instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>((Map<String, Object>) spec);
            cluster.getAdditionalProperties().put("spec", copy);
            return copy;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        cluster.getAdditionalProperties().put("spec", created);
        return created;
    }

    // ========== Delete ==========

    /**
     * Cluster 를 삭제하고 NotFound 가 될 때까지 대기한 뒤 kubeconfig Secret / 캐시된 클라이언트를 정리
     */
    public void deleteCluster(String name) {
        Resource<GenericKubernetesResource> resource = clusters().withName(name);
        try {
            if (resource.get() == null) {
                throw new K8sResourceNotFoundException("no cluster object " + name + " found in karmada control Plane");
            }
            resource.delete();
        } catch (KubernetesClientException e) {
            log.error("Failed to delete cluster object: {}", name, e);
            throw new K8sApiException("Failed to delete cluster " + name, e);
        }

        waitForDeletion(name);

        try {
            clusterClientService.getKarmadaClient().secrets()
                .inNamespace(CLUSTER_SECRET_NAMESPACE)
                .withName(name)
                .delete();
        } catch (KubernetesClientException e) {
            log.warn("Failed to delete kubeconfig secret of cluster {}: {}", name, e.getMessage());
        }
        clusterClientService.evictMemberClient(name);
        log.info("Cluster deleted: {}", name);
    }

    private void waitForDeletion(String name) {
        long deadline = System.nanoTime() + deleteTimeout.toNanos();
        while (true) {
            try {
                if (clusters().withName(name).get() == null) {
                    return;
                }
            } catch (KubernetesClientException e) {
                log.error("Failed to get cluster {}", name, e);
                throw new K8sApiException("Failed to get cluster " + name, e);
            }
            if (System.nanoTime() >= deadline) {
                throw new K8sApiException("timed out waiting for cluster " + name + " to be deleted");
            }
            log.info("Waiting for the cluster object {} to be deleted", name);
            try {
                Thread.sleep(deletePollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new K8sApiException("interrupted while waiting for cluster " + name + " to be deleted", e);
            }
        }
    }

    void setDeletePolling(Duration interval, Duration timeout) {
        this.deletePollInterval = interval;
        this.deleteTimeout = timeout;
    }

    private NonNamespaceOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> clusters() {
        return clusterClientService.getKarmadaClient()
            .genericKubernetesResources(GroupVersionResource.CLUSTER.toContext());
    }
}
