package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.DashboardException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.cluster.ClusterMapper;
import com.vibecoding.karmadadashboard.model.cluster.NodeSummary;
import com.vibecoding.karmadadashboard.model.overview.ClusterResourceStatus;
import com.vibecoding.karmadadashboard.model.overview.GpuSummary;
import com.vibecoding.karmadadashboard.model.overview.KarmadaInfo;
import com.vibecoding.karmadadashboard.model.overview.MemberClusterStatus;
import com.vibecoding.karmadadashboard.model.overview.MemberOverviewResponse;
import com.vibecoding.karmadadashboard.model.overview.MetricsDashboard;
import com.vibecoding.karmadadashboard.model.overview.OverviewResponse;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.VersionInfo;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 대시보드 개요 (Karmada / 멤버 / 관리 클러스터, GPU)
 */
@Service
@RequiredArgsConstructor
public class OverviewService {

    private static final Logger log = LoggerFactory.getLogger(OverviewService.class);

    static final String KARMADA_SYSTEM_NAMESPACE = "karmada-system";
    static final String CONTROLLER_MANAGER = "karmada-controller-manager";
    static final String GPU_RESOURCE = "nvidia.com/gpu";
    static final String GPU_PRODUCT_LABEL = "nvidia.com/gpu.product";
    static final String GPU_UNKNOWN_MODEL = "Unknown";
    static final String POD_PHASE_RUNNING = "Running";

    // 관리 클러스터는 사용량 수집이 없어 고정 비율 사용
    static final BigDecimal MGMT_CPU_USAGE = new BigDecimal("0.4");
    static final BigDecimal MGMT_MEMORY_USAGE = new BigDecimal("0.5");

    private final ClusterClientService clusterClientService;
    private final ClusterService clusterService;
    private final AggregationService aggregationService;
    private final DashboardConfigService dashboardConfigService;

    // ========== Karmada Overview ==========

    public OverviewResponse getOverview() {
        return OverviewResponse.builder()
            .karmadaInfo(getKarmadaInfo())
            .memberClusterStatus(getMemberClusterStatus())
            .clusterResourceStatus(getClusterResourceStatus())
            .metricsDashboards(metricsDashboards())
            .build();
    }

    public KarmadaInfo getKarmadaInfo() {
        KarmadaInfo info = KarmadaInfo.builder()
            .version(new KarmadaInfo.Version())
            .status(KarmadaInfo.STATUS_UNKNOWN)
            .build();
        try {
            VersionInfo version = clusterClientService.getKarmadaClient().getKubernetesVersion();
            if (version != null) {
                info.setVersion(KarmadaInfo.Version.builder()
                    .gitVersion(version.getGitVersion())
                    .gitCommit(version.getGitCommit())
                    .gitTreeState(version.getGitTreeState())
                    .buildDate(formatDate(version.getBuildDate()))
                    .build());
            }
        } catch (DashboardException | KubernetesClientException e) {
            log.warn("Failed to get karmada version: {}", e.getMessage());
        }

        try {
            Deployment deployment = clusterClientService.getManagementClient().apps().deployments()
                .inNamespace(KARMADA_SYSTEM_NAMESPACE)
                .withName(CONTROLLER_MANAGER)
                .get();
            if (deployment != null) {
                info.setCreateTime(deployment.getMetadata().getCreationTimestamp());
                if (isDeploymentReady(deployment)) {
                    info.setStatus(KarmadaInfo.STATUS_RUNNING);
                }
            }
        } catch (DashboardException | KubernetesClientException e) {
            log.warn("Failed to get {} deployment: {}", CONTROLLER_MANAGER, e.getMessage());
        }
        return info;
    }

    /**
     * Cluster 오브젝트의 status 를 합산
     */
    public MemberClusterStatus getMemberClusterStatus() {
        MemberClusterStatus status = new MemberClusterStatus();
        List<GenericKubernetesResource> clusters;
        try {
            clusters = clusterService.listClusterResources();
        } catch (DashboardException e) {
            log.warn("Failed to list clusters for overview: {}", e.getMessage());
            return status;
        }

        int totalNodes = 0;
        int readyNodes = 0;
        BigDecimal totalCpu = BigDecimal.ZERO;
        BigDecimal allocatedCpu = BigDecimal.ZERO;
        BigDecimal totalMemory = BigDecimal.ZERO;
        BigDecimal allocatedMemory = BigDecimal.ZERO;
        BigDecimal totalPods = BigDecimal.ZERO;
        BigDecimal allocatedPods = BigDecimal.ZERO;
        for (GenericKubernetesResource cluster : clusters) {
            NodeSummary nodes = ClusterMapper.nodeSummary(cluster);
            if (nodes != null) {
                totalNodes += nodes.getTotalNum();
                readyNodes += nodes.getReadyNum();
            }
            Map<String, Object> root = cluster.getAdditionalProperties();
            totalCpu = totalCpu.add(ClusterMapper.quantity(root, "allocatable", "cpu"));
            allocatedCpu = allocatedCpu.add(ClusterMapper.quantity(root, "allocated", "cpu"));
            totalMemory = totalMemory.add(ClusterMapper.quantity(root, "allocatable", "memory"));
            allocatedMemory = allocatedMemory.add(ClusterMapper.quantity(root, "allocated", "memory"));
            totalPods = totalPods.add(ClusterMapper.quantity(root, "allocatable", "pods"));
            allocatedPods = allocatedPods.add(ClusterMapper.quantity(root, "allocated", "pods"));
        }

        status.setNodeSummary(new NodeSummary(totalNodes, readyNodes));
        status.setCpuSummary(new MemberClusterStatus.CpuSummary(totalCpu.longValue(), allocatedCpu.doubleValue()));
        status.setMemorySummary(new MemberClusterStatus.MemorySummary(totalMemory.longValue(), allocatedMemory.doubleValue()));
        status.setPodSummary(new MemberClusterStatus.PodSummary(totalPods.longValue(), allocatedPods.longValue()));
        return status;
    }

    public ClusterResourceStatus getClusterResourceStatus() {
        ClusterResourceStatus status = new ClusterResourceStatus();
        KubernetesClient client;
        try {
            client = clusterClientService.getKarmadaClient();
        } catch (DashboardException e) {
            log.warn("Karmada client unavailable for overview: {}", e.getMessage());
            return status;
        }
        status.setPropagationPolicyNum(count(() -> client.genericKubernetesResources(
            GroupVersionResource.PROPAGATION_POLICY.toContext()).inAnyNamespace().list().getItems().size(), "propagationpolicies"));
        status.setOverridePolicyNum(count(() -> client.genericKubernetesResources(
            GroupVersionResource.OVERRIDE_POLICY.toContext()).inAnyNamespace().list().getItems().size(), "overridepolicies"));
        status.setNamespaceNum(count(() -> client.namespaces().list().getItems().size(), "namespaces"));
        status.setWorkloadNum(count(() -> client.apps().deployments().inAnyNamespace().list().getItems().size()
            + client.apps().statefulSets().inAnyNamespace().list().getItems().size()
            + client.apps().daemonSets().inAnyNamespace().list().getItems().size()
            + client.batch().v1().jobs().inAnyNamespace().list().getItems().size()
            + client.batch().v1().cronjobs().inAnyNamespace().list().getItems().size(), "workloads"));
        status.setServiceNum(count(() -> client.services().inAnyNamespace().list().getItems().size(), "services"));
        status.setConfigNum(count(() -> client.configMaps().inAnyNamespace().list().getItems().size()
            + client.secrets().inAnyNamespace().list().getItems().size(), "configs"));
        return status;
    }

    // ========== GPU ==========

    /**
     * 사용자에게 보이는 Ready 클러스터 전체의 GPU
     */
    public GpuSummary getGpuSummary(String username) {
        List<Node> nodes = new ArrayList<>();
        for (String clusterName : aggregationService.readyClusterNames(username)) {
            try {
                nodes.addAll(clusterClientService.getMemberClient(clusterName).nodes().list().getItems());
            } catch (DashboardException | KubernetesClientException e) {
                log.warn("Failed to list nodes from cluster {}: {}", clusterName, e.getMessage());
            }
        }
        return summarizeGpu(nodes);
    }

    public GpuSummary getMemberGpuSummary(String clusterName) {
        log.info("Collecting GPU summary for cluster: {}", clusterName);
        try {
            return summarizeGpu(clusterClientService.getMemberClient(clusterName).nodes().list().getItems());
        } catch (KubernetesClientException e) {
            log.warn("Failed to list nodes from cluster {}: {}", clusterName, e.getMessage());
            return new GpuSummary();
        }
    }

    static GpuSummary summarizeGpu(List<Node> nodes) {
        Map<String, Long> byModel = new TreeMap<>();
        long total = 0;
        for (Node node : nodes) {
            Map<String, Quantity> capacity = node.getStatus() != null ? node.getStatus().getCapacity() : null;
            if (capacity == null || capacity.get(GPU_RESOURCE) == null) {
                continue;
            }
            long count = Quantity.getAmountInBytes(capacity.get(GPU_RESOURCE)).longValue();
            if (count <= 0) {
                continue;
            }
            Map<String, String> labels = node.getMetadata().getLabels();
            String model = labels != null ? labels.getOrDefault(GPU_PRODUCT_LABEL, GPU_UNKNOWN_MODEL) : GPU_UNKNOWN_MODEL;
            byModel.merge(model, count, Long::sum);
            total += count;
        }

        GpuSummary summary = new GpuSummary();
        summary.setTotalGPU(total);
        for (Map.Entry<String, Long> entry : byModel.entrySet()) {
            summary.getGpuPools().add(new GpuSummary.GpuPool(entry.getKey(), entry.getValue()));
        }
        return summary;
    }

    // ========== Member / Mgmt Overview ==========

    public MemberOverviewResponse getMemberOverview(String clusterName) {
        log.info("Building overview for member cluster: {}", clusterName);
        KubernetesClient client = clusterClientService.getMemberClient(clusterName);

        int deploymentCount = count(() -> (int) client.apps().deployments().inAnyNamespace().list().getItems().stream()
            .filter(OverviewService::isDeploymentReady)
            .count(), "deployments");
        int namespaceCount = count(() -> client.namespaces().list().getItems().size(), "namespaces");

        MemberClusterStatus status = new MemberClusterStatus();
        try {
            List<Node> nodes = client.nodes().list().getItems();
            List<Pod> pods = client.pods().inAnyNamespace().list().getItems();
            status = memberStatus(nodes, pods);
        } catch (KubernetesClientException e) {
            log.warn("Failed to collect resource usage from cluster {}: {}", clusterName, e.getMessage());
        }

        return MemberOverviewResponse.builder()
            .karmadaInfo(getKarmadaInfo())
            .clusterName(clusterName)
            .deploymentCount(deploymentCount)
            .namespaceCount(namespaceCount)
            .memberClusterStatus(status)
            .metricsDashboards(metricsDashboards())
            .build();
    }

    /**
     * Running Pod 의 request 합 / 노드 allocatable
     */
    static MemberClusterStatus memberStatus(List<Node> nodes, List<Pod> pods) {
        BigDecimal totalCpu = BigDecimal.ZERO;
        BigDecimal totalMemory = BigDecimal.ZERO;
        BigDecimal totalPods = BigDecimal.ZERO;
        for (Node node : nodes) {
            Map<String, Quantity> allocatable = node.getStatus() != null ? node.getStatus().getAllocatable() : null;
            totalCpu = totalCpu.add(amount(allocatable, "cpu"));
            totalMemory = totalMemory.add(amount(allocatable, "memory"));
            totalPods = totalPods.add(amount(allocatable, "pods"));
        }

        BigDecimal requestedCpu = BigDecimal.ZERO;
        BigDecimal requestedMemory = BigDecimal.ZERO;
        for (Pod pod : pods) {
            if (pod.getStatus() == null || !POD_PHASE_RUNNING.equals(pod.getStatus().getPhase())) {
                continue;
            }
            for (Container container : pod.getSpec().getContainers()) {
                Map<String, Quantity> requests = container.getResources() != null
                    ? container.getResources().getRequests() : null;
                requestedCpu = requestedCpu.add(amount(requests, "cpu"));
                requestedMemory = requestedMemory.add(amount(requests, "memory"));
            }
        }

        MemberClusterStatus status = new MemberClusterStatus();
        status.setNodeSummary(new NodeSummary(nodes.size(), readyNodes(nodes)));
        status.setCpuSummary(new MemberClusterStatus.CpuSummary(totalCpu.longValue(), requestedCpu.doubleValue()));
        status.setMemorySummary(new MemberClusterStatus.MemorySummary(totalMemory.longValue(), requestedMemory.doubleValue()));
        status.setPodSummary(new MemberClusterStatus.PodSummary(totalPods.longValue(), pods.size()));
        return status;
    }

    public MemberOverviewResponse getMgmtOverview() {
        log.info("Building overview for management cluster");
        KubernetesClient client = clusterClientService.getManagementClient();
        int namespaceCount = count(() -> client.namespaces().list().getItems().size(), "namespaces");

        MemberClusterStatus status = new MemberClusterStatus();
        try {
            status = mgmtStatus(client.nodes().list().getItems(), client.pods().inAnyNamespace().list().getItems().size());
        } catch (KubernetesClientException e) {
            log.warn("Failed to collect management cluster nodes: {}", e.getMessage());
        }

        return MemberOverviewResponse.builder()
            .karmadaInfo(getKarmadaInfo())
            .clusterName(ClusterTarget.MGMT_CLUSTER_NAME)
            .deploymentCount(0)
            .namespaceCount(namespaceCount)
            .memberClusterStatus(status)
            .metricsDashboards(new ArrayList<>())
            .build();
    }

    static MemberClusterStatus mgmtStatus(List<Node> nodes, int podCount) {
        BigDecimal totalCpu = BigDecimal.ZERO;
        BigDecimal totalMemory = BigDecimal.ZERO;
        BigDecimal totalPods = BigDecimal.ZERO;
        for (Node node : nodes) {
            Map<String, Quantity> capacity = node.getStatus() != null ? node.getStatus().getCapacity() : null;
            totalCpu = totalCpu.add(amount(capacity, "cpu"));
            totalMemory = totalMemory.add(amount(capacity, "memory"));
            totalPods = totalPods.add(amount(capacity, "pods"));
        }

        MemberClusterStatus status = new MemberClusterStatus();
        status.setNodeSummary(new NodeSummary(nodes.size(), readyNodes(nodes)));
        status.setCpuSummary(new MemberClusterStatus.CpuSummary(
            totalCpu.longValue(), totalCpu.multiply(MGMT_CPU_USAGE).doubleValue()));
        status.setMemorySummary(new MemberClusterStatus.MemorySummary(
            totalMemory.longValue(), totalMemory.multiply(MGMT_MEMORY_USAGE).doubleValue()));
        status.setPodSummary(new MemberClusterStatus.PodSummary(totalPods.longValue(), podCount));
        return status;
    }

    // ========== Helpers ==========

    private List<MetricsDashboard> metricsDashboards() {
        try {
            return dashboardConfigService.getMetricsDashboards();
        } catch (DashboardException e) {
            log.warn("Failed to load metrics dashboards: {}", e.getMessage());
            return new ArrayList<>();
        }
    }

    private static int count(CountSupplier supplier, String what) {
        try {
            return supplier.get();
        } catch (KubernetesClientException e) {
            log.warn("Failed to count {}: {}", what, e.getMessage());
            return 0;
        }
    }

    static boolean isDeploymentReady(Deployment deployment) {
        if (deployment.getSpec() == null || deployment.getStatus() == null) {
            return false;
        }
        Integer replicas = deployment.getSpec().getReplicas();
        Integer ready = deployment.getStatus().getReadyReplicas();
        int want = replicas != null ? replicas : 1;
        return ready != null && ready == want;
    }

    private static int readyNodes(List<Node> nodes) {
        int ready = 0;
        for (Node node : nodes) {
            if (node.getStatus() == null || node.getStatus().getConditions() == null) {
                continue;
            }
            for (NodeCondition condition : node.getStatus().getConditions()) {
                if (ClusterMapper.CONDITION_READY.equals(condition.getType())
                    && ClusterMapper.STATUS_TRUE.equals(condition.getStatus())) {
                    ready++;
                }
            }
        }
        return ready;
    }

    private static BigDecimal amount(Map<String, Quantity> quantities, String name) {
        if (quantities == null || quantities.get(name) == null) {
            return BigDecimal.ZERO;
        }
        return Quantity.getAmountInBytes(quantities.get(name));
    }

    private static String formatDate(Date date) {
        return date != null ? date.toInstant().toString() : null;
    }

    @FunctionalInterface
    private interface CountSupplier {
        int get();
    }
}
