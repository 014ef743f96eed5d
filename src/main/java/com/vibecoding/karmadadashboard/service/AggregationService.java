package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.DashboardException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.ResourceKind;
import com.vibecoding.karmadadashboard.model.ResourceList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterMapper;
import com.vibecoding.karmadadashboard.model.crd.ApiVersionInfo;
import com.vibecoding.karmadadashboard.model.crd.ItemList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 준비된 멤버 클러스터 전체에서 리소스를 모아 하나의 목록으로 반환
 * - 클러스터는 순서대로 하나씩 조회
 * - 실패한 클러스터는 WARN 로그 후 건너뜀
 * - 모든 항목에 cluster=<이름> 라벨을 붙임
 */
@Service
@RequiredArgsConstructor
public class AggregationService {

    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);

    private final ClusterService clusterService;
    private final ClusterClientService clusterClientService;
    private final ResourceService resourceService;
    private final CustomResourceService customResourceService;

    /**
     * 사용자에게 보이는 클러스터 중 Ready 인 멤버 클러스터 (관리 클러스터 제외)
     */
    public List<String> readyClusterNames(String username) {
        return clusterService.visibleClusters(username).stream()
            .filter(ClusterMapper::isReady)
            .map(cluster -> cluster.getMetadata().getName())
            .filter(name -> !ClusterTarget.MGMT_CLUSTER_NAME.equals(name))
            .collect(Collectors.toList());
    }

    public ResourceList<HasMetadata> list(String username, ResourceKind kind, String namespace, DataSelectQuery query) {
        List<HasMetadata> merged = new ArrayList<>();
        for (String clusterName : readyClusterNames(username)) {
            try {
                KubernetesClient client = clusterClientService.getMemberClient(clusterName);
                for (HasMetadata item : resourceService.listItems(client, kind, namespace)) {
                    CustomResourceService.labelCluster(item.getMetadata(), clusterName);
                    merged.add(item);
                }
            } catch (DashboardException | KubernetesClientException e) {
                log.warn("Failed to list {} from cluster {}: {}", kind.getPath(), clusterName, e.getMessage());
            }
        }
        return ResourceList.of(kind.getListField(), query.apply(merged, HasMetadata::getMetadata));
    }

    public Object listDefinitions(String username, String groupBy) {
        List<GenericKubernetesResource> merged = new ArrayList<>();
        for (String clusterName : readyClusterNames(username)) {
            try {
                merged.addAll(customResourceService.summarizedDefinitions(
                    clusterClientService.getMemberClient(clusterName), clusterName));
            } catch (DashboardException | KubernetesClientException e) {
                log.warn("Failed to list CRDs from cluster {}: {}", clusterName, e.getMessage());
            }
        }
        if (CustomResourceService.GROUP_BY_GROUP.equals(groupBy)) {
            return CustomResourceService.group(merged);
        }
        return ItemList.of(merged);
    }

    public ItemList<GenericKubernetesResource> listResources(String username, String group, String crd) {
        CustomResourceService.requireGroupAndCrd(group, crd);
        List<GenericKubernetesResource> merged = new ArrayList<>();
        for (String clusterName : readyClusterNames(username)) {
            try {
                List<GenericKubernetesResource> items = customResourceService.listResourceItems(
                    clusterClientService.getMemberClient(clusterName), group, crd);
                for (GenericKubernetesResource item : items) {
                    CustomResourceService.labelCluster(item.getMetadata(), clusterName);
                    merged.add(item);
                }
            } catch (DashboardException | KubernetesClientException e) {
                log.warn("Failed to list {} from cluster {}: {}", crd, clusterName, e.getMessage());
            }
        }
        return ItemList.of(merged);
    }

    public ItemList<ApiVersionInfo> apiVersions(String username) {
        List<ApiVersionInfo> merged = new ArrayList<>();
        for (String clusterName : readyClusterNames(username)) {
            try {
                merged.addAll(customResourceService.apiVersions(
                    clusterClientService.getMemberClient(clusterName), clusterName));
            } catch (DashboardException | KubernetesClientException e) {
                log.warn("Failed to list API versions from cluster {}: {}", clusterName, e.getMessage());
            }
        }
        merged.sort(Comparator.comparing(ApiVersionInfo::getGroup));
        return ItemList.of(merged);
    }
}
