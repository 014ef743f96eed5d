package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.crd.ApiVersionInfo;
import com.vibecoding.karmadadashboard.model.crd.CrdDetail;
import com.vibecoding.karmadadashboard.model.crd.CrdGroup;
import com.vibecoding.karmadadashboard.model.crd.CrdGroupList;
import com.vibecoding.karmadadashboard.model.crd.ItemList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.vibecoding.karmadadashboard.model.cluster.ClusterMapper.nested;

/**
 * CustomResourceDefinition 목록 / 상세 / 수정과 CRD 인스턴스 조회
 */
@Service
@RequiredArgsConstructor
public class CustomResourceService {

    private static final Logger log = LoggerFactory.getLogger(CustomResourceService.class);

    public static final String GROUP_BY_GROUP = "group";
    static final String CLUSTER_LABEL = "cluster";
    static final String GROUP_LABEL = "group";

    private final ClusterClientService clusterClientService;

    // ========== Definition ==========

    /**
     * groupBy=group 이면 그룹별 묶음, 아니면 {items, totalItems}
     */
    public Object listDefinitions(ClusterTarget target, String groupBy) {
        List<GenericKubernetesResource> crds = summarizedDefinitions(
            clusterClientService.getClient(target), target.getClusterName());
        if (GROUP_BY_GROUP.equals(groupBy)) {
            return group(crds);
        }
        return ItemList.of(crds);
    }

    /**
     * spec 은 {group, scope} 만 남기고 status.acceptedNames 를 최상위로 올린다
     */
    public List<GenericKubernetesResource> summarizedDefinitions(KubernetesClient client, String clusterName) {
        List<GenericKubernetesResource> result = new ArrayList<>();
        for (GenericKubernetesResource crd : listDefinitionResources(client)) {
            result.add(summarize(crd, clusterName));
        }
        return result;
    }

    static GenericKubernetesResource summarize(GenericKubernetesResource crd, String clusterName) {
        Map<String, Object> root = crd.getAdditionalProperties();
        String group = stringAt(root, "spec", "group");
        labelCluster(crd.getMetadata(), clusterName);
        if (group != null) {
            crd.getMetadata().getLabels().put(GROUP_LABEL, group);
        }

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("group", group);
        String scope = stringAt(root, "spec", "scope");
        if (scope != null) {
            spec.put("scope", scope);
        }
        root.put("spec", spec);

        Object acceptedNames = nested(root, "status", "acceptedNames");
        if (acceptedNames != null) {
            root.put("acceptedNames", acceptedNames);
        }
        root.remove("status");
        return crd;
    }

    /**
     * (group, cluster) 별로 묶고 group → cluster 순으로 정렬
     */
    public static CrdGroupList group(List<GenericKubernetesResource> crds) {
        Map<String, Map<String, List<GenericKubernetesResource>>> byGroup = new TreeMap<>();
        for (GenericKubernetesResource crd : crds) {
            Map<String, String> labels = crd.getMetadata().getLabels();
            String group = labels.getOrDefault(GROUP_LABEL, "");
            String cluster = labels.getOrDefault(CLUSTER_LABEL, "");
            byGroup.computeIfAbsent(group, key -> new TreeMap<>())
                .computeIfAbsent(cluster, key -> new ArrayList<>())
                .add(crd);
        }

        List<CrdGroup> groups = new ArrayList<>();
        int total = 0;
        for (Map.Entry<String, Map<String, List<GenericKubernetesResource>>> groupEntry : byGroup.entrySet()) {
            for (Map.Entry<String, List<GenericKubernetesResource>> clusterEntry : groupEntry.getValue().entrySet()) {
                List<GenericKubernetesResource> items = clusterEntry.getValue();
                groups.add(new CrdGroup(groupEntry.getKey(), clusterEntry.getKey(), items, items.size()));
                total += items.size();
            }
        }
        return new CrdGroupList(groups, total);
    }

    public CrdDetail getDefinition(ClusterTarget target, String name) {
        GenericKubernetesResource crd = getDefinitionResource(clusterClientService.getClient(target), name);
        labelCluster(crd.getMetadata(), target.getClusterName());
        return new CrdDetail(crd);
    }

    public CrdDetail updateDefinition(ClusterTarget target, String name, GenericKubernetesResource body) {
        if (body.getMetadata() == null || !name.equals(body.getMetadata().getName())) {
            throw new BadRequestException("CRD name in body does not match " + name);
        }
        log.info("Updating CRD: {} in {}", name, target);
        try {
            GenericKubernetesResource updated = clusterClientService.getClient(target)
                .genericKubernetesResources(GroupVersionResource.CUSTOM_RESOURCE_DEFINITION.toContext())
                .resource(body)
                .update();
            return new CrdDetail(updated);
        } catch (KubernetesClientException e) {
            log.error("Failed to update CRD: {} in {}", name, target, e);
            throw new K8sApiException("Failed to update CRD " + name, e);
        }
    }

    // ========== Custom resource ==========

    public ItemList<GenericKubernetesResource> listResources(ClusterTarget target, String group, String crd) {
        requireGroupAndCrd(group, crd);
        return ItemList.of(listResourceItems(clusterClientService.getClient(target), group, crd));
    }

    /**
     * CRD 의 첫 번째 버전과 plural 로 인스턴스를 조회
     */
    public List<GenericKubernetesResource> listResourceItems(KubernetesClient client, String group, String crd) {
        GenericKubernetesResource definition = getDefinitionResource(client, crd);
        GroupVersionResource gvr = instanceResource(definition, group);
        try {
            if (gvr.isNamespaced()) {
                return client.genericKubernetesResources(gvr.toContext()).inAnyNamespace().list().getItems();
            }
            return client.genericKubernetesResources(gvr.toContext()).list().getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list custom resources: {}", gvr, e);
            throw new K8sApiException("Failed to list custom resources " + gvr, e);
        }
    }

    static GroupVersionResource instanceResource(GenericKubernetesResource definition, String group) {
        Map<String, Object> root = definition.getAdditionalProperties();
        Object versions = nested(root, "spec", "versions");
        if (!(versions instanceof List) || ((List<?>) versions).isEmpty()) {
            throw new BadRequestException("no versions found in CRD");
        }
        Object first = ((List<?>) versions).get(0);
        String version = first instanceof Map ? String.valueOf(((Map<?, ?>) first).get("name")) : null;
        String plural = stringAt(root, "spec", "names", "plural");
        String kind = stringAt(root, "spec", "names", "kind");
        boolean namespaced = !"Cluster".equals(stringAt(root, "spec", "scope"));
        return new GroupVersionResource(group, version, plural, kind, namespaced);
    }

    public static void requireGroupAndCrd(String group, String crd) {
        if (group == null || group.isBlank() || crd == null || crd.isBlank()) {
            throw new BadRequestException("group and crd query parameters are required");
        }
    }

    /**
     * 클러스터의 CRD 에서 그룹별 버전 목록을 만든다
     */
    public List<ApiVersionInfo> apiVersions(KubernetesClient client, String clusterName) {
        Map<String, Set<String>> versionsByGroup = new LinkedHashMap<>();
        for (GenericKubernetesResource crd : listDefinitionResources(client)) {
            Map<String, Object> root = crd.getAdditionalProperties();
            String group = stringAt(root, "spec", "group");
            if (group == null || versionsByGroup.containsKey(group)) {
                continue;
            }
            Set<String> versions = new LinkedHashSet<>();
            Object list = nested(root, "spec", "versions");
            if (list instanceof List) {
                for (Object version : (List<?>) list) {
                    if (version instanceof Map && ((Map<?, ?>) version).get("name") != null) {
                        versions.add(String.valueOf(((Map<?, ?>) version).get("name")));
                    }
                }
            }
            versionsByGroup.put(group, versions);
        }

        List<ApiVersionInfo> result = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : versionsByGroup.entrySet()) {
            List<String> versions = new ArrayList<>(entry.getValue());
            versions.sort(null);
            result.add(new ApiVersionInfo(entry.getKey(), versions, clusterName));
        }
        return result;
    }

    // ========== Helper ==========

    private List<GenericKubernetesResource> listDefinitionResources(KubernetesClient client) {
        try {
            return client.genericKubernetesResources(GroupVersionResource.CUSTOM_RESOURCE_DEFINITION.toContext())
                .list()
                .getItems();
        } catch (KubernetesClientException e) {
            log.error("Failed to list CRDs", e);
            throw new K8sApiException("failed to list CRDs", e);
        }
    }

    private GenericKubernetesResource getDefinitionResource(KubernetesClient client, String name) {
        GenericKubernetesResource crd;
        try {
            crd = client.genericKubernetesResources(GroupVersionResource.CUSTOM_RESOURCE_DEFINITION.toContext())
                .withName(name)
                .get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get CRD: {}", name, e);
            throw new K8sApiException("failed to get CRD " + name, e);
        }
        if (crd == null) {
            throw new K8sResourceNotFoundException("CustomResourceDefinition", null, name);
        }
        return crd;
    }

    /**
     * labels 가 없으면 만들고 cluster 라벨을 붙인다. managedFields 는 제거
     */
    public static void labelCluster(ObjectMeta metadata, String clusterName) {
        if (metadata.getLabels() == null) {
            metadata.setLabels(new HashMap<>());
        }
        metadata.getLabels().put(CLUSTER_LABEL, clusterName);
        metadata.setManagedFields(null);
    }

    private static String stringAt(Map<String, Object> root, String... path) {
        Object value = nested(root, path);
        return value != null ? value.toString() : null;
    }
}
