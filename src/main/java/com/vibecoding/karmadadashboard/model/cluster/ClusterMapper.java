package com.vibecoding.karmadadashboard.model.cluster;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.api.model.Taint;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * cluster.karmada.io/v1alpha1 Cluster (unstructured) → 대시보드 DTO 변환
 */
public final class ClusterMapper {

    public static final String CONDITION_READY = "Ready";
    public static final String STATUS_TRUE = "True";
    public static final String STATUS_UNKNOWN = "Unknown";

    private ClusterMapper() {
    }

    public static Cluster toCluster(GenericKubernetesResource resource) {
        Cluster cluster = new Cluster();
        fill(cluster, resource);
        return cluster;
    }

    public static ClusterDetail toClusterDetail(GenericKubernetesResource resource) {
        ClusterDetail detail = new ClusterDetail();
        fill(detail, resource);
        List<Taint> taints = new ArrayList<>();
        for (Object item : list(resource.getAdditionalProperties(), "spec", "taints")) {
            if (item instanceof Map) {
                Map<?, ?> taint = (Map<?, ?>) item;
                taints.add(new Taint(str(taint.get("effect")), str(taint.get("key")),
                    str(taint.get("timeAdded")), str(taint.get("value"))));
            }
        }
        detail.setTaints(taints);
        return detail;
    }

    private static void fill(Cluster cluster, GenericKubernetesResource resource) {
        Map<String, Object> root = resource.getAdditionalProperties();
        cluster.setObjectMeta(resource.getMetadata());
        cluster.setTypeMeta(new TypeMeta("cluster"));
        cluster.setReady(readyStatus(resource));
        cluster.setKubernetesVersion(str(nested(root, "status", "kubernetesVersion")));
        cluster.setSyncMode(str(nested(root, "spec", "syncMode")));
        cluster.setNodeSummary(nodeSummary(resource));
        cluster.setAllocatedResources(allocatedResources(resource));
    }

    /**
     * Ready 조건이 True 이면 "True", 아니면 "Unknown"
     */
    public static String readyStatus(GenericKubernetesResource resource) {
        for (Object item : list(resource.getAdditionalProperties(), "status", "conditions")) {
            if (item instanceof Map) {
                Map<?, ?> condition = (Map<?, ?>) item;
                if (CONDITION_READY.equals(condition.get("type")) && STATUS_TRUE.equals(condition.get("status"))) {
                    return STATUS_TRUE;
                }
            }
        }
        return STATUS_UNKNOWN;
    }

    public static boolean isReady(GenericKubernetesResource resource) {
        return STATUS_TRUE.equals(readyStatus(resource));
    }

    public static NodeSummary nodeSummary(GenericKubernetesResource resource) {
        Object summary = nested(resource.getAdditionalProperties(), "status", "nodeSummary");
        if (!(summary instanceof Map)) {
            return null;
        }
        Map<?, ?> map = (Map<?, ?>) summary;
        return new NodeSummary(intValue(map.get("totalNum")), intValue(map.get("readyNum")));
    }

    /**
     * allocatable 대비 allocated + allocating 의 비율
     */
    public static ClusterAllocatedResources allocatedResources(GenericKubernetesResource resource) {
        Map<String, Object> root = resource.getAdditionalProperties();
        BigDecimal cpuCapacity = quantity(root, "allocatable", "cpu");
        BigDecimal cpuAllocated = quantity(root, "allocated", "cpu").add(quantity(root, "allocating", "cpu"));
        BigDecimal memoryCapacity = quantity(root, "allocatable", "memory");
        BigDecimal memoryAllocated = quantity(root, "allocated", "memory").add(quantity(root, "allocating", "memory"));
        BigDecimal podCapacity = quantity(root, "allocatable", "pods");
        BigDecimal podAllocated = quantity(root, "allocated", "pods").add(quantity(root, "allocating", "pods"));

        return ClusterAllocatedResources.builder()
            .cpuCapacity(cpuCapacity.setScale(0, RoundingMode.CEILING).longValue())
            .cpuFraction(fraction(cpuAllocated, cpuCapacity))
            .memoryCapacity(memoryCapacity.longValue())
            .memoryFraction(fraction(memoryAllocated, memoryCapacity))
            .allocatedPods(podAllocated.longValue())
            .podCapacity(podCapacity.longValue())
            .podFraction(fraction(podAllocated, podCapacity))
            .build();
    }

    /**
     * status.resourceSummary.<section>.<name> 수량 (CPU 는 코어, 메모리는 바이트). 없으면 0
     */
    public static BigDecimal quantity(Map<String, Object> root, String section, String name) {
        Object value = nested(root, "status", "resourceSummary", section, name);
        if (value == null) {
            return BigDecimal.ZERO;
        }
        try {
            return Quantity.getAmountInBytes(new Quantity(value.toString()));
        } catch (IllegalArgumentException e) {
            return BigDecimal.ZERO;
        }
    }

    static double fraction(BigDecimal used, BigDecimal capacity) {
        if (capacity.signum() == 0) {
            return 0;
        }
        return used.multiply(BigDecimal.valueOf(100)).divide(capacity, 4, RoundingMode.HALF_UP).doubleValue();
    }

    public static Object nested(Map<String, Object> root, String... path) {
        Object current = root;
        for (String key : path) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(key);
        }
        return current;
    }

    private static List<?> list(Map<String, Object> root, String... path) {
        Object value = nested(root, path);
        return value instanceof List ? (List<?>) value : List.of();
    }

    private static String str(Object value) {
        return value != null ? value.toString() : null;
    }

    private static int intValue(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return 0;
    }
}
