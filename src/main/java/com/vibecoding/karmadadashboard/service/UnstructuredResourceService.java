package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 종류 이름만으로 임의 리소스를 조회 / 생성 / 수정 / 삭제 (GenericKubernetesResource)
 */
@Service
@RequiredArgsConstructor
public class UnstructuredResourceService {

    private static final Logger log = LoggerFactory.getLogger(UnstructuredResourceService.class);

    private static final Map<String, GroupVersionResource> KIND_TO_GVR = new HashMap<>();

    static final Set<String> CLUSTER_SCOPED_KINDS = Set.of(
        "namespace", "node", "persistentvolume", "clusterrole", "clusterrolebinding", "storageclass",
        "customresourcedefinition", "cluster", "clusteroverridepolicy", "clusterpropagationpolicy",
        "clusterresourcebinding");

    static {
        register("deployment", "apps", "v1", "deployments", "Deployment");
        register("statefulset", "apps", "v1", "statefulsets", "StatefulSet");
        register("daemonset", "apps", "v1", "daemonsets", "DaemonSet");
        register("replicaset", "apps", "v1", "replicasets", "ReplicaSet");
        register("job", "batch", "v1", "jobs", "Job");
        register("cronjob", "batch", "v1", "cronjobs", "CronJob");
        register("pod", "", "v1", "pods", "Pod");
        register("service", "", "v1", "services", "Service");
        register("configmap", "", "v1", "configmaps", "ConfigMap");
        register("secret", "", "v1", "secrets", "Secret");
        register("namespace", "", "v1", "namespaces", "Namespace");
        register("node", "", "v1", "nodes", "Node");
        register("persistentvolume", "", "v1", "persistentvolumes", "PersistentVolume");
        register("persistentvolumeclaim", "", "v1", "persistentvolumeclaims", "PersistentVolumeClaim");
        register("ingress", "networking.k8s.io", "v1", "ingresses", "Ingress");
        register("clusterrole", "rbac.authorization.k8s.io", "v1", "clusterroles", "ClusterRole");
        register("clusterrolebinding", "rbac.authorization.k8s.io", "v1", "clusterrolebindings", "ClusterRoleBinding");
        register("storageclass", "storage.k8s.io", "v1", "storageclasses", "StorageClass");
        register("policytemplate", "policy.karmada.io", "v1alpha1", "policytemplates", "PolicyTemplate");
        register(GroupVersionResource.CUSTOM_RESOURCE_DEFINITION);
        register(GroupVersionResource.PROPAGATION_POLICY);
        register(GroupVersionResource.CLUSTER_PROPAGATION_POLICY);
        register(GroupVersionResource.OVERRIDE_POLICY);
        register(GroupVersionResource.CLUSTER_OVERRIDE_POLICY);
        register(GroupVersionResource.RESOURCE_BINDING);
        register(GroupVersionResource.CLUSTER_RESOURCE_BINDING);
        register(GroupVersionResource.FEDERATED_RESOURCE_QUOTA);
        register(GroupVersionResource.CLUSTER);
    }

    private final ClusterClientService clusterClientService;

    private static void register(String kind, String group, String version, String plural, String kindName) {
        KIND_TO_GVR.put(kind, new GroupVersionResource(group, version, plural, kindName,
            !CLUSTER_SCOPED_KINDS.contains(kind)));
    }

    private static void register(GroupVersionResource gvr) {
        KIND_TO_GVR.put(gvr.getKind().toLowerCase(Locale.ROOT), gvr);
    }

    /**
     * 알려진 종류가 아니면 core/v1/{kind}s, 점이 있으면 마지막 부분을 리소스로, 나머지를 그룹으로 본다
     */
    public static GroupVersionResource resolve(String kind) {
        String lowerKind = kind.toLowerCase(Locale.ROOT);
        GroupVersionResource known = KIND_TO_GVR.get(lowerKind);
        if (known != null) {
            return known;
        }
        boolean namespaced = !isClusterScoped(lowerKind);
        int lastDot = lowerKind.lastIndexOf('.');
        if (lastDot < 0) {
            return new GroupVersionResource("", "v1", lowerKind + "s", null, namespaced);
        }
        String resource = lowerKind.substring(lastDot + 1) + "s";
        String group = lowerKind.substring(0, lastDot);
        return new GroupVersionResource(group, "v1", resource, null, namespaced);
    }

    public static boolean isClusterScoped(String kind) {
        return CLUSTER_SCOPED_KINDS.contains(kind.toLowerCase(Locale.ROOT));
    }

    public GenericKubernetesResource get(ClusterTarget target, String kind, String namespace, String name) {
        validate(kind, namespace, name);
        GroupVersionResource gvr = resolve(kind);
        GenericKubernetesResource result;
        try {
            result = resource(target, gvr, namespace, name).get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get resource: {} {}/{} in {}", gvr, namespace, name, target, e);
            throw new K8sApiException("Failed to get resource: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new K8sResourceNotFoundException(kind, gvr.isNamespaced() ? namespace : null, name);
        }
        return result;
    }

    public GenericKubernetesResource create(ClusterTarget target, String kind, String namespace,
                                            GenericKubernetesResource body) {
        if (kind == null || kind.isBlank()) {
            throw new BadRequestException("kind is required");
        }
        GroupVersionResource gvr = resolve(kind);
        if (gvr.isNamespaced() && (namespace == null || namespace.isBlank())) {
            throw new BadRequestException("Namespace is required for namespaced resources");
        }
        log.info("Creating resource: {} in {}/{}", gvr, target, namespace);
        try {
            if (gvr.isNamespaced()) {
                return operation(target, gvr).inNamespace(namespace).resource(body).create();
            }
            return operation(target, gvr).resource(body).create();
        } catch (KubernetesClientException e) {
            log.error("Failed to create resource: {} in {}/{}", gvr, target, namespace, e);
            throw new K8sApiException("Failed to create resource: " + e.getMessage(), e);
        }
    }

    public GenericKubernetesResource update(ClusterTarget target, String kind, String namespace, String name,
                                            GenericKubernetesResource body) {
        validate(kind, namespace, name);
        GroupVersionResource gvr = resolve(kind);
        log.info("Updating resource: {} {}/{} in {}", gvr, namespace, name, target);
        try {
            if (gvr.isNamespaced()) {
                return operation(target, gvr).inNamespace(namespace).resource(body).update();
            }
            return operation(target, gvr).resource(body).update();
        } catch (KubernetesClientException e) {
            log.error("Failed to update resource: {} {}/{} in {}", gvr, namespace, name, target, e);
            throw new K8sApiException("Failed to update resource: " + e.getMessage(), e);
        }
    }

    public Map<String, String> delete(ClusterTarget target, String kind, String namespace, String name) {
        validate(kind, namespace, name);
        GroupVersionResource gvr = resolve(kind);
        log.info("Deleting resource: {} {}/{} in {}", gvr, namespace, name, target);
        try {
            resource(target, gvr, namespace, name).delete();
        } catch (KubernetesClientException e) {
            log.error("Failed to delete resource: {} {}/{} in {}", gvr, namespace, name, target, e);
            throw new K8sApiException("Failed to delete resource: " + e.getMessage(), e);
        }
        return Map.of("status", "success");
    }

    /**
     * 클러스터 범위 종류는 namespace 를 검사하지 않는다
     */
    static void validate(String kind, String namespace, String name) {
        if (kind == null || kind.isBlank()) {
            throw new BadRequestException("kind is required");
        }
        if (!isClusterScoped(kind) && (namespace == null || namespace.isBlank())) {
            throw new BadRequestException("namespace is required");
        }
        if (name == null || name.isBlank()) {
            throw new BadRequestException("name is required");
        }
    }

    private Resource<GenericKubernetesResource> resource(ClusterTarget target, GroupVersionResource gvr,
                                                         String namespace, String name) {
        if (gvr.isNamespaced()) {
            return operation(target, gvr).inNamespace(namespace).withName(name);
        }
        return operation(target, gvr).withName(name);
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> operation(
        ClusterTarget target, GroupVersionResource gvr) {
        return clusterClientService.getClient(target).genericKubernetesResources(gvr.toContext());
    }
}
