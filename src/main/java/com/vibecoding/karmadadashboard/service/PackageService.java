package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.pkg.PackageResourceList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 관리 클러스터 default 네임스페이스의 config.porch.kpt.dev Repository / PackageRev CR
 */
@Service
@RequiredArgsConstructor
public class PackageService {

    private static final Logger log = LoggerFactory.getLogger(PackageService.class);

    static final String PACKAGE_NAMESPACE = "default";

    private final ClusterClientService clusterClientService;

    public PackageResourceList list(GroupVersionResource gvr) {
        try {
            List<GenericKubernetesResource> items = resources(gvr).inNamespace(PACKAGE_NAMESPACE).list().getItems();
            items.forEach(PackageService::stripManagedFields);
            return new PackageResourceList(items, items.size());
        } catch (KubernetesClientException e) {
            log.error("Failed to list {} resources", gvr.getKind(), e);
            throw new K8sApiException("Failed to list " + gvr.getKind() + " resources", e);
        }
    }

    public GenericKubernetesResource get(GroupVersionResource gvr, String name) {
        requireName(gvr, name);
        GenericKubernetesResource resource;
        try {
            resource = resources(gvr).inNamespace(PACKAGE_NAMESPACE).withName(name).get();
        } catch (KubernetesClientException e) {
            log.error("Failed to get {} resource: {}", gvr.getKind(), name, e);
            throw new K8sApiException("Failed to get " + gvr.getKind() + " resource", e);
        }
        if (resource == null) {
            throw new K8sResourceNotFoundException(gvr.getKind(), PACKAGE_NAMESPACE, name);
        }
        stripManagedFields(resource);
        return resource;
    }

    public GenericKubernetesResource create(GroupVersionResource gvr, GenericKubernetesResource body) {
        prepare(gvr, body);
        log.info("Creating {} resource in management cluster: {}", gvr.getKind(), body.getMetadata().getName());
        try {
            GenericKubernetesResource created = resources(gvr).inNamespace(PACKAGE_NAMESPACE).resource(body).create();
            stripManagedFields(created);
            return created;
        } catch (KubernetesClientException e) {
            log.error("Failed to create {} resource", gvr.getKind(), e);
            throw new K8sApiException("Failed to create " + gvr.getKind() + " resource", e);
        }
    }

    public GenericKubernetesResource update(GroupVersionResource gvr, String name, GenericKubernetesResource body) {
        requireName(gvr, name);
        prepare(gvr, body);
        if (!name.equals(body.getMetadata().getName())) {
            throw new BadRequestException(label(gvr) + " name in URL does not match name in request body");
        }
        log.info("Updating {} resource in management cluster: {}", gvr.getKind(), name);
        try {
            GenericKubernetesResource updated = resources(gvr).inNamespace(PACKAGE_NAMESPACE).resource(body).update();
            stripManagedFields(updated);
            return updated;
        } catch (KubernetesClientException e) {
            log.error("Failed to update {} resource: {}", gvr.getKind(), name, e);
            throw new K8sApiException("Failed to update " + gvr.getKind() + " resource", e);
        }
    }

    public Map<String, String> delete(GroupVersionResource gvr, String name) {
        requireName(gvr, name);
        log.info("Deleting {} resource in management cluster: {}", gvr.getKind(), name);
        try {
            resources(gvr).inNamespace(PACKAGE_NAMESPACE).withName(name).delete();
        } catch (KubernetesClientException e) {
            log.error("Failed to delete {} resource: {}", gvr.getKind(), name, e);
            throw new K8sApiException("Failed to delete " + gvr.getKind() + " resource", e);
        }
        return Map.of("message", String.format("%s '%s' deleted successfully", gvr.getKind(), name));
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources(
            GroupVersionResource gvr) {
        return clusterClientService.getManagementClient().genericKubernetesResources(gvr.toContext());
    }

    /**
     * apiVersion / kind 가 비어 있으면 채우고 네임스페이스는 default 로 고정
     */
    private static void prepare(GroupVersionResource gvr, GenericKubernetesResource body) {
        if (body == null) {
            throw new BadRequestException("request body is required");
        }
        if (body.getApiVersion() == null || body.getApiVersion().isEmpty()) {
            body.setApiVersion(gvr.getApiVersion());
        }
        if (body.getKind() == null || body.getKind().isEmpty()) {
            body.setKind(gvr.getKind());
        }
        if (body.getMetadata() == null) {
            body.setMetadata(new ObjectMeta());
        }
        body.getMetadata().setNamespace(PACKAGE_NAMESPACE);
    }

    private static void requireName(GroupVersionResource gvr, String name) {
        if (name == null || name.isBlank()) {
            throw new BadRequestException(label(gvr) + " name is required");
        }
    }

    private static String label(GroupVersionResource gvr) {
        return gvr.getKind().toLowerCase();
    }

    private static void stripManagedFields(GenericKubernetesResource resource) {
        if (resource != null && resource.getMetadata() != null) {
            resource.getMetadata().setManagedFields(null);
        }
    }
}
