package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.service.UnstructuredResourceService;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 종류를 가리지 않는 raw 리소스 조회 / 생성 / 수정 / 삭제
 */
@RestController
@RequiredArgsConstructor
public class UnstructuredResourceController {

    private static final Logger log = LoggerFactory.getLogger(UnstructuredResourceController.class);

    static final String KARMADA_NAMESPACED = "/api/v1/_raw/{kind}/namespace/{namespace}/name/{name}";
    static final String KARMADA_NAMESPACE = "/api/v1/_raw/{kind}/namespace/{namespace}";
    static final String KARMADA_KIND = "/api/v1/_raw/{kind}";
    static final String MGMT_NAMESPACED = "/api/v1/mgmt/resource/{kind}/{namespace}/{name}";
    static final String MGMT_NAMESPACE = "/api/v1/mgmt/resource/{kind}/{namespace}";
    static final String MGMT_KIND = "/api/v1/mgmt/resource/{kind}";
    static final String MEMBER_NAMESPACED = "/api/v1/member/{clustername}/_raw/{kind}/{namespace}/{name}";
    static final String MEMBER_NAMESPACE = "/api/v1/member/{clustername}/_raw/{kind}/{namespace}";
    static final String MEMBER_CLUSTER_SCOPED = "/api/v1/member/{clustername}/_raw/{kind}/name/{name}";
    static final String MEMBER_KIND = "/api/v1/member/{clustername}/_raw/{kind}";

    private final UnstructuredResourceService unstructuredResourceService;

    // ========== Namespaced ==========

    @GetMapping({KARMADA_NAMESPACED, MGMT_NAMESPACED, MEMBER_NAMESPACED})
    public BaseResponse<GenericKubernetesResource> get(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @PathVariable String name
    ) {
        log.info("Getting raw resource: {} {}/{} in {}", kind, namespace, name, target);
        return BaseResponse.success(unstructuredResourceService.get(target, kind, namespace, name));
    }

    @PutMapping({KARMADA_NAMESPACED, MGMT_NAMESPACED, MEMBER_NAMESPACED})
    public BaseResponse<GenericKubernetesResource> update(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @PathVariable String name,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(unstructuredResourceService.update(target, kind, namespace, name, body));
    }

    @DeleteMapping({KARMADA_NAMESPACED, MGMT_NAMESPACED, MEMBER_NAMESPACED})
    public BaseResponse<Map<String, String>> delete(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @PathVariable String name
    ) {
        return BaseResponse.success(unstructuredResourceService.delete(target, kind, namespace, name));
    }

    @PostMapping({KARMADA_NAMESPACE, MGMT_NAMESPACE, MEMBER_NAMESPACE})
    public BaseResponse<GenericKubernetesResource> createInNamespace(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(unstructuredResourceService.create(target, kind, namespace, body));
    }

    // ========== Cluster-scoped ==========

    @GetMapping(MEMBER_CLUSTER_SCOPED)
    public BaseResponse<GenericKubernetesResource> getClusterScoped(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String name
    ) {
        log.info("Getting raw resource: {} {} in {}", kind, name, target);
        return BaseResponse.success(unstructuredResourceService.get(target, kind, null, name));
    }

    @PutMapping(MEMBER_CLUSTER_SCOPED)
    public BaseResponse<GenericKubernetesResource> updateClusterScoped(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String name,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(unstructuredResourceService.update(target, kind, null, name, body));
    }

    @DeleteMapping(MEMBER_CLUSTER_SCOPED)
    public BaseResponse<Map<String, String>> deleteClusterScoped(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String name
    ) {
        return BaseResponse.success(unstructuredResourceService.delete(target, kind, null, name));
    }

    @PostMapping({KARMADA_KIND, MGMT_KIND, MEMBER_KIND})
    public BaseResponse<GenericKubernetesResource> create(
        ClusterTarget target,
        @PathVariable String kind,
        @RequestBody GenericKubernetesResource body
    ) {
        return BaseResponse.success(unstructuredResourceService.create(target, kind, null, body));
    }
}
