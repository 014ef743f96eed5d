package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.NamespaceRequest;
import com.vibecoding.karmadadashboard.model.PodLogs;
import com.vibecoding.karmadadashboard.model.ResourceKind;
import com.vibecoding.karmadadashboard.model.ResourceList;
import com.vibecoding.karmadadashboard.service.ResourceService;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Karmada / 관리 / 멤버 클러스터 공통 리소스 API
 * - 같은 핸들러를 세 가지 prefix 에 매핑하고 ClusterTarget 으로 대상 클라이언트를 고른다
 */
@RestController
@RequiredArgsConstructor
public class ResourceController {

    private static final Logger log = LoggerFactory.getLogger(ResourceController.class);

    static final String KARMADA = "/api/v1";
    static final String MGMT = "/api/v1/mgmt";
    static final String MEMBER = "/api/v1/member/{clustername}";
    static final String KIND = "/{kind:" + ResourceKind.PATH_REGEX + "}";

    private final ResourceService resourceService;

    // ========== List / Get ==========

    @GetMapping({KARMADA + KIND, MGMT + KIND, MEMBER + KIND})
    public BaseResponse<ResourceList<HasMetadata>> list(
        ClusterTarget target,
        @PathVariable String kind,
        @RequestParam(defaultValue = "false") boolean excludeSystem,
        DataSelectQuery query
    ) {
        log.info("Listing {} in cluster: {}", kind, target);
        ResourceKind resourceKind = ResourceKind.fromPath(kind);
        if (resourceKind == ResourceKind.NAMESPACE) {
            return BaseResponse.success(resourceService.listNamespaces(target, query, excludeSystem));
        }
        return BaseResponse.success(resourceService.list(target, resourceKind, null, query));
    }

    /**
     * namespaced 종류는 해당 네임스페이스 목록, cluster-scoped 종류는 이름으로 상세 조회
     */
    @GetMapping({KARMADA + KIND + "/{namespaceOrName}", MGMT + KIND + "/{namespaceOrName}",
        MEMBER + KIND + "/{namespaceOrName}"})
    public BaseResponse<Object> listInNamespaceOrGet(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespaceOrName,
        DataSelectQuery query
    ) {
        ResourceKind resourceKind = ResourceKind.fromPath(kind);
        if (resourceKind.isNamespaced()) {
            log.info("Listing {} in namespace: {}/{}", kind, target, namespaceOrName);
            return BaseResponse.success(resourceService.list(target, resourceKind, namespaceOrName, query));
        }
        log.info("Getting {}: {}/{}", kind, target, namespaceOrName);
        return BaseResponse.success(resourceService.get(target, resourceKind, null, namespaceOrName));
    }

    @GetMapping({KARMADA + KIND + "/{namespace}/{name}", MGMT + KIND + "/{namespace}/{name}",
        MEMBER + KIND + "/{namespace}/{name}"})
    public BaseResponse<Object> get(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @PathVariable String name
    ) {
        log.info("Getting {}: {}/{}/{}", kind, target, namespace, name);
        ResourceKind resourceKind = ResourceKind.fromPath(kind);
        if (resourceKind == ResourceKind.DEPLOYMENT) {
            return BaseResponse.success(resourceService.getDeploymentDetail(target, namespace, name));
        }
        return BaseResponse.success(resourceService.get(target, resourceKind, namespace, name));
    }

    // ========== Event ==========

    /**
     * cluster-scoped 종류의 이벤트.
     * namespaced 종류는 /{namespace}/{name} 과 같은 경로이므로 이름이 event 인 객체 상세 조회로 처리한다
     */
    @GetMapping({KARMADA + KIND + "/{name}/event", MGMT + KIND + "/{name}/event", MEMBER + KIND + "/{name}/event"})
    public BaseResponse<Object> clusterScopedEvents(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String name
    ) {
        ResourceKind resourceKind = ResourceKind.fromPath(kind);
        if (resourceKind.isNamespaced()) {
            return get(target, kind, name, "event");
        }
        log.info("Listing events of {}: {}/{}", kind, target, name);
        return BaseResponse.success(resourceService.events(target, resourceKind, null, name));
    }

    @GetMapping({KARMADA + KIND + "/{namespace}/{name}/event", MGMT + KIND + "/{namespace}/{name}/event",
        MEMBER + KIND + "/{namespace}/{name}/event"})
    public BaseResponse<ResourceList<Event>> events(
        ClusterTarget target,
        @PathVariable String kind,
        @PathVariable String namespace,
        @PathVariable String name
    ) {
        log.info("Listing events of {}: {}/{}/{}", kind, target, namespace, name);
        return BaseResponse.success(resourceService.events(target, ResourceKind.fromPath(kind), namespace, name));
    }

    // ========== Node / Pod / Deployment ==========

    @GetMapping({KARMADA + "/node/{name}/pod", MGMT + "/node/{name}/pod", MEMBER + "/node/{name}/pod"})
    public BaseResponse<ResourceList<HasMetadata>> nodePods(
        ClusterTarget target,
        @PathVariable String name,
        DataSelectQuery query
    ) {
        log.info("Listing pods on node: {}/{}", target, name);
        return BaseResponse.success(resourceService.nodePods(target, name, query));
    }

    @GetMapping({KARMADA + "/pod/{namespace}/{name}/logs", MGMT + "/pod/{namespace}/{name}/logs",
        MEMBER + "/pod/{namespace}/{name}/logs"})
    public BaseResponse<PodLogs> podLogs(
        ClusterTarget target,
        @PathVariable String namespace,
        @PathVariable String name,
        @RequestParam(required = false) String container,
        @RequestParam(defaultValue = "false") boolean previous,
        @RequestParam(required = false) Integer tailLines
    ) {
        log.info("Getting logs of pod: {}/{}/{}", target, namespace, name);
        return BaseResponse.success(resourceService.getPodLogs(target, namespace, name, container, previous, tailLines));
    }

    @PostMapping({KARMADA + "/deployment/{namespace}/{name}/restart", MGMT + "/deployment/{namespace}/{name}/restart",
        MEMBER + "/deployment/{namespace}/{name}/restart"})
    public BaseResponse<String> restartDeployment(
        ClusterTarget target,
        @PathVariable String namespace,
        @PathVariable String name
    ) {
        log.info("Restarting deployment: {}/{}/{}", target, namespace, name);
        resourceService.restartDeployment(target, namespace, name);
        return BaseResponse.success("ok");
    }

    // ========== Namespace ==========

    @PostMapping({KARMADA + "/namespace", MGMT + "/namespace", MEMBER + "/namespace"})
    public BaseResponse<Namespace> createNamespace(
        ClusterTarget target,
        @Valid @RequestBody NamespaceRequest request
    ) {
        log.info("Creating namespace: {}/{}", target, request.getName());
        return BaseResponse.success(resourceService.createNamespace(target, request));
    }

    @DeleteMapping({KARMADA + "/namespace/{name}", MGMT + "/namespace/{name}", MEMBER + "/namespace/{name}"})
    public BaseResponse<String> deleteNamespace(
        ClusterTarget target,
        @PathVariable String name
    ) {
        log.info("Deleting namespace: {}/{}", target, name);
        resourceService.deleteNamespace(target, name);
        return BaseResponse.success("ok");
    }
}
