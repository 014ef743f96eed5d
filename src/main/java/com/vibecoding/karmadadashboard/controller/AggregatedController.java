package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.ResourceKind;
import com.vibecoding.karmadadashboard.model.ResourceList;
import com.vibecoding.karmadadashboard.model.crd.ApiVersionInfo;
import com.vibecoding.karmadadashboard.model.crd.ItemList;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.AggregationService;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 사용자에게 보이는 Ready 멤버 클러스터 전체를 합친 조회
 */
@RestController
@RequestMapping("/api/v1/aggregated")
@RequiredArgsConstructor
public class AggregatedController {

    private static final Logger log = LoggerFactory.getLogger(AggregatedController.class);

    static final String KIND = "/{kind:" + ResourceKind.PATH_REGEX + "}";

    private final AggregationService aggregationService;

    @GetMapping(KIND)
    public BaseResponse<ResourceList<HasMetadata>> list(
        @PathVariable String kind,
        DataSelectQuery query
    ) {
        log.info("Listing aggregated {}", kind);
        return BaseResponse.success(aggregationService.list(
            SecurityUtils.currentUsername(), ResourceKind.fromPath(kind), null, query));
    }

    @GetMapping(KIND + "/{namespace}")
    public BaseResponse<ResourceList<HasMetadata>> listInNamespace(
        @PathVariable String kind,
        @PathVariable String namespace,
        DataSelectQuery query
    ) {
        log.info("Listing aggregated {} in namespace: {}", kind, namespace);
        return BaseResponse.success(aggregationService.list(
            SecurityUtils.currentUsername(), ResourceKind.fromPath(kind), namespace, query));
    }

    // ========== Custom Resource ==========

    @GetMapping("/customresource/definition")
    public BaseResponse<Object> listDefinitions(@RequestParam(required = false) String groupBy) {
        log.info("Listing aggregated custom resource definitions");
        return BaseResponse.success(aggregationService.listDefinitions(SecurityUtils.currentUsername(), groupBy));
    }

    @GetMapping("/customresource/resource")
    public BaseResponse<ItemList<GenericKubernetesResource>> listResources(
        @RequestParam(required = false) String group,
        @RequestParam(required = false) String crd
    ) {
        log.info("Listing aggregated custom resources: {}/{}", group, crd);
        return BaseResponse.success(aggregationService.listResources(SecurityUtils.currentUsername(), group, crd));
    }

    @GetMapping("/customresource/apiVersion")
    public BaseResponse<ItemList<ApiVersionInfo>> apiVersions() {
        log.info("Listing aggregated API versions");
        return BaseResponse.success(aggregationService.apiVersions(SecurityUtils.currentUsername()));
    }
}
