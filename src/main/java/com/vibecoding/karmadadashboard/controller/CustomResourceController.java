package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.crd.CrdDetail;
import com.vibecoding.karmadadashboard.model.crd.ItemList;
import com.vibecoding.karmadadashboard.service.CustomResourceService;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * CRD 와 CRD 인스턴스 (Karmada / 관리 / 멤버 클러스터)
 */
@RestController
@RequiredArgsConstructor
public class CustomResourceController {

    private static final Logger log = LoggerFactory.getLogger(CustomResourceController.class);

    static final String KARMADA = "/api/v1/customresource";
    static final String MGMT = "/api/v1/mgmt/customresource";
    static final String MEMBER = "/api/v1/member/{clustername}/customresource";

    private final CustomResourceService customResourceService;

    @GetMapping({KARMADA + "/definition", MGMT + "/definition", MEMBER + "/definition"})
    public BaseResponse<Object> listDefinitions(
        ClusterTarget target,
        @RequestParam(required = false) String groupBy
    ) {
        log.info("Listing custom resource definitions in cluster: {}", target);
        return BaseResponse.success(customResourceService.listDefinitions(target, groupBy));
    }

    @GetMapping({KARMADA + "/definition/{crdName}", MGMT + "/definition/{crdName}", MEMBER + "/definition/{crdName}"})
    public BaseResponse<CrdDetail> getDefinition(
        ClusterTarget target,
        @PathVariable String crdName
    ) {
        log.info("Getting custom resource definition: {}/{}", target, crdName);
        return BaseResponse.success(customResourceService.getDefinition(target, crdName));
    }

    @PutMapping({KARMADA + "/definition/{crdName}", MGMT + "/definition/{crdName}", MEMBER + "/definition/{crdName}"})
    public BaseResponse<CrdDetail> updateDefinition(
        ClusterTarget target,
        @PathVariable String crdName,
        @RequestBody GenericKubernetesResource body
    ) {
        log.info("Updating custom resource definition: {}/{}", target, crdName);
        return BaseResponse.success(customResourceService.updateDefinition(target, crdName, body));
    }

    @GetMapping({KARMADA + "/resource", MGMT + "/resource", MEMBER + "/resource"})
    public BaseResponse<ItemList<GenericKubernetesResource>> listResources(
        ClusterTarget target,
        @RequestParam(required = false) String group,
        @RequestParam(required = false) String crd
    ) {
        log.info("Listing custom resources {}/{} in cluster: {}", group, crd, target);
        return BaseResponse.success(customResourceService.listResources(target, group, crd));
    }
}
