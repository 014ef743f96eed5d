package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.cluster.ClusterDetail;
import com.vibecoding.karmadadashboard.model.cluster.ClusterList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUserList;
import com.vibecoding.karmadadashboard.model.cluster.ClusterUsersRequest;
import com.vibecoding.karmadadashboard.model.cluster.PostClusterRequest;
import com.vibecoding.karmadadashboard.model.cluster.PutClusterRequest;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.ClusterService;
import com.vibecoding.karmadadashboard.service.ClusterUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Karmada 멤버 클러스터 관리
 */
@RestController
@RequestMapping("/api/v1/cluster")
@RequiredArgsConstructor
public class ClusterController {

    private static final Logger log = LoggerFactory.getLogger(ClusterController.class);

    private final ClusterService clusterService;
    private final ClusterUserService clusterUserService;

    @GetMapping
    public BaseResponse<ClusterList> listClusters(DataSelectQuery query) {
        log.info("Listing clusters");
        return BaseResponse.success(clusterService.listClusters(SecurityUtils.currentUsername(), query));
    }

    @GetMapping("/{name}")
    public BaseResponse<ClusterDetail> getCluster(@PathVariable String name) {
        log.info("Getting cluster detail: {}", name);
        return BaseResponse.success(clusterService.getClusterDetail(name));
    }

    @PostMapping
    public BaseResponse<String> joinCluster(@Valid @RequestBody PostClusterRequest request) {
        log.info("Joining cluster: {} ({})", request.getMemberClusterName(), request.getSyncMode());
        clusterService.joinCluster(request, SecurityUtils.currentUsername());
        return BaseResponse.success("ok");
    }

    @PutMapping("/{name}")
    public BaseResponse<String> updateCluster(
        @PathVariable String name,
        @RequestBody PutClusterRequest request
    ) {
        log.info("Updating cluster: {}", name);
        clusterService.updateCluster(name, request);
        return BaseResponse.success("ok");
    }

    @DeleteMapping("/{name}")
    public BaseResponse<String> deleteCluster(@PathVariable String name) {
        log.info("Deleting cluster: {}", name);
        clusterService.deleteCluster(name);
        return BaseResponse.success("ok");
    }

    // ========== Cluster Users ==========

    @GetMapping("/{name}/users")
    public BaseResponse<ClusterUserList> getClusterUsers(@PathVariable String name) {
        log.info("Listing users of cluster: {}", name);
        return BaseResponse.success(clusterUserService.getClusterUsers(SecurityUtils.currentUsername(), name));
    }

    @PutMapping("/{name}/users")
    public BaseResponse<ClusterUserList> updateClusterUsers(
        @PathVariable String name,
        @RequestBody(required = false) ClusterUsersRequest request
    ) {
        log.info("Updating users of cluster: {}", name);
        return BaseResponse.success(
            clusterUserService.updateClusterUsers(SecurityUtils.currentUsername(), name, request));
    }
}
