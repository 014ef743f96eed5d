package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.overview.GpuSummary;
import com.vibecoding.karmadadashboard.model.overview.MemberOverviewResponse;
import com.vibecoding.karmadadashboard.model.overview.MetricsDashboard;
import com.vibecoding.karmadadashboard.model.overview.OverviewResponse;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.DashboardConfigService;
import com.vibecoding.karmadadashboard.service.OverviewService;
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

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class OverviewController {

    private static final Logger log = LoggerFactory.getLogger(OverviewController.class);

    private final OverviewService overviewService;
    private final DashboardConfigService dashboardConfigService;

    @GetMapping("/api/v1/overview")
    public BaseResponse<OverviewResponse> overview() {
        log.info("Building karmada overview");
        return BaseResponse.success(overviewService.getOverview());
    }

    @GetMapping("/api/v1/overview/gpu")
    public BaseResponse<GpuSummary> gpu() {
        return BaseResponse.success(overviewService.getGpuSummary(SecurityUtils.currentUsername()));
    }

    @GetMapping("/api/v1/member/{clustername}/overview/gpu")
    public BaseResponse<GpuSummary> memberGpu(@PathVariable String clustername) {
        return BaseResponse.success(overviewService.getMemberGpuSummary(clustername));
    }

    @GetMapping("/api/v1/member/{clustername}/overview")
    public BaseResponse<MemberOverviewResponse> memberOverview(@PathVariable String clustername) {
        return BaseResponse.success(overviewService.getMemberOverview(clustername));
    }

    @GetMapping("/api/v1/mgmt/overview")
    public BaseResponse<MemberOverviewResponse> mgmtOverview() {
        return BaseResponse.success(overviewService.getMgmtOverview());
    }

    // ========== Monitoring Dashboard ==========

    @PostMapping("/api/v1/overview/monitoring/dashboard")
    public BaseResponse<Map<String, String>> saveDashboard(@RequestBody(required = false) MetricsDashboard dashboard) {
        dashboardConfigService.addMetricsDashboard(dashboard != null ? dashboard : new MetricsDashboard());
        return BaseResponse.success(Map.of("message", "Dashboard saved successfully"));
    }

    @DeleteMapping("/api/v1/overview/monitoring/dashboard/{name}")
    public BaseResponse<Map<String, String>> deleteDashboard(
        @PathVariable String name,
        @RequestParam(required = false) String url
    ) {
        dashboardConfigService.deleteMetricsDashboard(name, url);
        return BaseResponse.success(Map.of("message", "Dashboard deleted successfully"));
    }
}
