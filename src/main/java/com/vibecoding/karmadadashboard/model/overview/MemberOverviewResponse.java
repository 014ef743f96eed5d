package com.vibecoding.karmadadashboard.model.overview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 멤버 / 관리 클러스터 하나의 개요
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberOverviewResponse {
    private KarmadaInfo karmadaInfo;
    private String clusterName;
    private int deploymentCount;
    private int namespaceCount;
    private MemberClusterStatus memberClusterStatus;
    private List<MetricsDashboard> metricsDashboards;
}
