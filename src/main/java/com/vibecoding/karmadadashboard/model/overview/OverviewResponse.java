package com.vibecoding.karmadadashboard.model.overview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewResponse {
    private KarmadaInfo karmadaInfo;
    private MemberClusterStatus memberClusterStatus;
    private ClusterResourceStatus clusterResourceStatus;
    private List<MetricsDashboard> metricsDashboards;
}
