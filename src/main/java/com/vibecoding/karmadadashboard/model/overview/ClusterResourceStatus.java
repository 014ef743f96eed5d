package com.vibecoding.karmadadashboard.model.overview;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Karmada 컨트롤 플레인의 리소스 개수
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterResourceStatus {
    private int propagationPolicyNum;
    private int overridePolicyNum;
    private int namespaceNum;
    private int workloadNum;
    private int serviceNum;
    private int configNum;
}
