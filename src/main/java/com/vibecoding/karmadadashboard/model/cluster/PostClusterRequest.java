package com.vibecoding.karmadadashboard.model.cluster;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 멤버 클러스터 join 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostClusterRequest {
    @NotBlank
    private String memberClusterName;
    @NotBlank
    private String memberClusterKubeConfig;
    @NotBlank
    private String syncMode;
    private String memberClusterEndpoint;
    private String memberClusterNamespace;
}
