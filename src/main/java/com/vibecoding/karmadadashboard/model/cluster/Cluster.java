package com.vibecoding.karmadadashboard.model.cluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Karmada Cluster 요약
 */
@Data
@NoArgsConstructor
public class Cluster {
    private ObjectMeta objectMeta;
    private TypeMeta typeMeta;
    private String ready;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String kubernetesVersion;
    private String syncMode;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private NodeSummary nodeSummary;
    private ClusterAllocatedResources allocatedResources;
}
