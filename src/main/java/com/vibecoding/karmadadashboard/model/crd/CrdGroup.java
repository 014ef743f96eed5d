package com.vibecoding.karmadadashboard.model.crd;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 클러스터 하나의 같은 API 그룹에 속한 CRD 묶음
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrdGroup {
    private String group;
    private String cluster;
    private List<GenericKubernetesResource> crds;
    private int count;
}
