package com.vibecoding.karmadadashboard.model;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deployment 상세 + selector 에 매칭되는 Pod 목록
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentDetail {
    private Deployment deployment;
    private ResourceList<Pod> podList;
}
