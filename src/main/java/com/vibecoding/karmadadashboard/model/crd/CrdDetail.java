package com.vibecoding.karmadadashboard.model.crd;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CrdDetail {
    private GenericKubernetesResource crd;
}
