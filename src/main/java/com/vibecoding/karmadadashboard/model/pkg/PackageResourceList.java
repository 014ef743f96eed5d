package com.vibecoding.karmadadashboard.model.pkg;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PackageResourceList {
    private List<GenericKubernetesResource> resources;
    private int totalResources;
}
