package com.vibecoding.karmadadashboard.model;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * group / version / plural 로 식별되는 API 리소스 (CRD 포함)
 */
@Getter
@EqualsAndHashCode
public final class GroupVersionResource {

    public static final GroupVersionResource CLUSTER =
        new GroupVersionResource("cluster.karmada.io", "v1alpha1", "clusters", "Cluster", false);
    public static final GroupVersionResource PROPAGATION_POLICY =
        new GroupVersionResource("policy.karmada.io", "v1alpha1", "propagationpolicies", "PropagationPolicy", true);
    public static final GroupVersionResource CLUSTER_PROPAGATION_POLICY =
        new GroupVersionResource("policy.karmada.io", "v1alpha1", "clusterpropagationpolicies", "ClusterPropagationPolicy", false);
    public static final GroupVersionResource OVERRIDE_POLICY =
        new GroupVersionResource("policy.karmada.io", "v1alpha1", "overridepolicies", "OverridePolicy", true);
    public static final GroupVersionResource CLUSTER_OVERRIDE_POLICY =
        new GroupVersionResource("policy.karmada.io", "v1alpha1", "clusteroverridepolicies", "ClusterOverridePolicy", false);
    public static final GroupVersionResource FEDERATED_RESOURCE_QUOTA =
        new GroupVersionResource("policy.karmada.io", "v1alpha1", "federatedresourcequotas", "FederatedResourceQuota", true);
    public static final GroupVersionResource RESOURCE_BINDING =
        new GroupVersionResource("work.karmada.io", "v1alpha2", "resourcebindings", "ResourceBinding", true);
    public static final GroupVersionResource CLUSTER_RESOURCE_BINDING =
        new GroupVersionResource("work.karmada.io", "v1alpha2", "clusterresourcebindings", "ClusterResourceBinding", false);
    public static final GroupVersionResource CUSTOM_RESOURCE_DEFINITION =
        new GroupVersionResource("apiextensions.k8s.io", "v1", "customresourcedefinitions", "CustomResourceDefinition", false);
    public static final GroupVersionResource PORCH_REPOSITORY =
        new GroupVersionResource("config.porch.kpt.dev", "v1alpha1", "repositories", "Repository", true);
    public static final GroupVersionResource PORCH_PACKAGE_REV =
        new GroupVersionResource("config.porch.kpt.dev", "v1alpha1", "packagerevs", "PackageRev", true);

    private final String group;
    private final String version;
    private final String plural;
    private final String kind;
    private final boolean namespaced;

    public GroupVersionResource(String group, String version, String plural, String kind, boolean namespaced) {
        this.group = group;
        this.version = version;
        this.plural = plural;
        this.kind = kind;
        this.namespaced = namespaced;
    }

    /**
     * 코어 그룹이면 "v1", 아니면 "group/version"
     */
    public String getApiVersion() {
        return group == null || group.isEmpty() ? version : group + "/" + version;
    }

    public ResourceDefinitionContext toContext() {
        return new ResourceDefinitionContext.Builder()
            .withGroup(group)
            .withVersion(version)
            .withPlural(plural)
            .withKind(kind)
            .withNamespaced(namespaced)
            .build();
    }

    @Override
    public String toString() {
        return (group == null || group.isEmpty() ? "core" : group) + "/" + version + "/" + plural;
    }
}
