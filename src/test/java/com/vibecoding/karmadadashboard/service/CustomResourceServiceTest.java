package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.crd.ApiVersionInfo;
import com.vibecoding.karmadadashboard.model.crd.CrdGroupList;
import com.vibecoding.karmadadashboard.model.crd.ItemList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class CustomResourceServiceTest {

    KubernetesClient client;

    private CustomResourceService service;

    @BeforeEach
    void setUp() {
        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getClient(any())).thenReturn(client);
        service = new CustomResourceService(clusterClientService);
    }

    static GenericKubernetesResource crd(String group, String plural, String kind, String scope, String... versions) {
        List<Map<String, Object>> versionList = new ArrayList<>();
        for (String version : versions) {
            versionList.add(Map.of("name", version, "served", true, "storage", true));
        }
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion("apiextensions.k8s.io/v1");
        resource.setKind("CustomResourceDefinition");
        resource.setMetadata(new ObjectMetaBuilder().withName(plural + "." + group).build());
        resource.setAdditionalProperty("spec", Map.of(
            "group", group,
            "scope", scope,
            "names", Map.of("plural", plural, "kind", kind),
            "versions", versionList));
        resource.setAdditionalProperty("status", Map.of("acceptedNames", Map.of("plural", plural, "kind", kind)));
        return resource;
    }

    private void createCrd(GenericKubernetesResource crd) {
        client.genericKubernetesResources(GroupVersionResource.CUSTOM_RESOURCE_DEFINITION.toContext())
            .resource(crd).create();
    }

    @Test
    void summarizeKeepsGroupScopeAndAcceptedNames() {
        GenericKubernetesResource summary = CustomResourceService.summarize(
            crd("example.com", "widgets", "Widget", "Namespaced", "v1"), "member1");

        Map<String, Object> root = summary.getAdditionalProperties();
        assertEquals(Map.of("group", "example.com", "scope", "Namespaced"), root.get("spec"));
        assertTrue(root.containsKey("acceptedNames"));
        assertFalse(root.containsKey("status"));
        assertEquals("member1", summary.getMetadata().getLabels().get("cluster"));
        assertEquals("example.com", summary.getMetadata().getLabels().get("group"));
    }

    @Test
    void groupsByApiGroupThenCluster() {
        List<GenericKubernetesResource> crds = List.of(
            CustomResourceService.summarize(crd("b.io", "things", "Thing", "Namespaced", "v1"), "member1"),
            CustomResourceService.summarize(crd("a.io", "widgets", "Widget", "Namespaced", "v1"), "member2"),
            CustomResourceService.summarize(crd("a.io", "gadgets", "Gadget", "Cluster", "v1"), "member2"),
            CustomResourceService.summarize(crd("a.io", "widgets", "Widget", "Namespaced", "v1"), "member1"));

        CrdGroupList grouped = CustomResourceService.group(crds);

        assertEquals(4, grouped.getTotalItems());
        assertEquals(3, grouped.getGroups().size());
        assertEquals("a.io", grouped.getGroups().get(0).getGroup());
        assertEquals("member1", grouped.getGroups().get(0).getCluster());
        assertEquals("member2", grouped.getGroups().get(1).getCluster());
        assertEquals(2, grouped.getGroups().get(1).getCount());
        assertEquals("b.io", grouped.getGroups().get(2).getGroup());
    }

    @Test
    void instanceResourceUsesFirstVersion() {
        GroupVersionResource gvr = CustomResourceService.instanceResource(
            crd("example.com", "gadgets", "Gadget", "Cluster", "v2", "v1"), "example.com");

        assertEquals("example.com/v2", gvr.getApiVersion());
        assertEquals("gadgets", gvr.getPlural());
        assertFalse(gvr.isNamespaced());
    }

    @Test
    void definitionWithoutVersionsIsRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> CustomResourceService.instanceResource(crd("example.com", "gadgets", "Gadget", "Cluster"), "example.com"));
        assertEquals("no versions found in CRD", ex.getMessage());
    }

    @Test
    void listsInstancesAcrossNamespaces() {
        createCrd(crd("example.com", "widgets", "Widget", "Namespaced", "v1"));
        GroupVersionResource widgets = new GroupVersionResource("example.com", "v1", "widgets", "Widget", true);
        for (String namespace : List.of("team-a", "team-b")) {
            GenericKubernetesResource widget = new GenericKubernetesResource();
            widget.setApiVersion("example.com/v1");
            widget.setKind("Widget");
            widget.setMetadata(new ObjectMetaBuilder().withName("w").withNamespace(namespace).build());
            client.genericKubernetesResources(widgets.toContext()).inNamespace(namespace).resource(widget).create();
        }

        ItemList<GenericKubernetesResource> items =
            service.listResources(ClusterTarget.member("member1"), "example.com", "widgets.example.com");

        assertEquals(2, items.getTotalItems());
    }

    @Test
    void missingDefinitionIsNotFound() {
        assertThrows(K8sResourceNotFoundException.class,
            () -> service.listResources(ClusterTarget.karmada(), "example.com", "ghosts.example.com"));
    }

    @Test
    void listingRequiresGroupAndCrd() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.listResources(ClusterTarget.karmada(), "", "widgets.example.com"));
        assertEquals("group and crd query parameters are required", ex.getMessage());
    }

    @Test
    void apiVersionsAreSortedPerGroup() {
        createCrd(crd("example.com", "widgets", "Widget", "Namespaced", "v2", "v1"));

        List<ApiVersionInfo> versions = service.apiVersions(client, "member1");

        assertEquals(1, versions.size());
        assertEquals(List.of("v1", "v2"), versions.get(0).getVersions());
        assertEquals("member1", versions.get(0).getCluster());
    }

    @Test
    void definitionDetailCarriesClusterLabel() {
        createCrd(crd("example.com", "widgets", "Widget", "Namespaced", "v1"));

        GenericKubernetesResource detail =
            service.getDefinition(ClusterTarget.member("member1"), "widgets.example.com").getCrd();

        assertEquals("member1", detail.getMetadata().getLabels().get("cluster"));
        assertNull(detail.getMetadata().getManagedFields());
    }
}
