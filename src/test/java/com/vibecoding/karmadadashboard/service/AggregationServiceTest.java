package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.ResourceKind;
import com.vibecoding.karmadadashboard.model.ResourceList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class AggregationServiceTest {

    KubernetesClient client;

    private AggregationService service;

    private static GenericKubernetesResource cluster(String name, boolean ready) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion("cluster.karmada.io/v1alpha1");
        resource.setKind("Cluster");
        resource.setMetadata(new ObjectMetaBuilder().withName(name).build());
        resource.setAdditionalProperty("status", Map.of(
            "conditions", List.of(Map.of("type", "Ready", "status", ready ? "True" : "False"))));
        return resource;
    }

    @BeforeEach
    void setUp() {
        ClusterService clusterService = mock(ClusterService.class);
        when(clusterService.visibleClusters("alice")).thenReturn(List.of(
            cluster("member1", true),
            cluster("member2", false),
            cluster("broken", true),
            cluster("mgmt-cluster", true)));

        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getMemberClient("member1")).thenReturn(client);
        when(clusterClientService.getMemberClient("broken")).thenThrow(new KubernetesClientException("connection refused"));

        service = new AggregationService(clusterService, clusterClientService,
            new ResourceService(clusterClientService), new CustomResourceService(clusterClientService));
    }

    @Test
    void onlyReadyMemberClustersAreQueried() {
        assertEquals(List.of("member1", "broken"), service.readyClusterNames("alice"));
    }

    @Test
    void mergesItemsAndSkipsFailingClusters() {
        client.apps().deployments().inNamespace("default").resource(new DeploymentBuilder()
            .withNewMetadata().withName("web").withNamespace("default").endMetadata()
            .build()).create();

        ResourceList<HasMetadata> list = service.list("alice", ResourceKind.DEPLOYMENT, null, DataSelectQuery.NONE);

        assertEquals(1, list.getListMeta().getTotalItems());
        HasMetadata item = list.getItems().get(0);
        assertEquals("web", item.getMetadata().getName());
        assertEquals("member1", item.getMetadata().getLabels().get("cluster"));
    }

    @Test
    void groupAndCrdAreRequired() {
        assertThrows(BadRequestException.class, () -> service.listResources("alice", "", "widgets"));
    }
}
