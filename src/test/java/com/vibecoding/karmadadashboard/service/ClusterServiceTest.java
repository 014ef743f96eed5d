package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.fga.InMemoryRelationshipAuthorizer;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.cluster.ClusterDetail;
import com.vibecoding.karmadadashboard.model.cluster.ClusterList;
import com.vibecoding.karmadadashboard.model.cluster.PostClusterRequest;
import com.vibecoding.karmadadashboard.model.cluster.PutClusterRequest;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class ClusterServiceTest {

    private static final String KUBECONFIG = "apiVersion: v1\n"
        + "kind: Config\n"
        + "clusters:\n"
        + "- name: member\n"
        + "  cluster:\n"
        + "    server: https://10.0.0.1:6443\n"
        + "users:\n"
        + "- name: member-admin\n"
        + "  user:\n"
        + "    token: abc\n"
        + "contexts:\n"
        + "- name: member\n"
        + "  context:\n"
        + "    cluster: member\n"
        + "    user: member-admin\n"
        + "current-context: member\n";

    KubernetesClient client;

    private ClusterClientService clusterClientService;
    private InMemoryRelationshipAuthorizer authorizer;
    private ClusterService service;

    @BeforeEach
    void setUp() {
        clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getKarmadaClient()).thenReturn(client);
        authorizer = new InMemoryRelationshipAuthorizer();
        service = new ClusterService(clusterClientService, new AuthorizationService(authorizer));
        service.setDeletePolling(Duration.ofMillis(10), Duration.ofSeconds(2));
    }

    private void createCluster(String name) {
        GenericKubernetesResource cluster = new GenericKubernetesResource();
        cluster.setApiVersion("cluster.karmada.io/v1alpha1");
        cluster.setKind("Cluster");
        cluster.setMetadata(new ObjectMetaBuilder().withName(name).build());
        cluster.setAdditionalProperty("spec", Map.of("syncMode", "Push", "apiEndpoint", "https://" + name));
        client.genericKubernetesResources(GroupVersionResource.CLUSTER.toContext()).resource(cluster).create();
    }

    private static List<String> names(ClusterList list) {
        return list.getClusters().stream()
            .map(c -> c.getObjectMeta().getName())
            .collect(Collectors.toList());
    }

    @Test
    void adminSeesManagementClusterFirst() {
        createCluster("member1");
        authorizer.writeTuple("admin", "admin", "dashboard", "dashboard");

        ClusterList list = service.listClusters("admin", DataSelectQuery.NONE);

        assertEquals(List.of("member1", "mgmt-cluster"), names(list));
        assertEquals(2, list.getListMeta().getTotalItems());
    }

    @Test
    void regularUserSeesOnlyRelatedClusters() {
        createCluster("member1");
        createCluster("member2");
        createCluster("member3");
        authorizer.writeTuple("bob", "owner", "cluster", "member1");
        authorizer.writeTuple("bob", "member", "cluster", "member3");

        ClusterList list = service.listClusters("bob", DataSelectQuery.NONE);

        assertEquals(List.of("member1", "member3"), names(list));
    }

    @Test
    void anonymousListGetsEverything() {
        createCluster("member1");
        createCluster("member2");

        assertEquals(2, service.listClusters(null, DataSelectQuery.NONE).getClusters().size());
    }

    @Test
    void missingClusterIsNotFound() {
        assertThrows(K8sResourceNotFoundException.class, () -> service.getClusterDetail("ghost"));
    }

    @Test
    void joinStoresSecretClusterAndOwnerTuple() {
        PostClusterRequest request = PostClusterRequest.builder()
            .memberClusterName("member9")
            .memberClusterKubeConfig(KUBECONFIG)
            .syncMode("Push")
            .build();

        service.joinCluster(request, "carol");

        Secret secret = client.secrets().inNamespace("karmada-cluster").withName("member9").get();
        assertNotNull(secret);
        GenericKubernetesResource cluster = service.getClusterResource("member9");
        Map<?, ?> spec = (Map<?, ?>) cluster.getAdditionalProperties().get("spec");
        assertTrue(spec.get("apiEndpoint").toString().startsWith("https://10.0.0.1:6443"));
        assertEquals(Map.of("namespace", "karmada-cluster", "name", "member9"), spec.get("secretRef"));
        assertTrue(authorizer.check("carol", "owner", "cluster", "member9"));
    }

    @Test
    void pullModeIsRejected() {
        PostClusterRequest request = PostClusterRequest.builder()
            .memberClusterName("member9")
            .memberClusterKubeConfig(KUBECONFIG)
            .syncMode("Pull")
            .build();

        BadRequestException ex = assertThrows(BadRequestException.class, () -> service.joinCluster(request, null));
        assertEquals("pull mode is not supported", ex.getMessage());
    }

    @Test
    void updateReplacesLabelsAndTaints() {
        createCluster("member1");
        PutClusterRequest request = new PutClusterRequest(
            List.of(new PutClusterRequest.LabelItem("region", "eu")),
            List.of(new PutClusterRequest.TaintItem("dedicated", "gpu", "NoSchedule")));

        service.updateCluster("member1", request);

        ClusterDetail detail = service.getClusterDetail("member1");
        assertEquals(Map.of("region", "eu"), detail.getObjectMeta().getLabels());
        assertEquals(1, detail.getTaints().size());
        assertEquals("NoSchedule", detail.getTaints().get(0).getEffect());
        assertEquals("Push", detail.getSyncMode());
    }

    @Test
    void deleteRemovesClusterAndEvictsClient() {
        createCluster("member1");

        service.deleteCluster("member1");

        assertNull(client.genericKubernetesResources(GroupVersionResource.CLUSTER.toContext()).withName("member1").get());
        verify(clusterClientService).evictMemberClient("member1");
    }

    @Test
    void deletingUnknownClusterIsNotFound() {
        K8sResourceNotFoundException ex = assertThrows(K8sResourceNotFoundException.class,
            () -> service.deleteCluster("ghost"));
        assertEquals("no cluster object ghost found in karmada control Plane", ex.getMessage());
    }
}
