package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import com.vibecoding.karmadadashboard.model.pkg.PackageResourceList;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class PackageServiceTest {

    private static final GroupVersionResource REPOSITORY = GroupVersionResource.PORCH_REPOSITORY;

    KubernetesClient client;

    private PackageService service;

    @BeforeEach
    void setUp() {
        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getManagementClient()).thenReturn(client);
        service = new PackageService(clusterClientService);
    }

    private static GenericKubernetesResource repository(String name, String namespace) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setMetadata(new ObjectMetaBuilder().withName(name).withNamespace(namespace).build());
        resource.setAdditionalProperty("spec", Map.of("type", "git", "git", Map.of("repo", "https://example.com/" + name)));
        return resource;
    }

    @Test
    void createFillsTypeAndForcesDefaultNamespace() {
        GenericKubernetesResource created = service.create(REPOSITORY, repository("blueprints", "other"));

        assertEquals("config.porch.kpt.dev/v1alpha1", created.getApiVersion());
        assertEquals("Repository", created.getKind());
        assertEquals("default", created.getMetadata().getNamespace());
    }

    @Test
    void listReturnsItemsWithTotal() {
        service.create(REPOSITORY, repository("blueprints", null));
        service.create(REPOSITORY, repository("deployments", null));

        PackageResourceList list = service.list(REPOSITORY);

        assertEquals(2, list.getTotalResources());
        assertEquals(2, list.getResources().size());
    }

    @Test
    void getMissingIsNotFound() {
        assertThrows(K8sResourceNotFoundException.class, () -> service.get(REPOSITORY, "ghost"));
    }

    @Test
    void updateRejectsMismatchedName() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.update(REPOSITORY, "blueprints", repository("other", null)));

        assertEquals("repository name in URL does not match name in request body", ex.getMessage());
    }

    @Test
    void updateReplacesSpec() {
        service.create(REPOSITORY, repository("blueprints", null));
        GenericKubernetesResource current = service.get(REPOSITORY, "blueprints");
        current.setAdditionalProperty("spec", Map.of("type", "oci"));

        service.update(REPOSITORY, "blueprints", current);

        Object spec = service.get(REPOSITORY, "blueprints").getAdditionalProperties().get("spec");
        assertEquals("oci", ((Map<?, ?>) spec).get("type"));
    }

    @Test
    void deleteReportsKindAndName() {
        service.create(REPOSITORY, repository("blueprints", null));

        Map<String, String> result = service.delete(REPOSITORY, "blueprints");

        assertEquals("Repository 'blueprints' deleted successfully", result.get("message"));
        assertThrows(K8sResourceNotFoundException.class, () -> service.get(REPOSITORY, "blueprints"));
    }

    @Test
    void blankNameIsRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.get(GroupVersionResource.PORCH_PACKAGE_REV, ""));

        assertEquals("packagerev name is required", ex.getMessage());
    }
}
