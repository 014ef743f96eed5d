package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.GroupVersionResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
class UnstructuredResourceServiceTest {

    KubernetesClient client;

    private UnstructuredResourceService service;

    @BeforeEach
    void setUp() {
        ClusterClientService clusterClientService = mock(ClusterClientService.class);
        when(clusterClientService.getClient(any())).thenReturn(client);
        service = new UnstructuredResourceService(clusterClientService);
    }

    private static GenericKubernetesResource configMap(String name, String namespace, String value) {
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion("v1");
        resource.setKind("ConfigMap");
        resource.setMetadata(new ObjectMetaBuilder().withName(name).withNamespace(namespace).build());
        resource.setAdditionalProperty("data", Map.of("key", value));
        return resource;
    }

    @Test
    void resolvesKnownKinds() {
        GroupVersionResource deployment = UnstructuredResourceService.resolve("Deployment");
        assertEquals("apps/v1", deployment.getApiVersion());
        assertEquals("deployments", deployment.getPlural());
        assertTrue(deployment.isNamespaced());

        assertEquals(GroupVersionResource.PROPAGATION_POLICY, UnstructuredResourceService.resolve("propagationpolicy"));
        assertFalse(UnstructuredResourceService.resolve("cluster").isNamespaced());
        assertFalse(UnstructuredResourceService.resolve("namespace").isNamespaced());
    }

    @Test
    void resolvesUnknownKindsByConvention() {
        GroupVersionResource plain = UnstructuredResourceService.resolve("widget");
        assertEquals("v1", plain.getApiVersion());
        assertEquals("widgets", plain.getPlural());

        GroupVersionResource grouped = UnstructuredResourceService.resolve("example.com.gadget");
        assertEquals("example.com", grouped.getGroup());
        assertEquals("gadgets", grouped.getPlural());
    }

    @Test
    void validationSkipsNamespaceForClusterScopedKinds() {
        assertDoesNotThrow(() -> UnstructuredResourceService.validate("node", null, "worker-1"));

        BadRequestException missingNamespace = assertThrows(BadRequestException.class,
            () -> UnstructuredResourceService.validate("deployment", "", "web"));
        assertEquals("namespace is required", missingNamespace.getMessage());

        BadRequestException missingName = assertThrows(BadRequestException.class,
            () -> UnstructuredResourceService.validate("node", null, " "));
        assertEquals("name is required", missingName.getMessage());
    }

    @Test
    void createGetUpdateDelete() {
        ClusterTarget target = ClusterTarget.karmada();
        service.create(target, "configmap", "apps", configMap("settings", "apps", "one"));

        GenericKubernetesResource current = service.get(target, "configmap", "apps", "settings");
        assertEquals("one", ((Map<?, ?>) current.getAdditionalProperties().get("data")).get("key"));

        current.setAdditionalProperty("data", Map.of("key", "two"));
        service.update(target, "configmap", "apps", "settings", current);
        GenericKubernetesResource updated = service.get(target, "configmap", "apps", "settings");
        assertEquals("two", ((Map<?, ?>) updated.getAdditionalProperties().get("data")).get("key"));

        assertEquals(Map.of("status", "success"), service.delete(target, "configmap", "apps", "settings"));
        assertThrows(K8sResourceNotFoundException.class, () -> service.get(target, "configmap", "apps", "settings"));
    }

    @Test
    void createNamespacedWithoutNamespaceIsRejected() {
        BadRequestException ex = assertThrows(BadRequestException.class,
            () -> service.create(ClusterTarget.karmada(), "configmap", null, configMap("x", null, "v")));
        assertEquals("Namespace is required for namespaced resources", ex.getMessage());
    }
}
