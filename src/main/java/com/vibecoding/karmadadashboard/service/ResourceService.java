package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.K8sApiException;
import com.vibecoding.karmadadashboard.exception.K8sResourceNotFoundException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.model.DataSelectQuery;
import com.vibecoding.karmadadashboard.model.DeploymentDetail;
import com.vibecoding.karmadadashboard.model.NamespaceRequest;
import com.vibecoding.karmadadashboard.model.PodLogs;
import com.vibecoding.karmadadashboard.model.ResourceKind;
import com.vibecoding.karmadadashboard.model.ResourceList;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ContainerResource;
import io.fabric8.kubernetes.client.dsl.TimeTailPrettyLoggable;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Karmada / 관리 / 멤버 클러스터의 네이티브 리소스 조회 서비스
 */
@Service
@RequiredArgsConstructor
public class ResourceService {

    private static final Logger log = LoggerFactory.getLogger(ResourceService.class);

    static final int MAX_EVENTS = 20;
    static final String SKIP_AUTO_PROPAGATION_LABEL = "namespace.karmada.io/skip-auto-propagation";

    private final ClusterClientService clusterClientService;

    // ========== List / Get ==========

    public ResourceList<HasMetadata> list(ClusterTarget target, ResourceKind kind, String namespace,
                                          DataSelectQuery query) {
        List<HasMetadata> items = listItems(clusterClientService.getClient(target), kind, namespace);
        return ResourceList.of(kind.getListField(), query.apply(items, HasMetadata::getMetadata));
    }

    /**
     * 시스템 네임스페이스(kube-*, karmada-*) 제외 옵션이 있는 네임스페이스 목록
     */
    public ResourceList<HasMetadata> listNamespaces(ClusterTarget target, DataSelectQuery query, boolean excludeSystem) {
        List<HasMetadata> items = listItems(clusterClientService.getClient(target), ResourceKind.NAMESPACE, null);
        if (excludeSystem) {
            items = items.stream()
                .filter(ns -> !isSystemNamespace(ns.getMetadata().getName()))
                .collect(Collectors.toList());
        }
        return ResourceList.of(ResourceKind.NAMESPACE.getListField(), query.apply(items, HasMetadata::getMetadata));
    }

    /**
     * 주어진 클라이언트로 리소스를 조회 (namespace 가 비어 있으면 전체 네임스페이스)
     */
    public List<HasMetadata> listItems(KubernetesClient client, ResourceKind kind, String namespace) {
        try {
            List<? extends HasMetadata> items;
            if (!kind.isNamespaced()) {
                items = client.resources(kind.getType()).list().getItems();
            } else if (namespace == null || namespace.isBlank()) {
                items = client.resources(kind.getType()).inAnyNamespace().list().getItems();
            } else {
                items = client.resources(kind.getType()).inNamespace(namespace).list().getItems();
            }
            return new ArrayList<>(items);
        } catch (KubernetesClientException e) {
            log.error("Failed to list {} in namespace: {}", kind.getPath(), namespace, e);
            throw new K8sApiException("Failed to list " + kind.getPath(), e);
        }
    }

    public HasMetadata get(ClusterTarget target, ResourceKind kind, String namespace, String name) {
        KubernetesClient client = clusterClientService.getClient(target);
        HasMetadata resource;
        try {
            if (kind.isNamespaced()) {
                resource = client.resources(kind.getType()).inNamespace(namespace).withName(name).get();
            } else {
                resource = client.resources(kind.getType()).withName(name).get();
            }
        } catch (KubernetesClientException e) {
            log.error("Failed to get {}: {}/{}/{}", kind.getPath(), target, namespace, name, e);
            throw new K8sApiException("Failed to get " + kind.getPath(), e);
        }
        if (resource == null) {
            throw new K8sResourceNotFoundException(kind.getKind(), kind.isNamespaced() ? namespace : null, name);
        }
        return resource;
    }

    // ========== Deployment ==========

    public DeploymentDetail getDeploymentDetail(ClusterTarget target, String namespace, String name) {
        Deployment deployment = (Deployment) get(target, ResourceKind.DEPLOYMENT, namespace, name);
        Map<String, String> selector = deployment.getSpec() != null && deployment.getSpec().getSelector() != null
            ? deployment.getSpec().getSelector().getMatchLabels()
            : null;

        List<Pod> pods = new ArrayList<>();
        if (selector != null && !selector.isEmpty()) {
            try {
                pods = clusterClientService.getClient(target).pods()
                    .inNamespace(namespace)
                    .withLabels(selector)
                    .list()
                    .getItems();
            } catch (KubernetesClientException e) {
                log.error("Failed to list pods of deployment: {}/{}/{}", target, namespace, name, e);
                throw new K8sApiException("Failed to list deployment pods", e);
            }
        }
        return new DeploymentDetail(deployment, new ResourceList<>("pods", pods, pods.size(), null));
    }

    public void restartDeployment(ClusterTarget target, String namespace, String name) {
        log.info("Restarting deployment: {}/{}/{}", target, namespace, name);
        try {
            Deployment deployment = clusterClientService.getClient(target).apps().deployments()
                .inNamespace(namespace)
                .withName(name)
                .get();
            if (deployment == null) {
                throw new K8sResourceNotFoundException("Deployment", namespace, name);
            }
            clusterClientService.getClient(target).apps().deployments()
                .inNamespace(namespace)
                .withName(name)
                .rolling()
                .restart();
        } catch (KubernetesClientException e) {
            log.error("Failed to restart deployment: {}/{}/{}", target, namespace, name, e);
            throw new K8sApiException("Failed to restart deployment", e);
        }
    }

    // ========== Event ==========

    /**
     * 대상 오브젝트의 이벤트 (최근 순, 최대 20개)
     */
    public ResourceList<Event> events(ClusterTarget target, ResourceKind kind, String namespace, String name) {
        try {
            KubernetesClient client = clusterClientService.getClient(target);
            List<Event> events;
            if (kind.isNamespaced()) {
                events = client.v1().events()
                    .inNamespace(namespace)
                    .withField("involvedObject.name", name)
                    .withField("involvedObject.kind", kind.getKind())
                    .list()
                    .getItems();
            } else {
                events = client.v1().events()
                    .inAnyNamespace()
                    .withField("involvedObject.name", name)
                    .withField("involvedObject.kind", kind.getKind())
                    .list()
                    .getItems();
            }
            List<Event> sorted = events.stream()
                .sorted(Comparator.comparing(
                    event -> event.getLastTimestamp() != null
                        ? event.getLastTimestamp()
                        : event.getFirstTimestamp(),
                    Comparator.nullsLast(Comparator.reverseOrder())
                ))
                .limit(MAX_EVENTS)
                .collect(Collectors.toList());
            return new ResourceList<>("events", sorted, sorted.size(), null);
        } catch (KubernetesClientException e) {
            log.error("Failed to get events of {}: {}/{}/{}", kind.getPath(), target, namespace, name, e);
            throw new K8sApiException("Failed to get events", e);
        }
    }

    // ========== Node ==========

    public ResourceList<HasMetadata> nodePods(ClusterTarget target, String nodeName, DataSelectQuery query) {
        try {
            List<HasMetadata> pods = new ArrayList<>(clusterClientService.getClient(target).pods()
                .inAnyNamespace()
                .withField("spec.nodeName", nodeName)
                .list()
                .getItems());
            return ResourceList.of(ResourceKind.POD.getListField(), query.apply(pods, HasMetadata::getMetadata));
        } catch (KubernetesClientException e) {
            log.error("Failed to list pods on node: {}/{}", target, nodeName, e);
            throw new K8sApiException("Failed to list node pods", e);
        }
    }

    // ========== Pod ==========

    public PodLogs getPodLogs(ClusterTarget target, String namespace, String name, String container,
                              boolean previous, Integer tailLines) {
        Pod pod = (Pod) get(target, ResourceKind.POD, namespace, name);
        String containerName = container;
        if (containerName == null || containerName.isBlank()) {
            List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : null;
            if (containers == null || containers.isEmpty()) {
                throw new BadRequestException("pod " + name + " has no containers");
            }
            containerName = containers.get(0).getName();
        }

        try {
            ContainerResource containerResource = clusterClientService.getClient(target).pods()
                .inNamespace(namespace)
                .withName(name)
                .inContainer(containerName);
            TimeTailPrettyLoggable loggable = previous ? containerResource.terminated() : containerResource;
            String logs = tailLines != null && tailLines > 0
                ? loggable.tailingLines(tailLines).getLog()
                : loggable.getLog();
            return PodLogs.of(logs);
        } catch (KubernetesClientException e) {
            log.error("Failed to get pod logs: {}/{}/{}", target, namespace, name, e);
            throw new K8sApiException("Failed to get pod logs", e);
        }
    }

    // ========== Namespace ==========

    public Namespace createNamespace(ClusterTarget target, NamespaceRequest request) {
        log.info("Creating namespace: {}/{}", target, request.getName());
        Map<String, String> labels = new HashMap<>();
        if (request.getLabels() != null) {
            labels.putAll(request.getLabels());
        }
        if (request.isSkipAutoPropagation()) {
            labels.put(SKIP_AUTO_PROPAGATION_LABEL, "true");
        }
        try {
            return clusterClientService.getClient(target).namespaces()
                .resource(new NamespaceBuilder()
                    .withNewMetadata()
                    .withName(request.getName())
                    .withLabels(labels)
                    .endMetadata()
                    .build())
                .create();
        } catch (KubernetesClientException e) {
            log.error("Failed to create namespace: {}/{}", target, request.getName(), e);
            throw new K8sApiException("Failed to create namespace", e);
        }
    }

    public void deleteNamespace(ClusterTarget target, String name) {
        log.info("Deleting namespace: {}/{}", target, name);
        try {
            clusterClientService.getClient(target).namespaces().withName(name).delete();
        } catch (KubernetesClientException e) {
            log.error("Failed to delete namespace: {}/{}", target, name, e);
            throw new K8sApiException("Failed to delete namespace", e);
        }
    }

    static boolean isSystemNamespace(String name) {
        return name != null && (name.startsWith("kube-") || name.startsWith("karmada-"));
    }
}
