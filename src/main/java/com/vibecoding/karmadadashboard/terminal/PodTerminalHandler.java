package com.vibecoding.karmadadashboard.terminal;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.service.ClusterClientService;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.Map;

/**
 * /api/v1/terminal?namespace&pod&container&cluster&shell
 */
@Component
public class PodTerminalHandler extends AbstractTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(PodTerminalHandler.class);

    private final DashboardProperties properties;

    public PodTerminalHandler(ClusterClientService clusterClientService, DashboardProperties properties) {
        super(clusterClientService);
        this.properties = properties;
    }

    @Override
    protected ExecWatch openTerminal(String sessionId, Map<String, String> params, WebSocketSession session) {
        String namespace = params.get("namespace");
        String podName = params.get("pod");
        if (namespace == null || namespace.isEmpty() || podName == null || podName.isEmpty()) {
            throw new TerminalException("Error: namespace and pod parameters are required");
        }
        String shell = valueOrDefault(params.get("shell"), properties.getTerminal().getDefaultShell());
        KubernetesClient client = resolveClient(params.get("cluster"));

        Pod pod;
        try {
            pod = client.pods().inNamespace(namespace).withName(podName).get();
        } catch (KubernetesClientException e) {
            throw new TerminalException(
                String.format("Error: Failed to get pod %s/%s: %s", namespace, podName, e.getMessage()), e);
        }
        if (pod == null) {
            throw new TerminalException(String.format("Error: Failed to get pod %s/%s: not found", namespace, podName));
        }
        String container = resolveContainer(pod, params.get("container"));

        log.info("Opening terminal: pod={}/{}, container={}, shell={}", namespace, podName, container, shell);
        ExecWatch watch = client.pods().inNamespace(namespace).withName(podName)
            .inContainer(container)
            .redirectingInput()
            .redirectingOutput()
            .withTTY()
            .exec(shell);
        sendStdout(session, String.format("Connected to pod %s/%s, container: %s\r\n", namespace, podName, container));
        return watch;
    }

    /**
     * 지정하지 않으면 첫 번째 컨테이너, 지정했으면 존재 여부 확인
     */
    static String resolveContainer(Pod pod, String requested) {
        String namespace = pod.getMetadata().getNamespace();
        String podName = pod.getMetadata().getName();
        List<Container> containers = pod.getSpec() != null ? pod.getSpec().getContainers() : List.of();
        if (containers == null || containers.isEmpty()) {
            throw new TerminalException(String.format("Error: Pod %s/%s has no containers", namespace, podName));
        }
        if (requested == null || requested.isEmpty()) {
            return containers.get(0).getName();
        }
        for (Container container : containers) {
            if (requested.equals(container.getName())) {
                return requested;
            }
        }
        throw new TerminalException(
            String.format("Error: Container %s not found in pod %s/%s", requested, namespace, podName));
    }
}
