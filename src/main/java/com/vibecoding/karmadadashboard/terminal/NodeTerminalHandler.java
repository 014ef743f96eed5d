package com.vibecoding.karmadadashboard.terminal;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.service.ClusterClientService;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * /api/v1/node-terminal?node&cluster&shell
 * - 대상 노드에 privileged 파드를 띄우고 nsenter 로 호스트 네임스페이스에 진입
 */
@Component
public class NodeTerminalHandler extends AbstractTerminalHandler {

    private static final Logger log = LoggerFactory.getLogger(NodeTerminalHandler.class);

    static final String SHELL_CONTAINER = "shell";
    private static final String NAME_CHARS = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final DashboardProperties properties;

    // 세션 id → 세션이 만든 shell 파드
    private final Map<String, ShellPod> shellPods = new ConcurrentHashMap<>();

    public NodeTerminalHandler(ClusterClientService clusterClientService, DashboardProperties properties) {
        super(clusterClientService);
        this.properties = properties;
    }

    @Override
    protected ExecWatch openTerminal(String sessionId, Map<String, String> params, WebSocketSession session) {
        String node = params.get("node");
        String cluster = params.get("cluster");
        if (node == null || node.isEmpty() || cluster == null || cluster.isEmpty()) {
            throw new TerminalException("Error: node and cluster parameters are required");
        }
        DashboardProperties.Terminal config = properties.getTerminal();
        String shell = valueOrDefault(params.get("shell"), config.getDefaultShell());
        KubernetesClient client = resolveClient(cluster);

        String namespace = config.getNodeShellNamespace();
        Pod pod = buildShellPod(node, namespace, config.getNodeShellImage());
        String podName = pod.getMetadata().getName();
        try {
            client.pods().inNamespace(namespace).resource(pod).create();
        } catch (KubernetesClientException e) {
            throw new TerminalException("Error: Failed to create shell pod: " + e.getMessage(), e);
        }
        shellPods.put(sessionId, new ShellPod(client, namespace, podName));
        log.info("Created node shell pod {}/{} on node {}", namespace, podName, node);

        Pod ready;
        try {
            ready = client.pods().inNamespace(namespace).withName(podName)
                .waitUntilCondition(p -> isShellReady(p) || isTerminated(p),
                    config.getNodeShellReadyTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (KubernetesClientException e) {
            throw new TerminalException(
                String.format("Error: Pod %s not running in time: %s", podName, e.getMessage()), e);
        }
        if (isTerminated(ready)) {
            throw new TerminalException(String.format("Error: Pod %s not running in time: pod terminated with phase %s",
                podName, ready.getStatus().getPhase()));
        }

        sendStdout(session, String.format("Connected to node %s, via pod %s\r\n", node, podName));
        return client.pods().inNamespace(namespace).withName(podName)
            .inContainer(SHELL_CONTAINER)
            .redirectingInput()
            .redirectingOutput()
            .withTTY()
            .exec("nsenter", "--target", "1", "--mount", "--uts", "--ipc", "--net", "--pid", "--", shell);
    }

    @Override
    protected void onSessionClosed(String sessionId) {
        ShellPod shellPod = shellPods.remove(sessionId);
        if (shellPod == null) {
            return;
        }
        try {
            shellPod.client.pods().inNamespace(shellPod.namespace).withName(shellPod.name).delete();
            log.info("Deleted node shell pod {}/{}", shellPod.namespace, shellPod.name);
        } catch (KubernetesClientException e) {
            log.error("Failed to delete shell pod {}/{}", shellPod.namespace, shellPod.name, e);
        }
    }

    static Pod buildShellPod(String node, String namespace, String image) {
        return new PodBuilder()
            .withNewMetadata()
                .withName("node-shell-" + node + "-" + randomSuffix())
                .withNamespace(namespace)
            .endMetadata()
            .withNewSpec()
                .withNodeName(node)
                .withHostPID(true)
                .withHostIPC(true)
                .withHostNetwork(true)
                .withRestartPolicy("Never")
                .addNewToleration()
                    .withOperator("Exists")
                .endToleration()
                .addNewContainer()
                    .withName(SHELL_CONTAINER)
                    .withImage(image)
                    .withCommand("sleep", "3600")
                    .withStdin(true)
                    .withTty(true)
                    .withNewSecurityContext()
                        .withPrivileged(true)
                    .endSecurityContext()
                .endContainer()
            .endSpec()
            .build();
    }

    /**
     * shell 컨테이너가 running 이고 ready
     */
    static boolean isShellReady(Pod pod) {
        if (pod == null || pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null) {
            return false;
        }
        for (ContainerStatus status : pod.getStatus().getContainerStatuses()) {
            if (SHELL_CONTAINER.equals(status.getName())) {
                return Boolean.TRUE.equals(status.getReady())
                    && status.getState() != null
                    && status.getState().getRunning() != null;
            }
        }
        return false;
    }

    static boolean isTerminated(Pod pod) {
        if (pod == null || pod.getStatus() == null) {
            return false;
        }
        String phase = pod.getStatus().getPhase();
        return "Failed".equals(phase) || "Succeeded".equals(phase);
    }

    static String randomSuffix() {
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            suffix.append(NAME_CHARS.charAt(ThreadLocalRandom.current().nextInt(NAME_CHARS.length())));
        }
        return suffix.toString();
    }

    private static class ShellPod {
        private final KubernetesClient client;
        private final String namespace;
        private final String name;

        ShellPod(KubernetesClient client, String namespace, String name) {
            this.client = client;
            this.namespace = namespace;
            this.name = name;
        }
    }
}
