package com.vibecoding.karmadadashboard.terminal;

import io.fabric8.kubernetes.api.model.ContainerStatusBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerminalHandlerHelpersTest {

    private static Pod podWithContainers(String... names) {
        PodBuilder builder = new PodBuilder()
            .withNewMetadata().withName("web-1").withNamespace("default").endMetadata()
            .withNewSpec().endSpec();
        for (String name : names) {
            builder.editSpec().addNewContainer().withName(name).withImage("busybox").endContainer().endSpec();
        }
        return builder.build();
    }

    @Test
    void parsesAndDecodesQueryParams() {
        Map<String, String> params = AbstractTerminalHandler.parseQueryParams("namespace=default&pod=web-1&shell=%2Fbin%2Fbash&empty");

        assertEquals("default", params.get("namespace"));
        assertEquals("web-1", params.get("pod"));
        assertEquals("/bin/bash", params.get("shell"));
        assertFalse(params.containsKey("empty"));
        assertTrue(AbstractTerminalHandler.parseQueryParams(null).isEmpty());
    }

    @Test
    void blankValueFallsBackToDefault() {
        assertEquals("/bin/sh", AbstractTerminalHandler.valueOrDefault("", "/bin/sh"));
        assertEquals("/bin/sh", AbstractTerminalHandler.valueOrDefault(null, "/bin/sh"));
        assertEquals("bash", AbstractTerminalHandler.valueOrDefault("bash", "/bin/sh"));
    }

    @Test
    void firstContainerWhenNoneRequested() {
        assertEquals("app", PodTerminalHandler.resolveContainer(podWithContainers("app", "sidecar"), null));
        assertEquals("sidecar", PodTerminalHandler.resolveContainer(podWithContainers("app", "sidecar"), "sidecar"));
    }

    @Test
    void unknownContainerIsRejected() {
        TerminalException e = assertThrows(TerminalException.class,
            () -> PodTerminalHandler.resolveContainer(podWithContainers("app"), "ghost"));
        assertEquals("Error: Container ghost not found in pod default/web-1", e.getMessage());
        assertThrows(TerminalException.class, () -> PodTerminalHandler.resolveContainer(podWithContainers(), null));
    }

    @Test
    void shellPodIsPinnedToNode() {
        Pod pod = NodeTerminalHandler.buildShellPod("worker-1", "kube-system", "busybox:1.36");

        assertTrue(pod.getMetadata().getName().startsWith("node-shell-worker-1-"));
        assertEquals("kube-system", pod.getMetadata().getNamespace());
        assertEquals("worker-1", pod.getSpec().getNodeName());
        assertTrue(pod.getSpec().getHostPID());
        assertTrue(pod.getSpec().getContainers().get(0).getSecurityContext().getPrivileged());
        assertEquals("Exists", pod.getSpec().getTolerations().get(0).getOperator());
    }

    @Test
    void shellReadyNeedsRunningReadyContainer() {
        Pod pending = NodeTerminalHandler.buildShellPod("worker-1", "default", "busybox");
        String container = pending.getSpec().getContainers().get(0).getName();
        assertFalse(NodeTerminalHandler.isShellReady(pending));

        Pod running = new PodBuilder(pending)
            .withNewStatus()
                .withPhase("Running")
                .addToContainerStatuses(new ContainerStatusBuilder()
                    .withName(container)
                    .withReady(true)
                    .withNewState().withNewRunning().endRunning().endState()
                    .build())
            .endStatus()
            .build();
        assertTrue(NodeTerminalHandler.isShellReady(running));
        assertFalse(NodeTerminalHandler.isTerminated(running));

        Pod failed = new PodBuilder(pending).withNewStatus().withPhase("Failed").endStatus().build();
        assertTrue(NodeTerminalHandler.isTerminated(failed));
    }
}
