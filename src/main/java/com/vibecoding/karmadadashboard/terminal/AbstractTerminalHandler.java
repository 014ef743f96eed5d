package com.vibecoding.karmadadashboard.terminal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.DashboardException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.service.ClusterClientService;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.ExecWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * exec 스트림과 WebSocket 을 연결하는 공통 핸들러
 * - 세션 id 별로 ExecWatch 와 출력 스레드를 관리
 */
public abstract class AbstractTerminalHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractTerminalHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int SEND_TIME_LIMIT_MS = 10000;
    private static final int BUFFER_SIZE_LIMIT = 1024 * 1024;

    protected final ClusterClientService clusterClientService;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, ExecWatch> execs = new ConcurrentHashMap<>();
    private final Map<String, Thread> outputThreads = new ConcurrentHashMap<>();

    protected AbstractTerminalHandler(ClusterClientService clusterClientService) {
        this.clusterClientService = clusterClientService;
    }

    /**
     * 쿼리 파라미터로 exec 스트림을 연다. 실패하면 TerminalException
     */
    protected abstract ExecWatch openTerminal(String sessionId, Map<String, String> params, WebSocketSession session)
        throws IOException;

    protected void onSessionClosed(String sessionId) {
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession rawSession) throws Exception {
        WebSocketSession session = new ConcurrentWebSocketSessionDecorator(rawSession, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        sessions.put(session.getId(), session);
        Map<String, String> params = parseQueryParams(session.getUri() != null ? session.getUri().getRawQuery() : null);
        log.info("WS Connecting: Session={}, Params={}", session.getId(), params.keySet());

        try {
            ExecWatch watch = openTerminal(session.getId(), params, session);
            execs.put(session.getId(), watch);
            Thread outputThread = new Thread(() -> streamOutput(watch, session), "terminal-" + session.getId());
            outputThread.setDaemon(true);
            outputThread.start();
            outputThreads.put(session.getId(), outputThread);
        } catch (TerminalException e) {
            log.error("Terminal setup failed: {}", e.getMessage());
            sendErrorAndClose(session, e.getMessage());
        } catch (DashboardException | KubernetesClientException e) {
            log.error("Terminal setup failed", e);
            sendErrorAndClose(session, "Error: " + e.getMessage());
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        ExecWatch watch = execs.get(session.getId());
        if (watch == null) {
            return;
        }
        TerminalMessage msg;
        try {
            msg = MAPPER.readValue(message.getPayload(), TerminalMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid terminal message on session {}: {}", session.getId(), e.getOriginalMessage());
            return;
        }
        if (msg.getOperation() == null) {
            return;
        }

        switch (msg.getOperation()) {
            case TerminalMessage.OP_STDIN:
                if (msg.getData() != null) {
                    OutputStream input = watch.getInput();
                    input.write(msg.getData().getBytes(StandardCharsets.UTF_8));
                    input.flush();
                }
                break;
            case TerminalMessage.OP_RESIZE:
                if (msg.getCols() > 0 && msg.getRows() > 0) {
                    watch.resize(msg.getCols(), msg.getRows());
                }
                break;
            case TerminalMessage.OP_PING:
                break;
            default:
                log.warn("Unknown terminal operation: {}", msg.getOperation());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) throws Exception {
        ExecWatch watch = execs.remove(session.getId());
        if (watch != null) {
            watch.close();
        }
        outputThreads.remove(session.getId());
        sessions.remove(session.getId());
        onSessionClosed(session.getId());
        log.info("WS Closed: Session={}, Status={}", session.getId(), status);
    }

    private void streamOutput(ExecWatch watch, WebSocketSession session) {
        try (InputStream output = watch.getOutput()) {
            byte[] buffer = new byte[4096];
            int read;
            while ((read = output.read(buffer)) != -1) {
                if (!session.isOpen()) {
                    break;
                }
                sendStdout(session, new String(buffer, 0, read, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            if (session.isOpen()) {
                log.warn("Stream error for session {}: {}", session.getId(), e.getMessage());
                sendStdout(session, "Connection closed: " + e.getMessage() + "\r\n");
            }
        } finally {
            closeQuietly(session);
        }
    }

    // ========== Helpers ==========

    /**
     * mgmt-cluster 는 관리 클러스터, 비어 있으면 Karmada, 그 외는 멤버 클러스터
     */
    protected KubernetesClient resolveClient(String cluster) {
        if (cluster == null || cluster.isEmpty()) {
            return clusterClientService.getKarmadaClient();
        }
        if (ClusterTarget.MGMT_CLUSTER_NAME.equals(cluster)) {
            return clusterClientService.getManagementClient();
        }
        try {
            return clusterClientService.getMemberClient(cluster);
        } catch (DashboardException | KubernetesClientException e) {
            throw new TerminalException("Error: Failed to get member cluster client for " + cluster + "\r\n", e);
        }
    }

    protected void sendStdout(WebSocketSession session, String data) {
        try {
            session.sendMessage(new TextMessage(MAPPER.writeValueAsString(TerminalMessage.stdout(data))));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send terminal output to session {}: {}", session.getId(), e.getMessage());
        }
    }

    protected void sendErrorAndClose(WebSocketSession session, String message) {
        sendStdout(session, message.endsWith("\r\n") ? message : message + "\r\n");
        closeQuietly(session);
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            if (session.isOpen()) {
                session.close();
            }
        } catch (IOException e) {
            log.error("Error closing session {}", session.getId(), e);
        }
    }

    static Map<String, String> parseQueryParams(String query) {
        Map<String, String> map = new HashMap<>();
        if (query != null) {
            for (String param : query.split("&")) {
                String[] pair = param.split("=", 2);
                if (pair.length > 1) {
                    map.put(URLDecoder.decode(pair[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(pair[1], StandardCharsets.UTF_8));
                }
            }
        }
        return map;
    }

    static String valueOrDefault(String value, String defaultValue) {
        return value == null || value.isEmpty() ? defaultValue : value;
    }
}
