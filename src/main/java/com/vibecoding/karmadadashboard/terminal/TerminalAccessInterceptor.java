package com.vibecoding.karmadadashboard.terminal;

import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.security.AdminAccessChecker;
import com.vibecoding.karmadadashboard.security.ClusterAccessChecker;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * 터미널 WebSocket 핸드셰이크 시 대상 클러스터 접근 확인
 * - 노드 터미널과 관리 클러스터는 대시보드 관리자만
 * - 멤버 클러스터는 HTTP 의 /member/{clustername} 과 같은 규칙
 */
@Component
@RequiredArgsConstructor
public class TerminalAccessInterceptor implements HandshakeInterceptor {

    private static final Logger log = LoggerFactory.getLogger(TerminalAccessInterceptor.class);

    static final String NODE_TERMINAL_PATH = "/api/v1/node-terminal";

    private final AdminAccessChecker adminAccessChecker;
    private final ClusterAccessChecker clusterAccessChecker;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        boolean nodeShell = request.getURI().getPath().endsWith(NODE_TERMINAL_PATH);
        String cluster = AbstractTerminalHandler.parseQueryParams(request.getURI().getRawQuery()).get("cluster");
        try {
            checkAccess(SecurityUtils.currentPrincipal().orElse(null), nodeShell, cluster);
            return true;
        } catch (DashboardAccessException e) {
            log.warn("Terminal handshake rejected ({}): {}", e.getCode(), e.getMessage());
            response.setStatusCode(HttpStatus.valueOf(e.getCode()));
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    void checkAccess(DashboardPrincipal principal, boolean nodeShell, String cluster) {
        if (principal == null || principal.getUsername() == null || principal.getUsername().isEmpty()) {
            throw new DashboardAccessException(401, "Authentication required for terminal access");
        }
        boolean mgmt = ClusterTarget.MGMT_CLUSTER_NAME.equals(cluster);
        if (nodeShell) {
            adminAccessChecker.requireAdmin(principal, "node terminal");
        } else if (mgmt) {
            adminAccessChecker.requireAdmin(principal, "management cluster");
        }
        if (cluster != null && !cluster.isEmpty() && !mgmt) {
            clusterAccessChecker.requireClusterAccess(principal.getUsername(), cluster);
        }
    }
}
