package com.vibecoding.karmadadashboard.security;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.exception.DashboardException;
import com.vibecoding.karmadadashboard.service.AuthorizationService;
import com.vibecoding.karmadadashboard.service.ClusterService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 멤버 클러스터 접근 확인
 * - 클러스터가 Karmada 에 존재해야 한다
 * - FGA 사용 시 admin / owner / member 중 하나여야 한다
 */
@Component
@RequiredArgsConstructor
public class ClusterAccessChecker {

    private static final Logger log = LoggerFactory.getLogger(ClusterAccessChecker.class);

    private final ClusterService clusterService;
    private final AuthorizationService authorizationService;

    /**
     * @param username 인증되지 않았으면 null (존재 여부만 확인)
     */
    public void requireClusterAccess(String username, String clusterName) {
        try {
            clusterService.getClusterResource(clusterName);
        } catch (DashboardException e) {
            log.error("Member cluster not found: {}", clusterName);
            throw new DashboardAccessException(500, e.getMessage(), e);
        }

        if (username == null || !authorizationService.isEnabled()) {
            return;
        }
        boolean allowed;
        try {
            allowed = authorizationService.hasClusterAccess(username, clusterName);
        } catch (AuthorizationException e) {
            log.error("Failed to check cluster access: {} {}", username, clusterName, e);
            throw new DashboardAccessException(500, "Failed to verify cluster permissions", e);
        }
        if (!allowed) {
            log.info("Cluster access denied: {} {}", username, clusterName);
            throw new DashboardAccessException(403, "Access to cluster " + clusterName + " is forbidden");
        }
    }
}
