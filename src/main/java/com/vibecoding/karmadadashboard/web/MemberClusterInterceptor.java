package com.vibecoding.karmadadashboard.web;

import com.vibecoding.karmadadashboard.model.ClusterTarget;
import com.vibecoding.karmadadashboard.security.AdminAccessChecker;
import com.vibecoding.karmadadashboard.security.ClusterAccessChecker;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /api/v1/member/{clustername}/** 접근 확인
 */
@Component
@RequiredArgsConstructor
public class MemberClusterInterceptor implements HandlerInterceptor {

    private final ClusterAccessChecker clusterAccessChecker;
    private final AdminAccessChecker adminAccessChecker;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        ClusterTarget target = ClusterTargetArgumentResolver.resolve(request);
        if (target.getScope() == ClusterTarget.Scope.MGMT) {
            adminAccessChecker.requireAdmin(SecurityUtils.currentPrincipal().orElse(null), MgmtAdminInterceptor.SUBJECT);
            return true;
        }
        clusterAccessChecker.requireClusterAccess(SecurityUtils.currentUsername(), target.getClusterName());
        return true;
    }
}
