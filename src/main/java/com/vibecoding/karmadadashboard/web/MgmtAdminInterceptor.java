package com.vibecoding.karmadadashboard.web;

import com.vibecoding.karmadadashboard.security.AdminAccessChecker;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /api/v1/mgmt/** 는 대시보드 관리자만 접근
 */
@Component
@RequiredArgsConstructor
public class MgmtAdminInterceptor implements HandlerInterceptor {

    static final String SUBJECT = "management cluster";

    private final AdminAccessChecker adminAccessChecker;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        adminAccessChecker.requireAdmin(SecurityUtils.currentPrincipal().orElse(null), SUBJECT);
        return true;
    }
}
