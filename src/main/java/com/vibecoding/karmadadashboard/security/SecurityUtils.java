package com.vibecoding.karmadadashboard.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<DashboardPrincipal> currentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof DashboardPrincipal) {
            return Optional.of((DashboardPrincipal) authentication.getPrincipal());
        }
        return Optional.empty();
    }

    /**
     * 인증되지 않았으면 null
     */
    public static String currentUsername() {
        return currentPrincipal().map(DashboardPrincipal::getUsername).orElse(null);
    }
}
