package com.vibecoding.karmadadashboard.exception;

/**
 * Kubernetes / Karmada API 호출 중 발생하는 예외
 */
public class K8sApiException extends DashboardException {

    public K8sApiException(String message) {
        super(500, message);
    }

    public K8sApiException(String message, Throwable cause) {
        super(500, cause != null && cause.getMessage() != null ? message + ": " + cause.getMessage() : message, cause);
    }
}
