package com.vibecoding.karmadadashboard.exception;

/**
 * 클러스터 또는 리소스를 찾을 수 없을 때 발생하는 예외
 */
public class K8sResourceNotFoundException extends DashboardException {

    public K8sResourceNotFoundException(String message) {
        super(500, message);
    }

    public K8sResourceNotFoundException(String kind, String namespace, String name) {
        super(500, namespace == null || namespace.isEmpty()
            ? String.format("%s not found: %s", kind, name)
            : String.format("%s not found: %s/%s", kind, namespace, name));
    }
}
