package com.vibecoding.karmadadashboard.exception;

/**
 * etcd 저장소 접근 실패
 */
public class StoreException extends DashboardException {

    public StoreException(String message) {
        super(500, message);
    }

    public StoreException(String message, Throwable cause) {
        super(500, cause != null && cause.getMessage() != null ? message + ": " + cause.getMessage() : message, cause);
    }
}
