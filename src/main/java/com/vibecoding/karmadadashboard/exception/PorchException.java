package com.vibecoding.karmadadashboard.exception;

/**
 * Porch API 프록시 실패
 */
public class PorchException extends DashboardException {

    public PorchException(String message) {
        super(500, message);
    }

    public PorchException(String message, Throwable cause) {
        super(500, cause != null && cause.getMessage() != null ? message + ": " + cause.getMessage() : message, cause);
    }
}
