package com.vibecoding.karmadadashboard.exception;

/**
 * OpenFGA 호출 실패
 */
public class AuthorizationException extends DashboardException {

    public AuthorizationException(String message) {
        super(500, message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(500, cause != null && cause.getMessage() != null ? message + ": " + cause.getMessage() : message, cause);
    }
}
