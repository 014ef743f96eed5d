package com.vibecoding.karmadadashboard.exception;

import org.springframework.http.HttpStatus;

/**
 * 인증/인가 실패. 다른 예외와 달리 실제 HTTP 상태 코드로 응답한다.
 */
public class DashboardAuthException extends DashboardException {

    private final HttpStatus status;

    public DashboardAuthException(HttpStatus status, String message) {
        super(status.value(), message);
        this.status = status;
    }

    public DashboardAuthException(HttpStatus status, String message, Throwable cause) {
        super(status.value(), message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public static DashboardAuthException unauthorized(String message) {
        return new DashboardAuthException(HttpStatus.UNAUTHORIZED, message);
    }

    public static DashboardAuthException forbidden(String message) {
        return new DashboardAuthException(HttpStatus.FORBIDDEN, message);
    }
}
