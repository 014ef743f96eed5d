package com.vibecoding.karmadadashboard.exception;

/**
 * 클러스터 / 관리 기능 접근 거부. HTTP 200 응답의 code 로 상태를 전달한다
 */
public class DashboardAccessException extends DashboardException {

    public DashboardAccessException(int code, String message) {
        super(code, message);
    }

    public DashboardAccessException(int code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
