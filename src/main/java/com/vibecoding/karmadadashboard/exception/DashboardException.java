package com.vibecoding.karmadadashboard.exception;

/**
 * 응답 envelope 의 code 를 가지는 대시보드 예외의 공통 부모
 */
public abstract class DashboardException extends RuntimeException {

    private final int code;

    protected DashboardException(int code, String message) {
        super(message);
        this.code = code;
    }

    protected DashboardException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
