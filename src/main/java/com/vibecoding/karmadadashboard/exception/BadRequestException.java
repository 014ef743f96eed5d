package com.vibecoding.karmadadashboard.exception;

/**
 * 잘못된 요청 파라미터
 */
public class BadRequestException extends DashboardException {

    public BadRequestException(String message) {
        super(400, message);
    }
}
