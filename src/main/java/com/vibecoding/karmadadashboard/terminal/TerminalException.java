package com.vibecoding.karmadadashboard.terminal;

/**
 * 터미널 세션 준비 실패. 메시지는 그대로 터미널에 출력된다
 */
public class TerminalException extends RuntimeException {

    public TerminalException(String message) {
        super(message);
    }

    public TerminalException(String message, Throwable cause) {
        super(message, cause);
    }
}
