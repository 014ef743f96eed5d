package com.vibecoding.karmadadashboard.terminal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 터미널 WebSocket 메시지
 * - 클라이언트: stdin / resize / ping
 * - 서버: stdout
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TerminalMessage {

    public static final String OP_STDIN = "stdin";
    public static final String OP_STDOUT = "stdout";
    public static final String OP_RESIZE = "resize";
    public static final String OP_PING = "ping";

    private String operation;
    private String data;
    private int rows;
    private int cols;

    public static TerminalMessage stdout(String data) {
        return new TerminalMessage(OP_STDOUT, data, 0, 0);
    }
}
