package com.vibecoding.karmadadashboard.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PodLogs {
    private String logs;
    private long totalLines;

    public static PodLogs of(String logs) {
        String text = logs != null ? logs : "";
        long lines = text.chars().filter(c -> c == '\n').count();
        if (!text.isEmpty() && text.charAt(text.length() - 1) != '\n') {
            lines++;
        }
        return new PodLogs(text, lines);
    }
}
