package com.vibecoding.karmadadashboard.model.auth;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InitTokenResponse {
    private boolean success;
    private String message;
}
