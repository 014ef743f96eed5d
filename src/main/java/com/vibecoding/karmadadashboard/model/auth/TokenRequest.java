package com.vibecoding.karmadadashboard.model.auth;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {token} 형태의 요청 본문 (init-token, keycloak validate)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {
    private String token;
}
