package com.vibecoding.karmadadashboard.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 검증된 Keycloak 토큰의 사용자 정보
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeycloakUser {
    private String username;
    private String email;
    private List<String> roles;
    @JsonProperty("isAdmin")
    private boolean admin;
}
