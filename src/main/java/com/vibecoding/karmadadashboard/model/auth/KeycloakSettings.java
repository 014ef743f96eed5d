package com.vibecoding.karmadadashboard.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 프론트엔드가 Keycloak 로그인에 사용하는 설정
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KeycloakSettings {
    private boolean enabled;
    private String url;
    private String realm;
    private String clientId;
    private String redirectUri;
    private String logoutRedirectUri;
}
