package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.exception.DashboardAuthException;
import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.auth.KeycloakSettings;
import com.vibecoding.karmadadashboard.model.auth.KeycloakUser;
import com.vibecoding.karmadadashboard.model.auth.TokenRequest;
import com.vibecoding.karmadadashboard.service.KeycloakService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/keycloak")
@RequiredArgsConstructor
public class KeycloakController {

    private final KeycloakService keycloakService;

    @GetMapping("/config")
    public BaseResponse<KeycloakSettings> config() {
        return BaseResponse.success(keycloakService.getSettings());
    }

    /**
     * 토큰 교환은 프론트엔드가 하므로 code 만 돌려준다
     */
    @GetMapping("/callback")
    public BaseResponse<Map<String, String>> callback(@RequestParam(required = false) String code) {
        if (code == null || code.isEmpty()) {
            throw new DashboardAuthException(HttpStatus.BAD_REQUEST, "Missing authorization code");
        }
        return BaseResponse.success(Map.of("code", code));
    }

    @PostMapping("/validate")
    public BaseResponse<KeycloakUser> validate(@RequestBody(required = false) TokenRequest request) {
        if (request == null || request.getToken() == null || request.getToken().isEmpty()) {
            throw new DashboardAuthException(HttpStatus.BAD_REQUEST, "token is required");
        }
        return BaseResponse.success(keycloakService.validate(request.getToken()));
    }
}
