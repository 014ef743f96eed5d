package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.auth.InitTokenResponse;
import com.vibecoding.karmadadashboard.model.auth.LoginRequest;
import com.vibecoding.karmadadashboard.model.auth.LoginResponse;
import com.vibecoding.karmadadashboard.model.auth.MeResponse;
import com.vibecoding.karmadadashboard.model.auth.TokenRequest;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 로그인 / 현재 사용자 / 서비스 계정 토큰 초기화
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final AuthService authService;

    @PostMapping("/login")
    public BaseResponse<LoginResponse> login(@RequestBody(required = false) LoginRequest request) {
        log.info("Login attempt: {}", request != null ? request.getUsername() : null);
        return BaseResponse.success(authService.login(request));
    }

    @GetMapping("/me")
    public BaseResponse<MeResponse> me() {
        return BaseResponse.success(authService.me(SecurityUtils.currentPrincipal().orElse(null)));
    }

    @PostMapping("/init-token")
    public BaseResponse<InitTokenResponse> initToken(@RequestBody(required = false) TokenRequest request) {
        log.info("Initializing service account token");
        return BaseResponse.success(authService.initToken(request != null ? request.getToken() : null));
    }
}
