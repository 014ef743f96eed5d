package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.exception.GlobalExceptionHandler;
import com.vibecoding.karmadadashboard.service.KeycloakService;
import com.vibecoding.karmadadashboard.service.UserSettingService;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 인증 관련 엔드포인트의 HTTP 상태 코드
 */
class ControllerStatusTest {

    private MockMvc build(Object controller) {
        return MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void callbackEchoesCode() throws Exception {
        build(new KeycloakController(mock(KeycloakService.class)))
            .perform(get("/api/v1/keycloak/callback").param("code", "abc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.code").value("abc"));
    }

    @Test
    void callbackWithoutCodeIsBadRequest() throws Exception {
        build(new KeycloakController(mock(KeycloakService.class)))
            .perform(get("/api/v1/keycloak/callback"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(400))
            .andExpect(jsonPath("$.message").value("Missing authorization code"));
    }

    @Test
    void validateRequiresToken() throws Exception {
        build(new KeycloakController(mock(KeycloakService.class)))
            .perform(post("/api/v1/keycloak/validate").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void userSettingWithoutLoginIsUnauthorizedEnvelope() throws Exception {
        build(new UserSettingController(mock(UserSettingService.class)))
            .perform(get("/api/v1/setting/user"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value(401))
            .andExpect(jsonPath("$.message").value("unauthorized user"));
    }

    @Test
    void healthEndpointsAnswerOk() throws Exception {
        MockMvc mockMvc = build(new HealthController());
        mockMvc.perform(get("/livez")).andExpect(content().string("ok"));
        mockMvc.perform(get("/readyz")).andExpect(content().string("ok"));
    }
}
