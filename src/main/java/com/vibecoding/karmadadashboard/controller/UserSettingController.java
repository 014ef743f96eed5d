package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.setting.UserSetting;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.UserSettingService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 로그인한 사용자의 설정. 요청 본문의 username 은 항상 호출자로 덮어쓴다
 */
@RestController
@RequestMapping("/api/v1/setting")
@RequiredArgsConstructor
public class UserSettingController {

    private static final Logger log = LoggerFactory.getLogger(UserSettingController.class);

    private final UserSettingService userSettingService;

    @GetMapping("/user")
    public BaseResponse<UserSetting> getUserSetting() {
        DashboardPrincipal principal = requireUser();
        return BaseResponse.success(userSettingService.getUserSetting(principal.getUsername(), principal.getRole()));
    }

    @PostMapping("/user")
    public BaseResponse<UserSetting> createUserSetting(@RequestBody UserSetting setting) {
        DashboardPrincipal principal = requireUser();
        setting.setUsername(principal.getUsername());
        log.info("Creating user setting: {}", principal.getUsername());
        return BaseResponse.success(userSettingService.createUserSetting(setting));
    }

    @PutMapping("/user")
    public BaseResponse<UserSetting> updateUserSetting(@RequestBody UserSetting setting) {
        DashboardPrincipal principal = requireUser();
        setting.setUsername(principal.getUsername());
        log.info("Updating user setting: {}", principal.getUsername());
        return BaseResponse.success(userSettingService.updateUserSetting(setting));
    }

    @DeleteMapping("/user")
    public BaseResponse<String> deleteUserSetting() {
        DashboardPrincipal principal = requireUser();
        log.info("Deleting user setting: {}", principal.getUsername());
        userSettingService.deleteUserSetting(principal.getUsername());
        return BaseResponse.success("User settings deleted successfully");
    }

    @GetMapping("/users")
    public BaseResponse<List<UserSetting>> getAllUsers() {
        DashboardPrincipal principal = requireUser();
        return BaseResponse.success(userSettingService.getAllUserSettings(principal.getUsername(), principal.getRole()));
    }

    private static DashboardPrincipal requireUser() {
        return SecurityUtils.currentPrincipal()
            .filter(principal -> principal.getUsername() != null && !principal.getUsername().isEmpty())
            .orElseThrow(() -> new DashboardAccessException(401, "unauthorized user"));
    }
}
