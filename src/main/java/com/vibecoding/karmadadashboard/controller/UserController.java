package com.vibecoding.karmadadashboard.controller;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import com.vibecoding.karmadadashboard.model.auth.CreateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.PasswordRequest;
import com.vibecoding.karmadadashboard.model.auth.RoleInfo;
import com.vibecoding.karmadadashboard.model.auth.UpdateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.UserInfo;
import com.vibecoding.karmadadashboard.security.AdminAccessChecker;
import com.vibecoding.karmadadashboard.security.SecurityUtils;
import com.vibecoding.karmadadashboard.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 대시보드 사용자 관리 (admin 전용)
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    static final String SUBJECT = "user management";

    private final UserService userService;
    private final AdminAccessChecker adminAccessChecker;

    @GetMapping("/users")
    public BaseResponse<List<UserInfo>> listUsers() {
        requireAdmin();
        return BaseResponse.success(userService.listUsers());
    }

    @PostMapping("/users")
    public BaseResponse<UserInfo> createUser(@Valid @RequestBody CreateUserRequest request) {
        requireAdmin();
        log.info("Creating user: {}", request.getUsername());
        return BaseResponse.success(userService.createUser(request));
    }

    @GetMapping("/users/{id}")
    public BaseResponse<UserInfo> getUser(@PathVariable String id) {
        requireAdmin();
        return BaseResponse.success(userService.getUser(id));
    }

    @PutMapping("/users/{id}")
    public BaseResponse<UserInfo> updateUser(
        @PathVariable String id,
        @RequestBody UpdateUserRequest request
    ) {
        requireAdmin();
        log.info("Updating user: {}", id);
        return BaseResponse.success(userService.updateUser(id, request));
    }

    @DeleteMapping("/users/{id}")
    public BaseResponse<String> deleteUser(@PathVariable String id) {
        requireAdmin();
        log.info("Deleting user: {}", id);
        userService.deleteUser(id);
        return BaseResponse.success("User deleted successfully");
    }

    @PutMapping("/users/{id}/password")
    public BaseResponse<String> resetPassword(
        @PathVariable String id,
        @Valid @RequestBody PasswordRequest request
    ) {
        requireAdmin();
        log.info("Resetting password of user: {}", id);
        userService.resetPassword(id, request.getPassword());
        return BaseResponse.success("Password updated successfully");
    }

    @GetMapping("/roles")
    public BaseResponse<List<RoleInfo>> listRoles() {
        requireAdmin();
        return BaseResponse.success(userService.listRoles());
    }

    private void requireAdmin() {
        adminAccessChecker.requireAdmin(SecurityUtils.currentPrincipal().orElse(null), SUBJECT);
    }
}
