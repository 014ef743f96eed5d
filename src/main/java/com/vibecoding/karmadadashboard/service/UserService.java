package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.model.auth.CreateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.RoleInfo;
import com.vibecoding.karmadadashboard.model.auth.UpdateUserRequest;
import com.vibecoding.karmadadashboard.model.auth.User;
import com.vibecoding.karmadadashboard.model.auth.UserInfo;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.DASHBOARD_ID;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_ADMIN;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.TYPE_DASHBOARD;

/**
 * 관리자용 사용자 관리 (etcd 사용자 + OpenFGA 대시보드 admin 튜플)
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final AuthorizationService authorizationService;

    public List<UserInfo> listUsers() {
        return userRepository.list().stream()
            .map(UserService::toUserInfo)
            .collect(Collectors.toList());
    }

    public UserInfo getUser(String id) {
        return toUserInfo(userRepository.get(id));
    }

    public UserInfo createUser(CreateUserRequest request) {
        String role = roleOf(request.getRoles());
        User user = userRepository.create(request.getUsername(), request.getPassword(), request.getEmail(), role);
        if (DashboardPrincipal.ROLE_ADMIN.equals(role)) {
            authorizationService.tryWrite(user.getUsername(), RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
        }
        log.info("User created by admin: {}", user.getUsername());
        return toUserInfo(user);
    }

    /**
     * 이메일 / 역할 갱신. admin 튜플은 역할에 맞게 다시 쓴다
     */
    public UserInfo updateUser(String id, UpdateUserRequest request) {
        User user = userRepository.get(id);
        if (request.getEmail() != null) {
            user.setEmail(request.getEmail());
        }
        if (request.getRoles() != null) {
            user.setRole(roleOf(request.getRoles()));
        }
        User updated = userRepository.update(user);

        if (DashboardPrincipal.ROLE_ADMIN.equals(updated.getRole())) {
            authorizationService.tryWrite(id, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
        } else {
            authorizationService.tryDelete(id, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
        }
        log.info("User updated by admin: {}", id);
        return toUserInfo(updated);
    }

    public void deleteUser(String id) {
        if (AuthService.ADMIN_USERNAME.equals(id)) {
            throw new BadRequestException("cannot delete the admin user");
        }
        userRepository.get(id);
        userRepository.delete(id);
        authorizationService.tryDelete(id, RELATION_ADMIN, TYPE_DASHBOARD, DASHBOARD_ID);
        log.info("User deleted by admin: {}", id);
    }

    public void resetPassword(String id, String password) {
        userRepository.updatePassword(id, password);
    }

    public List<RoleInfo> listRoles() {
        return List.of(new RoleInfo(DashboardPrincipal.ROLE_ADMIN), new RoleInfo(DashboardPrincipal.ROLE_BASIC_USER));
    }

    static String roleOf(List<String> roles) {
        if (roles != null && roles.contains(DashboardPrincipal.ROLE_ADMIN)) {
            return DashboardPrincipal.ROLE_ADMIN;
        }
        return DashboardPrincipal.ROLE_BASIC_USER;
    }

    static UserInfo toUserInfo(User user) {
        return UserInfo.builder()
            .id(user.getUsername())
            .username(user.getUsername())
            .email(user.getEmail())
            .role(user.getRole())
            .enabled(true)
            .createdTimestamp(epochMillis(user.getCreatedAt()))
            .build();
    }

    private static long epochMillis(String timestamp) {
        if (timestamp == null || timestamp.isEmpty()) {
            return 0;
        }
        try {
            return Instant.parse(timestamp).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable user timestamp: {}", timestamp);
            return 0;
        }
    }
}
