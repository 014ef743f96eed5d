package com.vibecoding.karmadadashboard.service;

import com.vibecoding.karmadadashboard.exception.AuthorizationException;
import com.vibecoding.karmadadashboard.exception.BadRequestException;
import com.vibecoding.karmadadashboard.exception.DashboardAccessException;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.model.auth.User;
import com.vibecoding.karmadadashboard.model.setting.UserSetting;
import com.vibecoding.karmadadashboard.repository.UserRepository;
import com.vibecoding.karmadadashboard.repository.UserSettingRepository;
import com.vibecoding.karmadadashboard.security.DashboardPrincipal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_MEMBER;
import static com.vibecoding.karmadadashboard.fga.RelationshipAuthorizer.RELATION_OWNER;

/**
 * 사용자 설정 조회 / 저장 및 설정 화면을 통한 사용자 생성
 */
@Service
@RequiredArgsConstructor
public class UserSettingService {

    private static final Logger log = LoggerFactory.getLogger(UserSettingService.class);

    static final String PREF_PASSWORD = "password";
    static final String PREF_ROLE = "role";
    static final String PREF_EMAIL = "email";

    private final UserRepository userRepository;
    private final UserSettingRepository userSettingRepository;
    private final AuthorizationService authorizationService;

    /**
     * 저장된 설정이 없으면 기본값. preferences.role 이 없으면 호출자의 역할을 채운다
     */
    public UserSetting getUserSetting(String username, String callerRole) {
        UserSetting setting = userSettingRepository.find(username).orElseGet(() -> defaultSetting(username));
        String role = callerRole;
        if (role == null || role.isEmpty()) {
            role = userRepository.find(username).map(User::getRole).orElse(null);
        }
        if (role != null && !role.isEmpty()) {
            if (setting.getPreferences() == null) {
                setting.setPreferences(new HashMap<>());
            }
            setting.getPreferences().putIfAbsent(PREF_ROLE, role);
        }
        return setting;
    }

    static UserSetting defaultSetting(String username) {
        return UserSetting.builder()
            .username(username)
            .theme("light")
            .language("en")
            .dateFormat("MM/DD/YYYY")
            .timeFormat("12h")
            .preferences(new HashMap<>())
            .dashboard(new UserSetting.DashboardSettings("clusters", 30))
            .build();
    }

    /**
     * etcd 사용자를 만들거나 갱신하고 설정을 저장 (비밀번호는 저장하지 않음)
     */
    public UserSetting createUserSetting(UserSetting setting) {
        String username = setting.getUsername();
        Map<String, String> preferences = preferences(setting);
        String password = password(setting, preferences);
        if (password == null) {
            throw new BadRequestException("password is required");
        }
        String role = preferences.getOrDefault(PREF_ROLE, "");
        if (role.isEmpty()) {
            role = DashboardPrincipal.ROLE_BASIC_USER;
        }
        validateRole(role);
        String email = preferences.get(PREF_EMAIL);

        if (!userRepository.exists(username)) {
            userRepository.create(username, password, email, role);
        } else {
            User user = userRepository.get(username);
            boolean needsUpdate = false;
            if (!role.equals(user.getRole())) {
                user.setRole(role);
                needsUpdate = true;
            }
            if (email != null && !email.isEmpty() && !email.equals(user.getEmail())) {
                user.setEmail(email);
                needsUpdate = true;
            }
            userRepository.updatePassword(username, password);
            if (needsUpdate) {
                User refreshed = userRepository.get(username);
                refreshed.setRole(user.getRole());
                refreshed.setEmail(user.getEmail());
                userRepository.update(refreshed);
            }
        }

        applyClusterPermissions(setting);
        UserSetting saved = sanitized(setting);
        userSettingRepository.save(saved);
        log.info("User setting created: {}", username);
        return saved;
    }

    /**
     * 사용자 정보(역할 / 이메일 / 비밀번호)를 갱신하고 기존 설정을 덮어쓴다
     */
    public UserSetting updateUserSetting(UserSetting setting) {
        String username = setting.getUsername();
        User user = userRepository.get(username);
        // 설정이 없으면 사용자와 FGA 튜플은 건드리지 않는다
        if (!userSettingRepository.exists(username)) {
            throw new StoreException("user setting not found for " + username);
        }
        Map<String, String> preferences = preferences(setting);
        String password = password(setting, preferences);

        boolean needsUpdate = false;
        String role = preferences.get(PREF_ROLE);
        if (role != null && !role.isEmpty() && !role.equals(user.getRole())) {
            validateRole(role);
            user.setRole(role);
            needsUpdate = true;
        }
        if (preferences.containsKey(PREF_EMAIL) && !preferences.get(PREF_EMAIL).equals(user.getEmail())) {
            user.setEmail(preferences.get(PREF_EMAIL));
            needsUpdate = true;
        }
        if (password != null) {
            userRepository.updatePassword(username, password);
            User refreshed = userRepository.get(username);
            user.setPasswordHash(refreshed.getPasswordHash());
        }
        if (needsUpdate) {
            userRepository.update(user);
        }

        applyClusterPermissions(setting);
        UserSetting saved = sanitized(setting);
        userSettingRepository.save(saved);
        log.info("User setting updated: {}", username);
        return saved;
    }

    /**
     * 설정과 etcd 사용자를 함께 삭제
     */
    public void deleteUserSetting(String username) {
        if (!userSettingRepository.delete(username)) {
            log.info("User setting not found, only deleting user: {}", username);
        }
        userRepository.delete(username);
    }

    /**
     * 모든 etcd 사용자와 설정 (역할 / 이메일을 preferences 에 채움). admin 만 조회 가능
     */
    public List<UserSetting> getAllUserSettings(String caller, String callerRole) {
        String role = callerRole;
        if (role == null || role.isEmpty()) {
            role = userRepository.find(caller).map(User::getRole).orElse(null);
        }
        if (!DashboardPrincipal.ROLE_ADMIN.equals(role)) {
            throw new DashboardAccessException(403, "insufficient privileges: admin role required");
        }
        List<UserSetting> result = new ArrayList<>();
        for (User user : userRepository.list()) {
            UserSetting setting;
            try {
                setting = userSettingRepository.find(user.getUsername())
                    .orElseGet(() -> defaultSetting(user.getUsername()));
            } catch (StoreException e) {
                log.error("Failed to get user settings: {}", user.getUsername(), e);
                continue;
            }
            if (setting.getPreferences() == null) {
                setting.setPreferences(new HashMap<>());
            }
            setting.getPreferences().put(PREF_ROLE, user.getRole());
            if (user.getEmail() != null && !user.getEmail().isEmpty()) {
                setting.getPreferences().put(PREF_EMAIL, user.getEmail());
                if (setting.getDisplayName() == null || setting.getDisplayName().isEmpty()) {
                    setting.setDisplayName(user.getEmail());
                }
            }
            result.add(setting);
        }
        return result;
    }

    private void applyClusterPermissions(UserSetting setting) {
        if (setting.getClusterPermissions() == null || setting.getClusterPermissions().isEmpty()) {
            return;
        }
        if (!authorizationService.isEnabled()) {
            log.debug("OpenFGA is disabled, skipping cluster permissions: {}", setting.getUsername());
            return;
        }
        for (UserSetting.ClusterPermission permission : setting.getClusterPermissions()) {
            if (permission.getRoles() == null) {
                continue;
            }
            for (String relation : permission.getRoles()) {
                if (!RELATION_OWNER.equals(relation) && !RELATION_MEMBER.equals(relation)) {
                    log.debug("Invalid cluster role, skipping: {} {} {}",
                        setting.getUsername(), permission.getCluster(), relation);
                    continue;
                }
                try {
                    authorizationService.grantClusterRelation(setting.getUsername(), relation, permission.getCluster());
                    log.info("Added cluster permission: {} {} {}", setting.getUsername(), relation, permission.getCluster());
                } catch (AuthorizationException e) {
                    log.error("Failed to set cluster permission: {} {} {}",
                        setting.getUsername(), relation, permission.getCluster(), e);
                }
            }
        }
    }

    private static UserSetting sanitized(UserSetting setting) {
        Map<String, String> preferences = new HashMap<>(preferences(setting));
        preferences.remove(PREF_PASSWORD);
        return UserSetting.builder()
            .username(setting.getUsername())
            .displayName(setting.getDisplayName())
            .theme(setting.getTheme())
            .language(setting.getLanguage())
            .dateFormat(setting.getDateFormat())
            .timeFormat(setting.getTimeFormat())
            .preferences(preferences)
            .dashboard(setting.getDashboard())
            .build();
    }

    private static Map<String, String> preferences(UserSetting setting) {
        return setting.getPreferences() != null ? setting.getPreferences() : Map.of();
    }

    private static String password(UserSetting setting, Map<String, String> preferences) {
        if (setting.getPassword() != null && !setting.getPassword().isEmpty()) {
            return setting.getPassword();
        }
        String password = preferences.get(PREF_PASSWORD);
        return password != null && !password.isEmpty() ? password : null;
    }

    private static void validateRole(String role) {
        if (!DashboardPrincipal.ROLE_ADMIN.equals(role) && !DashboardPrincipal.ROLE_BASIC_USER.equals(role)) {
            throw new BadRequestException("invalid role: " + role);
        }
    }
}
