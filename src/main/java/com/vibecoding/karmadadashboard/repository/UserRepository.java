package com.vibecoding.karmadadashboard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.model.auth.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * etcd 사용자 저장소 (key: /karmada/dashboard/users/{username}, value: User JSON)
 */
@Repository
public class UserRepository {

    private static final Logger log = LoggerFactory.getLogger(UserRepository.class);

    public static final String USER_KEY_PREFIX = "/karmada/dashboard/users/";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final PasswordEncoder passwordEncoder;

    public UserRepository(KeyValueStore store, ObjectMapper objectMapper, PasswordEncoder passwordEncoder) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.passwordEncoder = passwordEncoder;
    }

    public User create(String username, String password, String email, String role) {
        if (exists(username)) {
            throw new StoreException("user " + username + " already exists");
        }
        String now = Instant.now().toString();
        User user = User.builder()
            .username(username)
            .passwordHash(passwordEncoder.encode(password))
            .email(email)
            .role(role)
            .createdAt(now)
            .updatedAt(now)
            .build();
        save(user);
        log.info("Created user: {} (role={})", username, role);
        return user;
    }

    public boolean exists(String username) {
        return store.get(USER_KEY_PREFIX + username).isPresent();
    }

    public Optional<User> find(String username) {
        return store.get(USER_KEY_PREFIX + username).map(json -> read(json, username));
    }

    public User get(String username) {
        return find(username).orElseThrow(() -> new StoreException("user " + username + " not found"));
    }

    public User update(User user) {
        if (!exists(user.getUsername())) {
            throw new StoreException("user " + user.getUsername() + " not found");
        }
        user.setUpdatedAt(Instant.now().toString());
        save(user);
        return user;
    }

    public void updatePassword(String username, String password) {
        User user = get(username);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setUpdatedAt(Instant.now().toString());
        save(user);
        log.info("Updated password of user: {}", username);
    }

    public void delete(String username) {
        store.delete(USER_KEY_PREFIX + username);
        log.info("Deleted user: {}", username);
    }

    /**
     * 파싱할 수 없는 항목은 건너뛴다
     */
    public List<User> list() {
        List<User> users = new ArrayList<>();
        for (Map.Entry<String, String> entry : store.listByPrefix(USER_KEY_PREFIX).entrySet()) {
            try {
                users.add(objectMapper.readValue(entry.getValue(), User.class));
            } catch (JsonProcessingException e) {
                log.error("Failed to parse user: {}", entry.getKey(), e);
            }
        }
        return users;
    }

    /**
     * 비밀번호 해시가 비어 있으면 실패, 불일치면 false
     */
    public boolean verifyPassword(String username, String password) {
        User user = get(username);
        if (user.getPasswordHash() == null || user.getPasswordHash().isEmpty()) {
            throw new StoreException("user " + username + " has no password set");
        }
        boolean matches = passwordEncoder.matches(password, user.getPasswordHash());
        if (!matches) {
            log.debug("Password verification failed: {}", username);
        }
        return matches;
    }

    private void save(User user) {
        try {
            store.put(USER_KEY_PREFIX + user.getUsername(), objectMapper.writeValueAsString(user));
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize user " + user.getUsername(), e);
        }
    }

    private User read(String json, String username) {
        try {
            return objectMapper.readValue(json, User.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to parse user " + username, e);
        }
    }
}
