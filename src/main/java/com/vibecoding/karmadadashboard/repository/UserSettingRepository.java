package com.vibecoding.karmadadashboard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.karmadadashboard.exception.StoreException;
import com.vibecoding.karmadadashboard.model.setting.UserSetting;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 사용자 설정 저장소 (key: usersettings/{username})
 */
@Repository
public class UserSettingRepository {

    static final String SETTING_KEY_PREFIX = "usersettings/";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;

    public UserSettingRepository(KeyValueStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    public Optional<UserSetting> find(String username) {
        return store.get(SETTING_KEY_PREFIX + username).map(json -> {
            try {
                return objectMapper.readValue(json, UserSetting.class);
            } catch (JsonProcessingException e) {
                throw new StoreException("failed to unmarshal user settings", e);
            }
        });
    }

    public boolean exists(String username) {
        return store.get(SETTING_KEY_PREFIX + username).isPresent();
    }

    public void save(UserSetting setting) {
        try {
            store.put(SETTING_KEY_PREFIX + setting.getUsername(), objectMapper.writeValueAsString(setting));
        } catch (JsonProcessingException e) {
            throw new StoreException("failed to marshal user settings", e);
        }
    }

    public boolean delete(String username) {
        return store.delete(SETTING_KEY_PREFIX + username);
    }
}
