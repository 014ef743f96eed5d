package com.vibecoding.karmadadashboard.repository;

import java.util.Map;
import java.util.Optional;

/**
 * 사용자 / 설정 / 토큰을 저장하는 key-value 저장소
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * @return 삭제된 키가 있었으면 true
     */
    boolean delete(String key);

    /**
     * prefix 로 시작하는 모든 키와 값 (키 순서)
     */
    Map<String, String> listByPrefix(String prefix);
}
