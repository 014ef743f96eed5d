package com.vibecoding.karmadadashboard.repository;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 테스트용 메모리 key-value 저장소
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<String, String> data = new ConcurrentSkipListMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void put(String key, String value) {
        data.put(key, value);
    }

    @Override
    public boolean delete(String key) {
        return data.remove(key) != null;
    }

    @Override
    public Map<String, String> listByPrefix(String prefix) {
        Map<String, String> result = new TreeMap<>();
        data.tailMap(prefix).forEach((key, value) -> {
            if (key.startsWith(prefix)) {
                result.put(key, value);
            }
        });
        return result;
    }

    public int size() {
        return data.size();
    }
}
