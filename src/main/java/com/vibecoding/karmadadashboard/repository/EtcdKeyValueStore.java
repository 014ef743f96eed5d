package com.vibecoding.karmadadashboard.repository;

import com.vibecoding.karmadadashboard.config.DashboardProperties;
import com.vibecoding.karmadadashboard.exception.StoreException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * jetcd 기반 KeyValueStore
 * - 후보 endpoint 마다 재시도하며 첫 번째로 응답하는 etcd 에 연결
 * - 모두 실패하면 실패 상태로 시작하고 모든 호출이 "etcd is unavailable" 로 실패
 */
public class EtcdKeyValueStore implements KeyValueStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EtcdKeyValueStore.class);

    static final String PING_KEY = "/ping-test";

    private final DashboardProperties.Etcd config;
    private volatile Client client;
    private volatile String connectedEndpoint;

    public EtcdKeyValueStore(DashboardProperties.Etcd config) {
        this.config = config;
    }

    public void connect() {
        for (String endpoint : candidateEndpoints(config)) {
            for (int attempt = 1; attempt <= config.getConnectRetries(); attempt++) {
                Client candidate = Client.builder().endpoints(endpoint).build();
                try {
                    candidate.getKVClient()
                        .get(bytes(PING_KEY))
                        .get(config.getRequestTimeoutMillis(), TimeUnit.MILLISECONDS);
                    this.client = candidate;
                    this.connectedEndpoint = endpoint;
                    log.info("Connected to etcd: {}", endpoint);
                    return;
                } catch (InterruptedException e) {
                    candidate.close();
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while connecting to etcd");
                    return;
                } catch (ExecutionException | TimeoutException e) {
                    candidate.close();
                    log.warn("Failed to connect to etcd {} (attempt {}/{}): {}",
                        endpoint, attempt, config.getConnectRetries(), e.getMessage());
                    if (!sleep(attempt * config.getRetryBackoffMillis())) {
                        return;
                    }
                }
            }
        }
        log.error("Could not connect to any etcd endpoint, user store is unavailable");
    }

    /**
     * 설정된 endpoint, {host}.svc, {host}, localhost 순서 (중복 제거)
     */
    static List<String> candidateEndpoints(DashboardProperties.Etcd config) {
        Set<String> endpoints = new LinkedHashSet<>();
        if (config.getEndpoint() != null && !config.getEndpoint().isBlank()) {
            for (String endpoint : config.getEndpoint().split(",")) {
                if (!endpoint.isBlank()) {
                    endpoints.add(endpoint.trim());
                }
            }
        }
        endpoints.add("http://" + config.getHost() + ".svc:" + config.getPort());
        endpoints.add("http://" + config.getHost() + ":" + config.getPort());
        endpoints.add("http://localhost:" + config.getPort());
        return new ArrayList<>(endpoints);
    }

    public boolean isAvailable() {
        return client != null;
    }

    public String getConnectedEndpoint() {
        return connectedEndpoint;
    }

    @Override
    public Optional<String> get(String key) {
        GetResponse response = await(kv().get(bytes(key)), "get " + key);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0).getValue().toString(StandardCharsets.UTF_8));
    }

    @Override
    public void put(String key, String value) {
        await(kv().put(bytes(key), bytes(value)), "put " + key);
    }

    @Override
    public boolean delete(String key) {
        return await(kv().delete(bytes(key)), "delete " + key).getDeleted() > 0;
    }

    @Override
    public Map<String, String> listByPrefix(String prefix) {
        GetResponse response = await(
            kv().get(bytes(prefix), GetOption.newBuilder().isPrefix(true).build()),
            "list " + prefix);
        Map<String, String> result = new LinkedHashMap<>();
        for (KeyValue kv : response.getKvs()) {
            result.put(kv.getKey().toString(StandardCharsets.UTF_8), kv.getValue().toString(StandardCharsets.UTF_8));
        }
        return result;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
            log.info("Closed etcd client: {}", connectedEndpoint);
        }
    }

    private KV kv() {
        if (client == null) {
            throw new StoreException("etcd is unavailable");
        }
        return client.getKVClient();
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.get(config.getRequestTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted during etcd " + operation, e);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to {} in etcd", operation, e);
            throw new StoreException("Failed to " + operation, e);
        }
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }

    private static boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
