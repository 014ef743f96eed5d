package com.vibecoding.karmadadashboard.config;

import com.vibecoding.karmadadashboard.repository.EtcdKeyValueStore;
import com.vibecoding.karmadadashboard.repository.KeyValueStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EtcdConfig {

    @Bean(destroyMethod = "close")
    public KeyValueStore keyValueStore(DashboardProperties properties) {
        EtcdKeyValueStore store = new EtcdKeyValueStore(properties.getEtcd());
        store.connect();
        return store;
    }
}
