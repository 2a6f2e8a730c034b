package com.wshg.synergy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.repository.DeviceEmbeddingRepository;
import com.wshg.synergy.store.DeviceEmbeddingStore;
import com.wshg.synergy.store.InMemoryDeviceEmbeddingStore;
import com.wshg.synergy.store.MysqlDeviceEmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EmbeddingStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "synergy.embedding-store-type", havingValue = "file")
    public DeviceEmbeddingStore inMemoryDeviceEmbeddingStore(SynergyProperties props, ObjectMapper objectMapper, Clock clock) {
        return new InMemoryDeviceEmbeddingStore(props.getEmbeddingStorePath(), objectMapper, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "synergy.embedding-store-type", havingValue = "mysql", matchIfMissing = true)
    public DeviceEmbeddingStore mysqlDeviceEmbeddingStore(DeviceEmbeddingRepository repository, ObjectMapper objectMapper, Clock clock) {
        return new MysqlDeviceEmbeddingStore(repository, objectMapper, clock);
    }
}
