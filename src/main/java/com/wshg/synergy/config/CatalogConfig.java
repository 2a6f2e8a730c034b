package com.wshg.synergy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.synergy.catalog.DataApiDeviceCatalogProvider;
import com.wshg.synergy.catalog.DeviceCatalogProvider;
import com.wshg.synergy.catalog.JpaDeviceCatalogProvider;
import com.wshg.synergy.repository.SmartHomeDeviceRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class CatalogConfig {

    @Bean
    @ConditionalOnProperty(name = "synergy.catalog-type", havingValue = "jpa", matchIfMissing = true)
    public DeviceCatalogProvider jpaDeviceCatalogProvider(SmartHomeDeviceRepository repository) {
        return new JpaDeviceCatalogProvider(repository);
    }

    @Bean
    @ConditionalOnProperty(name = "synergy.catalog-type", havingValue = "data-api")
    public DeviceCatalogProvider dataApiDeviceCatalogProvider(RestTemplate restTemplate, ObjectMapper objectMapper,
                                                              SynergyProperties props) {
        return new DataApiDeviceCatalogProvider(restTemplate, objectMapper, props.getDataApiBaseUrl(),
                props.getDeviceIntelligenceBaseUrl(), props.getDataApiLimit());
    }
}
