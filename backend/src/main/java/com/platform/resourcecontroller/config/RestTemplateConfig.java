package com.platform.resourcecontroller.config;

import com.platform.resourcecontroller.reconciliation.http.OwningSystemProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * REST client used to call owning systems.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, OwningSystemProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectionTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .build();
    }
}
