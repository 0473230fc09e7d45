package com.platform.resourcecontroller.reconciliation.http;

import com.platform.resourcecontroller.reconciliation.ResourceClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Builds one {@link HttpResourceClient} per configured endpoint.
 */
@Slf4j
@Component
public class HttpResourceClientFactory {
    
    private final OwningSystemProperties properties;
    private final RestTemplate restTemplate;
    
    public HttpResourceClientFactory(OwningSystemProperties properties, RestTemplate restTemplate) {
        this.properties = properties;
        this.restTemplate = restTemplate;
    }
    
    public List<ResourceClient> createClients() {
        return properties.getEndpoints().entrySet().stream()
            .map(entry -> {
                log.info("[{}] Owning system endpoint: {}", entry.getKey(), entry.getValue().getBaseUrl());
                return (ResourceClient) new HttpResourceClient(entry.getKey(), entry.getValue(), restTemplate);
            })
            .toList();
    }
}
