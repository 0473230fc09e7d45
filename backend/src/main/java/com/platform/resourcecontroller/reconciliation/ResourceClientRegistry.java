package com.platform.resourcecontroller.reconciliation;

import com.platform.resourcecontroller.error.OwningSystemException;
import com.platform.resourcecontroller.reconciliation.http.HttpResourceClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Resource clients keyed by the resource type they serve.
 */
@Slf4j
@Component
public class ResourceClientRegistry {
    
    private final Map<String, ResourceClient> clients;
    
    /**
     * Client beans take precedence over configured HTTP endpoints of the
     * same type.
     */
    @Autowired
    public ResourceClientRegistry(ObjectProvider<ResourceClient> clients, HttpResourceClientFactory httpClients) {
        this(Stream.concat(httpClients.createClients().stream(), clients.orderedStream()).toList());
    }
    
    /**
     * Later clients replace earlier ones serving the same type.
     */
    public ResourceClientRegistry(List<ResourceClient> clients) {
        Map<String, ResourceClient> byType = new LinkedHashMap<>();
        for (ResourceClient client : clients) {
            ResourceClient replaced = byType.put(client.resourceType(), client);
            if (replaced != null) {
                log.warn("[{}] Resource client {} replaces {}", client.resourceType(),
                    client.getClass().getSimpleName(), replaced.getClass().getSimpleName());
            }
        }
        this.clients = Map.copyOf(byType);
        log.info("Registered resource clients for types: {}", this.clients.keySet());
    }
    
    /**
     * @throws OwningSystemException if no client serves the type
     */
    public ResourceClient forType(String resourceType) {
        ResourceClient client = clients.get(resourceType);
        if (client == null) {
            throw OwningSystemException.noClient(resourceType);
        }
        return client;
    }
    
    public Set<String> resourceTypes() {
        return clients.keySet();
    }
}
