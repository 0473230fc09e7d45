package com.platform.resourcecontroller.reconciliation.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.resourcecontroller.error.OwningSystemException;
import com.platform.resourcecontroller.reconciliation.ResourceClient;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.SourceMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Resource client for owning systems exposing a JSON collection:
 * <ul>
 *   <li>{@code GET {baseUrl}/{name}} reads, 404 meaning "does not exist"</li>
 *   <li>{@code POST {baseUrl}} creates from {@code {"name", "spec"}}</li>
 *   <li>{@code PUT {baseUrl}/{name}} updates from {@code {"spec"}}</li>
 * </ul>
 * Every call answers with {@code {"spec": {...}, "status": {...}}}.
 */
@Slf4j
public class HttpResourceClient implements ResourceClient {
    
    private final String resourceType;
    private final String baseUrl;
    private final RestTemplate restTemplate;
    private final HttpHeaders headers;
    
    public HttpResourceClient(String resourceType, OwningSystemProperties.Endpoint endpoint, RestTemplate restTemplate) {
        this.resourceType = resourceType;
        this.baseUrl = stripTrailingSlash(endpoint.getBaseUrl());
        this.restTemplate = restTemplate;
        this.headers = new HttpHeaders();
        this.headers.setContentType(MediaType.APPLICATION_JSON);
        this.headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isEmpty()) {
            this.headers.setBearerAuth(endpoint.getApiKey());
        }
    }
    
    @Override
    public String resourceType() {
        return resourceType;
    }
    
    @Override
    public Optional<ObservedRecord> read(DesiredRecord desired) {
        String name = desired.getIdentity().name();
        try {
            ObjectNode body = restTemplate.exchange(baseUrl + "/{name}", HttpMethod.GET,
                new HttpEntity<>(headers), ObjectNode.class, name).getBody();
            return Optional.of(toObserved(SourceMethod.READ, body));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("{}/{} does not exist in owning system", resourceType, name);
            return Optional.empty();
        } catch (RestClientException e) {
            throw failure("read", e);
        }
    }
    
    @Override
    public ObservedRecord create(DesiredRecord desired) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.put("name", desired.getIdentity().name());
        request.set("spec", desired.getSpec().deepCopy());
        try {
            ObjectNode body = restTemplate.exchange(baseUrl, HttpMethod.POST,
                new HttpEntity<>(request, headers), ObjectNode.class).getBody();
            return toObserved(SourceMethod.CREATE, body);
        } catch (RestClientException e) {
            throw failure("create", e);
        }
    }
    
    @Override
    public ObservedRecord update(DesiredRecord desired, ObservedRecord latest) {
        ObjectNode request = JsonNodeFactory.instance.objectNode();
        request.set("spec", desired.getSpec().deepCopy());
        try {
            ObjectNode body = restTemplate.exchange(baseUrl + "/{name}", HttpMethod.PUT,
                new HttpEntity<>(request, headers), ObjectNode.class, desired.getIdentity().name()).getBody();
            return toObserved(SourceMethod.UPDATE, body);
        } catch (RestClientException e) {
            throw failure("update", e);
        }
    }
    
    private ObservedRecord toObserved(SourceMethod method, ObjectNode body) {
        if (body == null) {
            throw new OwningSystemException(resourceType, method.name().toLowerCase(), "empty response body");
        }
        return new ObservedRecord(method, objectOrNull(body.get("spec")), objectOrNull(body.get("status")));
    }
    
    private OwningSystemException failure(String operation, RestClientException e) {
        String message = e instanceof HttpStatusCodeException status
            ? "HTTP " + status.getStatusCode().value() + " from " + baseUrl
            : e.getMessage();
        return new OwningSystemException(resourceType, operation, message, e);
    }
    
    private static ObjectNode objectOrNull(JsonNode node) {
        return node instanceof ObjectNode object ? object : null;
    }
    
    private static String stripTrailingSlash(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("base-url is required");
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
