package com.platform.resourcecontroller.reconciliation.http;

import com.platform.resourcecontroller.error.OwningSystemException;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ObservedRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import com.platform.resourcecontroller.resource.SourceMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static com.platform.resourcecontroller.support.Json.obj;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpResourceClientTest {
    
    private static final String BASE_URL = "http://functions.local/api/functions";
    
    private MockRestServiceServer server;
    private HttpResourceClient client;
    private final DesiredRecord checkout =
        DesiredRecord.of(ResourceIdentity.of("function", "checkout"), obj("{'runtime': 'java17'}"));
    
    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        OwningSystemProperties.Endpoint endpoint = new OwningSystemProperties.Endpoint();
        endpoint.setBaseUrl(BASE_URL + "/");
        endpoint.setApiKey("s3cret");
        client = new HttpResourceClient("function", endpoint, restTemplate);
    }
    
    @Test
    void readReturnsSpecAndStatus() {
        server.expect(requestTo(BASE_URL + "/checkout"))
            .andExpect(method(HttpMethod.GET))
            .andExpect(header("Authorization", "Bearer s3cret"))
            .andRespond(withSuccess(
                "{\"spec\": {\"runtime\": \"java17\", \"timeoutSeconds\": 30}, \"status\": {\"state\": \"Active\"}}",
                MediaType.APPLICATION_JSON));
        
        Optional<ObservedRecord> observed = client.read(checkout);
        
        assertThat(observed).isPresent();
        assertThat(observed.get().origin()).isEqualTo(SourceMethod.READ);
        assertThat(observed.get().spec().get("timeoutSeconds").asInt()).isEqualTo(30);
        assertThat(observed.get().status().get("state").asText()).isEqualTo("Active");
        server.verify();
    }
    
    @Test
    void readOfMissingResourceIsEmpty() {
        server.expect(requestTo(BASE_URL + "/checkout"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));
        
        assertThat(client.read(checkout)).isEmpty();
    }
    
    @Test
    void createPostsNameAndSpec() {
        server.expect(requestTo(BASE_URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(content().json("{\"name\": \"checkout\", \"spec\": {\"runtime\": \"java17\"}}"))
            .andRespond(withSuccess("{\"spec\": {\"runtime\": \"java17\", \"memoryMb\": 128}}",
                MediaType.APPLICATION_JSON));
        
        ObservedRecord created = client.create(checkout);
        
        assertThat(created.origin()).isEqualTo(SourceMethod.CREATE);
        assertThat(created.spec().get("memoryMb").asInt()).isEqualTo(128);
        assertThat(created.status().isEmpty()).isTrue();
        server.verify();
    }
    
    @Test
    void updatePutsSpec() {
        server.expect(requestTo(BASE_URL + "/checkout"))
            .andExpect(method(HttpMethod.PUT))
            .andExpect(content().json("{\"spec\": {\"runtime\": \"java17\"}}"))
            .andRespond(withSuccess("{\"spec\": {\"runtime\": \"java17\"}}", MediaType.APPLICATION_JSON));
        
        ObservedRecord updated = client.update(checkout, ObservedRecord.of(SourceMethod.READ, obj("{'runtime': 'java11'}")));
        
        assertThat(updated.origin()).isEqualTo(SourceMethod.UPDATE);
        server.verify();
    }
    
    @Test
    void serverErrorBecomesOwningSystemFailure() {
        server.expect(requestTo(BASE_URL))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        
        assertThatThrownBy(() -> client.create(checkout))
            .isInstanceOf(OwningSystemException.class)
            .hasMessageContaining("HTTP 503")
            .satisfies(e -> assertThat(((OwningSystemException) e).getOperation()).isEqualTo("create"));
    }
}
