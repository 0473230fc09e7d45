package com.platform.resourcecontroller;

import com.platform.resourcecontroller.lateinit.patch.PatchPlan;
import com.platform.resourcecontroller.reconciliation.PassOutcome;
import com.platform.resourcecontroller.reconciliation.ReconciliationOrchestrator;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import com.platform.resourcecontroller.support.FakeResourceClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static com.platform.resourcecontroller.support.Json.obj;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "resource-controller.late-init.resources.function.operations=create,read,update",
    "resource-controller.late-init.resources.function.fields[0].path=timeoutSeconds",
    "resource-controller.late-init.resources.function.fields[0].source-method=create",
    "resource-controller.late-init.resources.function.schema.timeoutSeconds=integer",
    "resource-controller.late-init.resources.function.schema.runtime=string required"
})
@AutoConfigureMockMvc
class ResourceControllerApplicationTest {
    
    @TestConfiguration
    static class OwningSystems {
        
        @Bean
        FakeResourceClient functionClient() {
            return new FakeResourceClient("function").withServerDefaults(obj("{'timeoutSeconds': 30}"));
        }
    }
    
    @Autowired
    private MockMvc mockMvc;
    
    @Autowired
    private ReconciliationOrchestrator orchestrator;
    
    @Test
    void putThenReconcileLateInitializesServerDefault() throws Exception {
        mockMvc.perform(put("/api/resources/function/checkout")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {\"runtime\": \"java17\"}}"))
            .andExpect(status().isOk());
        
        PassOutcome first = orchestrator.reconcileOnce(ResourceIdentity.of("function", "checkout"));
        PassOutcome second = orchestrator.reconcileOnce(ResourceIdentity.of("function", "checkout"));
        
        assertThat(first.patchPlan()).isEqualTo(PatchPlan.SPEC_AND_STATUS);
        assertThat(second.patchPlan()).isEqualTo(PatchPlan.NONE);
        mockMvc.perform(get("/api/resources/function/checkout"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.spec.runtime").value("java17"))
            .andExpect(jsonPath("$.spec.timeoutSeconds").value(30))
            .andExpect(jsonPath("$.lateInitPending").value(false));
    }
    
    @Test
    void userSuppliedValueIsKept() throws Exception {
        mockMvc.perform(put("/api/resources/function/billing")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {\"runtime\": \"java17\", \"timeoutSeconds\": 5}}"))
            .andExpect(status().isOk());
        
        orchestrator.reconcileOnce(ResourceIdentity.of("function", "billing"));
        
        mockMvc.perform(get("/api/resources/function/billing"))
            .andExpect(jsonPath("$.spec.timeoutSeconds").value(5));
    }
}
