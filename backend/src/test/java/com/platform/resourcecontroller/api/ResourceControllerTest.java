package com.platform.resourcecontroller.api;

import com.platform.resourcecontroller.lateinit.tracker.CompletionTracker;
import com.platform.resourcecontroller.observability.MetricsRegistry;
import com.platform.resourcecontroller.persistence.DesiredRecordStore;
import com.platform.resourcecontroller.reconciliation.ReconciliationOrchestrator;
import com.platform.resourcecontroller.resource.DesiredRecord;
import com.platform.resourcecontroller.resource.ResourceIdentity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.platform.resourcecontroller.support.Json.obj;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ResourceController.class)
class ResourceControllerTest {
    
    private static final ResourceIdentity LOGS = ResourceIdentity.of("bucket", "logs");
    
    @Autowired
    private MockMvc mockMvc;
    
    @MockBean
    private DesiredRecordStore store;
    
    @MockBean
    private ReconciliationOrchestrator orchestrator;
    
    @MockBean
    private CompletionTracker completionTracker;
    
    @MockBean
    private MetricsRegistry metricsRegistry;
    
    @Test
    void putStoresSpecAndQueuesReconciliation() throws Exception {
        DesiredRecord saved = new DesiredRecord(LOGS, obj("{'region': 'eu-west-1'}"), null, null, 0L);
        when(store.save(any())).thenReturn(saved);

        mockMvc.perform(put("/api/resources/bucket/logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {\"region\": \"eu-west-1\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resourceType").value("bucket"))
            .andExpect(jsonPath("$.spec.region").value("eu-west-1"))
            .andExpect(jsonPath("$.lateInitPending").value(false));

        verify(orchestrator).enqueue(LOGS);
    }
    
    @Test
    void putAppliesUserAnnotations() throws Exception {
        DesiredRecord saved = new DesiredRecord(LOGS, obj("{}"), null, null, 0L);
        DesiredRecord annotated = new DesiredRecord(LOGS, obj("{}"), null, Map.of("team", "payments"), 1L);
        when(store.save(any())).thenReturn(saved);
        when(store.setAnnotation(LOGS, "team", "payments")).thenReturn(annotated);

        mockMvc.perform(put("/api/resources/bucket/logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {}, \"annotations\": {\"team\": \"payments\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.annotations.team").value("payments"))
            .andExpect(jsonPath("$.version").value(1));
    }
    
    @Test
    void putReplacesUserAnnotationsButKeepsMarker() throws Exception {
        DesiredRecord saved = new DesiredRecord(LOGS, obj("{}"), null,
            Map.of("team", "payments", CompletionTracker.PENDING_ANNOTATION, "true"), 3L);
        DesiredRecord unlabeled = new DesiredRecord(LOGS, obj("{}"), null,
            Map.of(CompletionTracker.PENDING_ANNOTATION, "true"), 4L);
        DesiredRecord relabeled = new DesiredRecord(LOGS, obj("{}"), null,
            Map.of("owner", "storage", CompletionTracker.PENDING_ANNOTATION, "true"), 5L);
        when(store.save(any())).thenReturn(saved);
        when(store.removeAnnotation(LOGS, "team")).thenReturn(unlabeled);
        when(store.setAnnotation(LOGS, "owner", "storage")).thenReturn(relabeled);

        mockMvc.perform(put("/api/resources/bucket/logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {}, \"annotations\": {\"owner\": \"storage\"}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.annotations.owner").value("storage"))
            .andExpect(jsonPath("$.annotations.team").doesNotExist())
            .andExpect(jsonPath("$.lateInitPending").value(true));

        verify(store).removeAnnotation(LOGS, "team");
        verify(store, never()).removeAnnotation(LOGS, CompletionTracker.PENDING_ANNOTATION);
    }
    
    @Test
    void putRejectsControllerManagedAnnotation() throws Exception {
        mockMvc.perform(put("/api/resources/bucket/logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"spec\": {}, \"annotations\": {\"" + CompletionTracker.PENDING_ANNOTATION + "\": \"true\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("RC-105"));

        verify(store, never()).save(any());
    }
    
    @Test
    void putWithoutSpecIsInvalid() throws Exception {
        mockMvc.perform(put("/api/resources/bucket/logs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"annotations\": {}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.fieldErrors[0].field").value("spec"));
    }
    
    @Test
    void getMissingResourceIs404() throws Exception {
        when(store.find(LOGS)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/resources/bucket/logs"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("RC-300"));
    }
    
    @Test
    void getShowsPendingMarker() throws Exception {
        DesiredRecord pending = new DesiredRecord(LOGS, obj("{}"), obj("{'phase': 'Creating'}"),
            Map.of(CompletionTracker.PENDING_ANNOTATION, "true"), 4L);
        when(store.find(LOGS)).thenReturn(Optional.of(pending));

        mockMvc.perform(get("/api/resources/bucket/logs"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status.phase").value("Creating"))
            .andExpect(jsonPath("$.lateInitPending").value(true));
    }
    
    @Test
    void pendingListsMarkedResources() throws Exception {
        when(store.findByAnnotation(CompletionTracker.PENDING_ANNOTATION)).thenReturn(List.of(LOGS));

        mockMvc.perform(get("/api/resources/pending"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("bucket/logs"));
    }
    
    @Test
    void deleteForgetsTrackerState() throws Exception {
        mockMvc.perform(delete("/api/resources/bucket/logs"))
            .andExpect(status().isNoContent());

        verify(store).delete(LOGS);
        verify(completionTracker).forget(LOGS);
    }
    
    @Test
    void reconcileIsQueued() throws Exception {
        when(store.find(LOGS)).thenReturn(Optional.of(DesiredRecord.of(LOGS, obj("{}"))));

        mockMvc.perform(post("/api/resources/bucket/logs/reconcile"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("queued"));

        verify(orchestrator).enqueue(LOGS);
    }
    
    @Test
    void reconcileOfMissingResourceIs404() throws Exception {
        when(store.find(LOGS)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/resources/bucket/logs/reconcile"))
            .andExpect(status().isNotFound());

        verify(orchestrator, never()).enqueue(any());
    }
}
