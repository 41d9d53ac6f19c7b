package com.platform.schedulerjob.api;

import com.platform.schedulerjob.document.JobSpecReader;
import com.platform.schedulerjob.document.JobSpecWriter;
import com.platform.schedulerjob.error.ErrorCode;
import com.platform.schedulerjob.error.GlobalExceptionHandler;
import com.platform.schedulerjob.error.RemoteServiceException;
import com.platform.schedulerjob.error.ValidationException;
import com.platform.schedulerjob.error.ValidationException.FieldViolation;
import com.platform.schedulerjob.model.JobSpec;
import com.platform.schedulerjob.observability.MetricsRegistry;
import com.platform.schedulerjob.reconciliation.JobReconciler;
import com.platform.schedulerjob.reconciliation.ObservedJob;
import com.platform.schedulerjob.resource.JobResourceId;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {
    
    private static final JobResourceId ID = JobResourceId.of("sub-1", "rg-jobs", "collection-1", "nightly");
    
    private static final String DOCUMENT = """
        {
          "name": "nightly",
          "resource_group_name": "rg-jobs",
          "job_collection_name": "collection-1",
          "action_web": {
            "url": "https://example.com/run",
            "method": "Post",
            "authentication_basic": {"username": "ops", "password": "hunter2"}
          }
        }
        """;
    
    @Mock
    private JobReconciler reconciler;
    
    private MockMvc mockMvc;
    
    @BeforeEach
    void setUp() {
        JobController controller = new JobController(
            reconciler,
            new JobSpecReader(Validation.buildDefaultValidatorFactory().getValidator()),
            new JobSpecWriter());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new MetricsRegistry(new SimpleMeterRegistry())))
            .build();
    }
    
    @Test
    void applyReturnsTheObservedJob() throws Exception {
        when(reconciler.apply(any())).thenAnswer(call -> new ObservedJob(ID, call.getArgument(0)));
        
        mockMvc.perform(put("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(DOCUMENT))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(ID.format()))
            .andExpect(jsonPath("$.action_web.method").value("Post"))
            .andExpect(jsonPath("$.action_web.authentication_basic.username").value("ops"))
            .andExpect(jsonPath("$.action_web.authentication_basic.password").value(""));
        
        ArgumentCaptor<JobSpec> applied = ArgumentCaptor.forClass(JobSpec.class);
        verify(reconciler).apply(applied.capture());
        assertThat(applied.getValue().name()).isEqualTo("nightly");
    }
    
    @Test
    void invalidDocumentIsRejectedWithFieldErrors() throws Exception {
        String document = """
            {
              "name": "nightly",
              "resource_group_name": "rg-jobs",
              "action_web": {"url": "ftp://example.com", "method": "Get"}
            }
            """;
        
        mockMvc.perform(put("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(document))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("SJ-100"))
            .andExpect(jsonPath("$.fieldErrors[?(@.field == 'job_collection_name')]").exists())
            .andExpect(jsonPath("$.fieldErrors[?(@.field == 'action_web.url')]").exists());
        
        verifyNoInteractions(reconciler);
    }
    
    @Test
    void preconditionFailureIsUnprocessable() throws Exception {
        when(reconciler.apply(any())).thenThrow(new ValidationException(
            ErrorCode.RECONCILIATION_PRECONDITION_FAILED,
            List.of(FieldViolation.of("recurrence", "either 'count' or 'end_time' must be set"))));
        
        mockMvc.perform(put("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(DOCUMENT))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.code").value("SJ-110"))
            .andExpect(jsonPath("$.fieldErrors[0].field").value("recurrence"));
    }
    
    @Test
    void missingSubscriptionIsAFatalServerError() throws Exception {
        when(reconciler.apply(any())).thenThrow(new ValidationException(
            ErrorCode.CONFIGURATION_ERROR, "scheduler.azure.subscription-id is not configured"));
        
        mockMvc.perform(put("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(DOCUMENT))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("SJ-902"))
            .andExpect(jsonPath("$.fatal").value(true));
    }
    
    @Test
    void remoteRejectionIsBadGateway() throws Exception {
        when(reconciler.apply(any())).thenThrow(
            RemoteServiceException.rejected("create/update", "nightly", 409, "{\"error\":\"conflict\"}"));
        
        mockMvc.perform(put("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(DOCUMENT))
            .andExpect(status().isBadGateway())
            .andExpect(jsonPath("$.code").value("SJ-402"));
    }
    
    @Test
    void readOfGoneJobIsNotFound() throws Exception {
        when(reconciler.read(ID.format())).thenReturn(Optional.empty());
        
        mockMvc.perform(get("/api/jobs").param("id", ID.format()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.code").value("SJ-301"));
    }
    
    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/jobs").param("id", ID.format()))
            .andExpect(status().isNoContent());
        
        verify(reconciler).delete(ID.format());
    }
    
    @Test
    void missingIdParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/jobs"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value("SJ-102"));
    }
}
