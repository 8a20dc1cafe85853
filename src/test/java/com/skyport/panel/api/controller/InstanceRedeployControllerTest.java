package com.skyport.panel.api.controller;

import com.skyport.panel.api.model.AdminIdentity;
import com.skyport.panel.api.model.AuditAction;
import com.skyport.panel.api.model.AuditEvent;
import com.skyport.panel.api.model.RedeployRequest;
import com.skyport.panel.api.model.RedeployResult;
import com.skyport.panel.api.service.AuditRecorder;
import com.skyport.panel.api.service.HeaderAdminIdentityResolver;
import com.skyport.panel.api.service.RedeployFailureKind;
import com.skyport.panel.api.service.RedeployRequestValidator;
import com.skyport.panel.api.service.RedeploymentException;
import com.skyport.panel.api.service.RedeploymentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.Map;

import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InstanceRedeployController.class)
@Import({RedeployRequestValidator.class, HeaderAdminIdentityResolver.class})
class InstanceRedeployControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RedeploymentService redeploymentService;

    @MockitoBean
    private AuditRecorder auditRecorder;

    private static MockHttpServletRequestBuilder redeployRequest(String instanceId) {
        return get("/instances/redeploy/{id}", instanceId)
                .header("X-User-Id", "admin-1")
                .header("X-Username", "root")
                .header("X-User-Admin", "true")
                .param("image", "Node 20 (ghcr.io/skyport/node:20)")
                .param("memory", "512abc")
                .param("cpu", "2")
                .param("ports", "80:8080,443:8443")
                .param("name", "web")
                .param("user", "user-1")
                .param("primary", "true");
    }

    @Test
    @DisplayName("GET /instances/redeploy/{id} returns 201 with the new container")
    void redeploySucceeds() throws Exception {
        when(redeploymentService.redeploy(any(), anyString(), any()))
                .thenReturn(new RedeployResult("c2", "v1", "inst-1"));

        mockMvc.perform(redeployRequest("inst-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Container redeployed successfully"))
                .andExpect(jsonPath("$.data.containerId").value("c2"))
                .andExpect(jsonPath("$.data.volumeId").value("v1"))
                .andExpect(jsonPath("$.data.instanceId").value("inst-1"));

        ArgumentCaptor<RedeployRequest> request = ArgumentCaptor.forClass(RedeployRequest.class);
        verify(redeploymentService).redeploy(eq(new AdminIdentity("admin-1", "root", true)), eq("127.0.0.1"), request.capture());
        assertEquals(512, request.getValue().memory());
        assertEquals("user-1", request.getValue().userId());
    }

    @Test
    void nonAdminIsForbiddenAndAudited() throws Exception {
        mockMvc.perform(get("/instances/redeploy/inst-1").header("X-User-Id", "user-7"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("Admin privileges required"));

        ArgumentCaptor<AuditEvent> event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditRecorder).record(event.capture());
        assertEquals(AuditAction.UNAUTHORIZED_ADMIN_ACCESS, event.getValue().action());
        assertEquals("user-7", event.getValue().userId());
        verifyNoInteractions(redeploymentService);
    }

    @Test
    void missingParametersAreListed() throws Exception {
        mockMvc.perform(get("/instances/redeploy/inst-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Admin", "true")
                        .param("image", "Node (x)")
                        .param("cpu", "1")
                        .param("name", "web"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing required parameters"))
                .andExpect(jsonPath("$.missing", contains("memory", "ports", "user", "primary")));

        verifyNoInteractions(redeploymentService, auditRecorder);
    }

    @Test
    void malformedPortsAreRejected() throws Exception {
        mockMvc.perform(get("/instances/redeploy/inst-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Admin", "true")
                        .param("image", "Node (x)")
                        .param("memory", "512")
                        .param("cpu", "1")
                        .param("ports", "80-8080")
                        .param("name", "web")
                        .param("user", "user-1")
                        .param("primary", "false"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid port format"));

        verifyNoInteractions(redeploymentService);
    }

    @Test
    void missingInstanceIdIsRejected() throws Exception {
        mockMvc.perform(get("/instances/redeploy")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Admin", "true"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("missing_instance_id"));
    }

    @Test
    void unknownInstanceIs404() throws Exception {
        when(redeploymentService.redeploy(any(), anyString(), any()))
                .thenThrow(new RedeploymentException(RedeployFailureKind.NOT_FOUND, "Instance not found"));

        mockMvc.perform(redeployRequest("inst-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Instance not found"));
    }

    @Test
    void containerCheckFailureIs400WithDetails() throws Exception {
        when(redeploymentService.redeploy(any(), anyString(), any()))
                .thenThrow(new RedeploymentException(RedeployFailureKind.PRECONDITION_FAILED, "Container check failed",
                        "The existing container could not be verified"));

        mockMvc.perform(redeployRequest("inst-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Container check failed"))
                .andExpect(jsonPath("$.details").value("The existing container could not be verified"));
    }

    @Test
    void upstreamFailureUsesGenericEnvelope() throws Exception {
        when(redeploymentService.redeploy(any(), anyString(), any()))
                .thenThrow(new RedeploymentException(RedeployFailureKind.UPSTREAM_ERROR, "node redeploy failed: HTTP 502",
                        Map.of("status", 502, "data", "bad gateway")));

        mockMvc.perform(redeployRequest("inst-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Instance redeployment failed"))
                .andExpect(jsonPath("$.details.status").value(502))
                .andExpect(jsonPath("$.details.data").value("bad gateway"))
                .andExpect(jsonPath("$.suggestion").value("Check logs for more details and try again"));
    }

    @Test
    void unexpectedExceptionIsReportedAsRedeploymentFailure() throws Exception {
        when(redeploymentService.redeploy(any(), anyString(), any()))
                .thenThrow(new IllegalStateException("stored value under key instances is not readable"));

        mockMvc.perform(redeployRequest("inst-1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Instance redeployment failed"))
                .andExpect(jsonPath("$.details.message").value("stored value under key instances is not readable"));
    }
}
