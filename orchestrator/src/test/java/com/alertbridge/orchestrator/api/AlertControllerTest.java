package com.alertbridge.orchestrator.api;

import com.alertbridge.orchestrator.model.AlertSource;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.TicketingOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for AlertController.
 *
 * Only the web layer is started; the orchestrator is a mock.
 */
@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TicketingOrchestrator orchestrator;

    @Test
    void submit_createdTicket_returns200WithTicket() throws Exception {
        WorkflowState state = new WorkflowState("alert", "servicecore-mobile-errors");
        state.recordSourceValidation(AlertSource.DATADOG, true);
        state.setTicketInfo(TicketInfo.of("Crash", "Details", List.of("bug", "mobile")));
        state.setComplete(true);
        state.recordCreatedTicket("MOBILE-1001", "https://jira.example.com/browse/MOBILE-1001");
        state.markVerified();
        state.setFinalResponse("JIRA ticket created successfully!");
        when(orchestrator.run("alert", "servicecore-mobile-errors")).thenReturn(state);

        mockMvc.perform(post("/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"alert","channel":"servicecore-mobile-errors"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(state.getRunId().toString()))
                .andExpect(jsonPath("$.ticketId").value("MOBILE-1001"))
                .andExpect(jsonPath("$.ticketUrl").value("https://jira.example.com/browse/MOBILE-1001"))
                .andExpect(jsonPath("$.validSource").value(true))
                .andExpect(jsonPath("$.complete").value(true))
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.retryCount").value(0))
                .andExpect(jsonPath("$.finalResponse").value("JIRA ticket created successfully!"));
    }

    @Test
    void submit_rejectedMessage_stillReturns200() throws Exception {
        WorkflowState state = new WorkflowState("hi", "random");
        state.recordSourceValidation(AlertSource.UNKNOWN, false);
        state.enter(WorkflowNode.REJECTED);
        state.setErrorMessage("Invalid source");
        state.setFinalResponse("Message rejected: Source 'unknown' from channel 'random' is not valid.");
        when(orchestrator.run(any(), any())).thenReturn(state);

        mockMvc.perform(post("/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"hi","channel":"random"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validSource").value(false))
                .andExpect(jsonPath("$.ticketId").value(""))
                .andExpect(jsonPath("$.errorMessage").value("Invalid source"));
    }

    @Test
    void submit_missingChannel_returns400() throws Exception {
        mockMvc.perform(post("/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"Triggered: something"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void submit_blankMessage_returns400() throws Exception {
        mockMvc.perform(post("/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"  ","channel":"servicecore-mobile-errors"}
                                """))
                .andExpect(status().isBadRequest());
    }
}
