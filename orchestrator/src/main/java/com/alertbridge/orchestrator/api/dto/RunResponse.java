package com.alertbridge.orchestrator.api.dto;

import com.alertbridge.orchestrator.model.WorkflowState;

import java.util.UUID;

/**
 * Response body for POST /alerts: the terminal state of one run.
 * ticketId and ticketUrl are empty unless a ticket was created.
 */
public record RunResponse(
        UUID    runId,
        String  finalResponse,
        String  ticketId,
        String  ticketUrl,
        String  errorMessage,
        boolean validSource,
        boolean complete,
        int     inferenceAttempts,
        int     retryCount,
        boolean verified
) {
    public static RunResponse from(WorkflowState s) {
        return new RunResponse(
                s.getRunId(),
                s.getFinalResponse(),
                s.getJiraTicketId(),
                s.getJiraTicketUrl(),
                s.getErrorMessage(),
                s.isValidSource(),
                s.isComplete(),
                s.getInferenceAttempts(),
                s.getRetryCount(),
                s.isVerified()
        );
    }
}
