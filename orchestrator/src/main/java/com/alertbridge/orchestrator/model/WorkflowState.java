package com.alertbridge.orchestrator.model;

import java.util.UUID;

/**
 * The per-run record threaded through every workflow step.
 *
 * One instance is created per inbound alert and is owned by exactly one
 * {@code TicketingOrchestrator.run(...)} invocation for its whole lifetime;
 * it is never shared between runs, so it carries no synchronisation.
 *
 * Only raw_message and channel are populated at construction. Counters only
 * move forward, and final_response can be written once, by the formatter,
 * as the last mutation before the run ends.
 */
public class WorkflowState {

    private final UUID   runId;
    private final String rawMessage;
    private final String channel;

    // Set by SourceValidator.
    private AlertSource source = AlertSource.UNKNOWN;
    private boolean     validSource;

    // Set by InformationExtractor, refined by InferenceEngine.
    private TicketInfo ticketInfo = TicketInfo.empty();
    private boolean    complete;
    private int        inferenceAttempts;

    // Set by TicketCreator / TicketVerifier.
    private String  jiraTicketId  = "";
    private String  jiraTicketUrl = "";
    private int     retryCount;
    private boolean verified;

    private String       errorMessage  = "";
    private String       finalResponse = "";
    private WorkflowNode furthestNode  = WorkflowNode.START;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public WorkflowState(String rawMessage, String channel) {
        this(UUID.randomUUID(), rawMessage, channel);
    }

    public WorkflowState(UUID runId, String rawMessage, String channel) {
        this.runId      = runId;
        this.rawMessage = rawMessage == null ? "" : rawMessage;
        this.channel    = channel == null ? "" : channel;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID         getRunId()             { return runId; }
    public String       getRawMessage()        { return rawMessage; }
    public String       getChannel()           { return channel; }
    public AlertSource  getSource()            { return source; }
    public boolean      isValidSource()        { return validSource; }
    public TicketInfo   getTicketInfo()        { return ticketInfo; }
    public boolean      isComplete()           { return complete; }
    public int          getInferenceAttempts() { return inferenceAttempts; }
    public String       getJiraTicketId()      { return jiraTicketId; }
    public String       getJiraTicketUrl()     { return jiraTicketUrl; }
    public int          getRetryCount()        { return retryCount; }
    public boolean      isVerified()           { return verified; }
    public String       getErrorMessage()      { return errorMessage; }
    public String       getFinalResponse()     { return finalResponse; }
    public WorkflowNode getFurthestNode()      { return furthestNode; }

    public boolean hasTicket()        { return !jiraTicketId.isEmpty(); }
    public boolean hasError()         { return !errorMessage.isEmpty(); }
    public boolean isTerminal()       { return !finalResponse.isEmpty(); }
    public boolean isRejected()       { return furthestNode == WorkflowNode.REJECTED; }

    // ------------------------------------------------------------------
    // Mutators: each step only touches the fields it owns
    // ------------------------------------------------------------------

    public void recordSourceValidation(AlertSource source, boolean validSource) {
        this.source      = source == null ? AlertSource.UNKNOWN : source;
        this.validSource = validSource;
    }

    public void setTicketInfo(TicketInfo ticketInfo) {
        this.ticketInfo = ticketInfo == null ? TicketInfo.empty() : ticketInfo;
    }

    public void setComplete(boolean complete) { this.complete = complete; }

    public void incrementInferenceAttempts() { this.inferenceAttempts++; }

    public void incrementRetryCount() { this.retryCount++; }

    public void recordCreatedTicket(String ticketId, String ticketUrl) {
        if (ticketId == null || ticketId.isBlank()) {
            throw new IllegalArgumentException("Created ticket must have an id");
        }
        this.jiraTicketId  = ticketId;
        this.jiraTicketUrl = ticketUrl == null ? "" : ticketUrl;
    }

    public void markVerified() { this.verified = true; }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public void clearError() { this.errorMessage = ""; }

    public void enter(WorkflowNode node) {
        // FAILED, FORMATTING and END are bookkeeping nodes; furthest_node reports where the work stopped.
        if (node != WorkflowNode.FAILED && node != WorkflowNode.FORMATTING && node != WorkflowNode.END) {
            this.furthestNode = node;
        }
    }

    public void setFinalResponse(String finalResponse) {
        if (isTerminal()) {
            throw new IllegalStateException("final_response already set for run " + runId);
        }
        if (finalResponse == null || finalResponse.isBlank()) {
            throw new IllegalArgumentException("final_response must not be empty");
        }
        this.finalResponse = finalResponse;
    }
}
