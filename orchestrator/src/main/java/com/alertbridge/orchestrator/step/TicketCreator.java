package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.ticket.CreatedTicket;
import com.alertbridge.orchestrator.ticket.TicketSystemClient;
import com.alertbridge.orchestrator.ticket.TicketSystemException;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Files the ticket.
 *
 * retry_count counts failed transient attempts. After a transient failure
 * the run backs off and comes back here with the same ticket, until the
 * count reaches maxRetries; at that point the run fails. Permanent failures
 * fail straight away and leave retry_count alone.
 */
@Component
public class TicketCreator implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(TicketCreator.class);

    private final TicketSystemClient tickets;
    private final int                maxRetries;
    private final MeterRegistry      meterRegistry;

    @Autowired
    public TicketCreator(TicketSystemClient tickets, AlertBridgeProperties props, MeterRegistry meterRegistry) {
        this(tickets, props.creation().maxRetries(), meterRegistry);
    }

    public TicketCreator(TicketSystemClient tickets, int maxRetries, MeterRegistry meterRegistry) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1, got " + maxRetries);
        }
        this.tickets       = tickets;
        this.maxRetries    = maxRetries;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.CREATING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        CreatedTicket created;
        try {
            created = tickets.create(state.getTicketInfo());
        } catch (TicketSystemException e) {
            return handleFailure(state, e);
        }

        count("success");
        state.recordCreatedTicket(created.key(), created.url());
        state.clearError();
        log.info("Created ticket {} ({}) after {} failed attempt(s)",
                created.key(), created.url(), state.getRetryCount());
        return StepOutcome.SUCCESS;
    }

    private StepOutcome handleFailure(WorkflowState state, TicketSystemException e) {
        if (!e.isTransient()) {
            count("permanent");
            log.error("Ticket creation rejected: {}", e.getMessage());
            state.setErrorMessage("Ticket creation failed: " + e.getMessage());
            return StepOutcome.FAILED;
        }

        count("transient");
        state.incrementRetryCount();
        if (state.getRetryCount() < maxRetries) {
            log.warn("Ticket creation attempt {} failed, will retry: {}", state.getRetryCount(), e.getMessage());
            state.setErrorMessage(e.getMessage());
            return StepOutcome.RETRY;
        }

        log.error("Ticket creation failed after {} attempts: {}", state.getRetryCount(), e.getMessage());
        state.setErrorMessage("Ticket creation failed after " + state.getRetryCount()
                + " attempts: " + e.getMessage());
        return StepOutcome.FAILED;
    }

    private void count(String result) {
        meterRegistry.counter("alertbridge.ticket.create.attempts", "result", result).increment();
    }
}
