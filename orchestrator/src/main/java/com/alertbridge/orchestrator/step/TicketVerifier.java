package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.ticket.TicketSnapshot;
import com.alertbridge.orchestrator.ticket.TicketSystemClient;
import com.alertbridge.orchestrator.ticket.TicketSystemException;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the new ticket back from the tracker.
 *
 * A miss is reported through error_message only. The ticket is never
 * created a second time.
 */
@Component
public class TicketVerifier implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(TicketVerifier.class);

    private final TicketSystemClient tickets;

    public TicketVerifier(TicketSystemClient tickets) {
        this.tickets = tickets;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.VERIFYING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        String key = state.getJiraTicketId();
        Optional<TicketSnapshot> found;
        try {
            found = tickets.find(key);
        } catch (TicketSystemException e) {
            log.warn("Could not verify ticket {}: {}", key, e.getMessage());
            state.setErrorMessage("Ticket verification failed for " + key + ": " + e.getMessage());
            return StepOutcome.FAILED;
        }

        if (found.isEmpty()) {
            log.warn("Ticket {} was created but cannot be found", key);
            state.setErrorMessage("Ticket verification failed - ticket " + key + " not found");
            return StepOutcome.FAILED;
        }
        state.markVerified();
        log.debug("Verified ticket {} (status {})", key, found.get().status());
        return StepOutcome.SUCCESS;
    }
}
