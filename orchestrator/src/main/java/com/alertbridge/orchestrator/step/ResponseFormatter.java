package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Writes the single human-readable reply for the run.
 *
 * Three shapes: rejection, success (with a warning line if the ticket could
 * not be read back), and failure.
 */
@Component
public class ResponseFormatter implements WorkflowStep {

    private final String expectedChannel;

    @Autowired
    public ResponseFormatter(AlertBridgeProperties props) {
        this(props.source().channel());
    }

    public ResponseFormatter(String expectedChannel) {
        this.expectedChannel = expectedChannel;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.FORMATTING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        state.setFinalResponse(format(state));
        return StepOutcome.SUCCESS;
    }

    public String format(WorkflowState state) {
        if (state.isRejected()) {
            return "Message rejected: Source '" + state.getSource().label()
                    + "' from channel '" + state.getChannel() + "' is not valid. "
                    + "Only Datadog messages from '" + expectedChannel + "' channel are processed.";
        }
        if (state.hasTicket()) {
            StringBuilder sb = new StringBuilder("JIRA ticket created successfully!\n\n")
                    .append("Ticket: ").append(state.getJiraTicketId()).append('\n')
                    .append("URL: ").append(state.getJiraTicketUrl()).append('\n')
                    .append("Title: ").append(state.getTicketInfo().title()).append('\n')
                    .append("Labels: ").append(String.join(", ", state.getTicketInfo().labels()));
            if (state.hasError()) {
                sb.append("\n\nWarning: ").append(state.getErrorMessage());
            }
            return sb.toString();
        }
        String error = state.hasError() ? state.getErrorMessage() : "unknown error";
        return "Failed to create ticket: " + error
                + "\n(stopped at " + state.getFurthestNode() + ")";
    }
}
