package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether the ticket is good enough to file.
 *
 * Complete means a non-blank title, a non-blank description and every
 * required label present. With no required labels configured, any single
 * label will do.
 */
@Component
public class CompletenessChecker implements WorkflowStep {

    private final List<String> requiredLabels;

    @Autowired
    public CompletenessChecker(AlertBridgeProperties props) {
        this(props.completeness().requiredLabels());
    }

    public CompletenessChecker(List<String> requiredLabels) {
        this.requiredLabels = requiredLabels.stream()
                .map(l -> l.strip().toLowerCase(Locale.ROOT))
                .filter(l -> !l.isEmpty())
                .toList();
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.CHECKING_COMPLETENESS;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        boolean complete = isComplete(state.getTicketInfo());
        state.setComplete(complete);
        return complete ? StepOutcome.SUCCESS : StepOutcome.INCOMPLETE;
    }

    public boolean isComplete(TicketInfo ticket) {
        return missingFields(ticket).isEmpty();
    }

    public Set<TicketField> missingFields(TicketInfo ticket) {
        Set<TicketField> missing = EnumSet.noneOf(TicketField.class);
        if (!ticket.hasTitle())       missing.add(TicketField.TITLE);
        if (!ticket.hasDescription()) missing.add(TicketField.DESCRIPTION);
        if (!labelsSatisfied(ticket)) missing.add(TicketField.LABELS);
        return missing;
    }

    /** Required labels the ticket does not carry yet. */
    public List<String> missingLabels(TicketInfo ticket) {
        return requiredLabels.stream()
                .filter(l -> !ticket.hasLabel(l))
                .toList();
    }

    private boolean labelsSatisfied(TicketInfo ticket) {
        if (requiredLabels.isEmpty()) {
            return ticket.hasLabels();
        }
        return missingLabels(ticket).isEmpty();
    }
}
