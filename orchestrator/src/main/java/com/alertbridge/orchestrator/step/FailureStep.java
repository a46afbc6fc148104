package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point of every failure path.
 *
 * Most steps record their own error before failing. The one route that
 * arrives here without one is an incomplete ticket under the ABORT policy,
 * so that case is described from the ticket itself.
 */
@Component
public class FailureStep implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(FailureStep.class);

    private final CompletenessChecker completeness;

    public FailureStep(CompletenessChecker completeness) {
        this.completeness = completeness;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.FAILED;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        if (!state.hasError()) {
            state.setErrorMessage(describe(state));
        }
        log.warn("Run failed after {}: {}", state.getFurthestNode(), state.getErrorMessage());
        return StepOutcome.SUCCESS;
    }

    private String describe(WorkflowState state) {
        Set<TicketField> missing = completeness.missingFields(state.getTicketInfo());
        if (missing.isEmpty()) {
            return "Workflow failed at " + state.getFurthestNode();
        }
        String fields = missing.stream()
                .map(f -> f == TicketField.LABELS
                        ? "labels " + completeness.missingLabels(state.getTicketInfo())
                        : f.jsonName())
                .collect(Collectors.joining(", "));
        return "Ticket still incomplete after " + state.getInferenceAttempts()
                + " inference attempt(s); missing " + fields;
    }
}
