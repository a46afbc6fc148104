package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.springframework.stereotype.Component;

/** Marks a message that failed source validation. No external calls. */
@Component
public class RejectionStep implements WorkflowStep {

    static final String INVALID_SOURCE = "Invalid source";

    @Override
    public WorkflowNode node() {
        return WorkflowNode.REJECTED;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        state.setErrorMessage(INVALID_SOURCE);
        return StepOutcome.SUCCESS;
    }
}
