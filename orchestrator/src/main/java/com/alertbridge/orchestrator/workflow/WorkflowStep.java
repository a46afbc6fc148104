package com.alertbridge.orchestrator.workflow;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;

/**
 * One node's worth of work in the alert-to-ticket run.
 *
 * A step reads and updates the run's {@link WorkflowState} and reports a
 * {@link StepOutcome}; it never decides which node comes next; that is the
 * router's job. Fatal conditions are recorded into error_message and reported
 * as {@link StepOutcome#FAILED} rather than thrown.
 */
public interface WorkflowStep {

    /** The node this step executes. */
    WorkflowNode node();

    StepOutcome apply(WorkflowState state);
}
