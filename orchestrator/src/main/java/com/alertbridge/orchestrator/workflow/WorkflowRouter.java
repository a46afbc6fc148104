package com.alertbridge.orchestrator.workflow;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Transition table for the alert-to-ticket state machine.
 *
 * {@link #next} is a pure function of (current node, step outcome, state):
 * it reads the state but never mutates it, so the same inputs always pick
 * the same node. Both loops are bounded (inference by maxInferenceAttempts,
 * creation by the creator's retry budget), which is what makes
 * {@link #maxTransitions()} a hard ceiling on the length of a run.
 */
@Component
public class WorkflowRouter {

    private final int                    maxInferenceAttempts;
    private final int                    maxCreationRetries;
    private final IncompleteTicketPolicy incompletePolicy;

    @Autowired
    public WorkflowRouter(AlertBridgeProperties props) {
        this(props.inference().maxAttempts(),
                props.creation().maxRetries(),
                props.inference().incompletePolicy());
    }

    public WorkflowRouter(int maxInferenceAttempts,
                          int maxCreationRetries,
                          IncompleteTicketPolicy incompletePolicy) {
        this.maxInferenceAttempts = maxInferenceAttempts;
        this.maxCreationRetries   = maxCreationRetries;
        this.incompletePolicy     = incompletePolicy;
    }

    public WorkflowNode next(WorkflowNode current, StepOutcome outcome, WorkflowState state) {
        return switch (current) {
            case START -> WorkflowNode.VALIDATING;

            case VALIDATING -> switch (outcome) {
                case SUCCESS  -> WorkflowNode.EXTRACTING;
                case REJECTED -> WorkflowNode.REJECTED;
                default       -> WorkflowNode.FAILED;
            };

            case REJECTED -> WorkflowNode.FORMATTING;

            case EXTRACTING -> outcome == StepOutcome.SUCCESS
                    ? WorkflowNode.CHECKING_COMPLETENESS
                    : WorkflowNode.FAILED;

            case CHECKING_COMPLETENESS -> afterCompletenessCheck(outcome, state);

            // Unconditional loop-back: the attempt counter bounds the cycle.
            case INFERRING -> WorkflowNode.CHECKING_COMPLETENESS;

            case CREATING -> switch (outcome) {
                case SUCCESS -> WorkflowNode.VERIFYING;
                case RETRY   -> WorkflowNode.BACKOFF_WAITING;
                default      -> WorkflowNode.FAILED;
            };

            case BACKOFF_WAITING -> outcome == StepOutcome.SUCCESS
                    ? WorkflowNode.CREATING
                    : WorkflowNode.FAILED;

            // Verification problems are reported, never retried.
            case VERIFYING -> WorkflowNode.FORMATTING;

            case FAILED -> WorkflowNode.FORMATTING;

            case FORMATTING -> WorkflowNode.END;

            case END -> throw new IllegalStateException("END is terminal; no transition out of it");
        };
    }

    /**
     * Upper bound on node entries for any run:
     * validate + extract + (check, infer) pairs + final check
     * + (create, backoff) pairs + failed/verify + format + end.
     */
    public int maxTransitions() {
        return 8 + 2 * maxInferenceAttempts + 2 * maxCreationRetries;
    }

    public int maxInferenceAttempts()               { return maxInferenceAttempts; }
    public IncompleteTicketPolicy incompletePolicy() { return incompletePolicy; }

    private WorkflowNode afterCompletenessCheck(StepOutcome outcome, WorkflowState state) {
        if (outcome == StepOutcome.SUCCESS) {
            return WorkflowNode.CREATING;
        }
        if (outcome != StepOutcome.INCOMPLETE) {
            return WorkflowNode.FAILED;
        }
        if (state.getInferenceAttempts() < maxInferenceAttempts) {
            return WorkflowNode.INFERRING;
        }
        return incompletePolicy == IncompleteTicketPolicy.ABORT
                ? WorkflowNode.FAILED
                : WorkflowNode.CREATING;
    }
}
