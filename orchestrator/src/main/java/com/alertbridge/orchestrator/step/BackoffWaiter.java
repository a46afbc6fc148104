package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.config.AlertBridgeProperties;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.BackoffPolicy;
import com.alertbridge.orchestrator.workflow.Sleeper;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Sleeps between creation attempts; the delay grows with retry_count. */
@Component
public class BackoffWaiter implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(BackoffWaiter.class);

    private final BackoffPolicy policy;
    private final Sleeper       sleeper;

    @Autowired
    public BackoffWaiter(AlertBridgeProperties props, Sleeper sleeper) {
        this(new BackoffPolicy(props.creation().backoffBase(), props.creation().backoffCap()), sleeper);
    }

    public BackoffWaiter(BackoffPolicy policy, Sleeper sleeper) {
        this.policy  = policy;
        this.sleeper = sleeper;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.BACKOFF_WAITING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        Duration delay = policy.delayFor(Math.max(1, state.getRetryCount()));
        log.info("Backing off {} ms before creation attempt {}", delay.toMillis(), state.getRetryCount() + 1);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while backing off after {} failed attempt(s)", state.getRetryCount());
            state.setErrorMessage("Interrupted while waiting to retry ticket creation (last error: "
                    + state.getErrorMessage() + ")");
            return StepOutcome.FAILED;
        }
        return StepOutcome.SUCCESS;
    }
}
