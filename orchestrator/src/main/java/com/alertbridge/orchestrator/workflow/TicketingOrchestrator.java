package com.alertbridge.orchestrator.workflow;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives one alert through the state machine, from START to END.
 *
 * For a given (raw_message, channel) pair, this class:
 *   1. Creates a fresh {@link WorkflowState} owned by this invocation only
 *   2. Asks the {@link WorkflowRouter} for the next node
 *   3. Runs the {@link WorkflowStep} registered for that node
 *   4. Repeats until the router reaches END
 *
 * A run never throws: a step that blows up is recorded into error_message
 * and the run is routed to FAILED → FORMATTING, and the transition ceiling
 * turns a would-be infinite loop into a failure. The caller always gets back
 * a state with a non-empty final_response.
 *
 * The orchestrator itself is stateless between runs, so any number of
 * threads may call {@link #run} concurrently.
 */
@Component
public class TicketingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TicketingOrchestrator.class);

    // Nodes that are pure routing markers and have no step behind them.
    private static final Set<WorkflowNode> ROUTING_ONLY = EnumSet.of(WorkflowNode.START, WorkflowNode.END);

    private final Map<WorkflowNode, WorkflowStep> steps = new EnumMap<>(WorkflowNode.class);
    private final WorkflowRouter router;
    private final MeterRegistry  meterRegistry;

    public TicketingOrchestrator(List<WorkflowStep> allSteps,
                                 WorkflowRouter router,
                                 MeterRegistry meterRegistry) {
        this.router        = router;
        this.meterRegistry = meterRegistry;
        for (WorkflowStep step : allSteps) {
            WorkflowStep previous = steps.put(step.node(), step);
            if (previous != null) {
                throw new IllegalStateException("Two steps registered for node " + step.node()
                        + ": " + previous.getClass().getSimpleName() + " and " + step.getClass().getSimpleName());
            }
        }
        for (WorkflowNode node : WorkflowNode.values()) {
            if (!ROUTING_ONLY.contains(node) && !steps.containsKey(node)) {
                throw new IllegalStateException("No step registered for node " + node);
            }
        }
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run the full workflow for one inbound message.
     *
     * Blocks until the run reaches END. Suspends only on the extraction,
     * creation and verification calls and on the backoff wait.
     *
     * @return the terminal state; final_response is always populated
     */
    public WorkflowState run(String rawMessage, String channel) {
        WorkflowState state = new WorkflowState(rawMessage, channel);

        MDC.put("runId",   state.getRunId().toString());
        MDC.put("channel", state.getChannel());
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.info("Starting run {} for message on channel '{}'", state.getRunId(), state.getChannel());
            drive(state);
            if (!state.isTerminal()) {
                // Only reachable if the formatter itself failed.
                state.setFinalResponse("Failed to create ticket: " + describeError(state));
            }
            String outcome = outcomeTag(state);
            meterRegistry.counter("alertbridge.runs", "outcome", outcome).increment();
            log.info("Run {} finished: outcome={} ticket={} inferenceAttempts={} retries={}",
                    state.getRunId(), outcome, state.getJiraTicketId(),
                    state.getInferenceAttempts(), state.getRetryCount());
            return state;
        } finally {
            sample.stop(meterRegistry.timer("alertbridge.run.duration"));
            // Request threads are pooled; never leak run context to the next request.
            MDC.remove("runId");
            MDC.remove("channel");
            MDC.remove("node");
        }
    }

    // ------------------------------------------------------------------
    // State machine loop
    // ------------------------------------------------------------------

    private void drive(WorkflowState state) {
        int ceiling     = router.maxTransitions();
        int transitions = 0;
        WorkflowNode node = router.next(WorkflowNode.START, StepOutcome.SUCCESS, state);

        while (node != WorkflowNode.END) {
            if (++transitions > ceiling && node != WorkflowNode.FAILED && node != WorkflowNode.FORMATTING) {
                log.error("Run {} exceeded {} transitions at node {}; forcing failure",
                        state.getRunId(), ceiling, node);
                state.setErrorMessage("Workflow exceeded " + ceiling + " transitions at " + node);
                node = WorkflowNode.FAILED;
            }

            state.enter(node);
            MDC.put("node", node.name());

            StepOutcome outcome;
            try {
                outcome = steps.get(node).apply(state);
            } catch (RuntimeException e) {
                log.error("Unhandled error in node {} for run {}: {}", node, state.getRunId(), e.getMessage(), e);
                state.setErrorMessage("Unexpected error during " + node + ": " + e.getMessage());
                node = escalate(node);
                continue;
            }

            WorkflowNode next = router.next(node, outcome, state);
            log.debug("{} --{}--> {}", node, outcome, next);
            node = next;
        }
    }

    /** Where to go after a step threw instead of reporting an outcome. */
    private static WorkflowNode escalate(WorkflowNode failedAt) {
        return switch (failedAt) {
            case FORMATTING -> WorkflowNode.END;
            case FAILED     -> WorkflowNode.FORMATTING;
            // Inference never aborts a run; the attempt counter still bounds the loop.
            case INFERRING  -> WorkflowNode.CHECKING_COMPLETENESS;
            default         -> WorkflowNode.FAILED;
        };
    }

    private static String outcomeTag(WorkflowState state) {
        if (state.isRejected()) return "rejected";
        return state.hasTicket() ? "created" : "failed";
    }

    private static String describeError(WorkflowState state) {
        return state.hasError() ? state.getErrorMessage() : "unknown error at " + state.getFurthestNode();
    }
}
