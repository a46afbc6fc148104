package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.extraction.ExtractionException;
import com.alertbridge.orchestrator.extraction.ExtractionRequest;
import com.alertbridge.orchestrator.extraction.ExtractionService;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Second chance for an incomplete ticket: ask the extraction service to fill
 * in only what is missing.
 *
 * The attempt counter moves on every call, success or not. Fields the ticket
 * already has are never overwritten, and labels only ever grow. A failed call
 * leaves the ticket as it was; the completeness check runs again either way.
 */
@Component
public class InferenceEngine implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(InferenceEngine.class);

    private final ExtractionService   extraction;
    private final CompletenessChecker completeness;

    public InferenceEngine(ExtractionService extraction, CompletenessChecker completeness) {
        this.extraction   = extraction;
        this.completeness = completeness;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.INFERRING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        state.incrementInferenceAttempts();
        TicketInfo current = state.getTicketInfo();
        Set<TicketField> missing = completeness.missingFields(current);

        TicketInfo inferred;
        try {
            inferred = extraction.extract(
                    ExtractionRequest.fillMissing(state.getRawMessage(), current, missing));
        } catch (ExtractionException e) {
            log.warn("Inference attempt {} failed ({}); keeping ticket as is: {}",
                    state.getInferenceAttempts(), e.getKind(), e.getMessage());
            return StepOutcome.SUCCESS;
        }

        TicketInfo merged = merge(current, inferred, missing);
        state.setTicketInfo(merged);
        log.info("Inference attempt {} for {}: title='{}' labels={}",
                state.getInferenceAttempts(), missing, merged.title(), merged.labels());
        return StepOutcome.SUCCESS;
    }

    static TicketInfo merge(TicketInfo current, TicketInfo inferred, Set<TicketField> missing) {
        TicketInfo merged = current;
        if (missing.contains(TicketField.TITLE) && inferred.hasTitle()) {
            merged = merged.withTitle(inferred.title());
        }
        if (missing.contains(TicketField.DESCRIPTION) && inferred.hasDescription()) {
            merged = merged.withDescription(inferred.description());
        }
        return merged.withAddedLabels(inferred.labels());
    }
}
