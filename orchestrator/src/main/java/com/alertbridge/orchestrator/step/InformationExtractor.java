package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.extraction.ExtractionException;
import com.alertbridge.orchestrator.extraction.ExtractionRequest;
import com.alertbridge.orchestrator.extraction.ExtractionService;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * First pass over the alert: title, description and labels in one call.
 *
 * Runs exactly once per run. Empty fields are fine here; the completeness
 * check and inference deal with them. A failed extraction call is fatal.
 */
@Component
public class InformationExtractor implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(InformationExtractor.class);

    private final ExtractionService extraction;

    public InformationExtractor(ExtractionService extraction) {
        this.extraction = extraction;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.EXTRACTING;
    }

    @Override
    public StepOutcome apply(WorkflowState state) {
        TicketInfo info;
        try {
            info = extraction.extract(ExtractionRequest.full(state.getRawMessage()));
        } catch (ExtractionException e) {
            log.warn("Extraction failed ({}): {}", e.getKind(), e.getMessage());
            state.setErrorMessage("Extraction failed: " + e.getMessage());
            return StepOutcome.FAILED;
        }
        state.setTicketInfo(info);
        log.info("Extracted ticket: title='{}' labels={}", info.title(), info.labels());
        return StepOutcome.SUCCESS;
    }
}
