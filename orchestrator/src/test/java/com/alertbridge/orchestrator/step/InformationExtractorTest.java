package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.extraction.ExtractionException;
import com.alertbridge.orchestrator.extraction.ExtractionRequest;
import com.alertbridge.orchestrator.extraction.ExtractionService;
import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InformationExtractorTest {

    @Mock ExtractionService extraction;

    @Test
    void apply_success_storesNormalisedTicket() {
        when(extraction.extract(any())).thenReturn(
                TicketInfo.of("  Crash on launch ", "Details", List.of("Bug", "bug", " Mobile")));
        WorkflowState state = new WorkflowState("raw alert", "chan");

        StepOutcome outcome = new InformationExtractor(extraction).apply(state);

        assertThat(outcome).isEqualTo(StepOutcome.SUCCESS);
        assertThat(state.getTicketInfo().title()).isEqualTo("Crash on launch");
        assertThat(state.getTicketInfo().labels()).containsExactly("bug", "mobile");

        ArgumentCaptor<ExtractionRequest> captor = ArgumentCaptor.forClass(ExtractionRequest.class);
        verify(extraction).extract(captor.capture());
        assertThat(captor.getValue().isFillMissing()).isFalse();
        assertThat(captor.getValue().rawMessage()).isEqualTo("raw alert");
    }

    @Test
    void apply_emptyFields_isNotAFailure() {
        when(extraction.extract(any())).thenReturn(TicketInfo.empty());
        WorkflowState state = new WorkflowState("raw alert", "chan");

        assertThat(new InformationExtractor(extraction).apply(state)).isEqualTo(StepOutcome.SUCCESS);
        assertThat(state.hasError()).isFalse();
    }

    @Test
    void apply_malformedReply_failsWithError() {
        when(extraction.extract(any()))
                .thenThrow(new ExtractionException(ExtractionException.Kind.MALFORMED, "No JSON object in model reply"));
        WorkflowState state = new WorkflowState("raw alert", "chan");

        StepOutcome outcome = new InformationExtractor(extraction).apply(state);

        assertThat(outcome).isEqualTo(StepOutcome.FAILED);
        assertThat(state.getErrorMessage()).isEqualTo("Extraction failed: [MALFORMED] No JSON object in model reply");
        assertThat(state.getTicketInfo()).isEqualTo(TicketInfo.empty());
    }
}
