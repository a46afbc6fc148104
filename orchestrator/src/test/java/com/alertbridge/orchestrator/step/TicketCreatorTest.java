package com.alertbridge.orchestrator.step;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.alertbridge.orchestrator.model.WorkflowState;
import com.alertbridge.orchestrator.ticket.CreatedTicket;
import com.alertbridge.orchestrator.ticket.TicketSystemClient;
import com.alertbridge.orchestrator.ticket.TicketSystemException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TicketCreatorTest {

    @Mock TicketSystemClient tickets;

    SimpleMeterRegistry meters;
    TicketCreator       creator;
    WorkflowState       state;

    @BeforeEach
    void setUp() {
        meters  = new SimpleMeterRegistry();
        creator = new TicketCreator(tickets, 3, meters);
        state   = new WorkflowState("raw", "chan");
        state.setTicketInfo(TicketInfo.of("Crash", "Details", List.of("bug", "mobile")));
    }

    @Test
    void apply_success_recordsKeyAndUrl() {
        when(tickets.create(state.getTicketInfo()))
                .thenReturn(new CreatedTicket("10001", "MOBILE-1", "https://jira.example.com/browse/MOBILE-1"));

        assertThat(creator.apply(state)).isEqualTo(StepOutcome.SUCCESS);
        assertThat(state.getJiraTicketId()).isEqualTo("MOBILE-1");
        assertThat(state.getJiraTicketUrl()).isEqualTo("https://jira.example.com/browse/MOBILE-1");
        assertThat(meters.counter("alertbridge.ticket.create.attempts", "result", "success").count()).isEqualTo(1.0);
    }

    @Test
    void apply_successAfterTransient_clearsError() {
        state.setErrorMessage("[TRANSIENT] HTTP 502");
        when(tickets.create(any())).thenReturn(new CreatedTicket("1", "MOBILE-2", "u"));

        creator.apply(state);

        assertThat(state.hasError()).isFalse();
    }

    @Test
    void apply_transientWithBudget_asksForRetry() {
        when(tickets.create(any()))
                .thenThrow(new TicketSystemException(TicketSystemException.Kind.TRANSIENT, "HTTP 503"));

        assertThat(creator.apply(state)).isEqualTo(StepOutcome.RETRY);
        assertThat(state.getRetryCount()).isEqualTo(1);
        assertThat(state.getErrorMessage()).contains("HTTP 503");
        assertThat(state.hasTicket()).isFalse();
    }

    @Test
    void apply_transientAtBudget_fails() {
        when(tickets.create(any()))
                .thenThrow(new TicketSystemException(TicketSystemException.Kind.TRANSIENT, "HTTP 503"));

        assertThat(creator.apply(state)).isEqualTo(StepOutcome.RETRY);
        assertThat(creator.apply(state)).isEqualTo(StepOutcome.RETRY);
        assertThat(creator.apply(state)).isEqualTo(StepOutcome.FAILED);

        assertThat(state.getRetryCount()).isEqualTo(3);
        assertThat(state.getErrorMessage()).startsWith("Ticket creation failed after 3 attempts:");
    }

    @Test
    void apply_permanent_failsWithoutCountingRetry() {
        when(tickets.create(any()))
                .thenThrow(new TicketSystemException(TicketSystemException.Kind.PERMANENT, 400, "HTTP 400", null));

        assertThat(creator.apply(state)).isEqualTo(StepOutcome.FAILED);
        assertThat(state.getRetryCount()).isZero();
        assertThat(state.getErrorMessage()).startsWith("Ticket creation failed:");
        assertThat(meters.counter("alertbridge.ticket.create.attempts", "result", "permanent").count()).isEqualTo(1.0);
    }

    @Test
    void constructor_zeroRetries_rejected() {
        assertThatThrownBy(() -> new TicketCreator(tickets, 0, meters))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
