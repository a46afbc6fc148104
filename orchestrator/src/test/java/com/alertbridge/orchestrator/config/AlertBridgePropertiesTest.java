package com.alertbridge.orchestrator.config;

import com.alertbridge.orchestrator.workflow.IncompleteTicketPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertBridgePropertiesTest {

    @Test
    void defaults_matchDocumentedValues() {
        AlertBridgeProperties props = AlertBridgeProperties.defaults();

        assertThat(props.source().channel()).isEqualTo("servicecore-mobile-errors");
        assertThat(props.source().markers())
                .containsExactly("Triggered:", "@issue.id:", "RUM errors", "@slack-ServiceCore");
        assertThat(props.completeness().requiredLabels()).containsExactly("bug", "mobile");
        assertThat(props.inference().maxAttempts()).isEqualTo(2);
        assertThat(props.inference().incompletePolicy()).isEqualTo(IncompleteTicketPolicy.CREATE_PARTIAL);
        assertThat(props.creation().maxRetries()).isEqualTo(5);
        assertThat(props.creation().backoffBase()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.creation().backoffCap()).isEqualTo(Duration.ofSeconds(16));
        assertThat(props.extraction().provider()).isEqualTo("heuristic");
        assertThat(props.ticketSystem().provider()).isEqualTo("in-memory");
    }

    @Test
    void creation_capBelowBase_failsFast() {
        assertThatThrownBy(() -> new AlertBridgeProperties.Creation(
                        5, Duration.ofSeconds(10), Duration.ofSeconds(1), null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("backoff");
    }

    @Test
    void creation_zeroRetries_failsFast() {
        assertThatThrownBy(() -> new AlertBridgeProperties.Creation(0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-retries");
    }

    @Test
    void ticketSystem_failureRateOutsideUnitInterval_failsFast() {
        assertThatThrownBy(() -> new AlertBridgeProperties.TicketSystem(null, null, null, null, null, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void completeness_emptyListIsKept() {
        assertThat(new AlertBridgeProperties.Completeness(List.of()).requiredLabels()).isEmpty();
    }
}
