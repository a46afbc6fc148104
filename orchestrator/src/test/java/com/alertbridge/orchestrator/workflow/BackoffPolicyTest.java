package com.alertbridge.orchestrator.workflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(16));

    @Test
    void delayFor_doublesFromBase() {
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void delayFor_neverExceedsCap() {
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.delayFor(64)).isEqualTo(Duration.ofSeconds(16));
        assertThat(policy.delayFor(Integer.MAX_VALUE)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void delayFor_zeroRetries_rejected() {
        assertThatThrownBy(() -> policy.delayFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_capBelowBase_rejected() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("base <= cap");
    }

    @Test
    void zeroBase_alwaysZero() {
        BackoffPolicy none = new BackoffPolicy(Duration.ZERO, Duration.ZERO);
        assertThat(none.delayFor(3)).isEqualTo(Duration.ZERO);
    }
}
