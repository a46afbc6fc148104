package com.alertbridge.orchestrator.workflow;

import com.alertbridge.orchestrator.model.StepOutcome;
import com.alertbridge.orchestrator.model.WorkflowNode;
import com.alertbridge.orchestrator.model.WorkflowState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowRouterTest {

    private final WorkflowRouter router = new WorkflowRouter(2, 5, IncompleteTicketPolicy.CREATE_PARTIAL);
    private final WorkflowState  state  = new WorkflowState("msg", "chan");

    @Test
    void start_goesToValidation() {
        assertThat(router.next(WorkflowNode.START, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.VALIDATING);
    }

    @Test
    void validation_rejected_goesThroughRejectionToFormatting() {
        assertThat(router.next(WorkflowNode.VALIDATING, StepOutcome.REJECTED, state)).isEqualTo(WorkflowNode.REJECTED);
        assertThat(router.next(WorkflowNode.REJECTED, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.FORMATTING);
    }

    @Test
    void extraction_failure_goesToFailed() {
        assertThat(router.next(WorkflowNode.EXTRACTING, StepOutcome.FAILED, state)).isEqualTo(WorkflowNode.FAILED);
        assertThat(router.next(WorkflowNode.FAILED, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.FORMATTING);
    }

    @Test
    void incomplete_withAttemptsLeft_goesToInference() {
        assertThat(router.next(WorkflowNode.CHECKING_COMPLETENESS, StepOutcome.INCOMPLETE, state))
                .isEqualTo(WorkflowNode.INFERRING);
        assertThat(router.next(WorkflowNode.INFERRING, StepOutcome.SUCCESS, state))
                .isEqualTo(WorkflowNode.CHECKING_COMPLETENESS);
    }

    @Test
    void incomplete_attemptsExhausted_createsPartialTicket() {
        state.incrementInferenceAttempts();
        state.incrementInferenceAttempts();

        assertThat(router.next(WorkflowNode.CHECKING_COMPLETENESS, StepOutcome.INCOMPLETE, state))
                .isEqualTo(WorkflowNode.CREATING);
    }

    @Test
    void incomplete_attemptsExhausted_abortPolicy_fails() {
        WorkflowRouter strict = new WorkflowRouter(2, 5, IncompleteTicketPolicy.ABORT);
        state.incrementInferenceAttempts();
        state.incrementInferenceAttempts();

        assertThat(strict.next(WorkflowNode.CHECKING_COMPLETENESS, StepOutcome.INCOMPLETE, state))
                .isEqualTo(WorkflowNode.FAILED);
    }

    @Test
    void creation_outcomes() {
        assertThat(router.next(WorkflowNode.CREATING, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.VERIFYING);
        assertThat(router.next(WorkflowNode.CREATING, StepOutcome.RETRY, state)).isEqualTo(WorkflowNode.BACKOFF_WAITING);
        assertThat(router.next(WorkflowNode.CREATING, StepOutcome.FAILED, state)).isEqualTo(WorkflowNode.FAILED);
        assertThat(router.next(WorkflowNode.BACKOFF_WAITING, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.CREATING);
        assertThat(router.next(WorkflowNode.BACKOFF_WAITING, StepOutcome.FAILED, state)).isEqualTo(WorkflowNode.FAILED);
    }

    @Test
    void verification_alwaysGoesToFormatting() {
        assertThat(router.next(WorkflowNode.VERIFYING, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.FORMATTING);
        assertThat(router.next(WorkflowNode.VERIFYING, StepOutcome.FAILED, state)).isEqualTo(WorkflowNode.FORMATTING);
        assertThat(router.next(WorkflowNode.FORMATTING, StepOutcome.SUCCESS, state)).isEqualTo(WorkflowNode.END);
    }

    @Test
    void end_hasNoSuccessor() {
        assertThatThrownBy(() -> router.next(WorkflowNode.END, StepOutcome.SUCCESS, state))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void next_doesNotMutateState() {
        router.next(WorkflowNode.CHECKING_COMPLETENESS, StepOutcome.INCOMPLETE, state);

        assertThat(state.getInferenceAttempts()).isZero();
        assertThat(state.getFurthestNode()).isEqualTo(WorkflowNode.START);
    }

    @Test
    void maxTransitions_coversLongestPath() {
        // validate, extract, 3 checks, 2 inferences, 5 creates, 4 backoffs, failed, format
        int longest = 1 + 1 + 3 + 2 + 5 + 4 + 1 + 1;
        assertThat(router.maxTransitions()).isGreaterThanOrEqualTo(longest);
    }
}
