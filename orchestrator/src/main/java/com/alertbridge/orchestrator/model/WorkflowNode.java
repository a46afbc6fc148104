package com.alertbridge.orchestrator.model;

/**
 * Nodes of the alert-to-ticket state machine.
 *
 * Transitions (happy path):
 *   START → VALIDATING → EXTRACTING → CHECKING_COMPLETENESS → CREATING
 *         → VERIFYING → FORMATTING → END
 *
 * Loops:
 *   CHECKING_COMPLETENESS ⇄ INFERRING     (bounded by inference attempts)
 *   CREATING → BACKOFF_WAITING → CREATING (bounded by creation retries)
 *
 * Early exits:
 *   VALIDATING → REJECTED → FORMATTING
 *   any fatal step → FAILED → FORMATTING
 *
 * END is the only terminal node.
 */
public enum WorkflowNode {
    START,
    VALIDATING,
    REJECTED,
    EXTRACTING,
    CHECKING_COMPLETENESS,
    INFERRING,
    CREATING,
    BACKOFF_WAITING,
    FAILED,
    VERIFYING,
    FORMATTING,
    END
}
