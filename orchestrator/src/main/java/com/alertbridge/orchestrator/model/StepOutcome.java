package com.alertbridge.orchestrator.model;

/**
 * What a single step reports back to the router.
 *
 * The router combines the outcome with the current node (and, for the
 * completeness check, the attempt counter) to pick the next node.
 */
public enum StepOutcome {
    SUCCESS,    // step did its job; follow the normal edge
    REJECTED,   // message is not from the monitored source/channel
    INCOMPLETE, // ticket fields still missing after the completeness check
    RETRY,      // transient creation failure with retry budget left
    FAILED      // fatal for this run; error_message has been recorded
}
