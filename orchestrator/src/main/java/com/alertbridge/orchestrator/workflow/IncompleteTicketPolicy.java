package com.alertbridge.orchestrator.workflow;

/**
 * What to do when the ticket is still incomplete after the last inference attempt.
 */
public enum IncompleteTicketPolicy {
    CREATE_PARTIAL, // file whatever was extracted
    ABORT           // fail the run and report the missing fields
}
