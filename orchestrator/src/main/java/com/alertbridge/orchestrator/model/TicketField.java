package com.alertbridge.orchestrator.model;

/**
 * Ticket fields the completeness check can report as missing.
 */
public enum TicketField {
    TITLE,
    DESCRIPTION,
    LABELS;

    public String jsonName() {
        return name().toLowerCase();
    }
}
