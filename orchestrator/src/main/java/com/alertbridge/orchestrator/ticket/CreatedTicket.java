package com.alertbridge.orchestrator.ticket;

/**
 * What the tracker hands back after a successful create.
 *
 * @param id  tracker-internal numeric id
 * @param key human-facing key, e.g. "MOBILE-1001"; the workflow reports this one
 * @param url browse URL for the ticket
 */
public record CreatedTicket(String id, String key, String url) {
}
