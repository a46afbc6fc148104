package com.alertbridge.orchestrator.ticket;

import java.util.List;

/**
 * Read-back view of an existing ticket, used to verify creation.
 */
public record TicketSnapshot(String key, String title, String status, List<String> labels) {

    public TicketSnapshot {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
