package com.alertbridge.orchestrator.model;

/**
 * Monitoring tool an inbound message was recognised as coming from.
 */
public enum AlertSource {
    DATADOG,
    UNKNOWN;

    public String label() {
        return name().toLowerCase();
    }
}
