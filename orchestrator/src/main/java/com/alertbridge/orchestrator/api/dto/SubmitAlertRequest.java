package com.alertbridge.orchestrator.api.dto;

/**
 * Request body for POST /alerts.
 *
 * Both fields are required: message is the alert text as posted to chat,
 * channel is the name of the channel it was posted in.
 */
public record SubmitAlertRequest(String message, String channel) {
}
