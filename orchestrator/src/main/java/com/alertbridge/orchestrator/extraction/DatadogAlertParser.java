package com.alertbridge.orchestrator.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a Datadog monitor alert (as posted to Slack) into its parts.
 *
 * Expected shape:
 * <pre>
 *   Triggered: High number of errors in RUM on @issue.id:e1266418-...
 *   High number of errors on issue detected.
 *
 *   undefined is not an object : TypeError: undefined is not an object
 *     at executeTemplate @ capacitor://localhost/vendor.js:115793:15
 *     ...
 *   @slack-ServiceCore-servicecore-mobile-errors
 *
 *   The count of RUM errors ... was > 20 during the last 5m.
 * </pre>
 *
 * No I/O, no state.
 */
public final class DatadogAlertParser {

    static final int MAX_STACK_LINES = 20;

    private static final String ISSUE_MARKER = "@issue.id:";

    private DatadogAlertParser() {}

    public static ParsedAlert parse(String message) {
        if (message == null || message.isBlank()) {
            return new ParsedAlert("", "", List.of(), "");
        }
        String[] lines = message.strip().split("\\R");

        String issueId = "";
        int markerAt = lines[0].lastIndexOf(ISSUE_MARKER);
        if (markerAt >= 0) {
            issueId = lines[0].substring(markerAt + ISSUE_MARKER.length()).strip();
        }

        String       errorMessage = "";
        String       condition    = "";
        List<String> stack        = new ArrayList<>();
        boolean      inStack      = false;

        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) continue;

            if (line.startsWith("at ")) {
                inStack = true;
                if (stack.size() < MAX_STACK_LINES) stack.add(line);
            } else if (line.contains("was >") || line.contains("during the last")) {
                condition = line;
            } else if (!inStack && !line.startsWith("@slack-")) {
                // The first prose line is a summary; a later "Type: message" line is the real error.
                if (errorMessage.isEmpty()) {
                    errorMessage = line;
                } else if (line.contains(":") && stack.isEmpty()) {
                    errorMessage = line;
                }
            }
        }
        return new ParsedAlert(issueId, errorMessage, stack, condition);
    }
}
