package com.alertbridge.orchestrator.extraction;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The pieces of a monitoring alert that matter for a ticket.
 * Any component may be empty when the alert does not carry it.
 */
public record ParsedAlert(String issueId,
                          String errorMessage,
                          List<String> stackTrace,
                          String condition) {

    // "TypeError", "NullPointerException", "NetworkError", ...
    private static final Pattern ERROR_TYPE = Pattern.compile("\\b([A-Z][A-Za-z]*(?:Error|Exception))\\b");

    public ParsedAlert {
        issueId      = issueId == null ? "" : issueId;
        errorMessage = errorMessage == null ? "" : errorMessage;
        stackTrace   = stackTrace == null ? List.of() : List.copyOf(stackTrace);
        condition    = condition == null ? "" : condition;
    }

    /** The exception class named in the error line, or "" if there is none. */
    public String errorType() {
        Matcher m = ERROR_TYPE.matcher(errorMessage);
        return m.find() ? m.group(1) : "";
    }

    public String stackTraceText() {
        return String.join("\n", stackTrace);
    }
}
