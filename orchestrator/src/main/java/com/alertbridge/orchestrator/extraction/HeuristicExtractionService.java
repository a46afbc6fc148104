package com.alertbridge.orchestrator.extraction;

import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Deterministic extraction built on {@link DatadogAlertParser} alone.
 *
 * Used when no language model is configured (local runs, demos, tests):
 *   title       ← the typed error line ("TypeError: ..."), capped at 100 chars
 *   description ← Error / Stack Trace / Trigger Condition sections
 *   labels      ← the configured default labels
 *
 * In fill-missing mode only the requested fields are replaced.
 */
public class HeuristicExtractionService implements ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(HeuristicExtractionService.class);

    static final int MAX_TITLE_LENGTH = 100;

    private final List<String> defaultLabels;

    public HeuristicExtractionService(List<String> defaultLabels) {
        this.defaultLabels = List.copyOf(defaultLabels);
    }

    @Override
    public TicketInfo extract(ExtractionRequest request) {
        ParsedAlert alert = DatadogAlertParser.parse(request.rawMessage());
        TicketInfo derived = TicketInfo.of(title(alert), description(alert), defaultLabels);

        if (!request.isFillMissing()) {
            log.debug("Heuristic extraction for issue '{}': title='{}'", alert.issueId(), derived.title());
            return derived;
        }

        TicketInfo merged = request.partial();
        if (request.missingFields().contains(TicketField.TITLE)) {
            merged = merged.withTitle(derived.title());
        }
        if (request.missingFields().contains(TicketField.DESCRIPTION)) {
            merged = merged.withDescription(derived.description());
        }
        if (request.missingFields().contains(TicketField.LABELS)) {
            merged = merged.withAddedLabels(derived.labels());
        }
        return merged;
    }

    static String title(ParsedAlert alert) {
        String error = alert.errorMessage();
        // Datadog repeats the message as "<message> : <Type>: <message>"; the typed half reads better.
        int split = error.indexOf(" : ");
        String title = split >= 0 ? error.substring(split + 3).strip() : error;
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH - 3).stripTrailing() + "...";
        }
        return title;
    }

    static String description(ParsedAlert alert) {
        if (alert.errorMessage().isEmpty() && alert.stackTrace().isEmpty() && alert.condition().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (!alert.issueId().isEmpty()) {
            sb.append("Datadog issue: ").append(alert.issueId()).append("\n\n");
        }
        sb.append("## Error\n").append(alert.errorMessage()).append("\n\n");
        sb.append("## Stack Trace\n")
          .append(alert.stackTrace().isEmpty() ? "(none captured)" : alert.stackTraceText())
          .append("\n\n");
        sb.append("## Trigger Condition\n")
          .append(alert.condition().isEmpty() ? "(not reported)" : alert.condition());
        return sb.toString();
    }
}
