package com.alertbridge.orchestrator.extraction;

import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts for the two extraction modes.
 *
 * Each system prompt tells the model:
 *   1. What it is extracting and for whom
 *   2. The ticket schema ({{SCHEMA}} is replaced at construction time)
 *   3. The label rules ({{LABELS}})
 *   4. To answer with a single JSON object inside <result>...</result>
 */
public class ExtractionPrompts {

    private static final String SCHEMA = """
              {
                "title":       "string, concise, at most 100 characters, names the error",
                "description": "string, the full error message, relevant stack trace and trigger condition",
                "labels":      ["string", ...]
              }""";

    private final String extractPrompt;
    private final String inferPrompt;

    public ExtractionPrompts(List<String> requiredLabels) {
        String labelRule = requiredLabels.isEmpty()
                ? "Labels must contain at least one category label describing the problem."
                : "Labels must always include " + requiredLabels.stream()
                        .map(l -> "'" + l + "'")
                        .collect(Collectors.joining(" and "))
                  + ", plus any other relevant labels.";
        this.extractPrompt = EXTRACT_PROMPT.replace("{{SCHEMA}}", SCHEMA).replace("{{LABELS}}", labelRule);
        this.inferPrompt   = INFER_PROMPT.replace("{{SCHEMA}}", SCHEMA).replace("{{LABELS}}", labelRule);
    }

    public String systemPrompt(ExtractionRequest request) {
        return request.isFillMissing() ? inferPrompt : extractPrompt;
    }

    /** The user turn: parsed alert parts up front, the raw text as the source of truth. */
    public String userPrompt(ExtractionRequest request) {
        ParsedAlert alert = DatadogAlertParser.parse(request.rawMessage());
        StringBuilder sb = new StringBuilder();

        if (request.isFillMissing()) {
            TicketInfo partial = request.partial();
            sb.append("Improve this ticket information.\n\n");
            sb.append("Current Title: ").append(partial.title()).append('\n');
            sb.append("Current Description: ").append(partial.description()).append('\n');
            sb.append("Current Labels: ").append(String.join(", ", partial.labels())).append("\n\n");
            sb.append("Missing or weak fields: ").append(request.missingFields().stream()
                    .map(TicketField::jsonName)
                    .sorted()
                    .collect(Collectors.joining(", "))).append("\n\n");
        } else {
            sb.append("Extract ticket information from this alert.\n\n");
        }

        sb.append("Issue ID: ").append(alert.issueId()).append('\n');
        sb.append("Error: ").append(alert.errorMessage()).append('\n');
        sb.append("Stack Trace:\n").append(alert.stackTraceText()).append("\n\n");
        sb.append("Condition: ").append(alert.condition()).append("\n\n");
        sb.append("Raw Message:\n").append(request.rawMessage());
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Prompt templates
    // ------------------------------------------------------------------

    private static final String EXTRACT_PROMPT = """
            You are a ticket extraction assistant. Extract Jira ticket information from
            Datadog error alerts posted to Slack.

            RULES:
              - The title should be concise (max 100 chars) and describe the error.
              - The description should include the full error message, the relevant stack
                trace and the trigger condition, formatted with these sections:
                  ## Error
                  ## Stack Trace
                  ## Trigger Condition
              - {{LABELS}}
              - If a field cannot be determined from the alert, return it empty. Never invent
                stack frames or identifiers that are not in the alert.

            WHAT TO PRODUCE:
            Write exactly one JSON object inside <result>...</result> with this schema:
            {{SCHEMA}}
            """;

    private static final String INFER_PROMPT = """
            You are a ticket completion assistant. A ticket was extracted from a Datadog
            alert but some fields are missing or weak. Fill them in from the raw alert.

            RULES:
              - Only change the fields listed as missing or weak; copy the others unchanged.
              - If the title is weak, write a more descriptive one from the error message.
              - If the description is incomplete, add structure and the relevant details.
              - {{LABELS}}
              - Base every inference on the raw message.

            WHAT TO PRODUCE:
            Write exactly one JSON object inside <result>...</result> with this schema:
            {{SCHEMA}}
            """;
}
