package com.alertbridge.orchestrator.extraction;

import com.alertbridge.orchestrator.extraction.ClaudeClient.ClaudeApiException;
import com.alertbridge.orchestrator.extraction.ClaudeClient.Message;
import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * {@link ExtractionService} backed by Claude.
 *
 * The model's reply is never trusted as-is: the JSON object is located with
 * {@link ResponseParser}, bound with Jackson, and checked against the ticket
 * schema before it becomes a {@link TicketInfo}. Anything that fails those
 * checks surfaces as {@link ExtractionException.Kind#MALFORMED}.
 */
public class ClaudeExtractionService implements ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ClaudeExtractionService.class);

    /** Raw shape of the model's answer, before schema checks. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtractedTicket(String title, String description, List<String> labels) {}

    private final ClaudeClient      claude;
    private final ExtractionPrompts prompts;
    private final ObjectMapper      objectMapper;
    private final String            model;

    public ClaudeExtractionService(ClaudeClient claude,
                                   ExtractionPrompts prompts,
                                   ObjectMapper objectMapper,
                                   String model) {
        this.claude       = claude;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.model        = model;
    }

    @Override
    public TicketInfo extract(ExtractionRequest request) {
        String reply;
        try {
            reply = claude.complete(model,
                    prompts.systemPrompt(request),
                    List.of(new Message("user", prompts.userPrompt(request))));
        } catch (ClaudeApiException e) {
            ExtractionException.Kind kind;
            if (e.isMalformedResponse()) {
                kind = ExtractionException.Kind.MALFORMED;
            } else if (e.isTimeout()) {
                kind = ExtractionException.Kind.TIMEOUT;
            } else {
                kind = ExtractionException.Kind.UNAVAILABLE;
            }
            throw new ExtractionException(kind, e.getMessage(), e);
        }
        TicketInfo info = parseTicket(reply, request);
        log.debug("Claude extraction ({}) produced title='{}' labels={}",
                request.isFillMissing() ? "fill-missing" : "full", info.title(), info.labels());
        return info;
    }

    /**
     * Validate the reply against the ticket schema.
     *
     * Full extraction needs all three keys; fill-missing only needs the keys
     * that were asked for. Present-but-empty values are allowed.
     */
    TicketInfo parseTicket(String reply, ExtractionRequest request) {
        String jsonText = ResponseParser.extractJsonObject(reply)
                .orElseThrow(() -> new ExtractionException(ExtractionException.Kind.MALFORMED,
                        "No JSON object in model reply"));

        ExtractedTicket raw;
        try {
            raw = objectMapper.readValue(jsonText, ExtractedTicket.class);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED,
                    "Model reply does not match the ticket schema: " + e.getOriginalMessage(), e);
        }
        if (raw == null) {
            throw new ExtractionException(ExtractionException.Kind.MALFORMED, "Model reply was JSON null");
        }

        for (TicketField field : request.missingFields()) {
            Object value = switch (field) {
                case TITLE       -> raw.title();
                case DESCRIPTION -> raw.description();
                case LABELS      -> raw.labels();
            };
            if (value == null) {
                throw new ExtractionException(ExtractionException.Kind.MALFORMED,
                        "Model reply is missing required field '" + field.jsonName() + "'");
            }
        }
        return TicketInfo.of(raw.title(), raw.description(), raw.labels());
    }
}
