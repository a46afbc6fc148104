package com.alertbridge.orchestrator.extraction;

import com.alertbridge.orchestrator.model.TicketField;
import com.alertbridge.orchestrator.model.TicketInfo;

import java.util.EnumSet;
import java.util.Set;

/**
 * Input to {@link ExtractionService#extract}.
 *
 * partial == null means a full extraction; otherwise the service should only
 * fill in {@code missingFields} and may leave the others untouched.
 */
public record ExtractionRequest(String rawMessage, TicketInfo partial, Set<TicketField> missingFields) {

    public ExtractionRequest {
        rawMessage    = rawMessage == null ? "" : rawMessage;
        missingFields = missingFields == null || missingFields.isEmpty()
                ? Set.copyOf(EnumSet.allOf(TicketField.class))
                : Set.copyOf(missingFields);
    }

    public static ExtractionRequest full(String rawMessage) {
        return new ExtractionRequest(rawMessage, null, null);
    }

    public static ExtractionRequest fillMissing(String rawMessage, TicketInfo partial, Set<TicketField> missingFields) {
        return new ExtractionRequest(rawMessage, partial == null ? TicketInfo.empty() : partial, missingFields);
    }

    public boolean isFillMissing() {
        return partial != null;
    }
}
