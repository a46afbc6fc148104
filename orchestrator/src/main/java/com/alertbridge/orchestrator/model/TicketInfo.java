package com.alertbridge.orchestrator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Structured ticket fields extracted from an alert.
 *
 * Always normalised on construction: null text becomes "", text is trimmed,
 * labels are lower-cased, blank labels dropped and duplicates removed while
 * keeping first-seen order. A partially empty TicketInfo is a valid value;
 * the completeness check decides whether it is good enough to file.
 */
public record TicketInfo(String title, String description, Set<String> labels) {

    public TicketInfo {
        title       = title == null ? "" : title.strip();
        description = description == null ? "" : description.strip();
        labels      = normaliseLabels(labels);
    }

    public static TicketInfo empty() {
        return new TicketInfo("", "", Set.of());
    }

    public static TicketInfo of(String title, String description, Collection<String> labels) {
        return new TicketInfo(title, description, labels == null ? null : new LinkedHashSet<>(labels));
    }

    public boolean hasTitle()       { return !title.isEmpty(); }
    public boolean hasDescription() { return !description.isEmpty(); }
    public boolean hasLabels()      { return !labels.isEmpty(); }

    public boolean hasLabel(String label) {
        return label != null && labels.contains(label.strip().toLowerCase(Locale.ROOT));
    }

    public TicketInfo withTitle(String newTitle) {
        return new TicketInfo(newTitle, description, labels);
    }

    public TicketInfo withDescription(String newDescription) {
        return new TicketInfo(title, newDescription, labels);
    }

    /** Ordered union: existing labels first, then any new ones from {@code extra}. */
    public TicketInfo withAddedLabels(Collection<String> extra) {
        Set<String> merged = new LinkedHashSet<>(labels);
        if (extra != null) merged.addAll(extra);
        return new TicketInfo(title, description, merged);
    }

    private static Set<String> normaliseLabels(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String label : raw) {
            if (label == null) continue;
            String clean = label.strip().toLowerCase(Locale.ROOT);
            if (!clean.isEmpty()) out.add(clean);
        }
        return Collections.unmodifiableSet(out);
    }
}
