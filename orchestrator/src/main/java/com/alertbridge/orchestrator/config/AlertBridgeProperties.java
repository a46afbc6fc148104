package com.alertbridge.orchestrator.config;

import com.alertbridge.orchestrator.workflow.IncompleteTicketPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * All tunables for the alert-to-ticket workflow, bound from the
 * {@code alertbridge.*} section of application.yml.
 *
 * Values are read once at startup and never change for the lifetime of the
 * process. Every section falls back to the defaults below when absent, and
 * nonsensical bounds fail fast here instead of surfacing mid-run.
 */
@ConfigurationProperties(prefix = "alertbridge")
public record AlertBridgeProperties(
        Source       source,
        Completeness completeness,
        Inference    inference,
        Creation     creation,
        Extraction   extraction,
        TicketSystem ticketSystem
) {

    public AlertBridgeProperties {
        source       = source       != null ? source       : Source.defaults();
        completeness = completeness != null ? completeness : Completeness.defaults();
        inference    = inference    != null ? inference    : Inference.defaults();
        creation     = creation     != null ? creation     : Creation.defaults();
        extraction   = extraction   != null ? extraction   : Extraction.defaults();
        ticketSystem = ticketSystem != null ? ticketSystem : TicketSystem.defaults();
    }

    public static AlertBridgeProperties defaults() {
        return new AlertBridgeProperties(null, null, null, null, null, null);
    }

    // ------------------------------------------------------------------
    // Sections
    // ------------------------------------------------------------------

    /** Which channel is monitored and which text markers identify the alerting tool. */
    public record Source(String channel, List<String> markers) {
        public Source {
            if (channel == null || channel.isBlank()) channel = "servicecore-mobile-errors";
            if (markers == null || markers.isEmpty()) {
                markers = List.of("Triggered:", "@issue.id:", "RUM errors", "@slack-ServiceCore");
            }
            markers = List.copyOf(markers);
        }

        static Source defaults() { return new Source(null, null); }
    }

    /** Labels that must all be present for a ticket to count as complete. */
    public record Completeness(List<String> requiredLabels) {
        public Completeness {
            requiredLabels = requiredLabels == null ? List.of("bug", "mobile") : List.copyOf(requiredLabels);
        }

        static Completeness defaults() { return new Completeness(null); }
    }

    public record Inference(Integer maxAttempts, IncompleteTicketPolicy incompletePolicy) {
        public Inference {
            if (maxAttempts == null) maxAttempts = 2;
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("alertbridge.inference.max-attempts must be >= 0, got " + maxAttempts);
            }
            if (incompletePolicy == null) incompletePolicy = IncompleteTicketPolicy.CREATE_PARTIAL;
        }

        static Inference defaults() { return new Inference(null, null); }
    }

    /**
     * Ticket creation and its retry budget.
     *
     * maxRetries counts failed transient attempts; with the default of 5 the
     * creator makes at most 5 calls and waits between them for
     * min(backoffBase * 2^(n-1), backoffCap): 2s, 4s, 8s, 16s.
     */
    public record Creation(Integer  maxRetries,
                           Duration backoffBase,
                           Duration backoffCap,
                           String   projectKey,
                           String   issueType) {
        public Creation {
            if (maxRetries == null)  maxRetries  = 5;
            if (backoffBase == null) backoffBase = Duration.ofSeconds(2);
            if (backoffCap == null)  backoffCap  = Duration.ofSeconds(16);
            if (projectKey == null || projectKey.isBlank()) projectKey = "MOBILE";
            if (issueType == null || issueType.isBlank())   issueType  = "Bug";
            if (maxRetries < 1) {
                throw new IllegalArgumentException("alertbridge.creation.max-retries must be >= 1, got " + maxRetries);
            }
            if (backoffBase.isNegative() || backoffCap.isNegative() || backoffCap.compareTo(backoffBase) < 0) {
                throw new IllegalArgumentException(
                        "alertbridge.creation backoff must satisfy 0 <= base <= cap (base=%s, cap=%s)"
                                .formatted(backoffBase, backoffCap));
            }
        }

        static Creation defaults() { return new Creation(null, null, null, null, null); }
    }

    /**
     * Extraction service selection.
     *
     * provider: "claude" (Anthropic Messages API) or "heuristic" (local alert parsing).
     * defaultLabels are what the heuristic extractor files every alert under.
     */
    public record Extraction(String       provider,
                             String       model,
                             String       apiKey,
                             String       apiUrl,
                             Duration     timeout,
                             List<String> defaultLabels) {
        public Extraction {
            if (provider == null || provider.isBlank()) provider = "heuristic";
            if (model == null || model.isBlank())       model    = "claude-sonnet-4-5";
            if (apiKey == null)                          apiKey   = "";
            if (apiUrl == null || apiUrl.isBlank())     apiUrl   = "https://api.anthropic.com/v1/messages";
            if (timeout == null)                         timeout  = Duration.ofSeconds(60);
            defaultLabels = defaultLabels == null ? List.of("bug", "mobile") : List.copyOf(defaultLabels);
        }

        static Extraction defaults() { return new Extraction(null, null, null, null, null, null); }
    }

    /**
     * Ticket system selection.
     *
     * provider: "jira" (Jira REST v2) or "in-memory". failureRate only applies
     * to the in-memory store and makes create() fail transiently at that rate.
     */
    public record TicketSystem(String   provider,
                               String   baseUrl,
                               String   username,
                               String   apiToken,
                               Duration timeout,
                               Double   failureRate) {
        public TicketSystem {
            if (provider == null || provider.isBlank()) provider = "in-memory";
            if (baseUrl == null || baseUrl.isBlank())   baseUrl  = "https://jira.example.com";
            if (username == null)                        username = "";
            if (apiToken == null)                        apiToken = "";
            if (timeout == null)                         timeout  = Duration.ofSeconds(30);
            if (failureRate == null)                     failureRate = 0.0;
            if (failureRate < 0.0 || failureRate > 1.0) {
                throw new IllegalArgumentException(
                        "alertbridge.ticket-system.failure-rate must be within [0, 1], got " + failureRate);
            }
        }

        static TicketSystem defaults() { return new TicketSystem(null, null, null, null, null, null); }
    }
}
