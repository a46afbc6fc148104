package com.alertbridge.orchestrator.extraction;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * One call = one turn: a system prompt plus the conversation so far in, the
 * assistant's text out. Uses the JDK HttpClient so every header and byte on
 * the wire is explicit; retry policy lives with the callers, not here.
 */
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant".
     */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Extracts the text from the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("Response has no content blocks");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 2048;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       apiKey;
    private final Duration     timeout;

    public ClaudeClient(String apiUrl, String apiKey, Duration timeout, ObjectMapper objectMapper) {
        this.apiUrl  = apiUrl;
        this.apiKey  = apiKey;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * Temperature is pinned to 0 so the same alert yields the same fields
     * as far as the model allows.
     *
     * @param model    e.g. "claude-sonnet-4-5"
     * @param system   the system prompt
     * @param messages the conversation so far
     * @return the assistant's text content
     * @throws ClaudeApiException on a non-200 status, a timeout, or any transport/parse failure
     */
    public String complete(String model, String system, List<Message> messages) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  MAX_TOKENS,
                    "temperature", 0,
                    "system",      system,
                    "messages",    messages
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            try {
                MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
                if (parsed == null) {
                    throw new IllegalStateException("Response body was JSON null");
                }
                return parsed.firstText();
            } catch (JsonProcessingException | IllegalStateException e) {
                throw ClaudeApiException.malformed(e);
            }

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new ClaudeApiException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int     statusCode;
        private final boolean malformedResponse;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode        = statusCode;
            this.malformedResponse = false;
        }

        public ClaudeApiException(String message, Throwable cause) {
            this(0, message, cause, false);
        }

        private ClaudeApiException(int statusCode, String message, Throwable cause, boolean malformedResponse) {
            super(message, cause);
            this.statusCode        = statusCode;
            this.malformedResponse = malformedResponse;
        }

        /** A 200 whose body is not a Messages API response with a text block. */
        static ClaudeApiException malformed(Exception cause) {
            return new ClaudeApiException(200, "Unreadable Claude API response: " + cause.getMessage(), cause, true);
        }

        /** HTTP status, or 0 when the request never got a response. */
        public int statusCode() { return statusCode; }

        public boolean isMalformedResponse() { return malformedResponse; }

        public boolean isTimeout() { return getCause() instanceof HttpTimeoutException; }
    }
}
