package com.alertbridge.orchestrator.ticket;

import com.alertbridge.orchestrator.model.TicketInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Jira REST v2 client.
 *
 * Only the two calls the workflow needs: create an issue and read it back.
 * Every failure is turned into a {@link TicketSystemException} whose kind
 * comes from {@link #classify(int)}; I/O errors and timeouts are transient.
 */
public class JiraRestClient implements TicketSystemClient {

    private static final Logger log = LoggerFactory.getLogger(JiraRestClient.class);

    private static final String ISSUE_PATH = "/rest/api/2/issue";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IssueCreated(String id, String key, String self) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IssueView(String key, Fields fields) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Fields(String summary, List<String> labels, Status status) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Status(String name) {}
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       authHeader;
    private final String       projectKey;
    private final String       issueType;
    private final Duration     timeout;

    public JiraRestClient(String baseUrl,
                          String username,
                          String apiToken,
                          String projectKey,
                          String issueType,
                          Duration timeout,
                          ObjectMapper objectMapper) {
        this.baseUrl    = stripTrailingSlash(baseUrl);
        this.authHeader = basicAuthHeader(username, apiToken);
        this.projectKey = projectKey;
        this.issueType  = issueType;
        this.timeout    = timeout;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public CreatedTicket create(TicketInfo ticket) {
        String body = toJson(issuePayload(ticket));
        HttpRequest req = baseRequest(URI.create(baseUrl + ISSUE_PATH))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp = send(req, "create issue");
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new TicketSystemException(classify(resp.statusCode()), resp.statusCode(),
                    "create issue failed: HTTP " + resp.statusCode() + ": " + resp.body(), null);
        }

        IssueCreated created;
        try {
            created = json.readValue(resp.body(), IssueCreated.class);
        } catch (JsonProcessingException e) {
            throw new TicketSystemException(TicketSystemException.Kind.PERMANENT,
                    "Unreadable create issue response", e);
        }
        if (created == null || created.key() == null || created.key().isBlank()) {
            throw new TicketSystemException(TicketSystemException.Kind.PERMANENT,
                    "Create issue response carried no issue key");
        }
        log.info("Created Jira issue {} in project {}", created.key(), projectKey);
        return new CreatedTicket(created.id(), created.key(), browseUrl(created.key()));
    }

    @Override
    public Optional<TicketSnapshot> find(String ticketKey) {
        String encoded = URLEncoder.encode(ticketKey, StandardCharsets.UTF_8);
        HttpRequest req = baseRequest(URI.create(baseUrl + ISSUE_PATH + "/" + encoded
                        + "?fields=summary,labels,status"))
                .GET()
                .build();

        HttpResponse<String> resp = send(req, "read issue " + ticketKey);
        if (resp.statusCode() == 404) {
            return Optional.empty();
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new TicketSystemException(classify(resp.statusCode()), resp.statusCode(),
                    "read issue " + ticketKey + " failed: HTTP " + resp.statusCode(), null);
        }
        try {
            IssueView view = json.readValue(resp.body(), IssueView.class);
            if (view == null || view.key() == null || view.key().isBlank()) {
                throw new TicketSystemException(TicketSystemException.Kind.PERMANENT,
                        "Unreadable issue response for " + ticketKey);
            }
            IssueView.Fields fields = view.fields();
            return Optional.of(new TicketSnapshot(
                    view.key(),
                    fields == null ? null : fields.summary(),
                    fields == null || fields.status() == null ? null : fields.status().name(),
                    fields == null ? List.of() : fields.labels()));
        } catch (JsonProcessingException e) {
            throw new TicketSystemException(TicketSystemException.Kind.PERMANENT,
                    "Unreadable issue response for " + ticketKey, e);
        }
    }

    /**
     * 408, 429 and every 5xx are worth another attempt; any other status is
     * the tracker refusing the request as sent.
     */
    public static TicketSystemException.Kind classify(int statusCode) {
        if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
            return TicketSystemException.Kind.TRANSIENT;
        }
        return TicketSystemException.Kind.PERMANENT;
    }

    public String browseUrl(String key) {
        return baseUrl + "/browse/" + key;
    }

    Map<String, Object> issuePayload(TicketInfo ticket) {
        return Map.of("fields", Map.of(
                "project",     Map.of("key", projectKey),
                "summary",     ticket.title(),
                "description", ticket.description(),
                "issuetype",   Map.of("name", issueType),
                "labels",      new ArrayList<>(ticket.labels())));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder baseRequest(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept",        "application/json")
                .header("Authorization", authHeader);
    }

    private HttpResponse<String> send(HttpRequest req, String opName) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TicketSystemException(TicketSystemException.Kind.TRANSIENT,
                    opName + " interrupted", e);
        } catch (IOException e) {
            // HttpTimeoutException is an IOException
            throw new TicketSystemException(TicketSystemException.Kind.TRANSIENT,
                    opName + " failed: " + e.getMessage(), e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TicketSystemException(TicketSystemException.Kind.PERMANENT,
                    "JSON serialization failed", e);
        }
    }

    private static String basicAuthHeader(String username, String apiToken) {
        String token = Base64.getEncoder()
                .encodeToString((username + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
        return "Basic " + token;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
