package com.alertbridge.orchestrator.ticket;

import com.alertbridge.orchestrator.model.TicketInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracker stand-in for local runs and tests.
 *
 * Keys are "{project}-{n}" with n counting up from 1001. A non-zero
 * failure rate makes {@link #create} throw a transient error at random,
 * which is enough to exercise the retry path end to end.
 */
public class InMemoryTicketSystemClient implements TicketSystemClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTicketSystemClient.class);

    static final int FIRST_NUMBER = 1001;

    private final Map<String, TicketSnapshot> tickets = new ConcurrentHashMap<>();
    private final AtomicInteger counter = new AtomicInteger(FIRST_NUMBER - 1);

    private final String projectKey;
    private final String baseUrl;
    private final double failureRate;
    private final Random random;

    public InMemoryTicketSystemClient(String projectKey, String baseUrl, double failureRate) {
        this(projectKey, baseUrl, failureRate, new Random());
    }

    public InMemoryTicketSystemClient(String projectKey, String baseUrl, double failureRate, Random random) {
        if (failureRate < 0.0 || failureRate > 1.0) {
            throw new IllegalArgumentException("failureRate must be within [0, 1]: " + failureRate);
        }
        this.projectKey  = projectKey;
        this.baseUrl     = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.failureRate = failureRate;
        this.random      = random;
    }

    @Override
    public CreatedTicket create(TicketInfo ticket) {
        if (failureRate > 0.0 && random.nextDouble() < failureRate) {
            throw new TicketSystemException(TicketSystemException.Kind.TRANSIENT, 503,
                    "JIRA API temporarily unavailable", null);
        }
        int number = counter.incrementAndGet();
        String key = projectKey + "-" + number;
        tickets.put(key, new TicketSnapshot(key, ticket.title(), "Open", new ArrayList<>(ticket.labels())));
        log.info("Stored ticket {} ({} labels)", key, ticket.labels().size());
        return new CreatedTicket(String.valueOf(number), key, baseUrl + "/browse/" + key);
    }

    @Override
    public Optional<TicketSnapshot> find(String ticketKey) {
        return Optional.ofNullable(tickets.get(ticketKey));
    }

    /** Number of tickets created so far. */
    public int size() {
        return tickets.size();
    }
}
