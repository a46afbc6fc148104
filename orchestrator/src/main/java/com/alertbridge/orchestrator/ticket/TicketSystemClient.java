package com.alertbridge.orchestrator.ticket;

import com.alertbridge.orchestrator.model.TicketInfo;

import java.util.Optional;

/**
 * The issue tracker, as the workflow sees it.
 *
 * Implementations classify every failure as transient (worth retrying) or
 * permanent via {@link TicketSystemException.Kind}; the workflow never
 * inspects HTTP status codes itself.
 */
public interface TicketSystemClient {

    /**
     * File a new ticket.
     *
     * @throws TicketSystemException TRANSIENT for I/O errors, timeouts, 408/429/5xx;
     *                               PERMANENT for rejected requests (other 4xx)
     */
    CreatedTicket create(TicketInfo ticket) throws TicketSystemException;

    /**
     * Look a ticket up by its key.
     *
     * @return empty when the tracker reports the ticket does not exist
     * @throws TicketSystemException when the tracker could not answer
     */
    Optional<TicketSnapshot> find(String ticketKey) throws TicketSystemException;
}
