package com.alertbridge.orchestrator.extraction;

import com.alertbridge.orchestrator.model.TicketInfo;

/**
 * Turns alert text into structured ticket fields.
 *
 * Two modes, chosen by the request:
 * <ul>
 *   <li>full extraction: {@code request.partial()} is null; return title,
 *       description and labels from scratch.</li>
 *   <li>fill-missing: {@code request.partial()} holds what is already known
 *       and {@code request.missingFields()} names what to infer.</li>
 * </ul>
 * Fields the service cannot determine come back empty; that is not an error.
 *
 * @throws ExtractionException on timeout, unavailability, or a response that
 *                             does not match the ticket schema
 */
public interface ExtractionService {

    TicketInfo extract(ExtractionRequest request) throws ExtractionException;
}
