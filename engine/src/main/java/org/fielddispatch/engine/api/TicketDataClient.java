package org.fielddispatch.engine.api;

import org.fielddispatch.engine.domain.model.Ticket;

import java.util.Map;

/**
 * Client interface for the external ticket store.
 */
public interface TicketDataClient {

    /**
     * Fetch the current version of a ticket.
     * GET /v1/tickets/{ticketId}
     */
    Ticket getTicket(String ticketId);

    /**
     * Record the chosen executor on the ticket.
     * PUT /v1/tickets/{ticketId}/assignment
     */
    void updateTicketAssignment(String ticketId, String executorId, Map<String, Object> metadata);
}
