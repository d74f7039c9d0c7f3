package org.fielddispatch.engine.api;

/**
 * Client interface for the permission service.
 */
public interface PermissionClient {

    /**
     * Whether a user may assign the given ticket.
     * GET /v1/permissions/can-assign?user_id={userId}&amp;ticket_id={ticketId}
     */
    boolean canAssign(String userId, String ticketId);
}
