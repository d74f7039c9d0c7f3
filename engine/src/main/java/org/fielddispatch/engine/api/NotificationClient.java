package org.fielddispatch.engine.api;

/**
 * Client interface for the notification service.
 */
public interface NotificationClient {

    /**
     * POST /v1/notifications
     */
    void notify(String userId, String message, NotificationPriority priority);
}
