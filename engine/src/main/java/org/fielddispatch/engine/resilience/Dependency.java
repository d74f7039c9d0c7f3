package org.fielddispatch.engine.resilience;

import java.util.Locale;

/**
 * External collaborators guarded by a circuit breaker.
 */
public enum Dependency {
    TICKET_DATA("ticket-data"),
    EXECUTOR_ROSTER("executor-roster"),
    PERMISSION_CHECK("permission-check"),
    /** Never degrades the service mode. */
    NOTIFICATION("notification");

    private final String value;

    Dependency(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolve by wire name ({@code ticket-data}) or enum name ({@code TICKET_DATA}).
     */
    public static Dependency fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            for (Dependency dependency : values()) {
                if (dependency.value.equals(normalized)) {
                    return dependency;
                }
            }
        }
        throw new IllegalArgumentException("Unknown dependency: " + value);
    }
}
