package org.fielddispatch.engine.domain.model;

/**
 * Why a ticket was left without an executor.
 */
public enum UnassignedReason {
    /** No available executor with spare capacity. */
    NO_CAPACITY("no_capacity"),
    /** Executors with capacity exist but none has the skill or a generalist tag. */
    NO_SKILL_MATCH("no_skill_match"),
    /** The requesting user may not assign this ticket. */
    PERMISSION_DENIED("permission_denied"),
    /** Batch capacity ran out before this ticket's turn. */
    CAPACITY_EXHAUSTED("capacity_exhausted");

    private final String value;

    UnassignedReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
