package org.fielddispatch.engine.domain.service;

/**
 * Shared position for round-robin assignment in emergency mode.
 */
@FunctionalInterface
public interface RoundRobinCursor {

    /**
     * Returns the next slot in {@code [0, size)} and advances the cursor.
     *
     * @param size number of executors in the rotation, must be positive
     */
    int next(int size);
}
