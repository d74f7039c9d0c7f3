package org.fielddispatch.engine.api;

import org.fielddispatch.engine.domain.model.Executor;

import java.util.List;

/**
 * Client interface for the executor roster.
 */
public interface ExecutorRosterClient {

    /**
     * List executors currently on shift.
     * GET /v1/executors/available?skill={skillFilter}
     *
     * @param skillFilter optional skill tag; null lists everyone
     */
    List<Executor> listAvailableExecutors(String skillFilter);
}
