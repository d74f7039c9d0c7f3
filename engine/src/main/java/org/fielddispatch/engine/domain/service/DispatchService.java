package org.fielddispatch.engine.domain.service;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;

import java.util.List;

/**
 * Service for placing a single ticket on the best available executor.
 */
public interface DispatchService {

    String ALGORITHM_BASIC = "basic";
    String ALGORITHM_ROUND_ROBIN = "round_robin";

    /**
     * Choose an executor for one ticket. Never throws for per-ticket problems:
     * a ticket nobody can take yields an unassigned decision.
     *
     * @param ticket the ticket to place
     * @param executors snapshot of the executor pool
     * @param mode the current service mode
     * @return the decision, assigned or unassigned with a reason
     */
    AssignmentDecision assign(Ticket ticket, List<Executor> executors, ServiceMode mode);

    /**
     * All eligible candidates, best first: score descending, then lowest
     * current load, then lowest executor id.
     *
     * @param ticket the ticket to place
     * @param executors snapshot of the executor pool
     * @param mode the current service mode
     * @return ranked candidates, empty when no executor is eligible
     */
    List<AssignmentCandidateScore> rank(Ticket ticket, List<Executor> executors, ServiceMode mode);
}
