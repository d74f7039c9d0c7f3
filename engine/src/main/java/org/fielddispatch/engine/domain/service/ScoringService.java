package org.fielddispatch.engine.domain.service;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;

/**
 * Service for calculating assignment scores for executor candidates.
 */
public interface ScoringService {

    /**
     * Calculate the score of an executor for a ticket.
     * Higher score = better candidate. Factors the mode does not consider are
     * reported as 0.
     *
     * @param ticket the ticket to place
     * @param executor the candidate executor
     * @param mode the current service mode
     * @return candidate score with factor breakdown
     */
    AssignmentCandidateScore score(Ticket ticket, Executor executor, ServiceMode mode);

    /**
     * Whether the executor may take the ticket on skills alone: it has the
     * ticket's category or a generalist tag.
     */
    boolean isSkillEligible(Ticket ticket, Executor executor);
}
