package org.fielddispatch.engine.facade;

import org.fielddispatch.engine.domain.model.AssignmentDecision;

import java.util.HashMap;
import java.util.Map;

/**
 * Thread-safe accumulator behind {@link AssignmentStatistics}.
 */
final class StatisticsCollector {

    private long total;
    private long assigned;
    private long fallback;
    private long committed;
    private double scoreSum;
    private double processingMillisSum;
    private final Map<String, Long> algorithms = new HashMap<>();
    private final Map<String, Long> reasons = new HashMap<>();

    synchronized void record(AssignmentDecision decision) {
        total++;
        if (decision.isAssigned()) {
            assigned++;
            scoreSum += decision.getScore();
        } else {
            reasons.merge(decision.getReason(), 1L, Long::sum);
        }
        if (decision.isFallbackUsed()) {
            fallback++;
        }
        if (decision.isCommitted()) {
            committed++;
        }
        processingMillisSum += decision.getProcessingTime().toNanos() / 1_000_000.0;
        algorithms.merge(decision.getAlgorithm(), 1L, Long::sum);
    }

    synchronized AssignmentStatistics snapshot() {
        return new AssignmentStatistics(total, assigned, total - assigned, fallback, committed,
                algorithms, reasons,
                assigned > 0 ? scoreSum / assigned : 0.0,
                total > 0 ? processingMillisSum / total : 0.0);
    }
}
