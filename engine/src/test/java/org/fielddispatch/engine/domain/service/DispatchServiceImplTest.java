package org.fielddispatch.engine.domain.service;

import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ScoringWeights;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.model.UnassignedReason;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.geo.ZoneTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DispatchServiceImpl")
class DispatchServiceImplTest {

    private ScoringService scoringService;
    private AtomicInteger rotation;
    private DispatchServiceImpl dispatchService;

    @BeforeEach
    void setUp() {
        scoringService = new ScoringServiceImpl(new GeoService(ZoneTable.loadDefault()), ScoringWeights.defaults());
        rotation = new AtomicInteger();
        dispatchService = new DispatchServiceImpl(scoringService,
                size -> Math.floorMod(rotation.getAndIncrement(), size));
    }

    @Test
    @DisplayName("Best scoring executor wins, others become alternatives")
    void assignsBestCandidate() {
        Ticket ticket = ticket("t-1", "plumbing", 4);
        List<Executor> executors = Arrays.asList(
                executor("1", 85, 2, 5, "plumbing"),
                executor("2", 92, 0, 4, "general"));

        AssignmentDecision decision = dispatchService.assign(ticket, executors, ServiceMode.FULL);

        assertThat(decision.isAssigned()).isTrue();
        assertThat(decision.getExecutorId()).isEqualTo("1");
        assertThat(decision.getScore()).isCloseTo(0.875, within(1e-9));
        assertThat(decision.getAlgorithm()).isEqualTo(DispatchService.ALGORITHM_BASIC);
        assertThat(decision.getAlternativeExecutorIds()).containsExactly("2");
        assertThat(decision.getServiceMode()).isEqualTo(ServiceMode.FULL);
    }

    @Test
    @DisplayName("All executors at capacity yields no_capacity")
    void allFullYieldsNoCapacity() {
        List<Executor> executors = Arrays.asList(
                executor("1", 90, 5, 5, "plumbing"),
                executor("2", 90, 3, 3, "plumbing"));

        AssignmentDecision decision = dispatchService.assign(ticket("t-1", "plumbing", 3), executors,
                ServiceMode.FULL);

        assertThat(decision.isAssigned()).isFalse();
        assertThat(decision.getExecutorId()).isEqualTo(AssignmentDecision.UNASSIGNED);
        assertThat(decision.getReason()).isEqualTo("no_capacity");
    }

    @Test
    @DisplayName("Empty roster yields no_capacity")
    void emptyRosterYieldsNoCapacity() {
        AssignmentDecision decision = dispatchService.assign(ticket("t-1", "plumbing", 3),
                Collections.emptyList(), ServiceMode.FULL);

        assertThat(decision.getUnassignedReason()).isEqualTo(UnassignedReason.NO_CAPACITY);
    }

    @Test
    @DisplayName("Capacity without the skill yields no_skill_match")
    void missingSkillYieldsNoSkillMatch() {
        AssignmentDecision decision = dispatchService.assign(ticket("t-1", "plumbing", 3),
                Collections.singletonList(executor("1", 90, 0, 5, "electrical")), ServiceMode.FULL);

        assertThat(decision.getUnassignedReason()).isEqualTo(UnassignedReason.NO_SKILL_MATCH);
    }

    @Test
    @DisplayName("Equal scores are broken by id")
    void tieBreaksById() {
        List<Executor> executors = Arrays.asList(
                executor("10", 80, 1, 4, "plumbing"),
                executor("9", 80, 1, 4, "plumbing"),
                executor("2", 80, 1, 4, "plumbing"));

        AssignmentDecision decision = dispatchService.assign(ticket("t-1", "plumbing", 3), executors,
                ServiceMode.FULL);

        assertThat(decision.getExecutorId()).isEqualTo("2");
        assertThat(decision.getAlternativeExecutorIds()).containsExactly("9", "10");
    }

    @Test
    @DisplayName("Emergency mode rotates through available executors ignoring skills")
    void emergencyRoundRobin() {
        List<Executor> executors = Arrays.asList(
                executor("3", 50, 0, 2, "carpentry"),
                executor("1", 50, 0, 2, "electrical"),
                executor("2", 50, 2, 2, "plumbing"));
        Ticket ticket = ticket("t-1", "plumbing", 5);

        List<String> chosen = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            AssignmentDecision decision = dispatchService.assign(ticket, executors, ServiceMode.EMERGENCY);
            assertThat(decision.getAlgorithm()).isEqualTo(DispatchService.ALGORITHM_ROUND_ROBIN);
            assertThat(decision.getReasoning()).isEqualTo("emergency round-robin");
            chosen.add(decision.getExecutorId());
        }

        assertThat(chosen).containsExactly("1", "3", "1");
    }

    @ParameterizedTest(name = "mode {0}")
    @EnumSource(ServiceMode.class)
    @DisplayName("Never picks an executor that is unavailable or at capacity")
    void neverPicksIneligibleExecutor(ServiceMode mode) {
        Random random = new Random(42);
        String[] skills = {"plumbing", "electrical", "general", "carpentry"};
        for (int round = 0; round < 200; round++) {
            List<Executor> executors = new ArrayList<>();
            int count = random.nextInt(6);
            for (int i = 0; i < count; i++) {
                int capacity = random.nextInt(4);
                executors.add(Executor.builder()
                        .id(String.valueOf(i))
                        .skills(skills[random.nextInt(skills.length)])
                        .efficiencyRating(random.nextInt(101))
                        .workloadCapacity(capacity)
                        .currentLoad(random.nextInt(capacity + 2))
                        .available(random.nextBoolean())
                        .build());
            }
            Ticket ticket = ticket("t-" + round, skills[random.nextInt(skills.length)], 1 + random.nextInt(5));

            AssignmentDecision decision = dispatchService.assign(ticket, executors, mode);

            if (decision.isAssigned()) {
                Executor chosen = executors.stream()
                        .filter(e -> e.getId().equals(decision.getExecutorId()))
                        .findFirst()
                        .orElseThrow();
                assertThat(chosen.isAvailable()).isTrue();
                assertThat(chosen.getCurrentLoad()).isLessThan(chosen.getWorkloadCapacity());
            }
        }
    }

    @Test
    @DisplayName("Ranking is repeatable for identical snapshots")
    void rankIsIdempotent() {
        Ticket ticket = ticket("t-1", "plumbing", 3);
        List<Executor> executors = Arrays.asList(
                executor("1", 70, 1, 3, "plumbing"),
                executor("2", 95, 2, 3, "general"),
                executor("3", 60, 0, 3, "plumbing"));

        List<AssignmentCandidateScore> first = dispatchService.rank(ticket, executors, ServiceMode.FULL);
        List<AssignmentCandidateScore> second = dispatchService.rank(ticket, executors, ServiceMode.FULL);

        assertThat(first).hasSize(3).isEqualTo(second);
        assertThat(first.get(0).getScore()).isGreaterThanOrEqualTo(first.get(1).getScore());
        assertThat(first.get(1).getScore()).isGreaterThanOrEqualTo(first.get(2).getScore());
    }

    private static Ticket ticket(String id, String category, int urgency) {
        return Ticket.builder().id(id).category(category).urgency(urgency).build();
    }

    private static Executor executor(String id, double efficiency, int load, int capacity, String... skills) {
        return Executor.builder()
                .id(id)
                .skills(skills)
                .efficiencyRating(efficiency)
                .currentLoad(load)
                .workloadCapacity(capacity)
                .build();
    }
}
