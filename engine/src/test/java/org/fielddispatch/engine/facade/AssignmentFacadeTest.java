package org.fielddispatch.engine.facade;

import org.fielddispatch.engine.api.ExecutorRosterClient;
import org.fielddispatch.engine.api.NotificationClient;
import org.fielddispatch.engine.api.NotificationPriority;
import org.fielddispatch.engine.api.PermissionClient;
import org.fielddispatch.engine.api.TicketDataClient;
import org.fielddispatch.engine.domain.model.AssignmentCandidateScore;
import org.fielddispatch.engine.domain.model.AssignmentDecision;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ScoringWeights;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.domain.model.UnassignedReason;
import org.fielddispatch.engine.domain.service.DispatchService;
import org.fielddispatch.engine.domain.service.DispatchServiceImpl;
import org.fielddispatch.engine.domain.service.ScoringService;
import org.fielddispatch.engine.domain.service.ScoringServiceImpl;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.fielddispatch.engine.geo.CoverageReport;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.geo.RoutePlan;
import org.fielddispatch.engine.geo.ZoneTable;
import org.fielddispatch.engine.optimizer.BatchOptimizer;
import org.fielddispatch.engine.optimizer.BatchResult;
import org.fielddispatch.engine.optimizer.OptimizationAlgorithm;
import org.fielddispatch.engine.optimizer.OptimizationBudget;
import org.fielddispatch.engine.resilience.BreakerStatus;
import org.fielddispatch.engine.resilience.Dependency;
import org.fielddispatch.engine.resilience.ResilienceLayer;
import org.fielddispatch.engine.resilience.ResilienceState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssignmentFacade")
class AssignmentFacadeTest {

    @Mock
    private TicketDataClient ticketClient;

    @Mock
    private ExecutorRosterClient rosterClient;

    @Mock
    private PermissionClient permissionClient;

    @Mock
    private NotificationClient notificationClient;

    private ResilienceState state;
    private ResilienceLayer resilience;
    private AssignmentFacade facade;

    private final Ticket plumbingTicket = Ticket.builder()
            .id("t-1")
            .category("plumbing")
            .urgency(4)
            .zone("chilanzar")
            .build();

    private final List<Executor> roster = Arrays.asList(
            Executor.builder().id("1").skills("plumbing").efficiencyRating(85)
                    .workloadCapacity(5).currentLoad(2).homeZone("chilanzar").build(),
            Executor.builder().id("2").skills("general").efficiencyRating(92)
                    .workloadCapacity(4).homeZone("yunusabad").build(),
            Executor.builder().id("3").skills("electrical").efficiencyRating(99)
                    .workloadCapacity(4).homeZone("sergeli").build());

    @BeforeEach
    void setUp() {
        state = ResilienceState.withDefaults(Clock.systemUTC());
        resilience = ResilienceLayer.builder()
                .state(state)
                .ticketClient(ticketClient)
                .rosterClient(rosterClient)
                .permissionClient(permissionClient)
                .notificationClient(notificationClient)
                .build();
        GeoService geoService = new GeoService(ZoneTable.loadDefault());
        ScoringService scoringService = new ScoringServiceImpl(geoService, ScoringWeights.defaults());
        DispatchService dispatchService = new DispatchServiceImpl(scoringService, state);
        BatchOptimizer optimizer = new BatchOptimizer(scoringService, geoService, state,
                OptimizationBudget.defaults(), () -> new Random(1), Clock.systemUTC());
        facade = new AssignmentFacade(resilience, dispatchService, optimizer, geoService);
    }

    @AfterEach
    void tearDown() {
        resilience.close();
    }

    @Test
    @DisplayName("Assigns, commits and notifies with live data")
    void assignsWithLiveData() {
        when(permissionClient.canAssign("dispatcher", "t-1")).thenReturn(true);
        when(ticketClient.getTicket("t-1")).thenReturn(plumbingTicket);
        when(rosterClient.listAvailableExecutors(null)).thenReturn(roster);

        AssignmentDecision decision = facade.assignOne(plumbingTicket, "dispatcher");

        assertThat(decision.getExecutorId()).isEqualTo("1");
        assertThat(decision.isFallbackUsed()).isFalse();
        assertThat(decision.isCommitted()).isTrue();
        assertThat(decision.getServiceMode()).isEqualTo(ServiceMode.FULL);
        verify(ticketClient).updateTicketAssignment(eq("t-1"), eq("1"),
                argThat(metadata -> "basic".equals(metadata.get("algorithm"))
                        && "full".equals(metadata.get("service_mode"))));
        verify(notificationClient, timeout(2000)).notify(eq("1"), contains("t-1"), eq(NotificationPriority.HIGH));
    }

    @Test
    @DisplayName("Full roster yields an unassigned no_capacity decision")
    void noCapacity() {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(Arrays.asList(
                Executor.builder().id("1").skills("plumbing").workloadCapacity(2).currentLoad(2).build(),
                Executor.builder().id("2").skills("plumbing").workloadCapacity(1).currentLoad(1).build()));

        AssignmentDecision decision = facade.assignOne(plumbingTicket, null);

        assertThat(decision.getExecutorId()).isEqualTo(AssignmentDecision.UNASSIGNED);
        assertThat(decision.getReason()).isEqualTo("no_capacity");
        assertThat(decision.isCommitted()).isFalse();
        verify(ticketClient, never()).updateTicketAssignment(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Open ticket-data breaker still yields a decision from the fallback roster")
    void ticketDataOpenUsesFallback() {
        state.forceOpen(Dependency.TICKET_DATA);

        AssignmentDecision decision = facade.assignOne(plumbingTicket, null);

        assertThat(decision.isAssigned()).isTrue();
        assertThat(decision.isFallbackUsed()).isTrue();
        assertThat(decision.getExecutorId()).isEqualTo("fallback-1");
        assertThat(decision.getServiceMode()).isEqualTo(ServiceMode.DEGRADED);
        assertThat(decision.isCommitted()).isFalse();
        verify(ticketClient, never()).getTicket(anyString());
        verify(rosterClient, never()).listAvailableExecutors(any());
    }

    @Test
    @DisplayName("Denied permission stops before dispatch")
    void permissionDenied() {
        when(permissionClient.canAssign("intern", "t-1")).thenReturn(false);

        AssignmentDecision decision = facade.assignOne(plumbingTicket, "intern");

        assertThat(decision.getUnassignedReason()).isEqualTo(UnassignedReason.PERMISSION_DENIED);
        verify(rosterClient, never()).listAvailableExecutors(any());
        verify(ticketClient, never()).getTicket(anyString());
    }

    @Test
    @DisplayName("Emergency override rotates over the fallback roster")
    void emergencyOverride() {
        facade.setServiceMode(ServiceMode.EMERGENCY, "network outage");

        AssignmentDecision first = facade.assignOne(plumbingTicket, null);
        AssignmentDecision second = facade.assignOne(plumbingTicket.toBuilder().id("t-2").build(), null);

        assertThat(first.getAlgorithm()).isEqualTo(DispatchService.ALGORITHM_ROUND_ROBIN);
        assertThat(first.getServiceMode()).isEqualTo(ServiceMode.EMERGENCY);
        assertThat(first.isFallbackUsed()).isTrue();
        assertThat(first.getExecutorId()).isEqualTo("fallback-1");
        assertThat(second.getExecutorId()).isEqualTo("fallback-2");
        assertThat(facade.getServiceModeOverrideReason()).contains("network outage");

        facade.clearServiceModeOverride();
        assertThat(facade.getServiceMode()).isEqualTo(ServiceMode.FULL);
        assertThat(facade.getServiceModeOverrideReason()).isEmpty();
    }

    @Test
    @DisplayName("Recommendations are repeatable and side-effect free")
    void recommendIsIdempotent() {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(roster);

        List<AssignmentCandidateScore> first = facade.recommend(plumbingTicket, 5);
        List<AssignmentCandidateScore> second = facade.recommend(plumbingTicket, 5);
        List<AssignmentCandidateScore> top = facade.recommend(plumbingTicket, 1);

        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(AssignmentCandidateScore::getExecutorId).containsExactly("1", "2");
        assertThat(top).hasSize(1);
        assertThat(facade.getStatistics().getTotalDecisions()).isZero();
        verify(ticketClient, never()).updateTicketAssignment(anyString(), anyString(), anyMap());
        assertThatThrownBy(() -> facade.recommend(plumbingTicket, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Batch assignment commits every placed ticket")
    void assignsBatch() {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(roster);
        List<Ticket> tickets = Arrays.asList(
                plumbingTicket,
                Ticket.builder().id("t-2").category("electrical").urgency(2).zone("sergeli").build());

        BatchResult result = facade.assignBatch(tickets, "greedy");

        assertThat(result.getAlgorithm()).isEqualTo(OptimizationAlgorithm.GREEDY);
        assertThat(result.getDecisions()).extracting(AssignmentDecision::getExecutorId).containsExactly("1", "3");
        assertThat(result.getDecisions()).allMatch(AssignmentDecision::isCommitted);
        assertThat(facade.getStatistics().getAlgorithmUsage()).containsEntry("greedy", 2L);
    }

    @Test
    @DisplayName("Emergency batches share the round-robin rotation with single assignments")
    void emergencyBatchRotates() {
        facade.setServiceMode(ServiceMode.EMERGENCY, "network outage");
        List<Ticket> tickets = Arrays.asList(plumbingTicket, plumbingTicket.toBuilder().id("t-2").build());

        BatchResult result = facade.assignBatch(tickets, "hybrid");
        AssignmentDecision next = facade.assignOne(plumbingTicket.toBuilder().id("t-3").build(), null);

        assertThat(result.getDecisions()).extracting(AssignmentDecision::getExecutorId)
                .containsExactly("fallback-1", "fallback-2");
        assertThat(result.getDecisions()).extracting(AssignmentDecision::getAlgorithm)
                .containsOnly(DispatchService.ALGORITHM_ROUND_ROBIN);
        assertThat(next.getExecutorId()).isEqualTo("fallback-3");
    }

    @Test
    @DisplayName("Coverage compares ticket zones with the roster's home zones")
    void analyzesCoverage() {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(Arrays.asList(roster.get(0), roster.get(1)));
        List<Ticket> tickets = Arrays.asList(
                plumbingTicket,
                plumbingTicket.toBuilder().id("t-2").build(),
                Ticket.builder().id("t-3").category("electrical").urgency(2).zone("sergeli").build());

        CoverageReport report = facade.analyzeCoverage(tickets);

        assertThat(report.getDemand()).containsEntry("chilanzar", 2).containsEntry("sergeli", 1);
        assertThat(report.getRadiusKm()).isEqualTo(GeoService.DEFAULT_COVERAGE_RADIUS_KM);
        assertThat(report.getGaps()).containsExactly("sergeli");
        verify(ticketClient, never()).updateTicketAssignment(anyString(), anyString(), anyMap());
    }

    @Test
    @DisplayName("Unknown algorithm name is a configuration error")
    void unknownAlgorithm() {
        assertThatThrownBy(() -> facade.assignBatch(Arrays.asList(plumbingTicket), "quantum"))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @DisplayName("Statistics count outcomes by kind")
    void collectsStatistics() {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(Arrays.asList(roster.get(0), roster.get(2)));
        Ticket painting = Ticket.builder().id("t-9").category("painting").urgency(1).build();

        facade.assignOne(plumbingTicket, null);
        facade.assignOne(painting, null);
        AssignmentStatistics stats = facade.getStatistics();

        assertThat(stats.getTotalDecisions()).isEqualTo(2);
        assertThat(stats.getAssigned()).isEqualTo(1);
        assertThat(stats.getUnassigned()).isEqualTo(1);
        assertThat(stats.getCommitted()).isEqualTo(1);
        assertThat(stats.getFallbackDecisions()).isZero();
        assertThat(stats.getUnassignedReasons()).containsEntry("no_skill_match", 1L);
        assertThat(stats.getAverageScore()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("Breakers can be inspected and reset by name")
    void resetsBreakerByName() {
        state.forceOpen(Dependency.EXECUTOR_ROSTER);
        assertThat(facade.getCircuitBreakerStatus().get(Dependency.EXECUTOR_ROSTER).getStatus())
                .isEqualTo(BreakerStatus.OPEN);
        assertThat(facade.getServiceMode()).isEqualTo(ServiceMode.DEGRADED);

        assertThat(facade.resetCircuitBreaker("executor-roster").getStatus()).isEqualTo(BreakerStatus.CLOSED);
        assertThat(facade.getServiceMode()).isEqualTo(ServiceMode.FULL);
        assertThatThrownBy(() -> facade.resetCircuitBreaker("billing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Routes group assigned tickets per executor from the home zone")
    void plansRoutes() {
        List<Ticket> tickets = Arrays.asList(
                Ticket.builder().id("a").category("plumbing").urgency(3).zone("sergeli").build(),
                Ticket.builder().id("b").category("plumbing").urgency(3).zone("chilanzar").build(),
                Ticket.builder().id("c").category("plumbing").urgency(3).zone("olmazor").build());
        List<AssignmentDecision> decisions = Arrays.asList(
                assigned("a", "1"),
                assigned("b", "1"),
                AssignmentDecision.unassigned("c", "greedy", UnassignedReason.CAPACITY_EXHAUSTED, ServiceMode.FULL));

        Map<String, RoutePlan> routes = facade.planRoutes(tickets, decisions, roster);

        assertThat(routes).containsOnlyKeys("1");
        assertThat(routes.get("1").getHomeZone()).isEqualTo("chilanzar");
        assertThat(routes.get("1").getStops()).containsExactly("chilanzar", "sergeli");
    }

    private static AssignmentDecision assigned(String ticketId, String executorId) {
        return AssignmentDecision.builder()
                .ticketId(ticketId)
                .executorId(executorId)
                .algorithm("greedy")
                .build();
    }
}
