package org.fielddispatch.engine.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.fielddispatch.engine.api.ExecutorRosterClient;
import org.fielddispatch.engine.api.HttpCollaboratorClient;
import org.fielddispatch.engine.api.NotificationClient;
import org.fielddispatch.engine.api.PermissionClient;
import org.fielddispatch.engine.api.TicketDataClient;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.ScoringWeights;
import org.fielddispatch.engine.domain.service.DispatchServiceImpl;
import org.fielddispatch.engine.domain.service.ScoringServiceImpl;
import org.fielddispatch.engine.facade.AssignmentFacade;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.geo.ZoneTable;
import org.fielddispatch.engine.optimizer.BatchOptimizer;
import org.fielddispatch.engine.optimizer.OptimizationBudget;
import org.fielddispatch.engine.resilience.ResilienceLayer;
import org.fielddispatch.engine.resilience.ResilienceState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssignmentHttpServer")
class AssignmentHttpServerTest {

    private static final MediaType JSON = MediaType.get("application/json");

    @Mock
    private TicketDataClient ticketClient;

    @Mock
    private ExecutorRosterClient rosterClient;

    @Mock
    private PermissionClient permissionClient;

    @Mock
    private NotificationClient notificationClient;

    private final ObjectMapper objectMapper = HttpCollaboratorClient.createObjectMapper();
    private final OkHttpClient http = new OkHttpClient();

    private ResilienceLayer resilience;
    private AssignmentHttpServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        ResilienceState state = ResilienceState.withDefaults(Clock.systemUTC());
        resilience = ResilienceLayer.builder()
                .state(state)
                .ticketClient(ticketClient)
                .rosterClient(rosterClient)
                .permissionClient(permissionClient)
                .notificationClient(notificationClient)
                .build();
        GeoService geoService = new GeoService(ZoneTable.loadDefault());
        ScoringServiceImpl scoring = new ScoringServiceImpl(geoService, ScoringWeights.defaults());
        BatchOptimizer optimizer = new BatchOptimizer(scoring, geoService, state,
                OptimizationBudget.defaults(), () -> new Random(7), Clock.systemUTC());
        AssignmentFacade facade = new AssignmentFacade(resilience, new DispatchServiceImpl(scoring, state),
                optimizer, geoService);

        server = new AssignmentHttpServer(0, facade);
        server.start();
        baseUrl = "http://localhost:" + server.getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        resilience.close();
    }

    @Test
    @DisplayName("Health reports the current service mode")
    void health() throws IOException {
        try (Response response = get("/health")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = readJson(response);
            assertThat(body.get("status").asText()).isEqualTo("healthy");
            assertThat(body.get("service_mode").asText()).isEqualTo("full");
        }
    }

    @Test
    @DisplayName("Assign returns the decision as snake_case JSON")
    void assigns() throws IOException {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(Arrays.asList(
                Executor.builder().id("1").skills("plumbing").efficiencyRating(80).workloadCapacity(3).build()));

        try (Response response = post("/assign",
                "{\"ticket\":{\"id\":\"t-1\",\"category\":\"plumbing\",\"urgency\":2}}")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = readJson(response);
            assertThat(body.get("ticket_id").asText()).isEqualTo("t-1");
            assertThat(body.get("executor").asText()).isEqualTo("1");
            assertThat(body.get("fallback_used").asBoolean()).isFalse();
            assertThat(body.get("committed").asBoolean()).isTrue();
        }
    }

    @Test
    @DisplayName("Coverage reports demand per zone and uncovered zones")
    void coverage() throws IOException {
        when(rosterClient.listAvailableExecutors(null)).thenReturn(Arrays.asList(
                Executor.builder().id("1").skills("plumbing").homeZone("chilanzar").workloadCapacity(3).build()));

        try (Response response = post("/coverage", "{\"tickets\":["
                + "{\"id\":\"t-1\",\"category\":\"plumbing\",\"urgency\":2,\"zone\":\"chilanzar\"},"
                + "{\"id\":\"t-2\",\"category\":\"plumbing\",\"urgency\":2,\"zone\":\"sergeli\"}]}")) {
            assertThat(response.code()).isEqualTo(200);
            JsonNode body = readJson(response);
            assertThat(body.get("demand_analysis").get("chilanzar").asInt()).isEqualTo(1);
            assertThat(body.get("coverage_gaps").size()).isEqualTo(1);
            assertThat(body.get("coverage_gaps").get(0).asText()).isEqualTo("sergeli");
            assertThat(body.get("coverage_analysis").size()).isEqualTo(10);
        }
    }

    @Test
    @DisplayName("Malformed or incomplete bodies are rejected with 400")
    void rejectsBadBodies() throws IOException {
        try (Response response = post("/assign", "{not json")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(readJson(response).get("error").asText()).isEqualTo("malformed JSON body");
        }
        try (Response response = post("/assign", "{\"ticket\":{\"id\":\"t-1\"}}")) {
            assertThat(response.code()).isEqualTo(400);
            assertThat(readJson(response).get("error").asText()).contains("no category");
        }
        try (Response response = post("/recommend?top_n=many",
                "{\"ticket\":{\"id\":\"t-1\",\"category\":\"plumbing\"}}")) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    @DisplayName("Wrong method yields 405")
    void wrongMethod() throws IOException {
        try (Response response = post("/health", "{}")) {
            assertThat(response.code()).isEqualTo(405);
        }
    }

    @Test
    @DisplayName("Service mode can be overridden and returned to automatic")
    void overridesServiceMode() throws IOException {
        try (Response response = post("/service-mode", "{\"mode\":\"emergency\",\"reason\":\"drill\"}")) {
            JsonNode body = readJson(response);
            assertThat(body.get("mode").asText()).isEqualTo("emergency");
            assertThat(body.get("override_reason").asText()).isEqualTo("drill");
        }
        try (Response response = post("/service-mode", "{\"mode\":\"auto\"}")) {
            JsonNode body = readJson(response);
            assertThat(body.get("mode").asText()).isEqualTo("full");
            assertThat(body.get("override_reason").isNull()).isTrue();
        }
        try (Response response = post("/service-mode", "{\"mode\":\"panic\"}")) {
            assertThat(response.code()).isEqualTo(400);
        }
    }

    @Test
    @DisplayName("Breakers are listed and reset by name")
    void circuitBreakers() throws IOException {
        try (Response response = get("/circuit-breakers")) {
            JsonNode body = readJson(response);
            assertThat(body.isArray()).isTrue();
            assertThat(body.size()).isEqualTo(4);
            assertThat(body.get(0).get("status").asText()).isEqualTo("closed");
        }
        try (Response response = post("/circuit-breakers/notification/reset", "")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(readJson(response).get("dependency").asText()).isEqualTo("notification");
        }
        try (Response response = post("/circuit-breakers/billing/reset", "")) {
            assertThat(response.code()).isEqualTo(400);
        }
        try (Response response = get("/circuit-breakers/notification")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }

    @Test
    @DisplayName("Statistics start at zero")
    void statistics() throws IOException {
        try (Response response = get("/stats")) {
            JsonNode body = readJson(response);
            assertThat(body.get("total_decisions").asLong()).isZero();
            assertThat(body.get("algorithm_usage").size()).isZero();
        }
    }

    private Response get(String path) throws IOException {
        return http.newCall(new Request.Builder().url(baseUrl + path).get().build()).execute();
    }

    private Response post(String path, String json) throws IOException {
        return http.newCall(new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(json, JSON))
                .build()).execute();
    }

    private JsonNode readJson(Response response) throws IOException {
        return objectMapper.readTree(response.body().string());
    }
}
