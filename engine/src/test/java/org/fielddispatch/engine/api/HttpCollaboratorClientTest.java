package org.fielddispatch.engine.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.fielddispatch.engine.domain.model.Executor;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.exception.DependencyUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HttpCollaboratorClient")
class HttpCollaboratorClientTest {

    private final ObjectMapper objectMapper = HttpCollaboratorClient.createObjectMapper();

    private MockWebServer server;
    private HttpCollaboratorClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new HttpCollaboratorClient(server.url("/").toString(), "secret-token", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Fetches a ticket with the service token attached")
    void fetchesTicket() throws InterruptedException {
        server.enqueue(json("{\"id\":\"t-1\",\"category\":\"plumbing\",\"urgency\":5,"
                + "\"zone\":\"chilanzar\",\"created_at\":\"2024-03-01T08:00:00Z\",\"legacy_field\":true}"));

        Ticket ticket = client.getTicket("t-1");

        assertThat(ticket.getId()).isEqualTo("t-1");
        assertThat(ticket.getCategory()).isEqualTo("plumbing");
        assertThat(ticket.getUrgency()).isEqualTo(5);
        assertThat(ticket.getZone()).isEqualTo("chilanzar");
        assertThat(ticket.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T08:00:00Z"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/v1/tickets/t-1");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret-token");
    }

    @Test
    @DisplayName("Maps the roster from snake_case JSON")
    void listsExecutors() throws InterruptedException {
        server.enqueue(json("[{\"id\":\"7\",\"name\":\"Aziz\",\"skills\":[\"plumbing\",\"general\"],"
                + "\"home_zone\":\"sergeli\",\"efficiency_rating\":88.5,\"workload_capacity\":4,"
                + "\"current_load\":1,\"available\":true}]"));

        List<Executor> executors = client.listAvailableExecutors(null);

        assertThat(executors).hasSize(1);
        Executor executor = executors.get(0);
        assertThat(executor.getId()).isEqualTo("7");
        assertThat(executor.getSkills()).contains("plumbing", "general");
        assertThat(executor.getHomeZone()).isEqualTo("sergeli");
        assertThat(executor.getEfficiencyRating()).isEqualTo(88.5);
        assertThat(executor.getSpareCapacity()).isEqualTo(3);
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/executors/available");
    }

    @Test
    @DisplayName("Sends the assignment with its metadata")
    void updatesAssignment() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        client.updateTicketAssignment("t-1", "7", Collections.singletonMap("algorithm", "basic"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/v1/tickets/t-1/assignment");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("executor_id").asText()).isEqualTo("7");
        assertThat(body.get("metadata").get("algorithm").asText()).isEqualTo("basic");
    }

    @Test
    @DisplayName("Passes user and ticket to the permission check")
    void checksPermission() throws InterruptedException {
        server.enqueue(json("{\"allowed\":false,\"reason\":\"not on shift\"}"));

        assertThat(client.canAssign("u-1", "t-1")).isFalse();
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/permissions/can-assign?user_id=u-1&ticket_id=t-1");
    }

    @Test
    @DisplayName("Posts notifications with a lowercase priority")
    void sendsNotification() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(202));

        client.notify("7", "New plumbing ticket t-1", NotificationPriority.HIGH);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/notifications");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.get("user_id").asText()).isEqualTo("7");
        assertThat(body.get("priority").asText()).isEqualTo(NotificationPriority.HIGH.value());
    }

    @Test
    @DisplayName("Non-2xx responses surface as an unavailable dependency")
    void failsOnErrorStatus() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.getTicket("t-1"))
                .isInstanceOf(DependencyUnavailableException.class)
                .hasMessageContaining("503")
                .extracting(e -> ((DependencyUnavailableException) e).getDependency())
                .isEqualTo("ticket-data");
    }

    @Test
    @DisplayName("An empty body is treated as a failure")
    void failsOnEmptyBody() {
        server.enqueue(json("null"));

        assertThatThrownBy(() -> client.canAssign("u-1", "t-1"))
                .isInstanceOf(DependencyUnavailableException.class);
    }

    @Test
    @DisplayName("Omits the Authorization header without a token")
    void noTokenNoHeader() throws InterruptedException {
        HttpCollaboratorClient anonymous = new HttpCollaboratorClient(server.url("/").toString(), "",
                Duration.ofSeconds(2));
        server.enqueue(json("{\"allowed\":true}"));

        assertThat(anonymous.canAssign("u-1", "t-1")).isTrue();
        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }
}
