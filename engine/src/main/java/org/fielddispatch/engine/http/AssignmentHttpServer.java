package org.fielddispatch.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.fielddispatch.engine.api.HttpCollaboratorClient;
import org.fielddispatch.engine.api.dto.AssignRequestDto;
import org.fielddispatch.engine.api.dto.BatchRequestDto;
import org.fielddispatch.engine.api.dto.BatchResponseDto;
import org.fielddispatch.engine.api.dto.CandidateScoreDto;
import org.fielddispatch.engine.api.dto.CircuitBreakerDto;
import org.fielddispatch.engine.api.dto.ComparisonDto;
import org.fielddispatch.engine.api.dto.CoverageDto;
import org.fielddispatch.engine.api.dto.DecisionDto;
import org.fielddispatch.engine.api.dto.ServiceModeRequestDto;
import org.fielddispatch.engine.api.dto.StatisticsDto;
import org.fielddispatch.engine.api.dto.TicketDto;
import org.fielddispatch.engine.domain.model.ServiceMode;
import org.fielddispatch.engine.domain.model.Ticket;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.fielddispatch.engine.facade.AssignmentFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * HTTP front end of the assignment facade.
 * Request and response bodies are JSON; errors come back as {@code {"error": "..."}}.
 */
public final class AssignmentHttpServer {

    private static final Logger log = LoggerFactory.getLogger(AssignmentHttpServer.class);

    static final int DEFAULT_TOP_N = 3;
    private static final String BREAKERS_PATH = "/circuit-breakers";
    private static final String RESET_SUFFIX = "/reset";

    private final HttpServer server;
    private final ExecutorService executor;
    private final AssignmentFacade facade;
    private final ObjectMapper objectMapper;

    public AssignmentHttpServer(int port, AssignmentFacade facade) throws IOException {
        this.facade = Objects.requireNonNull(facade, "facade must not be null");
        this.objectMapper = HttpCollaboratorClient.createObjectMapper();

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        log.info("Assignment server initialized on port {}", getPort());
    }

    private void registerHandlers() {
        server.createContext("/health", exchange -> dispatch(exchange, Map.of("GET", this::health)));
        server.createContext("/assign", exchange -> dispatch(exchange, Map.of("POST", this::assign)));
        server.createContext("/assign/batch", exchange -> dispatch(exchange, Map.of("POST", this::assignBatch)));
        server.createContext("/recommend", exchange -> dispatch(exchange, Map.of("POST", this::recommend)));
        server.createContext("/compare", exchange -> dispatch(exchange, Map.of("POST", this::compare)));
        server.createContext("/coverage", exchange -> dispatch(exchange, Map.of("POST", this::coverage)));
        server.createContext("/service-mode", exchange -> dispatch(exchange,
                Map.of("GET", this::serviceMode, "POST", this::changeServiceMode)));
        server.createContext(BREAKERS_PATH, exchange -> dispatch(exchange,
                Map.of("GET", this::circuitBreakers, "POST", this::resetCircuitBreaker)));
        server.createContext("/stats", exchange -> dispatch(exchange, Map.of("GET", this::statistics)));
    }

    public void start() {
        server.start();
        log.info("Assignment server started");
    }

    public void stop() {
        server.stop(1);
        executor.shutdown();
        log.info("Assignment server stopped");
    }

    /**
     * Port actually bound; differs from the requested one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * GET /health
     */
    private Object health(HttpExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service_mode", facade.getServiceMode().value());
        return body;
    }

    /**
     * POST /assign
     */
    private Object assign(HttpExchange exchange) throws IOException {
        AssignRequestDto request = readBody(exchange, AssignRequestDto.class);
        Ticket ticket = toTicket(request.getTicket());
        log.info("Received assignment request for ticket {}", ticket.getId());
        return DecisionDto.from(facade.assignOne(ticket, request.getRequestingUser()));
    }

    /**
     * POST /assign/batch
     */
    private Object assignBatch(HttpExchange exchange) throws IOException {
        BatchRequestDto request = readBody(exchange, BatchRequestDto.class);
        List<Ticket> tickets = toTickets(request.getTickets());
        log.info("Received batch of {} tickets, algorithm {}", tickets.size(),
                request.getAlgorithm() != null ? request.getAlgorithm() : "auto");
        return BatchResponseDto.from(facade.assignBatch(tickets, request.getAlgorithm()));
    }

    /**
     * POST /recommend?top_n=N
     */
    private Object recommend(HttpExchange exchange) throws IOException {
        int topN = intParameter(exchange, "top_n", DEFAULT_TOP_N);
        AssignRequestDto request = readBody(exchange, AssignRequestDto.class);
        Ticket ticket = toTicket(request.getTicket());
        return facade.recommend(ticket, topN).stream()
                .map(CandidateScoreDto::from)
                .collect(Collectors.toList());
    }

    /**
     * POST /compare
     */
    private Object compare(HttpExchange exchange) throws IOException {
        BatchRequestDto request = readBody(exchange, BatchRequestDto.class);
        return ComparisonDto.from(facade.compareAlgorithms(toTickets(request.getTickets())));
    }

    /**
     * POST /coverage
     */
    private Object coverage(HttpExchange exchange) throws IOException {
        BatchRequestDto request = readBody(exchange, BatchRequestDto.class);
        return CoverageDto.from(facade.analyzeCoverage(toTickets(request.getTickets())));
    }

    /**
     * GET /service-mode
     */
    private Object serviceMode(HttpExchange exchange) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mode", facade.getServiceMode().value());
        body.put("override_reason", facade.getServiceModeOverrideReason().orElse(null));
        return body;
    }

    /**
     * POST /service-mode
     */
    private Object changeServiceMode(HttpExchange exchange) throws IOException {
        ServiceModeRequestDto request = readBody(exchange, ServiceModeRequestDto.class);
        String mode = request.getMode();
        if (mode == null || "auto".equalsIgnoreCase(mode.trim())) {
            log.info("Clearing service mode override");
            facade.clearServiceModeOverride();
        } else {
            facade.setServiceMode(ServiceMode.fromValue(mode), request.getReason());
        }
        return serviceMode(exchange);
    }

    /**
     * GET /circuit-breakers
     */
    private Object circuitBreakers(HttpExchange exchange) {
        if (!BREAKERS_PATH.equals(trimTrailingSlash(exchange.getRequestURI().getPath()))) {
            throw new NotFoundException("unknown path");
        }
        return facade.getCircuitBreakerStatus().values().stream()
                .map(CircuitBreakerDto::from)
                .collect(Collectors.toList());
    }

    /**
     * POST /circuit-breakers/{name}/reset
     */
    private Object resetCircuitBreaker(HttpExchange exchange) {
        String path = trimTrailingSlash(exchange.getRequestURI().getPath());
        if (!path.startsWith(BREAKERS_PATH + "/") || !path.endsWith(RESET_SUFFIX)) {
            throw new NotFoundException("unknown path");
        }
        String name = path.substring(BREAKERS_PATH.length() + 1, path.length() - RESET_SUFFIX.length());
        if (name.isEmpty() || name.contains("/")) {
            throw new IllegalArgumentException("missing dependency name");
        }
        log.info("Resetting circuit breaker {}", name);
        return CircuitBreakerDto.from(facade.resetCircuitBreaker(name));
    }

    /**
     * GET /stats
     */
    private Object statistics(HttpExchange exchange) {
        return StatisticsDto.from(facade.getStatistics());
    }

    private void dispatch(HttpExchange exchange, Map<String, Route> routes) throws IOException {
        try {
            Route route = routes.get(exchange.getRequestMethod());
            if (route == null) {
                sendError(exchange, 405, "method not allowed");
                return;
            }
            sendResponse(exchange, 200, objectMapper.writeValueAsBytes(route.handle(exchange)));
        } catch (NotFoundException e) {
            sendError(exchange, 404, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Malformed request to {}: {}", exchange.getRequestURI(), e.getOriginalMessage());
            sendError(exchange, 400, "malformed JSON body");
        } catch (InvalidConfigurationException | IllegalArgumentException e) {
            log.warn("Rejected request to {}: {}", exchange.getRequestURI(), e.getMessage());
            sendError(exchange, 400, e.getMessage());
        } catch (Exception e) {
            log.error("Request to {} failed", exchange.getRequestURI(), e);
            sendError(exchange, 500, "internal error");
        }
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T body = objectMapper.readValue(in, type);
            if (body == null) {
                throw new IllegalArgumentException("request body is required");
            }
            return body;
        }
    }

    private static Ticket toTicket(TicketDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("ticket is required");
        }
        if (dto.getId() == null || dto.getId().isBlank()) {
            throw new IllegalArgumentException("ticket id is required");
        }
        if (dto.getCategory() == null || dto.getCategory().isBlank()) {
            throw new IllegalArgumentException("ticket " + dto.getId() + " has no category");
        }
        return dto.toTicket();
    }

    private static List<Ticket> toTickets(List<TicketDto> dtos) {
        if (dtos == null) {
            return Collections.emptyList();
        }
        List<Ticket> tickets = new ArrayList<>(dtos.size());
        for (TicketDto dto : dtos) {
            tickets.add(toTicket(dto));
        }
        return tickets;
    }

    private static int intParameter(HttpExchange exchange, String name, int defaultValue) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return defaultValue;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (!name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                continue;
            }
            String value = eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
            }
        }
        return defaultValue;
    }

    private static String trimTrailingSlash(String path) {
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> body = Collections.singletonMap("error", message != null ? message : "error");
        sendResponse(exchange, statusCode, objectMapper.writeValueAsBytes(body));
    }

    /**
     * Send HTTP response.
     */
    private static void sendResponse(HttpExchange exchange, int statusCode, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @FunctionalInterface
    private interface Route {
        Object handle(HttpExchange exchange) throws IOException;
    }

    private static final class NotFoundException extends RuntimeException {
        NotFoundException(String message) {
            super(message);
        }
    }
}
