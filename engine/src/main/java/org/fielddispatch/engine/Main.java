package org.fielddispatch.engine;

import org.fielddispatch.engine.api.HttpCollaboratorClient;
import org.fielddispatch.engine.config.EngineConfig;
import org.fielddispatch.engine.domain.service.DispatchService;
import org.fielddispatch.engine.domain.service.DispatchServiceImpl;
import org.fielddispatch.engine.domain.service.ScoringService;
import org.fielddispatch.engine.domain.service.ScoringServiceImpl;
import org.fielddispatch.engine.facade.AssignmentFacade;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.geo.ZoneTable;
import org.fielddispatch.engine.http.AssignmentHttpServer;
import org.fielddispatch.engine.optimizer.BatchOptimizer;
import org.fielddispatch.engine.resilience.ResilienceLayer;
import org.fielddispatch.engine.resilience.ResilienceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Main entry point for the assignment engine.
 *
 * The engine matches service tickets to field executors. Single tickets go
 * through the scoring dispatcher, batches through the optimizer. Every
 * outbound call is guarded by a circuit breaker, and the engine degrades to
 * a static roster instead of failing.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            log.error("Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        log.info("=== Field Dispatch Assignment Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        log.info("Configuration: {}", config);

        // Geo and scoring
        ZoneTable zones = config.getZonesFile() != null
                ? ZoneTable.load(Paths.get(config.getZonesFile()))
                : ZoneTable.loadDefault();
        log.info("Loaded {} zones", zones.size());
        GeoService geoService = new GeoService(zones, config.getGeoSpeedKmh(), config.getGeoProximityCeilingKm(),
                config.getGeoDefaultDistanceKm());
        ScoringService scoringService = new ScoringServiceImpl(geoService, config.getWeights(),
                config.getPartialSkillCredit(), config.getGeneralistTags(), config.isGeoEnabled());
        ScoringService batchScoringService = new ScoringServiceImpl(geoService, config.getBatchWeights(),
                config.getPartialSkillCredit(), config.getGeneralistTags(), config.isGeoEnabled());

        // Collaborators behind breakers
        Clock clock = Clock.systemUTC();
        ResilienceState state = new ResilienceState(config.getBreakerSettings(), clock);
        HttpCollaboratorClient apiClient = new HttpCollaboratorClient(config.getApiBaseUrl(),
                config.getServiceToken(), config.getCallTimeout());
        log.info("API client configured for: {}", config.getApiBaseUrl());
        ResilienceLayer resilience = ResilienceLayer.builder()
                .state(state)
                .clients(apiClient)
                .allowOnPermissionFailure(config.isAllowOnPermissionFailure())
                .callTimeout(config.getCallTimeout())
                .poolSize(config.getCallPoolSize())
                .build();

        // Dispatch and optimization
        DispatchService dispatchService = new DispatchServiceImpl(scoringService, state);
        Long seed = config.getRandomSeed();
        Supplier<Random> randomSupplier = seed != null ? () -> new Random(seed) : Random::new;
        BatchOptimizer optimizer = new BatchOptimizer(batchScoringService, geoService, state, config.getBudget(),
                randomSupplier, clock, config.isOptimizationEnabled(), config.getSmallBatchMax(),
                config.getLargeBatchMin(), config.getCriticalUrgency());
        AssignmentFacade facade = new AssignmentFacade(resilience, dispatchService, optimizer, geoService);

        // Start HTTP server
        AssignmentHttpServer httpServer = new AssignmentHttpServer(config.getHttpPort(), facade);
        httpServer.start();

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down engine...");
            httpServer.stop();
            resilience.close();
            log.info("Engine shutdown complete");
        }));

        int port = httpServer.getPort();
        log.info("=== Assignment engine started successfully ===");
        log.info("Endpoints:");
        log.info("  - Health: GET http://localhost:{}/health", port);
        log.info("  - Assign: POST http://localhost:{}/assign", port);
        log.info("  - Batch: POST http://localhost:{}/assign/batch", port);
        log.info("  - Recommend: POST http://localhost:{}/recommend?top_n=3", port);
        log.info("  - Compare: POST http://localhost:{}/compare", port);
        log.info("  - Coverage: POST http://localhost:{}/coverage", port);
        log.info("  - Service mode: GET|POST http://localhost:{}/service-mode", port);
        log.info("  - Breakers: GET http://localhost:{}/circuit-breakers", port);
        log.info("  - Stats: GET http://localhost:{}/stats", port);

        // Keep main thread alive
        Thread.currentThread().join();
    }
}
