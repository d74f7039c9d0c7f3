package org.fielddispatch.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.fielddispatch.engine.domain.model.ScoringWeights;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.fielddispatch.engine.geo.GeoService;
import org.fielddispatch.engine.optimizer.BatchOptimizer;
import org.fielddispatch.engine.optimizer.OptimizationBudget;
import org.fielddispatch.engine.resilience.BreakerSettings;
import org.fielddispatch.engine.resilience.Dependency;
import org.fielddispatch.engine.resilience.ResilienceLayer;
import org.fielddispatch.engine.domain.service.ScoringServiceImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable configuration for the assignment engine.
 * Values come from environment variables, then a {@code .env} file in the
 * working or parent directory, then defaults. Semantic errors (weights,
 * budgets, thresholds) fail in {@link Builder#build()}.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DEFAULT_API_URL = "http://localhost:8081";
    public static final int DEFAULT_HTTP_PORT = 8090;

    // Environment keys
    static final String API_BASE_URL = "API_BASE_URL";
    static final String SERVICE_TOKEN = "ENGINE_SERVICE_TOKEN";
    static final String HTTP_PORT = "ENGINE_HTTP_PORT";
    static final String WEIGHT_PREFIX = "ENGINE_";
    static final String BATCH_WEIGHT_PREFIX = "ENGINE_BATCH_";
    static final String PARTIAL_SKILL_CREDIT = "ENGINE_PARTIAL_SKILL_CREDIT";
    static final String GENERALIST_TAGS = "ENGINE_GENERALIST_TAGS";
    static final String GEO_SPEED_KMH = "ENGINE_GEO_SPEED_KMH";
    static final String GEO_PROXIMITY_CEILING_KM = "ENGINE_GEO_PROXIMITY_CEILING_KM";
    static final String GEO_DEFAULT_DISTANCE_KM = "ENGINE_GEO_DEFAULT_DISTANCE_KM";
    static final String ZONES_FILE = "ENGINE_ZONES_FILE";
    static final String BREAKER_THRESHOLD = "ENGINE_BREAKER_THRESHOLD";
    static final String BREAKER_COOL_DOWN_SECONDS = "ENGINE_BREAKER_COOL_DOWN_SECONDS";
    static final String CALL_TIMEOUT_MS = "ENGINE_CALL_TIMEOUT_MS";
    static final String CALL_POOL_SIZE = "ENGINE_CALL_POOL_SIZE";
    static final String REQUEST_TIME_BUDGET_MS = "ENGINE_REQUEST_TIME_BUDGET_MS";
    static final String POPULATION_SIZE = "ENGINE_GA_POPULATION_SIZE";
    static final String GENERATIONS = "ENGINE_GA_GENERATIONS";
    static final String MUTATION_RATE = "ENGINE_GA_MUTATION_RATE";
    static final String CROSSOVER_RATE = "ENGINE_GA_CROSSOVER_RATE";
    static final String ELITE_SIZE = "ENGINE_GA_ELITE_SIZE";
    static final String TOURNAMENT_SIZE = "ENGINE_GA_TOURNAMENT_SIZE";
    static final String ANNEALING_ITERATIONS = "ENGINE_SA_ITERATIONS";
    static final String INITIAL_TEMPERATURE = "ENGINE_SA_INITIAL_TEMPERATURE";
    static final String COOLING_RATE = "ENGINE_SA_COOLING_RATE";
    static final String MIN_TEMPERATURE = "ENGINE_SA_MIN_TEMPERATURE";
    static final String HYBRID_ANNEALING_ITERATIONS = "ENGINE_HYBRID_SA_ITERATIONS";
    static final String CAPACITY_PENALTY = "ENGINE_CAPACITY_PENALTY";
    static final String RANDOM_SEED = "ENGINE_RANDOM_SEED";
    static final String SMALL_BATCH_MAX = "ENGINE_SMALL_BATCH_MAX";
    static final String LARGE_BATCH_MIN = "ENGINE_LARGE_BATCH_MIN";
    static final String CRITICAL_URGENCY = "ENGINE_CRITICAL_URGENCY";
    static final String OPTIMIZATION_ENABLED = "ENGINE_OPTIMIZATION_ENABLED";
    static final String GEO_ENABLED = "ENGINE_GEO_ENABLED";
    static final String PERMISSION_FALLBACK = "ENGINE_PERMISSION_FALLBACK";

    // Collaborators
    private final String apiBaseUrl;
    private final String serviceToken;
    private final int httpPort;

    // Scoring
    private final ScoringWeights weights;
    private final ScoringWeights batchWeights;
    private final double partialSkillCredit;
    private final Set<String> generalistTags;

    // Geo
    private final boolean geoEnabled;
    private final double geoSpeedKmh;
    private final double geoProximityCeilingKm;
    private final double geoDefaultDistanceKm;
    private final String zonesFile;

    // Resilience
    private final Map<Dependency, BreakerSettings> breakerSettings;
    private final Duration callTimeout;
    private final int callPoolSize;
    private final boolean allowOnPermissionFailure;

    // Optimization
    private final boolean optimizationEnabled;
    private final OptimizationBudget budget;
    private final Long randomSeed;
    private final int smallBatchMax;
    private final int largeBatchMin;
    private final int criticalUrgency;

    private EngineConfig(Builder builder) {
        this.apiBaseUrl = builder.apiBaseUrl;
        this.serviceToken = builder.serviceToken;
        this.httpPort = builder.httpPort;
        this.weights = Objects.requireNonNull(builder.weights, "weights must not be null");
        this.batchWeights = Objects.requireNonNull(builder.batchWeights, "batchWeights must not be null");
        this.partialSkillCredit = builder.partialSkillCredit;
        this.generalistTags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.generalistTags));
        this.geoEnabled = builder.geoEnabled;
        this.geoSpeedKmh = builder.geoSpeedKmh;
        this.geoProximityCeilingKm = builder.geoProximityCeilingKm;
        this.geoDefaultDistanceKm = builder.geoDefaultDistanceKm;
        this.zonesFile = builder.zonesFile;
        Map<Dependency, BreakerSettings> breakers = new EnumMap<>(Dependency.class);
        for (Dependency dependency : Dependency.values()) {
            breakers.put(dependency, builder.breakerSettings.getOrDefault(dependency, builder.defaultBreaker));
        }
        this.breakerSettings = Collections.unmodifiableMap(breakers);
        this.callTimeout = builder.callTimeout;
        this.callPoolSize = builder.callPoolSize;
        this.allowOnPermissionFailure = builder.allowOnPermissionFailure;
        this.optimizationEnabled = builder.optimizationEnabled;
        this.budget = builder.budget;
        this.randomSeed = builder.randomSeed;
        this.smallBatchMax = builder.smallBatchMax;
        this.largeBatchMin = builder.largeBatchMin;
        this.criticalUrgency = builder.criticalUrgency;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates configuration from the process environment, falling back to
     * {@code .env} files.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parentDotenv = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return fromSource(key -> {
            String value = System.getenv(key);
            if (isBlank(value)) {
                value = dotenv.get(key);
            }
            if (isBlank(value)) {
                value = parentDotenv.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup returning null for
     * missing keys.
     */
    public static EngineConfig fromSource(Function<String, String> source) {
        Lookup env = new Lookup(source);
        Builder builder = new Builder()
                .apiBaseUrl(env.getString(API_BASE_URL, DEFAULT_API_URL))
                .serviceToken(env.getString(SERVICE_TOKEN, ""))
                .httpPort(env.getInt(HTTP_PORT, DEFAULT_HTTP_PORT))
                .weights(readWeights(env, WEIGHT_PREFIX, ScoringWeights.defaults()))
                .batchWeights(readWeights(env, BATCH_WEIGHT_PREFIX, ScoringWeights.geoAware()))
                .partialSkillCredit(env.getDouble(PARTIAL_SKILL_CREDIT, ScoringServiceImpl.DEFAULT_PARTIAL_CREDIT))
                .generalistTags(splitTags(env.getString(GENERALIST_TAGS, ScoringServiceImpl.DEFAULT_GENERALIST_TAG)))
                .geoEnabled(env.getBoolean(GEO_ENABLED, true))
                .geoSpeedKmh(env.getDouble(GEO_SPEED_KMH, GeoService.DEFAULT_SPEED_KMH))
                .geoProximityCeilingKm(env.getDouble(GEO_PROXIMITY_CEILING_KM, GeoService.DEFAULT_PROXIMITY_CEILING_KM))
                .geoDefaultDistanceKm(env.getDouble(GEO_DEFAULT_DISTANCE_KM, GeoService.DEFAULT_UNKNOWN_DISTANCE_KM))
                .zonesFile(env.getString(ZONES_FILE, null))
                .callTimeout(Duration.ofMillis(env.getLong(CALL_TIMEOUT_MS,
                        ResilienceLayer.DEFAULT_CALL_TIMEOUT.toMillis())))
                .callPoolSize(env.getInt(CALL_POOL_SIZE, ResilienceLayer.DEFAULT_POOL_SIZE))
                .allowOnPermissionFailure(!"deny".equalsIgnoreCase(env.getString(PERMISSION_FALLBACK, "allow")))
                .optimizationEnabled(env.getBoolean(OPTIMIZATION_ENABLED, true))
                .budget(readBudget(env))
                .randomSeed(env.getOptionalLong(RANDOM_SEED))
                .smallBatchMax(env.getInt(SMALL_BATCH_MAX, BatchOptimizer.DEFAULT_SMALL_BATCH_MAX))
                .largeBatchMin(env.getInt(LARGE_BATCH_MIN, BatchOptimizer.DEFAULT_LARGE_BATCH_MIN))
                .criticalUrgency(env.getInt(CRITICAL_URGENCY, BatchOptimizer.DEFAULT_CRITICAL_URGENCY));

        int threshold = env.getInt(BREAKER_THRESHOLD, BreakerSettings.DEFAULT_FAILURE_THRESHOLD);
        long coolDown = env.getLong(BREAKER_COOL_DOWN_SECONDS, BreakerSettings.DEFAULT_COOL_DOWN.getSeconds());
        builder.defaultBreaker(new BreakerSettings(threshold, Duration.ofSeconds(coolDown)));
        for (Dependency dependency : Dependency.values()) {
            String prefix = "ENGINE_BREAKER_" + dependency.name() + "_";
            int depThreshold = env.getInt(prefix + "THRESHOLD", threshold);
            long depCoolDown = env.getLong(prefix + "COOL_DOWN_SECONDS", coolDown);
            builder.breaker(dependency, new BreakerSettings(depThreshold, Duration.ofSeconds(depCoolDown)));
        }
        return builder.build();
    }

    private static ScoringWeights readWeights(Lookup env, String prefix, ScoringWeights defaults) {
        Map<String, Double> values = defaults.toKeyMap().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> env.getStrictDouble(prefix + e.getKey().toUpperCase(Locale.ROOT), e.getValue())));
        return ScoringWeights.fromMap(values);
    }

    private static OptimizationBudget readBudget(Lookup env) {
        OptimizationBudget defaults = OptimizationBudget.defaults();
        return OptimizationBudget.builder()
                .populationSize(env.getInt(POPULATION_SIZE, defaults.getPopulationSize()))
                .generations(env.getInt(GENERATIONS, defaults.getGenerations()))
                .mutationRate(env.getDouble(MUTATION_RATE, defaults.getMutationRate()))
                .crossoverRate(env.getDouble(CROSSOVER_RATE, defaults.getCrossoverRate()))
                .eliteSize(env.getInt(ELITE_SIZE, defaults.getEliteSize()))
                .tournamentSize(env.getInt(TOURNAMENT_SIZE, defaults.getTournamentSize()))
                .annealingIterations(env.getInt(ANNEALING_ITERATIONS, defaults.getAnnealingIterations()))
                .initialTemperature(env.getDouble(INITIAL_TEMPERATURE, defaults.getInitialTemperature()))
                .coolingRate(env.getDouble(COOLING_RATE, defaults.getCoolingRate()))
                .minTemperature(env.getDouble(MIN_TEMPERATURE, defaults.getMinTemperature()))
                .hybridAnnealingIterations(env.getInt(HYBRID_ANNEALING_ITERATIONS,
                        defaults.getHybridAnnealingIterations()))
                .capacityPenalty(env.getDouble(CAPACITY_PENALTY, defaults.getCapacityPenalty()))
                .timeBudget(Duration.ofMillis(env.getLong(REQUEST_TIME_BUDGET_MS,
                        defaults.getTimeBudget().toMillis())))
                .build();
    }

    static Set<String> splitTags(String value) {
        if (isBlank(value)) {
            return Collections.emptySet();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    // Getters
    public String getApiBaseUrl() {
        return apiBaseUrl;
    }

    public String getServiceToken() {
        return serviceToken;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    /**
     * Weights for batch optimization; geography counts by default.
     */
    public ScoringWeights getBatchWeights() {
        return batchWeights;
    }

    public double getPartialSkillCredit() {
        return partialSkillCredit;
    }

    public Set<String> getGeneralistTags() {
        return generalistTags;
    }

    public boolean isGeoEnabled() {
        return geoEnabled;
    }

    public double getGeoSpeedKmh() {
        return geoSpeedKmh;
    }

    public double getGeoProximityCeilingKm() {
        return geoProximityCeilingKm;
    }

    public double getGeoDefaultDistanceKm() {
        return geoDefaultDistanceKm;
    }

    /**
     * Path of a custom zone table, or null for the bundled one.
     */
    public String getZonesFile() {
        return zonesFile;
    }

    public Map<Dependency, BreakerSettings> getBreakerSettings() {
        return breakerSettings;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public int getCallPoolSize() {
        return callPoolSize;
    }

    public boolean isAllowOnPermissionFailure() {
        return allowOnPermissionFailure;
    }

    public boolean isOptimizationEnabled() {
        return optimizationEnabled;
    }

    public OptimizationBudget getBudget() {
        return budget;
    }

    /**
     * Fixed seed for reproducible searches, or null for a fresh seed per run.
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public int getSmallBatchMax() {
        return smallBatchMax;
    }

    public int getLargeBatchMin() {
        return largeBatchMin;
    }

    public int getCriticalUrgency() {
        return criticalUrgency;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "apiBaseUrl='" + apiBaseUrl + '\'' +
                ", httpPort=" + httpPort +
                ", weights=" + weights +
                ", batchWeights=" + batchWeights +
                ", partialSkillCredit=" + partialSkillCredit +
                ", geoEnabled=" + geoEnabled +
                ", optimizationEnabled=" + optimizationEnabled +
                ", budget=" + budget +
                ", breakers=" + breakerSettings +
                '}';
    }

    /**
     * Environment lookup with typed accessors. Unparseable values fall back
     * to the default with a warning, except through {@link #getStrictDouble}.
     */
    private static final class Lookup {
        private final Function<String, String> source;

        Lookup(Function<String, String> source) {
            this.source = source;
        }

        String getString(String key, String defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                log.debug("Using default for {}: {}", key, defaultValue);
                return defaultValue;
            }
            return value.trim();
        }

        int getInt(String key, int defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        long getLong(String key, long defaultValue) {
            Long value = getOptionalLong(key);
            return value != null ? value : defaultValue;
        }

        Long getOptionalLong(String key) {
            String value = source.apply(key);
            if (isBlank(value)) {
                return null;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid integer for {}: {}, ignoring", key, value);
                return null;
            }
        }

        double getDouble(String key, double defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
        }

        double getStrictDouble(String key, double defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                return defaultValue;
            }
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Invalid number for " + key + ": " + value, e);
            }
        }

        boolean getBoolean(String key, boolean defaultValue) {
            String value = source.apply(key);
            if (isBlank(value)) {
                return defaultValue;
            }
            return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
        }
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private String apiBaseUrl = DEFAULT_API_URL;
        private String serviceToken = "";
        private int httpPort = DEFAULT_HTTP_PORT;
        private ScoringWeights weights = ScoringWeights.defaults();
        private ScoringWeights batchWeights = ScoringWeights.geoAware();
        private double partialSkillCredit = ScoringServiceImpl.DEFAULT_PARTIAL_CREDIT;
        private Set<String> generalistTags = Collections.singleton(ScoringServiceImpl.DEFAULT_GENERALIST_TAG);
        private boolean geoEnabled = true;
        private double geoSpeedKmh = GeoService.DEFAULT_SPEED_KMH;
        private double geoProximityCeilingKm = GeoService.DEFAULT_PROXIMITY_CEILING_KM;
        private double geoDefaultDistanceKm = GeoService.DEFAULT_UNKNOWN_DISTANCE_KM;
        private String zonesFile;
        private BreakerSettings defaultBreaker = BreakerSettings.defaults();
        private final Map<Dependency, BreakerSettings> breakerSettings = new EnumMap<>(Dependency.class);
        private Duration callTimeout = ResilienceLayer.DEFAULT_CALL_TIMEOUT;
        private int callPoolSize = ResilienceLayer.DEFAULT_POOL_SIZE;
        private boolean allowOnPermissionFailure = true;
        private boolean optimizationEnabled = true;
        private OptimizationBudget budget = OptimizationBudget.defaults();
        private Long randomSeed;
        private int smallBatchMax = BatchOptimizer.DEFAULT_SMALL_BATCH_MAX;
        private int largeBatchMin = BatchOptimizer.DEFAULT_LARGE_BATCH_MIN;
        private int criticalUrgency = BatchOptimizer.DEFAULT_CRITICAL_URGENCY;

        public Builder apiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl must not be null");
            return this;
        }

        public Builder serviceToken(String serviceToken) {
            this.serviceToken = serviceToken;
            return this;
        }

        public Builder httpPort(int httpPort) {
            this.httpPort = httpPort;
            return this;
        }

        public Builder weights(ScoringWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder batchWeights(ScoringWeights batchWeights) {
            this.batchWeights = batchWeights;
            return this;
        }

        public Builder partialSkillCredit(double partialSkillCredit) {
            this.partialSkillCredit = partialSkillCredit;
            return this;
        }

        public Builder generalistTags(Set<String> generalistTags) {
            this.generalistTags = Objects.requireNonNull(generalistTags, "generalistTags must not be null");
            return this;
        }

        public Builder geoEnabled(boolean geoEnabled) {
            this.geoEnabled = geoEnabled;
            return this;
        }

        public Builder geoSpeedKmh(double geoSpeedKmh) {
            this.geoSpeedKmh = geoSpeedKmh;
            return this;
        }

        public Builder geoProximityCeilingKm(double geoProximityCeilingKm) {
            this.geoProximityCeilingKm = geoProximityCeilingKm;
            return this;
        }

        public Builder geoDefaultDistanceKm(double geoDefaultDistanceKm) {
            this.geoDefaultDistanceKm = geoDefaultDistanceKm;
            return this;
        }

        public Builder zonesFile(String zonesFile) {
            this.zonesFile = zonesFile;
            return this;
        }

        /**
         * Settings for every dependency without its own entry.
         */
        public Builder defaultBreaker(BreakerSettings defaultBreaker) {
            this.defaultBreaker = Objects.requireNonNull(defaultBreaker, "defaultBreaker must not be null");
            return this;
        }

        public Builder breaker(Dependency dependency, BreakerSettings settings) {
            this.breakerSettings.put(dependency, Objects.requireNonNull(settings, "settings must not be null"));
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout must not be null");
            return this;
        }

        public Builder callPoolSize(int callPoolSize) {
            this.callPoolSize = callPoolSize;
            return this;
        }

        public Builder allowOnPermissionFailure(boolean allowOnPermissionFailure) {
            this.allowOnPermissionFailure = allowOnPermissionFailure;
            return this;
        }

        public Builder optimizationEnabled(boolean optimizationEnabled) {
            this.optimizationEnabled = optimizationEnabled;
            return this;
        }

        public Builder budget(OptimizationBudget budget) {
            this.budget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        public Builder randomSeed(Long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder smallBatchMax(int smallBatchMax) {
            this.smallBatchMax = smallBatchMax;
            return this;
        }

        public Builder largeBatchMin(int largeBatchMin) {
            this.largeBatchMin = largeBatchMin;
            return this;
        }

        public Builder criticalUrgency(int criticalUrgency) {
            this.criticalUrgency = criticalUrgency;
            return this;
        }

        public EngineConfig build() {
            if (httpPort <= 0 || httpPort > 65535) {
                throw new InvalidConfigurationException("httpPort must be between 1 and 65535, got " + httpPort);
            }
            if (Double.isNaN(partialSkillCredit) || partialSkillCredit < 0.0 || partialSkillCredit > 1.0) {
                throw new InvalidConfigurationException("partialSkillCredit must be in [0,1], got "
                        + partialSkillCredit);
            }
            if (geoSpeedKmh <= 0 || geoProximityCeilingKm <= 0 || geoDefaultDistanceKm < 0) {
                throw new InvalidConfigurationException("Geo speed and ceiling must be positive, default distance "
                        + "non-negative");
            }
            if (callTimeout.isNegative() || callTimeout.isZero()) {
                throw new InvalidConfigurationException("callTimeout must be positive, got " + callTimeout);
            }
            if (callPoolSize < 1) {
                throw new InvalidConfigurationException("callPoolSize must be at least 1, got " + callPoolSize);
            }
            if (smallBatchMax < 0 || largeBatchMin <= smallBatchMax) {
                throw new InvalidConfigurationException(String.format(
                        "Batch thresholds invalid: small batch max %d, large batch min %d",
                        smallBatchMax, largeBatchMin));
            }
            if (criticalUrgency < 1 || criticalUrgency > 5) {
                throw new InvalidConfigurationException("criticalUrgency must be in 1..5, got " + criticalUrgency);
            }
            return new EngineConfig(this);
        }
    }
}
