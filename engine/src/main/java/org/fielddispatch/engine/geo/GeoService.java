package org.fielddispatch.engine.geo;

import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Distance, travel time and proximity between zones.
 * Pure and thread-safe; unknown zones never raise.
 */
public final class GeoService {

    private static final Logger log = LoggerFactory.getLogger(GeoService.class);

    private static final double EARTH_RADIUS_KM = 6371.0;

    public static final double DEFAULT_SPEED_KMH = 25.0;
    public static final double DEFAULT_PROXIMITY_CEILING_KM = 15.0;
    public static final double DEFAULT_UNKNOWN_DISTANCE_KM = 10.0;
    public static final double NEUTRAL_PROXIMITY = 0.5;
    public static final double DEFAULT_COVERAGE_RADIUS_KM = 5.0;
    public static final String UNKNOWN_ZONE = "unknown";

    private final ZoneTable zones;
    private final double averageSpeedKmh;
    private final double proximityCeilingKm;
    private final double unknownDistanceKm;

    public GeoService(ZoneTable zones) {
        this(zones, DEFAULT_SPEED_KMH, DEFAULT_PROXIMITY_CEILING_KM, DEFAULT_UNKNOWN_DISTANCE_KM);
    }

    public GeoService(ZoneTable zones, double averageSpeedKmh, double proximityCeilingKm, double unknownDistanceKm) {
        this.zones = Objects.requireNonNull(zones, "zones must not be null");
        if (averageSpeedKmh <= 0) {
            throw new InvalidConfigurationException("Average speed must be positive, got " + averageSpeedKmh);
        }
        if (proximityCeilingKm <= 0) {
            throw new InvalidConfigurationException("Proximity ceiling must be positive, got " + proximityCeilingKm);
        }
        if (unknownDistanceKm < 0) {
            throw new InvalidConfigurationException("Default distance must not be negative, got " + unknownDistanceKm);
        }
        this.averageSpeedKmh = averageSpeedKmh;
        this.proximityCeilingKm = proximityCeilingKm;
        this.unknownDistanceKm = unknownDistanceKm;
    }

    public ZoneTable getZones() {
        return zones;
    }

    /**
     * Estimate the trip between two zones. Equal zone names cost nothing, even
     * when the zone is not in the table.
     */
    public TravelEstimate estimate(String fromZone, String toZone) {
        if (sameZone(fromZone, toZone)) {
            return TravelEstimate.zero();
        }
        Optional<Zone> from = zones.find(fromZone);
        Optional<Zone> to = zones.find(toZone);
        if (from.isEmpty() || to.isEmpty()) {
            log.debug("Unknown zone in {} -> {}, using default distance {} km", fromZone, toZone, unknownDistanceKm);
            return new TravelEstimate(unknownDistanceKm, toMinutes(unknownDistanceKm), false);
        }
        double km = distanceKm(from.get(), to.get());
        return new TravelEstimate(km, toMinutes(km), true);
    }

    /**
     * Proximity in [0,1]: 1.0 for the same zone, falling linearly to 0.0 at
     * the ceiling distance. Unresolvable pairs get {@value #NEUTRAL_PROXIMITY}.
     */
    public double proximity(String fromZone, String toZone) {
        TravelEstimate estimate = estimate(fromZone, toZone);
        if (!estimate.isResolved()) {
            return NEUTRAL_PROXIMITY;
        }
        double value = 1.0 - estimate.getDistanceKm() / proximityCeilingKm;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Nearest-neighbour ordering of destinations starting at the home zone.
     * Ties keep input order. Duplicate destinations are visited at zero cost.
     */
    public RoutePlan orderRoute(String homeZone, List<String> destinations) {
        Objects.requireNonNull(destinations, "destinations must not be null");
        List<String> remaining = new ArrayList<>(destinations);
        List<String> ordered = new ArrayList<>(destinations.size());
        String current = homeZone;
        double totalKm = 0.0;
        double totalMinutes = 0.0;

        while (!remaining.isEmpty()) {
            int bestIndex = 0;
            TravelEstimate best = estimate(current, remaining.get(0));
            for (int i = 1; i < remaining.size(); i++) {
                TravelEstimate candidate = estimate(current, remaining.get(i));
                if (candidate.getDistanceKm() < best.getDistanceKm()) {
                    best = candidate;
                    bestIndex = i;
                }
            }
            current = remaining.remove(bestIndex);
            ordered.add(current);
            totalKm += best.getDistanceKm();
            totalMinutes += best.getTravelMinutes();
        }
        return new RoutePlan(homeZone, ordered, totalKm, totalMinutes);
    }

    /**
     * Group items by zone, largest group first, ties by zone name. Items keep
     * input order within a group. Known zones use the table's spelling;
     * missing or blank zones fall under {@value #UNKNOWN_ZONE}.
     */
    public <T> Map<String, List<T>> clusterByZone(List<T> items, Function<T, String> zoneOf) {
        Objects.requireNonNull(items, "items must not be null");
        Map<String, List<T>> groups = new HashMap<>();
        for (T item : items) {
            groups.computeIfAbsent(canonicalZone(zoneOf.apply(item)), zone -> new ArrayList<>()).add(item);
        }
        Map<String, List<T>> clusters = new LinkedHashMap<>();
        groups.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, List<T>> e) -> e.getValue().size()).reversed()
                        .thenComparing(e -> e.getKey()))
                .forEach(e -> clusters.put(e.getKey(), Collections.unmodifiableList(e.getValue())));
        if (log.isDebugEnabled()) {
            Map<String, Integer> sizes = new LinkedHashMap<>();
            clusters.forEach((zone, members) -> sizes.put(zone, members.size()));
            log.debug("Clustered {} items into {} zones: {}", items.size(), clusters.size(), sizes);
        }
        return clusters;
    }

    /**
     * Compare ticket demand per zone with where executors are stationed.
     *
     * @param demandZones one zone per ticket, may repeat or be null
     * @param executorZones home zone per executor, may be null
     * @param radiusKm an executor covers every zone within this distance of its home
     */
    public CoverageReport analyzeCoverage(List<String> demandZones, List<String> executorZones, double radiusKm) {
        Objects.requireNonNull(demandZones, "demandZones must not be null");
        Objects.requireNonNull(executorZones, "executorZones must not be null");
        if (radiusKm < 0) {
            throw new IllegalArgumentException("radiusKm must not be negative, got " + radiusKm);
        }

        Map<String, Integer> demand = new LinkedHashMap<>();
        clusterByZone(demandZones, Function.identity()).forEach((zone, members) -> demand.put(zone, members.size()));
        int total = demandZones.size();

        Map<String, Double> percentages = new LinkedHashMap<>();
        Map<String, Integer> suggested = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : demand.entrySet()) {
            double percentage = entry.getValue() * 100.0 / total;
            percentages.put(entry.getKey(), percentage);
            suggested.put(entry.getKey(), (int) Math.max(1, Math.round(executorZones.size() * percentage / 100.0)));
        }

        List<CoverageReport.ZoneCoverage> coverage = new ArrayList<>(zones.size());
        for (Zone zone : zones.all()) {
            List<String> nearby = new ArrayList<>();
            for (Zone other : zones.all()) {
                if (!other.equals(zone) && distanceKm(zone, other) <= radiusKm) {
                    nearby.add(other.getName());
                }
            }
            String name = zone.getName();
            coverage.add(new CoverageReport.ZoneCoverage(name, nearby, percentages.getOrDefault(name, 0.0),
                    stationedIn(name, executorZones), executorsWithin(name, executorZones, radiusKm)));
        }

        List<String> gaps = new ArrayList<>();
        for (String zone : demand.keySet()) {
            if (!UNKNOWN_ZONE.equals(zone) && executorsWithin(zone, executorZones, radiusKm) == 0) {
                gaps.add(zone);
            }
        }

        CoverageReport report = new CoverageReport(radiusKm, total, demand, percentages, suggested, coverage, gaps);
        log.info("Coverage analysed: {}", report);
        return report;
    }

    String canonicalZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return UNKNOWN_ZONE;
        }
        return zones.find(zone).map(Zone::getName).orElse(ZoneTable.normalize(zone));
    }

    private int stationedIn(String zone, List<String> executorZones) {
        int count = 0;
        for (String home : executorZones) {
            if (sameZone(home, zone)) {
                count++;
            }
        }
        return count;
    }

    private int executorsWithin(String zone, List<String> executorZones, double radiusKm) {
        if (UNKNOWN_ZONE.equals(zone)) {
            return 0;
        }
        int count = 0;
        for (String home : executorZones) {
            if (home == null || home.isBlank()) {
                continue;
            }
            TravelEstimate trip = estimate(home, zone);
            if (trip.isResolved() && trip.getDistanceKm() <= radiusKm) {
                count++;
            }
        }
        return count;
    }

    private double toMinutes(double km) {
        return km / averageSpeedKmh * 60.0;
    }

    private static boolean sameZone(String a, String b) {
        return a != null && b != null && ZoneTable.normalize(a).equals(ZoneTable.normalize(b));
    }

    /**
     * Haversine distance between two zone centers in kilometres.
     */
    static double distanceKm(Zone a, Zone b) {
        double dLat = Math.toRadians(b.getLatitude() - a.getLatitude());
        double dLon = Math.toRadians(b.getLongitude() - a.getLongitude());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(a.getLatitude())) * Math.cos(Math.toRadians(b.getLatitude()))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }
}
