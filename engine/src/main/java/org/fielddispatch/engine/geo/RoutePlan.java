package org.fielddispatch.engine.geo;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered visiting plan for one executor, starting from the home zone.
 */
public final class RoutePlan {

    private final String homeZone;
    private final List<String> stops;
    private final double totalDistanceKm;
    private final double totalTravelMinutes;

    public RoutePlan(String homeZone, List<String> stops, double totalDistanceKm, double totalTravelMinutes) {
        this.homeZone = homeZone;
        this.stops = Collections.unmodifiableList(List.copyOf(Objects.requireNonNull(stops, "stops must not be null")));
        this.totalDistanceKm = totalDistanceKm;
        this.totalTravelMinutes = totalTravelMinutes;
    }

    public String getHomeZone() {
        return homeZone;
    }

    /**
     * Destination zones in visiting order.
     */
    public List<String> getStops() {
        return stops;
    }

    public double getTotalDistanceKm() {
        return totalDistanceKm;
    }

    public double getTotalTravelMinutes() {
        return totalTravelMinutes;
    }

    @Override
    public String toString() {
        return String.format("RoutePlan{home='%s', stops=%s, %.2fkm, %.1fmin}",
                homeZone, stops, totalDistanceKm, totalTravelMinutes);
    }
}
