package org.fielddispatch.engine.geo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ticket demand per zone against where executors are stationed.
 * Maps iterate from highest demand down.
 */
public final class CoverageReport {

    private final double radiusKm;
    private final int totalDemand;
    private final Map<String, Integer> demand;
    private final Map<String, Double> demandPercentages;
    private final Map<String, Integer> suggestedExecutors;
    private final List<ZoneCoverage> zones;
    private final List<String> gaps;

    public CoverageReport(double radiusKm, int totalDemand, Map<String, Integer> demand,
                          Map<String, Double> demandPercentages, Map<String, Integer> suggestedExecutors,
                          List<ZoneCoverage> zones, List<String> gaps) {
        this.radiusKm = radiusKm;
        this.totalDemand = totalDemand;
        this.demand = Collections.unmodifiableMap(new LinkedHashMap<>(demand));
        this.demandPercentages = Collections.unmodifiableMap(new LinkedHashMap<>(demandPercentages));
        this.suggestedExecutors = Collections.unmodifiableMap(new LinkedHashMap<>(suggestedExecutors));
        this.zones = List.copyOf(zones);
        this.gaps = List.copyOf(gaps);
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public int getTotalDemand() {
        return totalDemand;
    }

    /**
     * Ticket count per zone.
     */
    public Map<String, Integer> getDemand() {
        return demand;
    }

    public Map<String, Double> getDemandPercentages() {
        return demandPercentages;
    }

    /**
     * Executors each demanded zone should have, proportional to its share of
     * demand, at least one.
     */
    public Map<String, Integer> getSuggestedExecutors() {
        return suggestedExecutors;
    }

    /**
     * One entry per known zone, in table order.
     */
    public List<ZoneCoverage> getZones() {
        return zones;
    }

    /**
     * Demanded zones with no executor stationed within the radius. Demand
     * without a zone is never a gap.
     */
    public List<String> getGaps() {
        return gaps;
    }

    @Override
    public String toString() {
        return String.format("CoverageReport{radius=%.1fkm, demand=%d in %d zones, gaps=%s}",
                radiusKm, totalDemand, demand.size(), gaps);
    }

    /**
     * Coverage of a single zone.
     */
    public static final class ZoneCoverage {
        private final String zone;
        private final List<String> nearbyZones;
        private final double demandPercentage;
        private final int stationedExecutors;
        private final int executorsWithinRadius;

        public ZoneCoverage(String zone, List<String> nearbyZones, double demandPercentage,
                            int stationedExecutors, int executorsWithinRadius) {
            this.zone = zone;
            this.nearbyZones = List.copyOf(nearbyZones);
            this.demandPercentage = demandPercentage;
            this.stationedExecutors = stationedExecutors;
            this.executorsWithinRadius = executorsWithinRadius;
        }

        public String getZone() {
            return zone;
        }

        /**
         * Other known zones whose centers lie within the radius.
         */
        public List<String> getNearbyZones() {
            return nearbyZones;
        }

        public double getDemandPercentage() {
            return demandPercentage;
        }

        public int getStationedExecutors() {
            return stationedExecutors;
        }

        public int getExecutorsWithinRadius() {
            return executorsWithinRadius;
        }

        public boolean isCovered() {
            return executorsWithinRadius > 0;
        }
    }
}
