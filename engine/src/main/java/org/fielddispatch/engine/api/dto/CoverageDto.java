package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.geo.CoverageReport;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * DTO for POST /coverage.
 */
public final class CoverageDto {

    @JsonProperty("coverage_radius_km")
    private final double radiusKm;

    @JsonProperty("total_demand")
    private final int totalDemand;

    @JsonProperty("demand_analysis")
    private final Map<String, Integer> demand;

    @JsonProperty("demand_percentages")
    private final Map<String, Double> demandPercentages;

    @JsonProperty("suggested_executor_distribution")
    private final Map<String, Integer> suggestedExecutors;

    @JsonProperty("coverage_analysis")
    private final List<ZoneDto> zones;

    @JsonProperty("coverage_gaps")
    private final List<String> gaps;

    private CoverageDto(CoverageReport report) {
        this.radiusKm = report.getRadiusKm();
        this.totalDemand = report.getTotalDemand();
        this.demand = report.getDemand();
        this.demandPercentages = report.getDemandPercentages();
        this.suggestedExecutors = report.getSuggestedExecutors();
        this.zones = report.getZones().stream().map(ZoneDto::new).collect(Collectors.toList());
        this.gaps = report.getGaps();
    }

    public static CoverageDto from(CoverageReport report) {
        return new CoverageDto(report);
    }

    public double getRadiusKm() {
        return radiusKm;
    }

    public int getTotalDemand() {
        return totalDemand;
    }

    public Map<String, Integer> getDemand() {
        return demand;
    }

    public Map<String, Double> getDemandPercentages() {
        return demandPercentages;
    }

    public Map<String, Integer> getSuggestedExecutors() {
        return suggestedExecutors;
    }

    public List<ZoneDto> getZones() {
        return zones;
    }

    public List<String> getGaps() {
        return gaps;
    }

    public static final class ZoneDto {

        @JsonProperty("zone")
        private final String zone;

        @JsonProperty("nearby_zones")
        private final List<String> nearbyZones;

        @JsonProperty("demand_percentage")
        private final double demandPercentage;

        @JsonProperty("stationed_executors")
        private final int stationedExecutors;

        @JsonProperty("executors_within_radius")
        private final int executorsWithinRadius;

        ZoneDto(CoverageReport.ZoneCoverage coverage) {
            this.zone = coverage.getZone();
            this.nearbyZones = coverage.getNearbyZones();
            this.demandPercentage = coverage.getDemandPercentage();
            this.stationedExecutors = coverage.getStationedExecutors();
            this.executorsWithinRadius = coverage.getExecutorsWithinRadius();
        }

        public String getZone() {
            return zone;
        }

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
    }
}
