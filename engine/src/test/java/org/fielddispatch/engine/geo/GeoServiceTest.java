package org.fielddispatch.engine.geo;

import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GeoService")
class GeoServiceTest {

    // One tenth of a degree of latitude on a 6371 km sphere.
    private static final double TENTH_DEGREE_KM = 6371.0 * Math.toRadians(0.1);

    private GeoService geoService;

    @BeforeEach
    void setUp() {
        ZoneTable zones = ZoneTable.of(Arrays.asList(
                new Zone("home", 0.0, 0.0),
                new Zone("north-1", 0.1, 0.0),
                new Zone("north-2", 0.2, 0.0),
                new Zone("north-3", 0.3, 0.0),
                new Zone("far", 1.0, 0.0)));
        geoService = new GeoService(zones);
    }

    @Test
    @DisplayName("Same zone costs nothing, regardless of case")
    void sameZoneIsFree() {
        TravelEstimate estimate = geoService.estimate("Home ", "home");

        assertThat(estimate.getDistanceKm()).isZero();
        assertThat(estimate.getTravelMinutes()).isZero();
        assertThat(estimate.isResolved()).isTrue();
        assertThat(geoService.proximity("home", "HOME")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Known zones use great-circle distance and average speed")
    void knownZonesUseHaversine() {
        TravelEstimate estimate = geoService.estimate("home", "north-1");

        assertThat(estimate.isResolved()).isTrue();
        assertThat(estimate.getDistanceKm()).isCloseTo(TENTH_DEGREE_KM, within(1e-6));
        assertThat(estimate.getTravelMinutes()).isCloseTo(TENTH_DEGREE_KM / 25.0 * 60.0, within(1e-6));
        assertThat(geoService.proximity("home", "north-1"))
                .isCloseTo(1.0 - TENTH_DEGREE_KM / 15.0, within(1e-6));
    }

    @Test
    @DisplayName("Proximity is clamped to zero beyond the ceiling")
    void proximityClampsAtCeiling() {
        assertThat(geoService.proximity("home", "far")).isZero();
    }

    @Test
    @DisplayName("Unknown zones fall back to the default distance and neutral proximity")
    void unknownZoneUsesDefaults() {
        TravelEstimate estimate = geoService.estimate("home", "atlantis");

        assertThat(estimate.isResolved()).isFalse();
        assertThat(estimate.getDistanceKm()).isEqualTo(10.0);
        assertThat(estimate.getTravelMinutes()).isCloseTo(24.0, within(1e-9));
        assertThat(geoService.proximity("home", "atlantis")).isEqualTo(GeoService.NEUTRAL_PROXIMITY);
        assertThat(geoService.proximity(null, "home")).isEqualTo(GeoService.NEUTRAL_PROXIMITY);
    }

    @Test
    @DisplayName("Route visits the nearest remaining zone first")
    void orderRouteNearestNeighbour() {
        RoutePlan plan = geoService.orderRoute("home", Arrays.asList("north-2", "north-1", "north-3"));

        assertThat(plan.getHomeZone()).isEqualTo("home");
        assertThat(plan.getStops()).containsExactly("north-1", "north-2", "north-3");
        assertThat(plan.getTotalDistanceKm()).isCloseTo(3 * TENTH_DEGREE_KM, within(1e-6));
    }

    @Test
    @DisplayName("Route ties keep input order")
    void orderRouteTiesKeepInputOrder() {
        RoutePlan plan = geoService.orderRoute("home", Arrays.asList("nowhere-b", "nowhere-a"));

        assertThat(plan.getStops()).containsExactly("nowhere-b", "nowhere-a");
        assertThat(plan.getTotalDistanceKm()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Clusters group by canonical zone, largest first, unknown zones together")
    void clustersByZone() {
        List<String> items = Arrays.asList("north-1", "Home", "home ", null, "lake", " ");

        Map<String, List<String>> clusters = geoService.clusterByZone(items, Function.identity());

        assertThat(clusters.keySet()).containsExactly("home", GeoService.UNKNOWN_ZONE, "lake", "north-1");
        assertThat(clusters.get("home")).containsExactly("Home", "home ");
        assertThat(clusters.get(GeoService.UNKNOWN_ZONE)).containsExactly(null, " ");
    }

    @Test
    @DisplayName("Coverage reports demand shares, nearby zones and uncovered demand")
    void analyzesCoverage() {
        CoverageReport report = geoService.analyzeCoverage(
                Arrays.asList("home", "home", "north-2", "far", null),
                Arrays.asList("north-1", "lake", null),
                12.0);

        assertThat(report.getTotalDemand()).isEqualTo(5);
        assertThat(report.getDemand().keySet()).containsExactly("home", "far", "north-2", GeoService.UNKNOWN_ZONE);
        assertThat(report.getDemand()).containsEntry("home", 2);
        assertThat(report.getDemandPercentages().get("home")).isCloseTo(40.0, within(1e-9));
        assertThat(report.getSuggestedExecutors()).containsEntry("home", 1).containsEntry("far", 1);
        assertThat(report.getGaps()).containsExactly("far");

        CoverageReport.ZoneCoverage home = report.getZones().get(0);
        assertThat(home.getZone()).isEqualTo("home");
        assertThat(home.getNearbyZones()).containsExactly("north-1");
        assertThat(home.getStationedExecutors()).isZero();
        assertThat(home.getExecutorsWithinRadius()).isEqualTo(1);
        assertThat(home.isCovered()).isTrue();

        CoverageReport.ZoneCoverage north1 = report.getZones().get(1);
        assertThat(north1.getNearbyZones()).containsExactly("home", "north-2");
        assertThat(north1.getStationedExecutors()).isEqualTo(1);
        assertThat(north1.getDemandPercentage()).isZero();
    }

    @Test
    @DisplayName("Coverage rejects a negative radius")
    void coverageRejectsNegativeRadius() {
        assertThatThrownBy(() -> geoService.analyzeCoverage(Collections.emptyList(), Collections.emptyList(), -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Non-positive speed is rejected")
    void rejectsInvalidSpeed() {
        assertThatThrownBy(() -> new GeoService(ZoneTable.of(Collections.emptyList()), 0.0, 15.0, 10.0))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
