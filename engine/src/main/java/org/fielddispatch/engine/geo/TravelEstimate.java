package org.fielddispatch.engine.geo;

/**
 * Estimated distance and travel time between two zones.
 * {@code resolved} is false when either zone was missing from the table
 * and the default distance was used instead.
 */
public final class TravelEstimate {

    private static final TravelEstimate ZERO = new TravelEstimate(0.0, 0.0, true);

    private final double distanceKm;
    private final double travelMinutes;
    private final boolean resolved;

    public TravelEstimate(double distanceKm, double travelMinutes, boolean resolved) {
        this.distanceKm = distanceKm;
        this.travelMinutes = travelMinutes;
        this.resolved = resolved;
    }

    public static TravelEstimate zero() {
        return ZERO;
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public double getTravelMinutes() {
        return travelMinutes;
    }

    public boolean isResolved() {
        return resolved;
    }

    @Override
    public String toString() {
        return String.format("TravelEstimate{%.2fkm, %.1fmin%s}",
                distanceKm, travelMinutes, resolved ? "" : ", unresolved");
    }
}
