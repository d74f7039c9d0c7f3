package org.fielddispatch.engine.geo;

import java.util.Objects;

/**
 * Named district with approximate center coordinates.
 */
public final class Zone {

    private final String name;
    private final double latitude;
    private final double longitude;

    public Zone(String name, double latitude, double longitude) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("coordinates out of range for zone " + name);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public String getName() {
        return name;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Zone)) {
            return false;
        }
        Zone other = (Zone) o;
        return name.equals(other.name)
                && Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format("Zone{%s @ %.4f,%.4f}", name, latitude, longitude);
    }
}
