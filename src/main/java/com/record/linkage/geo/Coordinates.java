package com.record.linkage.geo;

import java.util.Locale;

/**
 * A latitude/longitude pair in decimal degrees.
 */
public record Coordinates(double latitude, double longitude) {

    public Coordinates {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("latitude must be between -90 and 90, got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("longitude must be between -180 and 180, got " + longitude);
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude);
    }

    /**
     * (0, 0) is what naive geocoding scripts return for "not found".
     */
    public boolean isNullIsland() {
        return latitude == 0.0 && longitude == 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.4f, %.4f)", latitude, longitude);
    }
}
