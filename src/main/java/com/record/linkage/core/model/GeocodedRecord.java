package com.record.linkage.core.model;

import com.record.linkage.geo.Coordinates;

import java.util.Objects;
import java.util.Optional;

/**
 * A standardized record plus the coordinates its address resolved to, if any.
 *
 * @param standardized the standardized record
 * @param location     resolved coordinates, or {@code null} when geocoding did not resolve
 */
public record GeocodedRecord(
        StandardizedRecord standardized,
        Coordinates location
) {
    public GeocodedRecord {
        Objects.requireNonNull(standardized, "standardized is required");
    }

    public static GeocodedRecord resolved(StandardizedRecord standardized, Coordinates location) {
        return new GeocodedRecord(standardized, Objects.requireNonNull(location, "location is required"));
    }

    public static GeocodedRecord unresolved(StandardizedRecord standardized) {
        return new GeocodedRecord(standardized, null);
    }

    public int index() {
        return standardized.index();
    }

    public String companyNameNorm() {
        return standardized.companyNameNorm();
    }

    public String addressNorm() {
        return standardized.addressNorm();
    }

    public CompanyRecord source() {
        return standardized.source();
    }

    public boolean isMatchable() {
        return standardized.isMatchable();
    }

    public boolean hasCoordinates() {
        return location != null;
    }

    public Optional<Coordinates> coordinates() {
        return Optional.ofNullable(location);
    }
}
