package com.record.linkage.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns a geocoder failure into an empty result for a single address.
 */
final class SafeGeocoding {
    private static final Logger log = LoggerFactory.getLogger(SafeGeocoding.class);

    private SafeGeocoding() {
    }

    static Optional<Coordinates> resolve(Geocoder geocoder, String address) {
        try {
            Optional<Coordinates> result = geocoder.geocode(address);
            return result != null ? result : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("geocode.failed geocoder={} address='{}' error={}",
                    geocoder.getName(), address, e.toString());
            return Optional.empty();
        }
    }
}
