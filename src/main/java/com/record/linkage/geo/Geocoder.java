package com.record.linkage.geo;

import java.util.Optional;

/**
 * Resolves an address to coordinates.
 *
 * <p>Implementations must be idempotent for a given address and must not let provider
 * failures escape: rate limiting, network errors and timeouts all resolve to
 * {@link Optional#empty()}. Implementations may be called from several threads at once.</p>
 */
@FunctionalInterface
public interface Geocoder {

    /**
     * @param address the address to resolve
     * @return the coordinates, or empty when the address could not be resolved
     */
    Optional<Coordinates> geocode(String address);

    /**
     * Returns the name of this geocoder for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
