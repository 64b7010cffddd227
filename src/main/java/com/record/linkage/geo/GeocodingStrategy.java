package com.record.linkage.geo;

import java.util.List;
import java.util.Optional;

/**
 * Drives a {@link Geocoder} over a batch of addresses.
 *
 * <p>Implementations may run calls concurrently but must return a list aligned by index with
 * the input. A failed or timed-out call resolves to {@link Optional#empty()} for that address
 * only. The result for a given geocoder and input must not depend on the strategy used.</p>
 */
public interface GeocodingStrategy {

    /**
     * Geocodes every address of the batch.
     *
     * @param addresses the geocoder queries, in input order
     * @param geocoder  the geocoder to call
     * @param callback  progress sink, invoked once per completed address
     * @return one result per address, at the same index
     */
    List<Optional<Coordinates>> geocodeAll(List<String> addresses, Geocoder geocoder, ProgressCallback callback);

    /**
     * Returns the configuration name of this strategy.
     */
    String getName();
}
