package com.record.linkage.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Geocodes one address after the other on the calling thread.
 */
public class SequentialGeocodingStrategy implements GeocodingStrategy {

    public static final String NAME = "sequential";

    @Override
    public List<Optional<Coordinates>> geocodeAll(List<String> addresses, Geocoder geocoder,
                                                  ProgressCallback callback) {
        List<Optional<Coordinates>> results = new ArrayList<>(addresses.size());
        long total = addresses.size();
        for (String address : addresses) {
            results.add(SafeGeocoding.resolve(geocoder, address));
            callback.onProgress(results.size(), total, "geocoded");
        }
        return results;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
