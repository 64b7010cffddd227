package com.record.linkage.geo;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Caffeine-backed memo in front of another geocoder. Caches unresolved addresses too, so a
 * given address yields the same answer for the lifetime of the cache.
 */
public class CachingGeocoder implements Geocoder {
    private static final Logger log = LoggerFactory.getLogger(CachingGeocoder.class);

    private final Geocoder delegate;
    private final Cache<String, Optional<Coordinates>> cache;

    public CachingGeocoder(Geocoder delegate, long maxSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.info("CachingGeocoder initialized: delegate={}, maxSize={}", delegate.getName(), maxSize);
    }

    @Override
    public Optional<Coordinates> geocode(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return cache.get(address, delegate::geocode);
    }

    @Override
    public String getName() {
        return "Caching(" + delegate.getName() + ")";
    }

    public GeocodeCacheStats getStats() {
        CacheStats stats = cache.stats();
        return new GeocodeCacheStats(stats.hitCount(), stats.missCount(), cache.estimatedSize());
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
