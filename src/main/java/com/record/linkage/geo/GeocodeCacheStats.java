package com.record.linkage.geo;

/**
 * Snapshot of {@link CachingGeocoder} statistics.
 *
 * @param hitCount  lookups answered from the cache
 * @param missCount lookups that went to the delegate geocoder
 * @param size      approximate number of cached addresses
 */
public record GeocodeCacheStats(long hitCount, long missCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
