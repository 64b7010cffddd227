package com.record.linkage.metrics;

import com.record.linkage.core.model.AssignmentReason;

import java.time.Duration;

/**
 * Interface for recording linkage run metrics.
 * The default {@link NoOpLinkageMetrics} does nothing, so the library works without a
 * metrics registry.
 */
public interface LinkageMetrics {

    void recordRunDuration(Duration duration);

    void incrementGeocodeResolved();

    void incrementGeocodeUnresolved();

    void incrementAssignment(AssignmentReason reason);

    void incrementLowSimilarity();

    void recordBestScore(double score);
}
