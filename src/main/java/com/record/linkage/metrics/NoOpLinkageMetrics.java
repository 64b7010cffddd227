package com.record.linkage.metrics;

import com.record.linkage.core.model.AssignmentReason;

import java.time.Duration;

/**
 * No-op implementation of {@link LinkageMetrics}.
 */
public final class NoOpLinkageMetrics implements LinkageMetrics {

    public static final NoOpLinkageMetrics INSTANCE = new NoOpLinkageMetrics();

    private NoOpLinkageMetrics() {
    }

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void incrementGeocodeResolved() {
    }

    @Override
    public void incrementGeocodeUnresolved() {
    }

    @Override
    public void incrementAssignment(AssignmentReason reason) {
    }

    @Override
    public void incrementLowSimilarity() {
    }

    @Override
    public void recordBestScore(double score) {
    }
}
