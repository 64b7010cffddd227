package com.record.linkage.geo;

/**
 * Callback interface for tracking progress of geocoding batches.
 * May be invoked from worker threads.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of addresses processed so far
     * @param total     the total number of addresses (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
