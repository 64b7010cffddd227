package com.record.linkage.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CompletableFuture-based fan-out bounded by a semaphore.
 * Each call gets its own timeout; an address that cannot obtain a permit within the timeout,
 * or whose call does not finish within it, resolves to empty.
 *
 * <p>A permit is held until the geocoder call itself returns, not until its future times out,
 * so at most {@code maxConcurrency} calls are ever in flight.</p>
 */
public class AsyncGeocodingStrategy implements GeocodingStrategy, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AsyncGeocodingStrategy.class);

    public static final String NAME = "async";

    private final int maxConcurrency;
    private final long timeoutMs;
    private final ExecutorService executor;

    public AsyncGeocodingStrategy(int maxConcurrency, long timeoutMs) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.maxConcurrency = maxConcurrency;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "geocode-async");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public List<Optional<Coordinates>> geocodeAll(List<String> addresses, Geocoder geocoder,
                                                  ProgressCallback callback) {
        Semaphore semaphore = new Semaphore(maxConcurrency);
        AtomicLong completed = new AtomicLong();
        long total = addresses.size();

        List<CompletableFuture<Optional<Coordinates>>> futures = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            futures.add(submit(address, geocoder, semaphore, completed, total, callback));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream()
                        .map(CompletableFuture::join)
                        .toList())
                .join();
    }

    private CompletableFuture<Optional<Coordinates>> submit(String address, Geocoder geocoder, Semaphore semaphore,
                                                             AtomicLong completed, long total,
                                                             ProgressCallback callback) {
        boolean acquired;
        try {
            acquired = semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            log.warn("geocode.no_permit strategy={} address='{}'", NAME, address);
            callback.onProgress(completed.incrementAndGet(), total, "skipped");
            return CompletableFuture.completedFuture(Optional.empty());
        }

        CompletableFuture<Optional<Coordinates>> call;
        try {
            call = CompletableFuture.supplyAsync(() -> {
                try {
                    return SafeGeocoding.resolve(geocoder, address);
                } finally {
                    semaphore.release();
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            semaphore.release();
            throw e;
        }

        return call
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    log.warn("geocode.timeout strategy={} address='{}' error={}", NAME, address, error.toString());
                    return Optional.empty();
                })
                .whenComplete((result, error) ->
                        callback.onProgress(completed.incrementAndGet(), total, "geocoded"));
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
