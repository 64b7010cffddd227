package com.record.linkage.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Geocodes a batch on a fixed pool of worker threads.
 *
 * <p>The whole batch gets a time budget of {@code timeoutMs * ceil(n / workers)}. Addresses
 * still pending when the budget runs out are cancelled and resolve to empty.</p>
 */
public class WorkerPoolGeocodingStrategy implements GeocodingStrategy, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPoolGeocodingStrategy.class);

    public static final String NAME = "worker-pool";

    private final int workers;
    private final long timeoutMs;
    private final ExecutorService executor;

    public WorkerPoolGeocodingStrategy(int workers, long timeoutMs) {
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.workers = workers;
        this.timeoutMs = timeoutMs;
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "geocode-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public List<Optional<Coordinates>> geocodeAll(List<String> addresses, Geocoder geocoder,
                                                  ProgressCallback callback) {
        long total = addresses.size();
        AtomicLong completed = new AtomicLong();

        List<Future<Optional<Coordinates>>> futures = new ArrayList<>(addresses.size());
        for (String address : addresses) {
            futures.add(executor.submit(() -> {
                Optional<Coordinates> result = SafeGeocoding.resolve(geocoder, address);
                callback.onProgress(completed.incrementAndGet(), total, "geocoded");
                return result;
            }));
        }

        long rounds = (addresses.size() + workers - 1) / workers;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs * Math.max(1, rounds));

        List<Optional<Coordinates>> results = new ArrayList<>(addresses.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(collect(futures.get(i), addresses.get(i), deadline));
        }
        return results;
    }

    private Optional<Coordinates> collect(Future<Optional<Coordinates>> future, String address, long deadline) {
        long remaining = deadline - System.nanoTime();
        try {
            return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("geocode.timeout strategy={} address='{}'", NAME, address);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("geocode.failed strategy={} address='{}' error={}", NAME, address, e.getCause().toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    public int getWorkers() {
        return workers;
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
