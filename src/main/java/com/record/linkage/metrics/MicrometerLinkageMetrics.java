package com.record.linkage.metrics;

import com.record.linkage.core.model.AssignmentReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link LinkageMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linkage.run.duration} Timer</li>
 *   <li>{@code linkage.geocode.resolved} Counter</li>
 *   <li>{@code linkage.geocode.unresolved} Counter</li>
 *   <li>{@code linkage.group.assignment} Counter (tag: reason)</li>
 *   <li>{@code linkage.record.low_similarity} Counter</li>
 *   <li>{@code linkage.best_score} DistributionSummary</li>
 * </ul>
 */
public class MicrometerLinkageMetrics implements LinkageMetrics {

    private final Timer runTimer;
    private final Counter geocodeResolved;
    private final Counter geocodeUnresolved;
    private final Map<AssignmentReason, Counter> assignmentCounters = new EnumMap<>(AssignmentReason.class);
    private final Counter lowSimilarity;
    private final DistributionSummary bestScoreSummary;

    public MicrometerLinkageMetrics(MeterRegistry registry) {
        this.runTimer = Timer.builder("linkage.run.duration")
                .description("Duration of complete linkage runs")
                .register(registry);
        this.geocodeResolved = Counter.builder("linkage.geocode.resolved")
                .description("Addresses resolved to coordinates")
                .register(registry);
        this.geocodeUnresolved = Counter.builder("linkage.geocode.unresolved")
                .description("Addresses that could not be resolved")
                .register(registry);
        for (AssignmentReason reason : AssignmentReason.values()) {
            assignmentCounters.put(reason, Counter.builder("linkage.group.assignment")
                    .description("Grouping decisions")
                    .tag("reason", reason.name())
                    .register(registry));
        }
        this.lowSimilarity = Counter.builder("linkage.record.low_similarity")
                .description("Records flagged for manual review")
                .register(registry);
        this.bestScoreSummary = DistributionSummary.builder("linkage.best_score")
                .description("Best in-group overall score per record")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void incrementGeocodeResolved() {
        geocodeResolved.increment();
    }

    @Override
    public void incrementGeocodeUnresolved() {
        geocodeUnresolved.increment();
    }

    @Override
    public void incrementAssignment(AssignmentReason reason) {
        assignmentCounters.get(reason).increment();
    }

    @Override
    public void incrementLowSimilarity() {
        lowSimilarity.increment();
    }

    @Override
    public void recordBestScore(double score) {
        bestScoreSummary.record(score);
    }

    /**
     * One-line {@code key=value} rendering of every meter this instance records.
     */
    public String report() {
        StringBuilder report = new StringBuilder()
                .append("geocode.resolved=").append((long) geocodeResolved.count())
                .append(" geocode.unresolved=").append((long) geocodeUnresolved.count());
        assignmentCounters.forEach((reason, counter) -> report
                .append(" assignment.").append(reason.name()).append('=').append((long) counter.count()));
        report.append(" low_similarity=").append((long) lowSimilarity.count())
                .append(String.format(Locale.ROOT, " best_score.mean=%.2f best_score.max=%.2f",
                        bestScoreSummary.mean(), bestScoreSummary.max()))
                .append(" run.ms=").append((long) runTimer.totalTime(TimeUnit.MILLISECONDS));
        return report.toString();
    }
}
