package com.record.linkage.api;

import com.record.linkage.audit.AssignmentLedger;
import com.record.linkage.cluster.GroupingResult;
import com.record.linkage.cluster.SpatialGrouper;
import com.record.linkage.core.model.CompanyRecord;
import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.GroupAssignment;
import com.record.linkage.core.model.LinkedRecord;
import com.record.linkage.core.model.LocationGroup;
import com.record.linkage.core.model.SimilarityPair;
import com.record.linkage.core.model.StandardizedRecord;
import com.record.linkage.geo.Coordinates;
import com.record.linkage.geo.Geocoder;
import com.record.linkage.geo.GeocodingStrategy;
import com.record.linkage.geo.ProgressCallback;
import com.record.linkage.geo.SequentialGeocodingStrategy;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.LinkageMetrics;
import com.record.linkage.metrics.NoOpLinkageMetrics;
import com.record.linkage.rules.DefaultNormalizationRules;
import com.record.linkage.rules.NormalizationEngine;
import com.record.linkage.rules.TextStandardizer;
import com.record.linkage.similarity.SimilarityScorer;
import com.record.linkage.similarity.WeightedSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the linkage pipeline over a batch of company records:
 * standardize, geocode, group, then split the records into processed and low-similarity rows.
 *
 * <p>Each call to {@link #link(List)} owns its own state; an orchestrator can be reused for
 * several batches. Only geocoding may run concurrently, inside the configured
 * {@link GeocodingStrategy}.</p>
 *
 * Usage:
 * <pre>
 * LinkageOrchestrator orchestrator = LinkageOrchestrator.builder()
 *     .geocoder(new CachingGeocoder(NominatimGeocoder.builder().build(), 10_000))
 *     .options(LinkageOptions.defaults())
 *     .build();
 * LinkageResult result = orchestrator.link(records);
 * </pre>
 */
public class LinkageOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(LinkageOrchestrator.class);

    private final LinkageOptions options;
    private final TextStandardizer standardizer;
    private final SimilarityScorer scorer;
    private final Geocoder geocoder;
    private final GeocodingStrategy geocodingStrategy;
    private final NormalizationEngine queryEngine;
    private final LinkageMetrics metrics;
    private final ProgressCallback progressCallback;

    private LinkageOrchestrator(Builder builder) {
        this.options = builder.options;
        this.standardizer = builder.standardizer;
        this.scorer = builder.scorer;
        this.geocoder = builder.geocoder;
        this.geocodingStrategy = builder.geocodingStrategy;
        this.queryEngine = DefaultNormalizationRules.createGeocodingQueryEngine();
        this.metrics = builder.metrics;
        this.progressCallback = builder.progressCallback;
    }

    /**
     * Links a batch of records.
     *
     * @param records input rows; their indices must be unique
     * @return both output partitions, the groups and the grouping trace
     */
    public LinkageResult link(List<CompanyRecord> records) {
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("linkage.started records={} geocoder={} strategy={} options={}",
                    records.size(), geocoder.getName(), geocodingStrategy.getName(), options);

            List<StandardizedRecord> standardized = new ArrayList<>(records.size());
            for (CompanyRecord record : records) {
                standardized.add(standardizer.standardize(record));
            }

            List<GeocodedRecord> geocoded = geocode(standardized);
            int unresolved = (int) geocoded.stream().filter(r -> !r.hasCoordinates()).count();

            AssignmentLedger ledger = new AssignmentLedger();
            SpatialGrouper grouper = new SpatialGrouper(scorer,
                    options.getDistanceThresholdMiles(), options.getSimilarityAcceptanceThreshold());
            GroupingResult grouping = grouper.group(geocoded, ledger);
            for (GroupAssignment assignment : grouping.getAssignments()) {
                metrics.incrementAssignment(assignment.reason());
            }

            List<LinkedRecord> processed = new ArrayList<>();
            List<LinkedRecord> lowSimilarity = new ArrayList<>();
            Map<Integer, GeocodedRecord> byIndex = new HashMap<>();
            geocoded.forEach(r -> byIndex.put(r.index(), r));

            for (GeocodedRecord record : geocoded) {
                LocationGroup group = grouping.getGroup(grouping.groupIdOf(record.index()));
                LinkedRecord linked = bestMatch(record, group, byIndex);
                metrics.recordBestScore(linked.bestScore());
                if (linked.bestScore() >= options.getLowSimilarityReportThreshold()) {
                    processed.add(linked);
                } else {
                    lowSimilarity.add(linked);
                    metrics.incrementLowSimilarity();
                }
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordRunDuration(elapsed);
            LinkageSummary summary = summarize(records.size(), grouping, unresolved,
                    processed, lowSimilarity, elapsed);

            log.info("linkage.completed {}", summary.describe());
            return new LinkageResult(runId, processed, lowSimilarity, grouping.getGroups(),
                    ledger.getAllAssignments(), summary);
        }
    }

    /**
     * Geocodes every distinct non-empty query once and maps the results back by index.
     */
    private List<GeocodedRecord> geocode(List<StandardizedRecord> standardized) {
        Map<String, Integer> distinctQueries = new LinkedHashMap<>();
        List<String> queryByRecord = new ArrayList<>(standardized.size());
        for (StandardizedRecord record : standardized) {
            String query = geocodingQuery(record);
            queryByRecord.add(query);
            if (!query.isEmpty()) {
                distinctQueries.putIfAbsent(query, distinctQueries.size());
            }
        }

        List<String> queries = new ArrayList<>(distinctQueries.keySet());
        log.info("geocode.started records={} distinctQueries={} strategy={}",
                standardized.size(), queries.size(), geocodingStrategy.getName());

        List<Optional<Coordinates>> results = queries.isEmpty()
                ? List.of()
                : geocodingStrategy.geocodeAll(queries, geocoder, progressCallback);
        if (results.size() != queries.size()) {
            throw new IllegalStateException("Geocoding strategy " + geocodingStrategy.getName()
                    + " returned " + results.size() + " results for " + queries.size() + " queries");
        }

        List<GeocodedRecord> geocoded = new ArrayList<>(standardized.size());
        for (int i = 0; i < standardized.size(); i++) {
            StandardizedRecord record = standardized.get(i);
            String query = queryByRecord.get(i);
            Optional<Coordinates> location = query.isEmpty()
                    ? Optional.empty()
                    : results.get(distinctQueries.get(query));
            if (location != null && location.isPresent()) {
                metrics.incrementGeocodeResolved();
                geocoded.add(GeocodedRecord.resolved(record, location.get()));
            } else {
                metrics.incrementGeocodeUnresolved();
                geocoded.add(GeocodedRecord.unresolved(record));
            }
        }

        log.info("geocode.completed resolved={} unresolved={}",
                geocoded.stream().filter(GeocodedRecord::hasCoordinates).count(),
                geocoded.stream().filter(r -> !r.hasCoordinates()).count());
        return geocoded;
    }

    private String geocodingQuery(StandardizedRecord record) {
        String address = record.addressNorm();
        if (address.isEmpty() || !options.isPreprocessGeocodingQuery()) {
            return address;
        }
        return queryEngine.normalize(address);
    }

    /**
     * Best overall score against any other member of the record's group; ties go to the
     * lowest record index.
     */
    private LinkedRecord bestMatch(GeocodedRecord record, LocationGroup group, Map<Integer, GeocodedRecord> byIndex) {
        SimilarityPair best = null;
        int bestIndex = -1;
        for (int memberIndex : group.getMembers()) {
            if (memberIndex == record.index()) {
                continue;
            }
            SimilarityPair pair = scorer.score(record, byIndex.get(memberIndex));
            if (best == null
                    || pair.overallScore() > best.overallScore()
                    || (pair.overallScore() == best.overallScore() && memberIndex < bestIndex)) {
                best = pair;
                bestIndex = memberIndex;
            }
        }
        return new LinkedRecord(record, group.getGroupId(), best, bestIndex);
    }

    private LinkageSummary summarize(int totalRecords, GroupingResult grouping, int unresolved,
                                     List<LinkedRecord> processed, List<LinkedRecord> lowSimilarity,
                                     Duration elapsed) {
        double sum = 0.0;
        double lowest = Double.MAX_VALUE;
        int grouped = 0;
        for (List<LinkedRecord> partition : List.of(processed, lowSimilarity)) {
            for (LinkedRecord linked : partition) {
                if (linked.bestMatch() == null) {
                    continue;
                }
                grouped++;
                sum += linked.bestScore();
                lowest = Math.min(lowest, linked.bestScore());
            }
        }
        double average = grouped == 0 ? 0.0 : sum / grouped;
        return new LinkageSummary(totalRecords, grouping.groupCount(), grouping.multiMemberGroupCount(),
                unresolved, processed.size(), lowSimilarity.size(), average,
                grouped == 0 ? 0.0 : lowest, elapsed);
    }

    public LinkageOptions getOptions() {
        return options;
    }

    public GeocodingStrategy getGeocodingStrategy() {
        return geocodingStrategy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LinkageOptions options = LinkageOptions.defaults();
        private TextStandardizer standardizer = new TextStandardizer();
        private SimilarityScorer scorer = new WeightedSimilarityScorer();
        private Geocoder geocoder;
        private GeocodingStrategy geocodingStrategy = new SequentialGeocodingStrategy();
        private LinkageMetrics metrics = NoOpLinkageMetrics.INSTANCE;
        private ProgressCallback progressCallback = ProgressCallback.NOOP;

        public Builder options(LinkageOptions options) {
            this.options = options;
            return this;
        }

        public Builder standardizer(TextStandardizer standardizer) {
            this.standardizer = standardizer;
            return this;
        }

        public Builder scorer(SimilarityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder geocoder(Geocoder geocoder) {
            this.geocoder = geocoder;
            return this;
        }

        public Builder geocodingStrategy(GeocodingStrategy geocodingStrategy) {
            this.geocodingStrategy = geocodingStrategy;
            return this;
        }

        public Builder metrics(LinkageMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public LinkageOrchestrator build() {
            Objects.requireNonNull(geocoder, "geocoder is required");
            Objects.requireNonNull(options, "options is required");
            Objects.requireNonNull(standardizer, "standardizer is required");
            Objects.requireNonNull(scorer, "scorer is required");
            Objects.requireNonNull(geocodingStrategy, "geocodingStrategy is required");
            Objects.requireNonNull(metrics, "metrics is required");
            Objects.requireNonNull(progressCallback, "progressCallback is required");
            return new LinkageOrchestrator(this);
        }
    }
}
