package com.record.linkage.config;

import com.record.linkage.api.LinkageOptions;
import com.record.linkage.geo.AsyncGeocodingStrategy;
import com.record.linkage.geo.CachingGeocoder;
import com.record.linkage.geo.Geocoder;
import com.record.linkage.geo.GeocodingStrategy;
import com.record.linkage.geo.NominatimGeocoder;
import com.record.linkage.geo.SequentialGeocodingStrategy;
import com.record.linkage.geo.WorkerPoolGeocodingStrategy;
import com.record.linkage.rules.StandardizationProfile;
import com.record.linkage.rules.TextStandardizer;
import com.record.linkage.similarity.ScoreWeights;
import com.record.linkage.similarity.SimilarityAlgorithm;
import com.record.linkage.similarity.WeightedSimilarityScorer;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Linkage settings read from MicroProfile Config.
 *
 * <p>Sources by precedence: explicit overrides, an optional properties file, system properties,
 * environment variables, then {@code META-INF/microprofile-config.properties} on the classpath.
 * Every value is validated when the configuration is loaded.</p>
 *
 * <pre>
 * LinkageConfig config = LinkageConfig.load(Map.of("linkage.distance_threshold_miles", "25"), null);
 * LinkageOrchestrator orchestrator = LinkageOrchestrator.builder()
 *     .options(config.toOptions())
 *     .scorer(config.createScorer())
 *     .geocoder(config.createGeocoder())
 *     .build();
 * </pre>
 */
public class LinkageConfig {
    private static final Logger log = LoggerFactory.getLogger(LinkageConfig.class);

    static final int OVERRIDES_ORDINAL = 500;
    static final int FILE_ORDINAL = 450;

    // ── Thresholds ────────────────────────────────────────────
    public static final String DISTANCE_THRESHOLD_MILES = "linkage.distance_threshold_miles";
    public static final String ACCEPTANCE_THRESHOLD = "linkage.similarity_acceptance_threshold";
    public static final String LOW_SIMILARITY_REPORT_THRESHOLD = "linkage.low_similarity_report_threshold";

    // ── Scoring ───────────────────────────────────────────────
    public static final String NAME_WEIGHT = "linkage.name_weight";
    public static final String ADDRESS_WEIGHT = "linkage.address_weight";
    public static final String SIMILARITY_ALGORITHM = "linkage.similarity.algorithm";
    public static final String STANDARDIZATION_PROFILE = "linkage.standardization.profile";

    // ── Geocoding ─────────────────────────────────────────────
    public static final String GEOCODING_CONCURRENCY = "linkage.geocoding.concurrency";
    public static final String GEOCODING_STRATEGY = "linkage.geocoding.strategy";
    public static final String GEOCODING_TIMEOUT_MS = "linkage.geocoding.timeout-ms";
    public static final String GEOCODING_PREPROCESS_QUERY = "linkage.geocoding.preprocess-query";
    public static final String NOMINATIM_BASE_URL = "linkage.nominatim.base-url";
    public static final String NOMINATIM_USER_AGENT = "linkage.nominatim.user-agent";
    public static final String NOMINATIM_MAX_RETRIES = "linkage.nominatim.max-retries";
    public static final String NOMINATIM_RETRY_DELAY_MS = "linkage.nominatim.retry-delay-ms";
    public static final String NOMINATIM_REQUESTS_PER_SECOND = "linkage.nominatim.requests-per-second";
    public static final String CACHE_MAX_SIZE = "linkage.cache.max-size";

    // ── CSV ───────────────────────────────────────────────────
    public static final String INPUT_NAME_COLUMN = "linkage.input.name-column";
    public static final String INPUT_ADDRESS_COLUMN = "linkage.input.address-column";
    public static final String OUTPUT_INCLUDE_SCORES = "linkage.output.include-scores";

    private final double distanceThresholdMiles;
    private final double acceptanceThreshold;
    private final double lowSimilarityReportThreshold;
    private final ScoreWeights weights;
    private final SimilarityAlgorithm algorithm;
    private final StandardizationProfile standardizationProfile;
    private final int geocodingConcurrency;
    private final String geocodingStrategy;
    private final long geocodingTimeoutMs;
    private final boolean preprocessQuery;
    private final String nominatimBaseUrl;
    private final String nominatimUserAgent;
    private final int nominatimMaxRetries;
    private final long nominatimRetryDelayMs;
    private final double nominatimRequestsPerSecond;
    private final long cacheMaxSize;
    private final String nameColumn;
    private final String addressColumn;
    private final boolean includeScores;

    private LinkageConfig(Config config) {
        this.distanceThresholdMiles = read(config, DISTANCE_THRESHOLD_MILES, Double.class, 50.0);
        this.acceptanceThreshold = read(config, ACCEPTANCE_THRESHOLD, Double.class, 60.0);
        this.lowSimilarityReportThreshold = read(config, LOW_SIMILARITY_REPORT_THRESHOLD, Double.class, 68.0);
        double nameWeight = read(config, NAME_WEIGHT, Double.class, 1.4);
        double addressWeight = read(config, ADDRESS_WEIGHT, Double.class, 1.0);
        this.weights = validated(NAME_WEIGHT + "/" + ADDRESS_WEIGHT,
                () -> new ScoreWeights(nameWeight, addressWeight));
        String algorithmName = read(config, SIMILARITY_ALGORITHM, String.class, "ratio");
        this.algorithm = validated(SIMILARITY_ALGORITHM, () -> SimilarityAlgorithm.forName(algorithmName));
        String profileName = read(config, STANDARDIZATION_PROFILE, String.class, "basic");
        this.standardizationProfile = validated(STANDARDIZATION_PROFILE,
                () -> StandardizationProfile.fromString(profileName));

        this.geocodingConcurrency = read(config, GEOCODING_CONCURRENCY, Integer.class, 4);
        this.geocodingStrategy = read(config, GEOCODING_STRATEGY, String.class, AsyncGeocodingStrategy.NAME)
                .trim().toLowerCase(Locale.ROOT);
        this.geocodingTimeoutMs = read(config, GEOCODING_TIMEOUT_MS, Long.class, 30_000L);
        this.preprocessQuery = read(config, GEOCODING_PREPROCESS_QUERY, Boolean.class, false);
        this.nominatimBaseUrl = read(config, NOMINATIM_BASE_URL, String.class, "https://nominatim.openstreetmap.org");
        this.nominatimUserAgent = read(config, NOMINATIM_USER_AGENT, String.class, "company-location-linkage");
        this.nominatimMaxRetries = read(config, NOMINATIM_MAX_RETRIES, Integer.class, 3);
        this.nominatimRetryDelayMs = read(config, NOMINATIM_RETRY_DELAY_MS, Long.class, 2000L);
        this.nominatimRequestsPerSecond = read(config, NOMINATIM_REQUESTS_PER_SECOND, Double.class, 1.0);
        this.cacheMaxSize = read(config, CACHE_MAX_SIZE, Long.class, 10_000L);

        this.nameColumn = read(config, INPUT_NAME_COLUMN, String.class, "Company Name").trim();
        this.addressColumn = read(config, INPUT_ADDRESS_COLUMN, String.class, "first3_addresses").trim();
        this.includeScores = read(config, OUTPUT_INCLUDE_SCORES, Boolean.class, false);

        validate();
    }

    /**
     * Loads configuration from the default sources plus the given overrides and optional file.
     *
     * @param overrides      highest-precedence values, may be empty
     * @param propertiesFile optional properties file, may be {@code null}
     * @throws LinkageConfigurationException if a source cannot be read or a value is invalid
     */
    public static LinkageConfig load(Map<String, String> overrides, Path propertiesFile) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withSources(new PropertiesConfigSource(Map.copyOf(overrides), "linkage-overrides", OVERRIDES_ORDINAL));
        if (propertiesFile != null) {
            if (!Files.isReadable(propertiesFile)) {
                throw new LinkageConfigurationException("Config file not readable: " + propertiesFile);
            }
            try {
                builder.withSources(new PropertiesConfigSource(propertiesFile.toUri().toURL(), FILE_ORDINAL));
            } catch (IOException e) {
                throw new LinkageConfigurationException("Failed to read config file " + propertiesFile, e);
            }
        }
        LinkageConfig config = new LinkageConfig(builder.build());
        log.info("config.loaded overrides={} file={} strategy={} algorithm={} profile={}",
                overrides.size(), propertiesFile, config.geocodingStrategy, config.algorithm.getName(),
                config.standardizationProfile);
        return config;
    }

    /**
     * Loads configuration from the default sources only.
     */
    public static LinkageConfig load() {
        return load(Map.of(), null);
    }

    private static <T> T read(Config config, String key, Class<T> type, T defaultValue) {
        try {
            return config.getOptionalValue(key, type).orElse(defaultValue);
        } catch (IllegalArgumentException e) {
            throw new LinkageConfigurationException("Invalid value for " + key + ": " + e.getMessage(), e);
        }
    }

    private static <T> T validated(String key, Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new LinkageConfigurationException("Invalid value for " + key + ": " + e.getMessage(), e);
        }
    }

    private void validate() {
        validated(DISTANCE_THRESHOLD_MILES + "/" + ACCEPTANCE_THRESHOLD + "/" + LOW_SIMILARITY_REPORT_THRESHOLD,
                this::toOptions);
        if (geocodingConcurrency <= 0) {
            throw new LinkageConfigurationException(GEOCODING_CONCURRENCY + " must be > 0");
        }
        if (geocodingTimeoutMs <= 0) {
            throw new LinkageConfigurationException(GEOCODING_TIMEOUT_MS + " must be > 0");
        }
        if (!geocodingStrategy.equals(AsyncGeocodingStrategy.NAME)
                && !geocodingStrategy.equals(WorkerPoolGeocodingStrategy.NAME)
                && !geocodingStrategy.equals(SequentialGeocodingStrategy.NAME)) {
            throw new LinkageConfigurationException("Unknown " + GEOCODING_STRATEGY + ": " + geocodingStrategy);
        }
        if (nominatimMaxRetries <= 0) {
            throw new LinkageConfigurationException(NOMINATIM_MAX_RETRIES + " must be > 0");
        }
        if (nominatimRetryDelayMs < 0) {
            throw new LinkageConfigurationException(NOMINATIM_RETRY_DELAY_MS + " must be >= 0");
        }
        if (!(nominatimRequestsPerSecond > 0)) {
            throw new LinkageConfigurationException(NOMINATIM_REQUESTS_PER_SECOND + " must be > 0");
        }
        if (cacheMaxSize <= 0) {
            throw new LinkageConfigurationException(CACHE_MAX_SIZE + " must be > 0");
        }
        if (nameColumn.isEmpty() || addressColumn.isEmpty()) {
            throw new LinkageConfigurationException("Input column names must not be empty");
        }
    }

    public LinkageOptions toOptions() {
        return LinkageOptions.builder()
                .distanceThresholdMiles(distanceThresholdMiles)
                .similarityAcceptanceThreshold(acceptanceThreshold)
                .lowSimilarityReportThreshold(lowSimilarityReportThreshold)
                .preprocessGeocodingQuery(preprocessQuery)
                .build();
    }

    public TextStandardizer createStandardizer() {
        return new TextStandardizer(standardizationProfile);
    }

    public WeightedSimilarityScorer createScorer() {
        return new WeightedSimilarityScorer(algorithm, weights);
    }

    /**
     * Nominatim geocoder behind a Caffeine cache.
     */
    public Geocoder createGeocoder() {
        NominatimGeocoder nominatim = NominatimGeocoder.builder()
                .baseUrl(nominatimBaseUrl)
                .userAgent(nominatimUserAgent)
                .maxRetries(nominatimMaxRetries)
                .retryDelay(Duration.ofMillis(nominatimRetryDelayMs))
                .requestsPerSecond(nominatimRequestsPerSecond)
                .build();
        return new CachingGeocoder(nominatim, cacheMaxSize);
    }

    /**
     * Creates the configured strategy. Strategies owning threads are {@link AutoCloseable}.
     */
    public GeocodingStrategy createGeocodingStrategy() {
        switch (geocodingStrategy) {
            case SequentialGeocodingStrategy.NAME:
                return new SequentialGeocodingStrategy();
            case WorkerPoolGeocodingStrategy.NAME:
                return new WorkerPoolGeocodingStrategy(geocodingConcurrency, geocodingTimeoutMs);
            default:
                return new AsyncGeocodingStrategy(geocodingConcurrency, geocodingTimeoutMs);
        }
    }

    public double getDistanceThresholdMiles() {
        return distanceThresholdMiles;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public double getLowSimilarityReportThreshold() {
        return lowSimilarityReportThreshold;
    }

    public ScoreWeights getWeights() {
        return weights;
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }

    public StandardizationProfile getStandardizationProfile() {
        return standardizationProfile;
    }

    public int getGeocodingConcurrency() {
        return geocodingConcurrency;
    }

    public String getGeocodingStrategy() {
        return geocodingStrategy;
    }

    public long getGeocodingTimeoutMs() {
        return geocodingTimeoutMs;
    }

    public boolean isPreprocessQuery() {
        return preprocessQuery;
    }

    public String getNominatimBaseUrl() {
        return nominatimBaseUrl;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public String getNameColumn() {
        return nameColumn;
    }

    public String getAddressColumn() {
        return addressColumn;
    }

    public boolean isIncludeScores() {
        return includeScores;
    }
}
