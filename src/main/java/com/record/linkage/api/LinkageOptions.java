package com.record.linkage.api;

/**
 * Options for a linkage run: clustering and reporting thresholds.
 * The acceptance threshold decides who is grouped together; the report threshold only
 * decides which records are flagged for review.
 */
public class LinkageOptions {

    private static final double DEFAULT_DISTANCE_THRESHOLD_MILES = 50.0;
    private static final double DEFAULT_ACCEPTANCE_THRESHOLD = 60.0;
    private static final double DEFAULT_LOW_SIMILARITY_REPORT_THRESHOLD = 68.0;

    private final double distanceThresholdMiles;
    private final double similarityAcceptanceThreshold;
    private final double lowSimilarityReportThreshold;
    private final boolean preprocessGeocodingQuery;

    private LinkageOptions(Builder builder) {
        this.distanceThresholdMiles = builder.distanceThresholdMiles;
        this.similarityAcceptanceThreshold = builder.similarityAcceptanceThreshold;
        this.lowSimilarityReportThreshold = builder.lowSimilarityReportThreshold;
        this.preprocessGeocodingQuery = builder.preprocessGeocodingQuery;
    }

    public double getDistanceThresholdMiles() {
        return distanceThresholdMiles;
    }

    public double getSimilarityAcceptanceThreshold() {
        return similarityAcceptanceThreshold;
    }

    public double getLowSimilarityReportThreshold() {
        return lowSimilarityReportThreshold;
    }

    public boolean isPreprocessGeocodingQuery() {
        return preprocessGeocodingQuery;
    }

    /**
     * 50 miles, acceptance 60, report 68.
     */
    public static LinkageOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double distanceThresholdMiles = DEFAULT_DISTANCE_THRESHOLD_MILES;
        private double similarityAcceptanceThreshold = DEFAULT_ACCEPTANCE_THRESHOLD;
        private double lowSimilarityReportThreshold = DEFAULT_LOW_SIMILARITY_REPORT_THRESHOLD;
        private boolean preprocessGeocodingQuery = false;

        public Builder distanceThresholdMiles(double distanceThresholdMiles) {
            if (!(distanceThresholdMiles >= 0.0) || Double.isInfinite(distanceThresholdMiles)) {
                throw new IllegalArgumentException("distanceThresholdMiles must be a finite value >= 0");
            }
            this.distanceThresholdMiles = distanceThresholdMiles;
            return this;
        }

        public Builder similarityAcceptanceThreshold(double similarityAcceptanceThreshold) {
            validateScore(similarityAcceptanceThreshold, "similarityAcceptanceThreshold");
            this.similarityAcceptanceThreshold = similarityAcceptanceThreshold;
            return this;
        }

        public Builder lowSimilarityReportThreshold(double lowSimilarityReportThreshold) {
            validateScore(lowSimilarityReportThreshold, "lowSimilarityReportThreshold");
            this.lowSimilarityReportThreshold = lowSimilarityReportThreshold;
            return this;
        }

        public Builder preprocessGeocodingQuery(boolean preprocessGeocodingQuery) {
            this.preprocessGeocodingQuery = preprocessGeocodingQuery;
            return this;
        }

        public LinkageOptions build() {
            return new LinkageOptions(this);
        }

        private void validateScore(double value, String name) {
            if (!(value >= 0.0 && value <= 100.0)) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }

    @Override
    public String toString() {
        return "LinkageOptions{" +
                "distanceThresholdMiles=" + distanceThresholdMiles +
                ", similarityAcceptanceThreshold=" + similarityAcceptanceThreshold +
                ", lowSimilarityReportThreshold=" + lowSimilarityReportThreshold +
                ", preprocessGeocodingQuery=" + preprocessGeocodingQuery +
                '}';
    }
}
