package com.record.linkage.similarity;

import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.SimilarityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Scores names and addresses with the same fuzzy algorithm and combines them with fixed weights.
 */
public class WeightedSimilarityScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(WeightedSimilarityScorer.class);

    private final SimilarityAlgorithm algorithm;
    private final ScoreWeights weights;

    public WeightedSimilarityScorer() {
        this(new IndelRatio(), ScoreWeights.defaultWeights());
    }

    public WeightedSimilarityScorer(SimilarityAlgorithm algorithm, ScoreWeights weights) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
        this.weights = Objects.requireNonNull(weights, "weights is required");
    }

    @Override
    public SimilarityPair score(GeocodedRecord a, GeocodedRecord b) {
        double nameScore = algorithm.compute(a.companyNameNorm(), b.companyNameNorm());
        double addressScore = algorithm.compute(a.addressNorm(), b.addressNorm());
        double overall = weights.combine(nameScore, addressScore);

        if (log.isTraceEnabled()) {
            log.trace("similarity a={} b={} algorithm={} name={} address={} overall={}",
                    a.index(), b.index(), algorithm.getName(), nameScore, addressScore, overall);
        }
        return new SimilarityPair(nameScore, addressScore, overall);
    }

    public SimilarityAlgorithm getAlgorithm() {
        return algorithm;
    }

    public ScoreWeights getWeights() {
        return weights;
    }
}
