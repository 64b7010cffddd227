package com.record.linkage.similarity;

import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.SimilarityPair;

/**
 * Compares two records. Implementations must be pure and symmetric:
 * {@code score(a, b)} equals {@code score(b, a)}.
 */
@FunctionalInterface
public interface SimilarityScorer {

    SimilarityPair score(GeocodedRecord a, GeocodedRecord b);
}
