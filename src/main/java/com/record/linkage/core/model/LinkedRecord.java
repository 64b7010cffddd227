package com.record.linkage.core.model;

import java.util.Objects;

/**
 * A record in the final output: its group, and its strongest match inside that group.
 *
 * @param record        the geocoded record
 * @param groupId       the Location Index
 * @param bestMatch     scores against the best-matching other member, or {@code null} for a sole member
 * @param bestMatchIndex index of that member, or -1
 */
public record LinkedRecord(
        GeocodedRecord record,
        int groupId,
        SimilarityPair bestMatch,
        int bestMatchIndex
) {
    public LinkedRecord {
        Objects.requireNonNull(record, "record is required");
    }

    public int index() {
        return record.index();
    }

    /**
     * The best overall score against any other member of the group, 0 when alone.
     */
    public double bestScore() {
        return bestMatch != null ? bestMatch.overallScore() : 0.0;
    }
}
