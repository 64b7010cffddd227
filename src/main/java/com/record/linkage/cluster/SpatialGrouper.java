package com.record.linkage.cluster;

import com.record.linkage.audit.AssignmentLedger;
import com.record.linkage.core.model.AssignmentReason;
import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.GroupAssignment;
import com.record.linkage.core.model.LocationGroup;
import com.record.linkage.core.model.SimilarityPair;
import com.record.linkage.similarity.SimilarityScorer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Greedy single-pass clustering of geocoded records into location groups.
 *
 * <p>Records are visited in list order. Each one joins the first existing group (lowest id)
 * that accepts it, or opens a new group:</p>
 * <ul>
 *   <li>When the record and at least one member have coordinates, a coordinate-bearing member
 *       must lie within the distance threshold and score at least the acceptance threshold.</li>
 *   <li>Otherwise any member scoring at least the acceptance threshold accepts it.</li>
 *   <li>When the record has coordinates, every coordinate-bearing member must be within the
 *       distance threshold or score at least the acceptance threshold.</li>
 * </ul>
 * <p>Records with an empty standardized name or address are always singletons.
 * The outcome depends only on input order, scorer and thresholds.</p>
 */
public class SpatialGrouper {

    private final SimilarityScorer scorer;
    private final double distanceThresholdMiles;
    private final double acceptanceThreshold;

    public SpatialGrouper(SimilarityScorer scorer, double distanceThresholdMiles, double acceptanceThreshold) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        if (!(distanceThresholdMiles >= 0) || Double.isInfinite(distanceThresholdMiles)) {
            throw new IllegalArgumentException("distanceThresholdMiles must be a finite value >= 0");
        }
        if (!(acceptanceThreshold >= 0 && acceptanceThreshold <= 100)) {
            throw new IllegalArgumentException("acceptanceThreshold must be between 0 and 100");
        }
        this.distanceThresholdMiles = distanceThresholdMiles;
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public GroupingResult group(List<GeocodedRecord> records) {
        return group(records, new AssignmentLedger());
    }

    /**
     * Groups the records and writes every decision to the ledger.
     *
     * @throws IllegalArgumentException if two records share an index
     */
    public GroupingResult group(List<GeocodedRecord> records, AssignmentLedger ledger) {
        Map<Integer, GeocodedRecord> byIndex = new LinkedHashMap<>();
        for (GeocodedRecord record : records) {
            if (byIndex.put(record.index(), record) != null) {
                throw new IllegalArgumentException("Duplicate record index: " + record.index());
            }
        }

        List<LocationGroup> groups = new ArrayList<>();
        List<GroupAssignment> assignments = new ArrayList<>(records.size());
        Map<Integer, Integer> groupIdByIndex = new HashMap<>();

        for (GeocodedRecord record : records) {
            GroupAssignment assignment = place(record, groups, byIndex);
            if (assignment.joinedExistingGroup()) {
                groups.get(assignment.groupId() - 1).add(record.index());
            } else {
                groups.add(new LocationGroup(assignment.groupId(), record.index()));
            }
            groupIdByIndex.put(record.index(), assignment.groupId());
            assignments.add(assignment);
            ledger.record(assignment);
        }

        return new GroupingResult(groups, assignments, groupIdByIndex);
    }

    private GroupAssignment place(GeocodedRecord record, List<LocationGroup> groups,
                                  Map<Integer, GeocodedRecord> byIndex) {
        int nextGroupId = groups.size() + 1;
        if (!record.isMatchable()) {
            return GroupAssignment.newGroup(record.index(), nextGroupId, AssignmentReason.UNMATCHABLE);
        }
        for (LocationGroup group : groups) {
            GroupAssignment accepted = tryJoin(record, group, byIndex);
            if (accepted != null) {
                return accepted;
            }
        }
        return GroupAssignment.newGroup(record.index(), nextGroupId, AssignmentReason.NEW_GROUP);
    }

    /**
     * Returns the assignment into this group, or null when the group rejects the record.
     */
    private GroupAssignment tryJoin(GeocodedRecord record, LocationGroup group, Map<Integer, GeocodedRecord> byIndex) {
        List<Candidate> candidates = new ArrayList<>(group.size());
        boolean anyMemberHasCoordinates = false;
        for (int memberIndex : group.getMembers()) {
            GeocodedRecord member = byIndex.get(memberIndex);
            if (!member.isMatchable()) {
                continue;
            }
            Double distance = null;
            if (record.hasCoordinates() && member.hasCoordinates()) {
                distance = GeodesicDistance.miles(record.location(), member.location());
            }
            anyMemberHasCoordinates |= member.hasCoordinates();
            candidates.add(new Candidate(member, scorer.score(record, member), distance));
        }
        if (candidates.isEmpty()) {
            return null;
        }

        boolean spatial = record.hasCoordinates() && anyMemberHasCoordinates;
        Candidate anchor = null;
        for (Candidate candidate : candidates) {
            boolean similar = candidate.pair().meets(acceptanceThreshold);
            if (candidate.distance() != null && candidate.distance() > distanceThresholdMiles && !similar) {
                return null;
            }
            boolean qualifies = spatial
                    ? candidate.distance() != null && candidate.distance() <= distanceThresholdMiles && similar
                    : similar;
            if (qualifies && (anchor == null || candidate.isBetterAnchorThan(anchor))) {
                anchor = candidate;
            }
        }
        if (anchor == null) {
            return null;
        }

        AssignmentReason reason = spatial ? AssignmentReason.SPATIAL_MATCH : AssignmentReason.TEXTUAL_FALLBACK;
        return new GroupAssignment(record.index(), group.getGroupId(), reason,
                anchor.member().index(), anchor.pair().overallScore(), anchor.distance());
    }

    public double getDistanceThresholdMiles() {
        return distanceThresholdMiles;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    private record Candidate(GeocodedRecord member, SimilarityPair pair, Double distance) {

        boolean isBetterAnchorThan(Candidate other) {
            int cmp = Double.compare(pair.overallScore(), other.pair.overallScore());
            return cmp > 0 || (cmp == 0 && member.index() < other.member.index());
        }
    }
}
