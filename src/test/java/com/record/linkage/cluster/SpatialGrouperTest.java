package com.record.linkage.cluster;

import com.record.linkage.audit.AssignmentLedger;
import com.record.linkage.core.model.AssignmentReason;
import com.record.linkage.core.model.GeocodedRecord;
import com.record.linkage.core.model.GroupAssignment;
import com.record.linkage.core.model.LocationGroup;
import com.record.linkage.core.model.SimilarityPair;
import com.record.linkage.similarity.SimilarityScorer;
import com.record.linkage.similarity.WeightedSimilarityScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static com.record.linkage.TestRecords.at;
import static com.record.linkage.TestRecords.unresolved;
import static org.junit.jupiter.api.Assertions.*;

class SpatialGrouperTest {

    private static final double BOSTON_LAT = 42.3601;
    private static final double BOSTON_LON = -71.0589;

    /** Scores 100 for equal standardized names, 0 otherwise. */
    private static final SimilarityScorer SAME_NAME = (a, b) ->
            a.companyNameNorm().equals(b.companyNameNorm())
                    ? new SimilarityPair(100.0, 100.0, 100.0)
                    : SimilarityPair.none();

    private final SpatialGrouper grouper = new SpatialGrouper(new WeightedSimilarityScorer(), 50.0, 60.0);

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Boston variants should share a group and New York should get its own")
        void testBostonAndNewYork() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Example Co.", "123 Main St, Boston, MA", 42.3601, -71.0589),
                    at(1, "Example Co", "123 Main Street, Boston, MA", 42.3601, -71.0589),
                    at(2, "Another LLC", "789 Broadway, New York, NY", 40.7128, -74.0060));

            GroupingResult result = grouper.group(records);

            assertEquals(1, result.groupIdOf(0));
            assertEquals(1, result.groupIdOf(1));
            assertEquals(2, result.groupIdOf(2));

            GroupAssignment joined = result.getAssignments().get(1);
            assertEquals(AssignmentReason.SPATIAL_MATCH, joined.reason());
            assertEquals(0, joined.anchorIndex());
            assertEquals(0.0, joined.distanceMiles(), 1e-9);
            assertTrue(joined.score() >= 60.0);
            assertEquals(AssignmentReason.NEW_GROUP, result.getAssignments().get(2).reason());
        }

        @Test
        @DisplayName("An unresolved record should join on text similarity alone")
        void testTextualFallback() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Example Co.", "123 Main St, Boston, MA", 42.3601, -71.0589),
                    unresolved(1, "Example Co", "123 Main Street, Boston, MA"));

            GroupingResult result = grouper.group(records);

            GroupAssignment assignment = result.getAssignments().get(1);
            assertEquals(1, assignment.groupId());
            assertEquals(AssignmentReason.TEXTUAL_FALLBACK, assignment.reason());
            assertEquals(0, assignment.anchorIndex());
            assertNull(assignment.distanceMiles());
        }

        @Test
        @DisplayName("A located record should fall back to text when no member is located")
        void testFallbackIntoUnlocatedGroup() {
            List<GeocodedRecord> records = List.of(
                    unresolved(0, "Example Co", "123 Main St, Boston, MA"),
                    at(1, "Example Co", "123 Main St, Boston, MA", 42.3601, -71.0589));

            GroupingResult result = grouper.group(records);

            assertEquals(1, result.groupCount());
            assertEquals(AssignmentReason.TEXTUAL_FALLBACK, result.getAssignments().get(1).reason());
        }

        @Test
        @DisplayName("Identical text far apart should not be grouped")
        void testTooFar() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Example Co", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "Example Co", "1 Main St", BOSTON_LAT, BOSTON_LON + 1.5));

            GroupingResult result = grouper.group(records);

            assertEquals(2, result.groupCount());
        }

        @Test
        @DisplayName("Dissimilar text at the same place should not be grouped")
        void testDissimilarNeighbours() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Example Co", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "Zyxw Qv", "999 Elm Rd", BOSTON_LAT, BOSTON_LON));

            assertEquals(2, grouper.group(records).groupCount());
        }
    }

    @Nested
    @DisplayName("Rules")
    class Rules {

        private final SpatialGrouper sameName = new SpatialGrouper(SAME_NAME, 50.0, 60.0);

        @Test
        @DisplayName("Unmatchable records should always be singletons")
        void testUnmatchable() {
            List<GeocodedRecord> records = List.of(
                    at(0, "", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    unresolved(2, "Acme", ""),
                    unresolved(3, "Acme", ""));

            GroupingResult result = sameName.group(records);

            assertEquals(4, result.groupCount());
            assertTrue(result.getAssignments().stream()
                    .allMatch(a -> a.reason() == AssignmentReason.UNMATCHABLE && !a.joinedExistingGroup()));
        }

        @Test
        @DisplayName("A located record far from every located member should not join through an unlocated one")
        void testSpatialGateWins() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Acme", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    unresolved(1, "Acme", "1 Main St"),
                    at(2, "Acme", "1 Main St", BOSTON_LAT, BOSTON_LON + 1.5));

            GroupingResult result = sameName.group(records);

            assertEquals(1, result.groupIdOf(1));
            assertEquals(2, result.groupIdOf(2));
        }

        @Test
        @DisplayName("Should join the lowest-numbered accepting group")
        void testFirstGroupWins() {
            List<GeocodedRecord> records = List.of(
                    at(0, "Acme", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "Acme", "1 Main St", BOSTON_LAT, BOSTON_LON + 1.4),
                    at(2, "Acme", "1 Main St", BOSTON_LAT, BOSTON_LON + 0.7));

            GroupingResult result = sameName.group(records);

            // record 2 is within 50 miles of both groups
            assertEquals(2, result.groupCount());
            assertEquals(1, result.groupIdOf(2));
        }

        @Test
        @DisplayName("Should pick the best-scoring anchor, ties to the lowest index")
        void testAnchorChoice() {
            Map<String, Double> scores = new HashMap<>();
            scores.put("A|B", 70.0);
            scores.put("A|C", 70.0);
            scores.put("B|C", 90.0);
            scores.put("A|D", 80.0);
            scores.put("B|D", 80.0);
            scores.put("C|D", 80.0);
            SpatialGrouper tabled = new SpatialGrouper(tableScorer(scores), 50.0, 60.0);

            List<GeocodedRecord> records = List.of(
                    at(0, "A", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "B", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(2, "C", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(3, "D", "1 Main St", BOSTON_LAT, BOSTON_LON));

            GroupingResult result = tabled.group(records);

            assertEquals(1, result.groupCount());
            assertEquals(1, result.getAssignments().get(2).anchorIndex());
            assertEquals(90.0, result.getAssignments().get(2).score(), 1e-9);
            assertEquals(0, result.getAssignments().get(3).anchorIndex());
        }

        @Test
        @DisplayName("Should refuse a group holding a far and dissimilar located member")
        void testPairwiseDistanceGuard() {
            Map<String, Double> scores = new HashMap<>();
            scores.put("M1|M2", 80.0);
            scores.put("M2|R", 90.0);
            scores.put("M1|R", 10.0);
            SpatialGrouper tabled = new SpatialGrouper(tableScorer(scores), 50.0, 60.0);

            List<GeocodedRecord> records = List.of(
                    at(0, "M1", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "M2", "1 Main St", BOSTON_LAT, BOSTON_LON + 0.5),
                    at(2, "R", "1 Main St", BOSTON_LAT, BOSTON_LON + 1.4));

            GroupingResult result = tabled.group(records);

            assertEquals(1, result.groupIdOf(1));
            assertEquals(2, result.groupIdOf(2));
        }

        @Test
        @DisplayName("A far member that is similar enough should not block the join")
        void testPairwiseGuardSatisfiedBySimilarity() {
            Map<String, Double> scores = new HashMap<>();
            scores.put("M1|M2", 80.0);
            scores.put("M2|R", 90.0);
            scores.put("M1|R", 70.0);
            SpatialGrouper tabled = new SpatialGrouper(tableScorer(scores), 50.0, 60.0);

            List<GeocodedRecord> records = List.of(
                    at(0, "M1", "1 Main St", BOSTON_LAT, BOSTON_LON),
                    at(1, "M2", "1 Main St", BOSTON_LAT, BOSTON_LON + 0.5),
                    at(2, "R", "1 Main St", BOSTON_LAT, BOSTON_LON + 1.4));

            GroupingResult result = tabled.group(records);

            assertEquals(1, result.groupIdOf(2));
            assertEquals(1, result.getAssignments().get(2).anchorIndex());
        }

        @Test
        @DisplayName("Should reject duplicate record indices")
        void testDuplicateIndex() {
            List<GeocodedRecord> records = List.of(
                    unresolved(0, "Acme", "1 Main St"),
                    unresolved(0, "Acme", "1 Main St"));

            assertThrows(IllegalArgumentException.class, () -> sameName.group(records));
        }

        @Test
        @DisplayName("Should validate thresholds")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new SpatialGrouper(SAME_NAME, -1.0, 60.0));
            assertThrows(IllegalArgumentException.class, () -> new SpatialGrouper(SAME_NAME, 50.0, 101.0));
            assertThrows(IllegalArgumentException.class, () -> new SpatialGrouper(SAME_NAME, Double.NaN, 60.0));
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("Every record should be in exactly one group and group ids should be sequential")
        void testPartitionCompleteness() {
            List<GeocodedRecord> records = randomRecords(80, 7L);

            GroupingResult result = grouper.group(records);

            Set<Integer> seen = new HashSet<>();
            for (int i = 0; i < result.getGroups().size(); i++) {
                LocationGroup group = result.getGroups().get(i);
                assertEquals(i + 1, group.getGroupId());
                for (int member : group.getMembers()) {
                    assertTrue(seen.add(member), "record " + member + " in two groups");
                    assertEquals(group.getGroupId(), result.groupIdOf(member));
                }
            }
            assertEquals(records.size(), seen.size());
            assertEquals(records.size(), result.getAssignments().size());
        }

        @Test
        @DisplayName("Same input order should produce the same assignments")
        void testDeterminism() {
            List<GeocodedRecord> records = randomRecords(80, 11L);

            assertEquals(grouper.group(records).getAssignments(), grouper.group(records).getAssignments());
        }

        @Test
        @DisplayName("Located pairs in a group should be close or similar")
        void testDistanceInvariant() {
            WeightedSimilarityScorer scorer = new WeightedSimilarityScorer();
            List<GeocodedRecord> records = randomRecords(120, 3L);
            Map<Integer, GeocodedRecord> byIndex = new HashMap<>();
            records.forEach(r -> byIndex.put(r.index(), r));

            GroupingResult result = grouper.group(records);

            for (LocationGroup group : result.getGroups()) {
                List<Integer> members = group.getMembers();
                for (int i = 0; i < members.size(); i++) {
                    for (int j = i + 1; j < members.size(); j++) {
                        GeocodedRecord a = byIndex.get(members.get(i));
                        GeocodedRecord b = byIndex.get(members.get(j));
                        if (a.hasCoordinates() && b.hasCoordinates()) {
                            double distance = GeodesicDistance.miles(a.location(), b.location());
                            double score = scorer.score(a, b).overallScore();
                            assertTrue(distance <= 50.0 || score >= 60.0,
                                    "records " + a.index() + " and " + b.index() + " distance " + distance
                                            + " score " + score);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Every decision should be written to the ledger")
        void testLedger() {
            List<GeocodedRecord> records = randomRecords(30, 5L);
            AssignmentLedger ledger = new AssignmentLedger();

            GroupingResult result = grouper.group(records, ledger);

            assertEquals(result.getAssignments(), ledger.getAllAssignments());
        }
    }

    private static SimilarityScorer tableScorer(Map<String, Double> scores) {
        return (a, b) -> {
            String x = a.companyNameNorm();
            String y = b.companyNameNorm();
            String key = x.compareTo(y) <= 0 ? x + "|" + y : y + "|" + x;
            double score = scores.getOrDefault(key, 0.0);
            return new SimilarityPair(score, score, score);
        };
    }

    private static List<GeocodedRecord> randomRecords(int count, long seed) {
        String[] names = {"Example Co", "Example Company", "Another LLC", "Acme Widgets", "Acme Widget", "Zenith"};
        String[] streets = {"123 Main St", "123 Main Street", "789 Broadway", "5 Harbor Rd"};
        Random random = new Random(seed);
        List<GeocodedRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String name = names[random.nextInt(names.length)];
            String address = streets[random.nextInt(streets.length)];
            if (random.nextInt(5) == 0) {
                records.add(unresolved(i, name, address));
            } else {
                double lat = BOSTON_LAT + random.nextDouble() * 2.0 - 1.0;
                double lon = BOSTON_LON + random.nextDouble() * 2.0 - 1.0;
                records.add(at(i, name, address, lat, lon));
            }
        }
        return records;
    }
}
