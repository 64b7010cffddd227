package com.record.linkage.api;

import java.time.Duration;
import java.util.Locale;

/**
 * End-of-run statistics.
 *
 * @param totalRecords          records read
 * @param groupCount            location groups formed
 * @param multiMemberGroupCount groups with more than one member
 * @param unresolvedGeocodes    records without coordinates
 * @param processedCount        records at or above the report threshold
 * @param lowSimilarityCount    records flagged for review
 * @param averageBestScore      mean best score over records in multi-member groups, 0 when there are none
 * @param lowestBestScore       lowest best score over records in multi-member groups, 0 when there are none
 * @param elapsed               wall-clock duration of the run
 */
public record LinkageSummary(
        int totalRecords,
        int groupCount,
        long multiMemberGroupCount,
        int unresolvedGeocodes,
        int processedCount,
        int lowSimilarityCount,
        double averageBestScore,
        double lowestBestScore,
        Duration elapsed
) {

    public String describe() {
        return String.format(Locale.ROOT,
                "records=%d groups=%d multiMemberGroups=%d unresolved=%d processed=%d lowSimilarity=%d "
                        + "averageBestScore=%.2f lowestBestScore=%.2f elapsedMs=%d",
                totalRecords, groupCount, multiMemberGroupCount, unresolvedGeocodes, processedCount,
                lowSimilarityCount, averageBestScore, lowestBestScore, elapsed.toMillis());
    }
}
