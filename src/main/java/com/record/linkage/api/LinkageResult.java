package com.record.linkage.api;

import com.record.linkage.core.model.GroupAssignment;
import com.record.linkage.core.model.LinkedRecord;
import com.record.linkage.core.model.LocationGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Output of one linkage run. {@code processed} and {@code lowSimilarity} are disjoint, each in
 * input order, and together hold every input record.
 *
 * @param runId         identifier of the run, also present in the log MDC
 * @param processed     records whose best in-group score reached the report threshold
 * @param lowSimilarity records flagged for manual review
 * @param groups        location groups in id order
 * @param assignments   grouping trace, one entry per record
 * @param summary       run statistics
 */
public record LinkageResult(
        String runId,
        List<LinkedRecord> processed,
        List<LinkedRecord> lowSimilarity,
        List<LocationGroup> groups,
        List<GroupAssignment> assignments,
        LinkageSummary summary
) {
    public LinkageResult {
        processed = List.copyOf(processed);
        lowSimilarity = List.copyOf(lowSimilarity);
        groups = List.copyOf(groups);
        assignments = List.copyOf(assignments);
    }

    /**
     * Both partitions merged back into input order.
     */
    public List<LinkedRecord> allRecords() {
        List<LinkedRecord> all = new ArrayList<>(processed.size() + lowSimilarity.size());
        all.addAll(processed);
        all.addAll(lowSimilarity);
        all.sort(Comparator.comparingInt(LinkedRecord::index));
        return all;
    }
}
