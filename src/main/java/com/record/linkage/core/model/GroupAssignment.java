package com.record.linkage.core.model;

import java.util.Objects;

/**
 * Trace entry explaining one grouping decision.
 *
 * @param recordIndex   index of the record being placed
 * @param groupId       the group the record was placed in
 * @param reason        why it was placed there
 * @param anchorIndex   index of the member that accepted it, or -1 for a new group
 * @param score         overall score against the anchor, or 0 for a new group
 * @param distanceMiles distance to the anchor, or {@code null} when not computed
 */
public record GroupAssignment(
        int recordIndex,
        int groupId,
        AssignmentReason reason,
        int anchorIndex,
        double score,
        Double distanceMiles
) {
    public GroupAssignment {
        Objects.requireNonNull(reason, "reason is required");
        if (groupId < 1) {
            throw new IllegalArgumentException("groupId must be >= 1");
        }
    }

    public static GroupAssignment newGroup(int recordIndex, int groupId, AssignmentReason reason) {
        return new GroupAssignment(recordIndex, groupId, reason, -1, 0.0, null);
    }

    public boolean joinedExistingGroup() {
        return anchorIndex >= 0;
    }
}
