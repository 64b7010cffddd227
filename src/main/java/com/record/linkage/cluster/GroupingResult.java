package com.record.linkage.cluster;

import com.record.linkage.core.model.GroupAssignment;
import com.record.linkage.core.model.LocationGroup;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one grouping pass: the groups in id order, one assignment per record in input
 * order, and the group id of every record index.
 */
public class GroupingResult {

    private final List<LocationGroup> groups;
    private final List<GroupAssignment> assignments;
    private final Map<Integer, Integer> groupIdByIndex;

    GroupingResult(List<LocationGroup> groups, List<GroupAssignment> assignments,
                   Map<Integer, Integer> groupIdByIndex) {
        this.groups = Collections.unmodifiableList(groups);
        this.assignments = Collections.unmodifiableList(assignments);
        this.groupIdByIndex = Collections.unmodifiableMap(groupIdByIndex);
    }

    public List<LocationGroup> getGroups() {
        return groups;
    }

    public List<GroupAssignment> getAssignments() {
        return assignments;
    }

    public LocationGroup getGroup(int groupId) {
        if (groupId < 1 || groupId > groups.size()) {
            throw new IllegalArgumentException("Unknown groupId: " + groupId);
        }
        return groups.get(groupId - 1);
    }

    /**
     * @throws IllegalArgumentException if the record was not part of the pass
     */
    public int groupIdOf(int recordIndex) {
        Integer groupId = groupIdByIndex.get(recordIndex);
        if (groupId == null) {
            throw new IllegalArgumentException("Unknown record index: " + recordIndex);
        }
        return groupId;
    }

    public int groupCount() {
        return groups.size();
    }

    public long multiMemberGroupCount() {
        return groups.stream().filter(g -> !g.isSingleton()).count();
    }
}
