package com.record.linkage.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A cluster of records believed to be the same company at the same place.
 * Members are kept in the order they joined.
 */
public class LocationGroup {

    private final int groupId;
    private final List<Integer> members = new ArrayList<>();

    public LocationGroup(int groupId, int firstMember) {
        if (groupId < 1) {
            throw new IllegalArgumentException("groupId must be >= 1");
        }
        this.groupId = groupId;
        this.members.add(firstMember);
    }

    public int getGroupId() {
        return groupId;
    }

    public List<Integer> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    public boolean isSingleton() {
        return members.size() == 1;
    }

    public void add(int recordIndex) {
        if (members.contains(recordIndex)) {
            throw new IllegalStateException("record " + recordIndex + " already in group " + groupId);
        }
        members.add(recordIndex);
    }

    @Override
    public String toString() {
        return "LocationGroup{id=" + groupId + ", members=" + members + '}';
    }
}
