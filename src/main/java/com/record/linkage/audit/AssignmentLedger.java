package com.record.linkage.audit;

import com.record.linkage.core.model.AssignmentReason;
import com.record.linkage.core.model.GroupAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only trace of grouping decisions for one linkage run.
 * Explains, for every record, which group it went to and why.
 */
public class AssignmentLedger {
    private static final Logger log = LoggerFactory.getLogger(AssignmentLedger.class);

    private final List<GroupAssignment> assignments;

    public AssignmentLedger() {
        this.assignments = new CopyOnWriteArrayList<>();
    }

    /**
     * Records a grouping decision. Entries cannot be modified or removed.
     */
    public GroupAssignment record(GroupAssignment assignment) {
        assignments.add(assignment);
        if (log.isDebugEnabled()) {
            log.debug("group.assigned record={} group={} reason={} anchor={} score={} distanceMiles={}",
                    assignment.recordIndex(),
                    assignment.groupId(),
                    assignment.reason(),
                    assignment.anchorIndex(),
                    assignment.score(),
                    assignment.distanceMiles());
        }
        return assignment;
    }

    /**
     * Gets all assignments in decision order (immutable view).
     */
    public List<GroupAssignment> getAllAssignments() {
        return Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public Optional<GroupAssignment> getAssignment(int recordIndex) {
        return assignments.stream()
                .filter(a -> a.recordIndex() == recordIndex)
                .findFirst();
    }

    public List<GroupAssignment> getAssignmentsForGroup(int groupId) {
        return assignments.stream()
                .filter(a -> a.groupId() == groupId)
                .collect(Collectors.toList());
    }

    public List<GroupAssignment> getAssignmentsByReason(AssignmentReason reason) {
        return assignments.stream()
                .filter(a -> a.reason() == reason)
                .collect(Collectors.toList());
    }

    /**
     * Counts decisions per reason.
     */
    public Map<AssignmentReason, Long> countByReason() {
        return assignments.stream()
                .collect(Collectors.groupingBy(GroupAssignment::reason, Collectors.counting()));
    }

    public int size() {
        return assignments.size();
    }
}
