package com.record.linkage.core.model;

/**
 * Why a record ended up in its location group.
 */
public enum AssignmentReason {
    /** No existing group accepted the record. */
    NEW_GROUP,
    /** Joined a group through a member within the distance threshold. */
    SPATIAL_MATCH,
    /** Joined a group on text similarity alone because coordinates were missing. */
    TEXTUAL_FALLBACK,
    /** Empty name or address; always a singleton. */
    UNMATCHABLE
}
