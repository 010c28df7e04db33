package com.sni.curation.model;

/**
 * Action names written to the curation audit log and to narrative curation notes.
 */
public final class CurationActions {

    private CurationActions() {
    }

    public static final String CREATED = "created";
    public static final String CREATED_MANUAL_PARENT = "created_manual_parent";
    public static final String ASSIGNED_TO_PARENT = "assigned_to_parent";
    public static final String REMOVED_FROM_PARENT = "removed_from_parent";
    public static final String STATUS_CHANGED = "status_changed";
    public static final String PRIORITY_CHANGED = "priority_changed";
    public static final String REVIEW_ASSIGNED = "review_assigned";
    public static final String NOTE_ADDED = "note_added";
    public static final String CLUSTER_GROUP_LINKED = "cluster_group_linked";
    public static final String DELETED = "deleted";

    // Curation note actions
    public static final String CHILDREN_ASSIGNED = "children_assigned";
    public static final String GROUP_SUBMITTED = "submitted_for_review";
    public static final String GROUP_APPROVED = "approved";
}
