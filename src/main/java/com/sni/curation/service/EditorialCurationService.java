package com.sni.curation.service;

import com.sni.curation.dto.AssignmentResult;
import com.sni.curation.dto.NarrativeDetailsResponse;
import com.sni.curation.model.ActorType;
import com.sni.curation.model.CurationActions;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.CurationNote;
import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.exception.CurationValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Curator-facing operations composed from the narrative store, workflow, cluster registry and audit log.
 * Each public method runs in one transaction.
 */
@Service
public class EditorialCurationService {

    private static final Logger logger = LoggerFactory.getLogger(EditorialCurationService.class);

    static final String MANUAL_CONFIDENCE = "medium";
    private static final int RECENT_ACTIVITY_LIMIT = 20;

    private final NarrativeStore narrativeStore;
    private final ClusterGroupRegistry clusterGroupRegistry;
    private final HierarchyCacheService hierarchyCache;
    private final CurationAuditLog auditLog;
    private final Clock clock;
    private final int defaultPriority;
    private final int maxClusterIds;
    private final int maxChildrenPerAssignment;

    public EditorialCurationService(NarrativeStore narrativeStore,
                                    ClusterGroupRegistry clusterGroupRegistry,
                                    HierarchyCacheService hierarchyCache,
                                    CurationAuditLog auditLog,
                                    Clock clock,
                                    @Value("${app.curation.default-priority:3}") int defaultPriority,
                                    @Value("${app.curation.max-cluster-ids:50}") int maxClusterIds,
                                    @Value("${app.curation.max-children-per-assignment:20}") int maxChildrenPerAssignment) {
        this.narrativeStore = narrativeStore;
        this.clusterGroupRegistry = clusterGroupRegistry;
        this.hierarchyCache = hierarchyCache;
        this.auditLog = auditLog;
        this.clock = clock;
        this.defaultPriority = defaultPriority;
        this.maxClusterIds = Math.max(1, maxClusterIds);
        this.maxChildrenPerAssignment = Math.max(1, maxChildrenPerAssignment);
    }

    /**
     * Creates a manual root in {@code manual_draft}. Cluster groups are not created here; callers link them
     * separately through {@link ClusterGroupRegistry}.
     */
    @Transactional
    public Narrative createManualParent(String title,
                                        String summary,
                                        String curatorId,
                                        List<String> clusterIds,
                                        Integer priority) {
        if (curatorId == null || curatorId.isBlank()) {
            throw new CurationValidationException("Curator id is required");
        }
        List<String> clusters = clusterIds != null ? clusterIds : List.of();
        if (clusters.size() > maxClusterIds) {
            throw new CurationValidationException(
                    "A manual parent may reference at most " + maxClusterIds + " clusters");
        }
        int effectivePriority = priority != null ? priority : defaultPriority;

        Narrative parent = narrativeStore.createRoot(CurationSource.MANUAL, CurationStatus.MANUAL_DRAFT,
                NarrativeFields.builder()
                        .title(title)
                        .summary(summary)
                        .curatorId(curatorId)
                        .confidenceRating(MANUAL_CONFIDENCE)
                        .editorialPriority(effectivePriority)
                        .manualClusterIds(clusters)
                        .build());

        Map<String, Object> newValues = new HashMap<>();
        newValues.put("title", parent.getTitle());
        newValues.put("narrative_id", parent.getNarrativeId());
        newValues.put("cluster_ids", new ArrayList<>(clusters));
        newValues.put("editorial_priority", effectivePriority);
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(parent.getId())
                .actionType(CurationActions.CREATED_MANUAL_PARENT)
                .newValues(newValues)
                .reason("Manual parent narrative created")
                .actorId(curatorId)
                .sessionId(auditLog.newSessionId()));
        logger.info("Curator {} created manual parent {} ({})", curatorId, parent.getId(), parent.getNarrativeId());
        return parent;
    }

    /**
     * Registers a root narrative on behalf of the pipeline producer (or a hybrid-assisted flow).
     */
    @Transactional
    public Narrative registerNarrative(CurationSource source,
                                       CurationStatus status,
                                       NarrativeFields fields,
                                       String actorId) {
        CurationSource effectiveSource = source != null ? source : CurationSource.PIPELINE;
        CurationStatus effectiveStatus = status != null ? status
                : effectiveSource == CurationSource.MANUAL ? CurationStatus.MANUAL_DRAFT : CurationStatus.AUTO_GENERATED;
        Narrative narrative = narrativeStore.createRoot(effectiveSource, effectiveStatus, fields);

        Map<String, Object> newValues = new HashMap<>();
        newValues.put("status", effectiveStatus.getValue());
        newValues.put("source", effectiveSource.getValue());
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(narrative.getId())
                .actionType(CurationActions.CREATED)
                .newValues(newValues)
                .actorId(actorId != null && !actorId.isBlank() ? actorId : effectiveSource.getValue())
                .actorType(effectiveSource == CurationSource.PIPELINE ? ActorType.PIPELINE : ActorType.USER));
        return narrative;
    }

    /**
     * Assigns orphaned narratives under a manual root. Children that already have a parent are skipped and
     * reported, not treated as failures. Duplicate ids in the request are collapsed.
     */
    @Transactional
    public AssignmentResult assignChildren(UUID parentId, List<UUID> childIds, String curatorId, String rationale) {
        if (childIds == null || childIds.isEmpty()) {
            throw new CurationValidationException("At least one child id is required");
        }
        if (curatorId == null || curatorId.isBlank()) {
            throw new CurationValidationException("Curator id is required");
        }
        LinkedHashSet<UUID> uniqueIds = new LinkedHashSet<>(childIds);
        if (uniqueIds.contains(null)) {
            throw new CurationValidationException("Child ids must not be null");
        }
        if (uniqueIds.size() > maxChildrenPerAssignment) {
            throw new CurationValidationException(
                    "At most " + maxChildrenPerAssignment + " children can be assigned at once");
        }

        Narrative parent = narrativeStore.lockNarrative(parentId);
        if (!parent.isManualRoot()) {
            throw new CurationValidationException("Narrative " + parentId + " is not a manual root narrative");
        }
        for (UUID childId : uniqueIds) {
            // Fails fast before any assignment when a child id is unknown.
            narrativeStore.get(childId);
        }

        String sessionId = auditLog.newSessionId();
        List<UUID> assigned = new ArrayList<>();
        List<UUID> skipped = new ArrayList<>();
        for (UUID childId : uniqueIds) {
            if (!narrativeStore.assignIfOrphaned(childId, parentId)) {
                skipped.add(childId);
                continue;
            }
            assigned.add(childId);
            Map<String, Object> oldValues = new HashMap<>();
            oldValues.put("parent_id", null);
            Map<String, Object> newValues = new HashMap<>();
            newValues.put("parent_id", parentId.toString());
            auditLog.append(CurationLogEntry.builder()
                    .narrativeId(childId)
                    .actionType(CurationActions.ASSIGNED_TO_PARENT)
                    .oldValues(oldValues)
                    .newValues(newValues)
                    .reason(rationale)
                    .actorId(curatorId)
                    .sessionId(sessionId));
        }

        parent.appendNote(new CurationNote(CurationActions.CHILDREN_ASSIGNED,
                "Assigned " + assigned.size() + " child narratives" + (rationale != null ? ": " + rationale : ""),
                curatorId, OffsetDateTime.now(clock)));
        narrativeStore.saveUpdated(parent);

        logger.info("Curator {} assigned {} children to {} ({} skipped)",
                curatorId, assigned.size(), parentId, skipped.size());
        return new AssignmentResult(parentId, assigned.size(), assigned, skipped);
    }

    /**
     * Clears the parent link of a child narrative and audits the removal.
     */
    @Transactional
    public Narrative detachChild(UUID childId, String curatorId, String reason) {
        UUID formerParent = narrativeStore.clearParent(childId);
        Map<String, Object> oldValues = new HashMap<>();
        oldValues.put("parent_id", formerParent.toString());
        Map<String, Object> newValues = new HashMap<>();
        newValues.put("parent_id", null);
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(childId)
                .actionType(CurationActions.REMOVED_FROM_PARENT)
                .oldValues(oldValues)
                .newValues(newValues)
                .reason(reason)
                .actorId(curatorId));
        return narrativeStore.get(childId);
    }

    /**
     * Deletes a narrative, its children if it is a root, and the cluster groups linked to it.
     *
     * @return ids of the deleted narratives
     */
    @Transactional
    public List<UUID> deleteNarrative(UUID narrativeId, String actorId, String reason) {
        Narrative target = narrativeStore.get(narrativeId);
        Map<UUID, Narrative> snapshots = new HashMap<>();
        snapshots.put(narrativeId, target);
        int groups = 0;
        if (target.isRoot()) {
            narrativeStore.getChildren(narrativeId).forEach(child -> snapshots.put(child.getId(), child));
            groups = clusterGroupRegistry.deleteGroupsLinkedTo(narrativeId);
        }
        List<UUID> deleted = narrativeStore.delete(narrativeId);
        String sessionId = auditLog.newSessionId();
        for (UUID id : deleted) {
            Narrative snapshot = snapshots.get(id);
            Map<String, Object> oldValues = new HashMap<>();
            if (snapshot != null) {
                oldValues.put("narrative_id", snapshot.getNarrativeId());
                oldValues.put("title", snapshot.getTitle());
                oldValues.put("status", snapshot.getCurationStatus().getValue());
                oldValues.put("parent_id", snapshot.getParentId() != null ? snapshot.getParentId().toString() : null);
            }
            auditLog.append(CurationLogEntry.builder()
                    .narrativeId(id)
                    .actionType(CurationActions.DELETED)
                    .oldValues(oldValues)
                    .reason(reason)
                    .actorId(actorId)
                    .sessionId(sessionId));
        }
        logger.info("{} deleted narrative {} ({} narratives, {} cluster groups)",
                actorId, narrativeId, deleted.size(), groups);
        return deleted;
    }

    @Transactional
    public Narrative updatePriority(UUID narrativeId, int priority, String actorId, String reason) {
        NarrativeStore.validatePriority(priority);
        Narrative narrative = narrativeStore.lockNarrative(narrativeId);
        Integer previous = narrative.getEditorialPriority();
        narrative.setEditorialPriority(priority);
        Narrative saved = narrativeStore.saveUpdated(narrative);

        Map<String, Object> oldValues = new HashMap<>();
        oldValues.put("editorial_priority", previous);
        Map<String, Object> newValues = new HashMap<>();
        newValues.put("editorial_priority", priority);
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(narrativeId)
                .actionType(CurationActions.PRIORITY_CHANGED)
                .oldValues(oldValues)
                .newValues(newValues)
                .reason(reason)
                .actorId(actorId));
        return saved;
    }

    @Transactional
    public Narrative assignReview(UUID narrativeId, String reviewerId, OffsetDateTime deadline, String actorId) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new CurationValidationException("Reviewer id is required");
        }
        Narrative narrative = narrativeStore.lockNarrative(narrativeId);
        Map<String, Object> oldValues = new HashMap<>();
        oldValues.put("reviewer_id", narrative.getReviewerId());
        oldValues.put("review_deadline", narrative.getReviewDeadline() != null ? narrative.getReviewDeadline().toString() : null);
        narrative.setReviewerId(reviewerId);
        narrative.setReviewDeadline(deadline);
        Narrative saved = narrativeStore.saveUpdated(narrative);

        Map<String, Object> newValues = new HashMap<>();
        newValues.put("reviewer_id", reviewerId);
        newValues.put("review_deadline", deadline != null ? deadline.toString() : null);
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(narrativeId)
                .actionType(CurationActions.REVIEW_ASSIGNED)
                .oldValues(oldValues)
                .newValues(newValues)
                .actorId(actorId));
        return saved;
    }

    @Transactional
    public Narrative addNote(UUID narrativeId, String detail, String actorId) {
        if (detail == null || detail.isBlank()) {
            throw new CurationValidationException("Note text is required");
        }
        Narrative narrative = narrativeStore.lockNarrative(narrativeId);
        narrative.appendNote(new CurationNote(CurationActions.NOTE_ADDED, detail, actorId, OffsetDateTime.now(clock)));
        Narrative saved = narrativeStore.saveUpdated(narrative);
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(narrativeId)
                .actionType(CurationActions.NOTE_ADDED)
                .reason(detail)
                .actorId(actorId));
        return saved;
    }

    @Transactional(readOnly = true)
    public NarrativeDetailsResponse getNarrativeDetails(UUID narrativeId) {
        Narrative narrative = narrativeStore.get(narrativeId);
        Narrative parent = narrativeStore.getParent(narrativeId).orElse(null);
        List<Narrative> children = narrative.isRoot() ? narrativeStore.getChildren(narrativeId) : List.of();
        UUID rootId = narrative.isRoot() ? narrativeId : narrative.getParentId();
        List<CurationLogEntry> activity = auditLog.entriesFor(narrativeId);
        if (activity.size() > RECENT_ACTIVITY_LIMIT) {
            activity = activity.subList(0, RECENT_ACTIVITY_LIMIT);
        }
        return new NarrativeDetailsResponse(narrative, parent, children,
                hierarchyCache.getEntry(rootId).orElse(null), activity);
    }
}
