package com.sni.curation.service;

import com.sni.curation.dto.CreateClusterGroupRequest;
import com.sni.curation.model.ClusterGroupStatus;
import com.sni.curation.model.CurationActions;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.CurationNote;
import com.sni.curation.model.ManualClusterGroup;
import com.sni.curation.model.Narrative;
import com.sni.curation.repository.ManualClusterGroupRepository;
import com.sni.curation.repository.NarrativeRepository;
import com.sni.curation.service.exception.CurationValidationException;
import com.sni.curation.service.exception.InvalidParentReferenceException;
import com.sni.curation.service.exception.InvalidTransitionException;
import com.sni.curation.service.exception.NarrativeNotFoundException;
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
 * Curator-defined groupings of external cluster ids and their two-step review.
 */
@Service
public class ClusterGroupRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ClusterGroupRegistry.class);

    private final ManualClusterGroupRepository groupRepository;
    private final NarrativeRepository narrativeRepository;
    private final CurationAuditLog auditLog;
    private final Clock clock;
    private final int maxClusterIds;

    public ClusterGroupRegistry(ManualClusterGroupRepository groupRepository,
                                NarrativeRepository narrativeRepository,
                                CurationAuditLog auditLog,
                                Clock clock,
                                @Value("${app.curation.max-cluster-ids:50}") int maxClusterIds) {
        this.groupRepository = groupRepository;
        this.narrativeRepository = narrativeRepository;
        this.auditLog = auditLog;
        this.clock = clock;
        this.maxClusterIds = Math.max(1, maxClusterIds);
    }

    @Transactional
    public ManualClusterGroup createGroup(String name,
                                          String description,
                                          List<String> clusterIds,
                                          String curatorId,
                                          String rationale) {
        CreateClusterGroupRequest request = new CreateClusterGroupRequest();
        request.setName(name);
        request.setDescription(description);
        request.setClusterIds(clusterIds);
        request.setCuratorId(curatorId);
        request.setRationale(rationale);
        return createGroup(request);
    }

    /**
     * Creates a group in {@code draft}. Duplicate cluster ids are collapsed, keeping first occurrence order.
     */
    @Transactional
    public ManualClusterGroup createGroup(CreateClusterGroupRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new CurationValidationException("Group name is required");
        }
        if (request.getCuratorId() == null || request.getCuratorId().isBlank()) {
            throw new CurationValidationException("Curator id is required");
        }
        List<String> clusterIds = normalizeClusterIds(request.getClusterIds());
        if (clusterIds.isEmpty()) {
            throw new CurationValidationException("At least one cluster id is required");
        }
        if (clusterIds.size() > maxClusterIds) {
            throw new CurationValidationException(
                    "A cluster group may reference at most " + maxClusterIds + " clusters");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        ManualClusterGroup group = ManualClusterGroup.builder()
                .name(request.getName().trim())
                .description(request.getDescription())
                .clusterIds(clusterIds)
                .clusterMetadata(request.getClusterMetadata() != null
                        ? new HashMap<>(request.getClusterMetadata())
                        : new HashMap<>())
                .curatorId(request.getCuratorId())
                .rationale(request.getRationale())
                .strategicSignificance(request.getStrategicSignificance())
                .status(ClusterGroupStatus.DRAFT)
                .createdAt(now)
                .updatedAt(now)
                .build();
        ManualClusterGroup saved = groupRepository.save(group);
        logger.info("Created cluster group {} '{}' with {} clusters for curator {}",
                saved.getId(), saved.getName(), clusterIds.size(), saved.getCuratorId());
        return saved;
    }

    /**
     * Links a group to a manual root narrative. Relinking to another parent is allowed.
     */
    @Transactional
    public ManualClusterGroup linkToParent(UUID groupId, UUID parentNarrativeId, String actorId) {
        if (parentNarrativeId == null) {
            throw new CurationValidationException("Parent narrative id is required");
        }
        ManualClusterGroup group = lockGroup(groupId);
        Narrative parent = narrativeRepository.findById(parentNarrativeId)
                .orElseThrow(() -> new InvalidParentReferenceException(
                        "Parent narrative not found: " + parentNarrativeId));
        if (!parent.isManualRoot()) {
            throw new InvalidParentReferenceException(
                    "Narrative " + parentNarrativeId + " is not a manual root narrative");
        }

        UUID previousParent = group.getParentNarrativeId();
        group.setParentNarrativeId(parentNarrativeId);
        group.setUpdatedAt(OffsetDateTime.now(clock));
        ManualClusterGroup saved = groupRepository.save(group);

        Map<String, Object> oldValues = new HashMap<>();
        oldValues.put("parent_narrative_id", previousParent != null ? previousParent.toString() : null);
        Map<String, Object> newValues = new HashMap<>();
        newValues.put("cluster_group_id", groupId.toString());
        newValues.put("parent_narrative_id", parentNarrativeId.toString());
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(parentNarrativeId)
                .actionType(CurationActions.CLUSTER_GROUP_LINKED)
                .oldValues(oldValues)
                .newValues(newValues)
                .reason("Linked cluster group '" + group.getName() + "'")
                .actorId(actorId != null ? actorId : group.getCuratorId()));
        logger.info("Linked cluster group {} to narrative {}", groupId, parentNarrativeId);
        return saved;
    }

    /**
     * Advances the group one review step: draft to pending_review, then pending_review to approved.
     */
    @Transactional
    public ManualClusterGroup approve(UUID groupId, String reviewerId, String notes) {
        if (reviewerId == null || reviewerId.isBlank()) {
            throw new CurationValidationException("Reviewer id is required");
        }
        ManualClusterGroup group = lockGroup(groupId);
        ClusterGroupStatus current = group.getStatus();
        ClusterGroupStatus next = current.next();
        if (next == null) {
            throw new InvalidTransitionException(current.getValue(), current.getValue());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        group.setStatus(next);
        group.setReviewerId(reviewerId);
        group.setUpdatedAt(now);
        if (next == ClusterGroupStatus.APPROVED) {
            group.setApprovedAt(now);
        }
        String action = next == ClusterGroupStatus.APPROVED
                ? CurationActions.GROUP_APPROVED
                : CurationActions.GROUP_SUBMITTED;
        group.appendReviewNote(new CurationNote(action, notes, reviewerId, now));
        ManualClusterGroup saved = groupRepository.save(group);
        logger.info("Cluster group {} moved from {} to {} by {}", groupId, current, next, reviewerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public ManualClusterGroup get(UUID groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new NarrativeNotFoundException("Cluster group not found: " + groupId));
    }

    @Transactional(readOnly = true)
    public List<ManualClusterGroup> list(ClusterGroupStatus status, String curatorId) {
        if (status != null) {
            List<ManualClusterGroup> groups = groupRepository.findAllByStatusOrderByCreatedAtDesc(status);
            if (curatorId == null) {
                return groups;
            }
            return groups.stream().filter(g -> curatorId.equals(g.getCuratorId())).toList();
        }
        if (curatorId != null) {
            return groupRepository.findAllByCuratorIdOrderByCreatedAtDesc(curatorId);
        }
        return groupRepository.findAllByOrderByCreatedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<ManualClusterGroup> findForParent(UUID parentNarrativeId) {
        return groupRepository.findAllByParentNarrativeId(parentNarrativeId);
    }

    /**
     * Groups with no parent, or whose parent no longer exists. Reported, never removed automatically.
     */
    @Transactional(readOnly = true)
    public List<ManualClusterGroup> findOrphaned() {
        return groupRepository.findOrphaned();
    }

    /**
     * Removes the groups linked to a narrative that is about to be deleted.
     */
    @Transactional
    public int deleteGroupsLinkedTo(UUID parentNarrativeId) {
        List<ManualClusterGroup> linked = groupRepository.findAllByParentNarrativeId(parentNarrativeId);
        if (linked.isEmpty()) {
            return 0;
        }
        groupRepository.deleteAll(linked);
        logger.info("Deleted {} cluster groups linked to narrative {}", linked.size(), parentNarrativeId);
        return linked.size();
    }

    private ManualClusterGroup lockGroup(UUID groupId) {
        return groupRepository.findByIdForUpdate(groupId)
                .orElseThrow(() -> new NarrativeNotFoundException("Cluster group not found: " + groupId));
    }

    private static List<String> normalizeClusterIds(List<String> clusterIds) {
        if (clusterIds == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String clusterId : clusterIds) {
            if (clusterId != null && !clusterId.isBlank()) {
                unique.add(clusterId.trim());
            }
        }
        return new ArrayList<>(unique);
    }
}
