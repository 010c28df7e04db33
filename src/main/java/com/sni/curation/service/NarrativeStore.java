package com.sni.curation.service;

import com.sni.curation.dto.HierarchyStatistics;
import com.sni.curation.dto.HierarchyTreeNode;
import com.sni.curation.dto.IntegrityCheck;
import com.sni.curation.dto.IntegrityReport;
import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.repository.NarrativeRepository;
import com.sni.curation.service.exception.AlreadyParentedException;
import com.sni.curation.service.exception.ConcurrentNarrativeModificationException;
import com.sni.curation.service.exception.CurationValidationException;
import com.sni.curation.service.exception.DepthViolationException;
import com.sni.curation.service.exception.InvalidParentReferenceException;
import com.sni.curation.service.exception.NarrativeNotFoundException;
import com.sni.curation.service.exception.SelfReferenceException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Owns the {@code narratives} table and the two-level parent/child invariants.
 *
 * <p>Rows are always locked parent first, then child, so that concurrent assignments and deletes on the
 * same subtree serialize instead of deadlocking. A row that this transaction already read is re-read once
 * its lock is held, so checks made under the lock see committed state.
 */
@Service
public class NarrativeStore {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeStore.class);

    static final int DEFAULT_PRIORITY = 5;
    private static final int MIN_PRIORITY = 1;
    private static final int MAX_PRIORITY = 5;
    private static final int DISPLAY_ID_ATTEMPTS = 5;
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    public static final String CHECK_SELF_REFERENCES = "self_references";
    public static final String CHECK_DANGLING_PARENTS = "dangling_parent_references";
    public static final String CHECK_HIERARCHY_DEPTH = "hierarchy_depth";
    public static final String CHECK_MANUAL_ROOT_SOURCE = "manual_root_source_mismatch";

    private final NarrativeRepository narrativeRepository;
    private final HierarchyCacheService hierarchyCache;
    private final Clock clock;
    private final EntityManager entityManager;

    public NarrativeStore(NarrativeRepository narrativeRepository,
                          HierarchyCacheService hierarchyCache,
                          Clock clock,
                          EntityManager entityManager) {
        this.narrativeRepository = narrativeRepository;
        this.hierarchyCache = hierarchyCache;
        this.clock = clock;
        this.entityManager = entityManager;
    }

    /**
     * Inserts a root narrative. The status must be an entry state permitted for the given provenance.
     */
    @Transactional
    public Narrative createRoot(CurationSource source, CurationStatus status, NarrativeFields fields) {
        if (source == null || status == null) {
            throw new CurationValidationException("Curation source and status are required");
        }
        if (!source.allowsInitialStatus(status)) {
            throw new CurationValidationException(
                    "Status " + status + " is not a valid initial status for source " + source);
        }
        if (fields == null || fields.getTitle() == null || fields.getTitle().isBlank()) {
            throw new CurationValidationException("Title is required");
        }
        int priority = fields.getEditorialPriority() != null ? fields.getEditorialPriority() : DEFAULT_PRIORITY;
        validatePriority(priority);
        List<String> clusterIds = fields.getManualClusterIds() != null
                ? new ArrayList<>(fields.getManualClusterIds())
                : new ArrayList<>();
        if (source == CurationSource.PIPELINE && !clusterIds.isEmpty()) {
            throw new CurationValidationException("Manual cluster ids are only meaningful for curated narratives");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        String displayId = resolveDisplayId(fields.getNarrativeId(), source, now);
        Narrative narrative = Narrative.builder()
                .id(UUID.randomUUID())
                .narrativeId(displayId)
                .title(fields.getTitle().trim())
                .summary(fields.getSummary())
                .confidenceRating(fields.getConfidenceRating())
                .curationSource(source)
                .curationStatus(status)
                .curatorId(fields.getCuratorId())
                .editorialPriority(priority)
                .manualClusterIds(clusterIds)
                .createdAt(now)
                .updatedAt(now)
                .build();
        Narrative saved = narrativeRepository.save(narrative);
        hierarchyCache.rootCreated(saved);
        logger.info("Created {} root narrative {} ({})", source, saved.getId(), saved.getNarrativeId());
        return saved;
    }

    /**
     * Links {@code childId} under {@code parentId}. Assignment never overwrites an existing link.
     */
    @Transactional
    public void setParent(UUID childId, UUID parentId) {
        Narrative[] locked = lockForAssignment(childId, parentId);
        Narrative child = locked[1];
        if (child.getParentId() != null) {
            throw new AlreadyParentedException(childId, child.getParentId());
        }
        attach(locked[0], child);
    }

    /**
     * Same checks as {@link #setParent(UUID, UUID)}, but a child that already has a parent is reported by
     * returning {@code false} instead of raising.
     */
    @Transactional
    public boolean assignIfOrphaned(UUID childId, UUID parentId) {
        Narrative[] locked = lockForAssignment(childId, parentId);
        Narrative child = locked[1];
        if (child.getParentId() != null) {
            logger.debug("Narrative {} already assigned to {}; skipping", childId, child.getParentId());
            return false;
        }
        attach(locked[0], child);
        return true;
    }

    /**
     * Removes the parent link of a child, making it a root again.
     *
     * @return the former parent id
     */
    @Transactional
    public UUID clearParent(UUID childId) {
        Narrative snapshot = get(childId);
        UUID parentId = snapshot.getParentId();
        if (parentId == null) {
            throw new CurationValidationException("Narrative " + childId + " has no parent to remove");
        }
        Narrative parent = lockRow(parentId).orElse(null);
        Narrative child = lockNarrative(childId);
        if (!parentId.equals(child.getParentId())) {
            throw new ConcurrentNarrativeModificationException(
                    "Parent of narrative " + childId + " changed while it was being detached");
        }
        child.setParentId(null);
        child.setUpdatedAt(OffsetDateTime.now(clock));
        Narrative saved = narrativeRepository.save(child);
        if (parent != null) {
            hierarchyCache.childDetached(parent, childId);
        }
        hierarchyCache.rootCreated(saved);
        logger.info("Detached narrative {} from parent {}", childId, parentId);
        return parentId;
    }

    /**
     * Deletes a narrative. Deleting a root deletes its children first, in the same transaction.
     *
     * @return ids of every deleted narrative, children before the root
     */
    @Transactional
    public List<UUID> delete(UUID id) {
        Narrative snapshot = get(id);
        List<UUID> deleted = new ArrayList<>();
        if (snapshot.isRoot()) {
            Narrative root = lockNarrative(id);
            if (!root.isRoot()) {
                throw new ConcurrentNarrativeModificationException(
                        "Narrative " + id + " was assigned to a parent while being deleted");
            }
            List<Narrative> children = narrativeRepository.findChildrenForUpdate(id);
            for (Narrative child : children) {
                entityManager.refresh(child, LockModeType.PESSIMISTIC_WRITE);
                deleted.add(child.getId());
            }
            narrativeRepository.deleteAll(children);
            narrativeRepository.delete(root);
            deleted.add(id);
            hierarchyCache.rootRemoved(id);
            logger.info("Deleted root narrative {} with {} children", id, children.size());
        } else {
            UUID parentId = snapshot.getParentId();
            Narrative parent = lockRow(parentId).orElse(null);
            Narrative child = lockNarrative(id);
            if (!parentId.equals(child.getParentId())) {
                throw new ConcurrentNarrativeModificationException(
                        "Parent of narrative " + id + " changed while it was being deleted");
            }
            narrativeRepository.delete(child);
            deleted.add(id);
            if (parent != null) {
                hierarchyCache.childDetached(parent, id);
            }
            logger.info("Deleted child narrative {} of parent {}", id, parentId);
        }
        return deleted;
    }

    /**
     * Persists edits to descriptive or workflow fields and refreshes the owning cache row. The row is flushed
     * so the returned entity carries the version that was written.
     */
    @Transactional
    public Narrative saveUpdated(Narrative narrative) {
        narrative.setUpdatedAt(OffsetDateTime.now(clock));
        Narrative saved = narrativeRepository.saveAndFlush(narrative);
        if (saved.isRoot()) {
            hierarchyCache.rootUpdated(saved);
        } else {
            hierarchyCache.childUpdated(saved);
        }
        return saved;
    }

    /**
     * Loads a narrative holding its row lock until the surrounding transaction ends. The returned state is
     * read after the lock was granted.
     */
    @Transactional
    public Narrative lockNarrative(UUID id) {
        return lockRow(id).orElseThrow(() -> new NarrativeNotFoundException("Narrative not found: " + id));
    }

    @Transactional(readOnly = true)
    public Narrative get(UUID id) {
        return narrativeRepository.findById(id)
                .orElseThrow(() -> new NarrativeNotFoundException("Narrative not found: " + id));
    }

    /**
     * Returns the children of a narrative, oldest first.
     */
    @Transactional(readOnly = true)
    public List<Narrative> getChildren(UUID parentId) {
        get(parentId);
        return narrativeRepository.findAllByParentIdOrderByCreatedAtAsc(parentId);
    }

    @Transactional(readOnly = true)
    public Optional<Narrative> getParent(UUID childId) {
        Narrative child = get(childId);
        if (child.getParentId() == null) {
            return Optional.empty();
        }
        return narrativeRepository.findById(child.getParentId());
    }

    /**
     * Returns the root of the hierarchy containing {@code id}; a root is its own root.
     */
    @Transactional(readOnly = true)
    public Narrative getRoot(UUID id) {
        Narrative narrative = get(id);
        if (narrative.isRoot()) {
            return narrative;
        }
        return narrativeRepository.findById(narrative.getParentId())
                .orElseThrow(() -> new NarrativeNotFoundException(
                        "Parent " + narrative.getParentId() + " of narrative " + id + " not found"));
    }

    @Transactional(readOnly = true)
    public List<HierarchyTreeNode> getHierarchyTree(UUID rootId) {
        Narrative root = get(rootId);
        if (!root.isRoot()) {
            throw new CurationValidationException("Narrative " + rootId + " is not a root narrative");
        }
        List<Narrative> children = narrativeRepository.findAllByParentIdOrderByCreatedAtAsc(rootId);
        List<HierarchyTreeNode> tree = new ArrayList<>();
        tree.add(HierarchyTreeNode.root(root, children.size()));
        for (Narrative child : children) {
            tree.add(HierarchyTreeNode.child(child));
        }
        return tree;
    }

    @Transactional(readOnly = true)
    public HierarchyStatistics getHierarchyStatistics() {
        long total = narrativeRepository.count();
        long roots = narrativeRepository.findAllByParentIdIsNull().size();
        Map<UUID, Long> childCounts = narrativeRepository.findAllByParentIdIsNotNull().stream()
                .collect(Collectors.groupingBy(Narrative::getParentId, Collectors.counting()));
        long children = childCounts.values().stream().mapToLong(Long::longValue).sum();
        double average = childCounts.values().stream().mapToLong(Long::longValue).average().orElse(0.0);
        long max = childCounts.values().stream().mapToLong(Long::longValue).max().orElse(0L);
        return new HierarchyStatistics(total, roots, children, average, max);
    }

    /**
     * Scans the whole table for hierarchy invariant violations. Read-only; never called on the write path.
     */
    @Transactional(readOnly = true)
    public IntegrityReport validateIntegrity() {
        List<IntegrityCheck> checks = new ArrayList<>();
        checks.add(IntegrityCheck.of(CHECK_SELF_REFERENCES,
                "Narratives whose parent is themselves",
                IntegrityCheck.FAIL,
                narrativeRepository.findSelfReferencingIds()));
        checks.add(IntegrityCheck.of(CHECK_DANGLING_PARENTS,
                "Narratives whose parent does not exist",
                IntegrityCheck.FAIL,
                narrativeRepository.findDanglingParentReferenceIds()));
        checks.add(IntegrityCheck.of(CHECK_HIERARCHY_DEPTH,
                "Narratives whose parent itself has a parent",
                IntegrityCheck.FAIL,
                narrativeRepository.findDepthViolationIds()));
        checks.add(IntegrityCheck.of(CHECK_MANUAL_ROOT_SOURCE,
                "Roots in manual_draft whose curation source is pipeline",
                IntegrityCheck.FAIL,
                narrativeRepository.findRootIdsBySourceAndStatus(CurationSource.PIPELINE, CurationStatus.MANUAL_DRAFT)));
        IntegrityReport report = IntegrityReport.of(OffsetDateTime.now(clock), checks);
        if (!IntegrityCheck.PASS.equals(report.overallStatus())) {
            logger.warn("Hierarchy integrity check finished with status {}", report.overallStatus());
        }
        return report;
    }

    public static void validatePriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new CurationValidationException(
                    "Editorial priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + priority);
        }
    }

    /**
     * Runs the checks shared by assignment paths and returns {parent, child}, both locked.
     */
    private Narrative[] lockForAssignment(UUID childId, UUID parentId) {
        if (childId == null || parentId == null) {
            throw new CurationValidationException("Child and parent ids are required");
        }
        if (childId.equals(parentId)) {
            throw new SelfReferenceException(childId);
        }
        Narrative parent = lockRow(parentId)
                .orElseThrow(() -> new InvalidParentReferenceException("Parent narrative not found: " + parentId));
        if (parent.getParentId() != null) {
            throw new DepthViolationException("Narrative " + parentId + " is itself a child of "
                    + parent.getParentId() + " and cannot receive children");
        }
        Narrative child = lockNarrative(childId);
        if (child.getParentId() == null && narrativeRepository.existsByParentId(childId)) {
            throw new DepthViolationException("Narrative " + childId + " has children of its own and cannot be assigned");
        }
        return new Narrative[]{parent, child};
    }

    /**
     * The locking query hands back an instance already in the persistence context unchanged, so it is
     * refreshed under the same lock.
     */
    private Optional<Narrative> lockRow(UUID id) {
        Optional<Narrative> locked = narrativeRepository.findByIdForUpdate(id);
        locked.ifPresent(narrative -> entityManager.refresh(narrative, LockModeType.PESSIMISTIC_WRITE));
        return locked;
    }

    private void attach(Narrative parent, Narrative child) {
        child.setParentId(parent.getId());
        child.setUpdatedAt(OffsetDateTime.now(clock));
        Narrative saved = narrativeRepository.save(child);
        hierarchyCache.rootRemoved(saved.getId());
        hierarchyCache.childAttached(parent, saved);
        logger.debug("Assigned narrative {} to parent {}", saved.getId(), parent.getId());
    }

    private String resolveDisplayId(String requested, CurationSource source, OffsetDateTime now) {
        if (requested != null && !requested.isBlank()) {
            if (narrativeRepository.existsByNarrativeId(requested)) {
                throw new CurationValidationException("Narrative id already in use: " + requested);
            }
            return requested;
        }
        String prefix = "EN-" + DISPLAY_DATE.format(now) + "-" + sourceMarker(source);
        for (int attempt = 0; attempt < DISPLAY_ID_ATTEMPTS; attempt++) {
            String candidate = prefix + String.format("%06d", ThreadLocalRandom.current().nextInt(1_000_000));
            if (!narrativeRepository.existsByNarrativeId(candidate)) {
                return candidate;
            }
        }
        throw new ConcurrentNarrativeModificationException("Could not allocate a unique narrative id for " + prefix);
    }

    private static String sourceMarker(CurationSource source) {
        return switch (source) {
            case MANUAL -> "M";
            case PIPELINE -> "P";
            case HYBRID_ASSISTED -> "H";
        };
    }
}
