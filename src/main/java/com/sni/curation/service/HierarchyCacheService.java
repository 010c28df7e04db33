package com.sni.curation.service;

import com.sni.curation.model.HierarchyChildSummary;
import com.sni.curation.model.Narrative;
import com.sni.curation.model.NarrativeHierarchyCacheEntry;
import com.sni.curation.repository.NarrativeHierarchyCacheRepository;
import com.sni.curation.repository.NarrativeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Maintains {@code narrative_hierarchy_cache}, one aggregate row per root narrative.
 *
 * <p>Structural mutations update only the affected root's row, inside the caller's transaction. A full
 * rebuild is available through {@link #refreshHierarchyCache()} to recover from drift.
 */
@Service
public class HierarchyCacheService {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyCacheService.class);

    private static final Comparator<HierarchyChildSummary> CREATION_ORDER = Comparator
            .comparing(HierarchyChildSummary::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(HierarchyChildSummary::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final NarrativeHierarchyCacheRepository cacheRepository;
    private final NarrativeRepository narrativeRepository;
    private final Clock clock;

    public HierarchyCacheService(NarrativeHierarchyCacheRepository cacheRepository,
                                 NarrativeRepository narrativeRepository,
                                 Clock clock) {
        this.cacheRepository = cacheRepository;
        this.narrativeRepository = narrativeRepository;
        this.clock = clock;
    }

    /**
     * Registers a new root with an empty aggregate, or re-derives it if the root already has children.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void rootCreated(Narrative root) {
        List<HierarchyChildSummary> children = narrativeRepository.findAllByParentIdOrderByCreatedAtAsc(root.getId())
                .stream()
                .map(HierarchyChildSummary::of)
                .collect(Collectors.toCollection(ArrayList::new));
        cacheRepository.save(aggregate(root, children));
    }

    /**
     * Drops the row of a narrative that stopped being a root (deleted, or assigned under a parent).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void rootRemoved(UUID rootId) {
        if (cacheRepository.existsById(rootId)) {
            cacheRepository.deleteById(rootId);
        }
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void childAttached(Narrative parent, Narrative child) {
        NarrativeHierarchyCacheEntry entry = loadOrRebuild(parent);
        List<HierarchyChildSummary> children = withoutChild(entry, child.getId());
        children.add(HierarchyChildSummary.of(child));
        cacheRepository.save(aggregate(parent, children));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void childDetached(Narrative parent, UUID childId) {
        NarrativeHierarchyCacheEntry entry = loadOrRebuild(parent);
        cacheRepository.save(aggregate(parent, withoutChild(entry, childId)));
    }

    /**
     * Refreshes the snapshot of one child (title, confidence, update time) inside its parent's row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void childUpdated(Narrative child) {
        if (child.getParentId() == null) {
            return;
        }
        Optional<Narrative> parent = narrativeRepository.findById(child.getParentId());
        if (parent.isEmpty()) {
            logger.warn("Narrative {} references missing parent {}; cache not updated", child.getId(), child.getParentId());
            return;
        }
        childAttached(parent.get(), child);
    }

    /**
     * Refreshes the parent-side columns of a root's row after the root itself was edited.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void rootUpdated(Narrative root) {
        if (!root.isRoot()) {
            return;
        }
        NarrativeHierarchyCacheEntry entry = loadOrRebuild(root);
        cacheRepository.save(aggregate(root, withoutChild(entry, null)));
    }

    /**
     * Rebuilds every row from the narratives table. Rows whose aggregate did not change are left untouched
     * and rows of narratives that are no longer roots are removed, so repeated calls converge.
     *
     * @return number of rows written or removed
     */
    @Transactional
    public int refreshHierarchyCache() {
        List<Narrative> roots = narrativeRepository.findAllByParentIdIsNull();
        Map<UUID, List<HierarchyChildSummary>> childrenByParent = narrativeRepository.findAllByParentIdIsNotNull()
                .stream()
                .collect(Collectors.groupingBy(Narrative::getParentId,
                        Collectors.mapping(HierarchyChildSummary::of, Collectors.toList())));
        Map<UUID, NarrativeHierarchyCacheEntry> existing = cacheRepository.findAll().stream()
                .collect(Collectors.toMap(NarrativeHierarchyCacheEntry::getParentId, Function.identity()));

        int changed = 0;
        Set<UUID> rootIds = new HashSet<>();
        for (Narrative root : roots) {
            rootIds.add(root.getId());
            NarrativeHierarchyCacheEntry rebuilt = aggregate(root, childrenByParent.getOrDefault(root.getId(), List.of()));
            NarrativeHierarchyCacheEntry current = existing.get(root.getId());
            if (!rebuilt.hasSameAggregateAs(current)) {
                cacheRepository.save(rebuilt);
                changed++;
            }
        }
        for (UUID staleId : existing.keySet()) {
            if (!rootIds.contains(staleId)) {
                cacheRepository.deleteById(staleId);
                changed++;
            }
        }
        logger.info("Hierarchy cache refreshed: {} roots, {} rows changed", roots.size(), changed);
        return changed;
    }

    @Transactional(readOnly = true)
    public Optional<NarrativeHierarchyCacheEntry> getEntry(UUID rootId) {
        return cacheRepository.findById(rootId);
    }

    @Transactional(readOnly = true)
    public List<NarrativeHierarchyCacheEntry> listEntries() {
        return cacheRepository.findAllByOrderByChildCountDesc();
    }

    private NarrativeHierarchyCacheEntry loadOrRebuild(Narrative root) {
        return cacheRepository.findById(root.getId()).orElseGet(() -> {
            logger.debug("No cache row for root {}; deriving from narratives", root.getId());
            List<HierarchyChildSummary> children = narrativeRepository
                    .findAllByParentIdOrderByCreatedAtAsc(root.getId())
                    .stream()
                    .map(HierarchyChildSummary::of)
                    .collect(Collectors.toCollection(ArrayList::new));
            return aggregate(root, children);
        });
    }

    private static List<HierarchyChildSummary> withoutChild(NarrativeHierarchyCacheEntry entry, UUID childId) {
        List<HierarchyChildSummary> children = new ArrayList<>();
        if (entry.getChildren() != null) {
            for (HierarchyChildSummary summary : entry.getChildren()) {
                if (childId == null || !childId.equals(summary.getId())) {
                    children.add(summary);
                }
            }
        }
        return children;
    }

    /**
     * Derives a complete row for {@code root} from the given child snapshots.
     */
    NarrativeHierarchyCacheEntry aggregate(Narrative root, List<HierarchyChildSummary> snapshots) {
        List<HierarchyChildSummary> children = new ArrayList<>(snapshots);
        children.sort(CREATION_ORDER);

        OffsetDateTime firstCreated = null;
        OffsetDateTime latestCreated = null;
        OffsetDateTime latestUpdated = null;
        Map<String, Integer> confidenceCounts = new TreeMap<>();
        for (HierarchyChildSummary child : children) {
            firstCreated = earliest(firstCreated, child.getCreatedAt());
            latestCreated = latest(latestCreated, child.getCreatedAt());
            latestUpdated = latest(latestUpdated, child.getUpdatedAt());
            if (child.getConfidenceRating() != null) {
                confidenceCounts.merge(child.getConfidenceRating(), 1, Integer::sum);
            }
        }

        // Ties resolve to the alphabetically first rating.
        String predominant = null;
        int best = 0;
        for (Map.Entry<String, Integer> count : confidenceCounts.entrySet()) {
            if (count.getValue() > best) {
                best = count.getValue();
                predominant = count.getKey();
            }
        }

        return NarrativeHierarchyCacheEntry.builder()
                .parentId(root.getId())
                .parentNarrativeId(root.getNarrativeId())
                .parentTitle(root.getTitle())
                .parentConfidenceRating(root.getConfidenceRating())
                .childCount(children.size())
                .children(children)
                .firstChildCreatedAt(firstCreated)
                .latestChildCreatedAt(latestCreated)
                .latestChildUpdatedAt(latestUpdated)
                .confidenceDiversity(confidenceCounts.size())
                .predominantChildConfidence(predominant)
                .cacheUpdatedAt(OffsetDateTime.now(clock))
                .build();
    }

    private static OffsetDateTime earliest(OffsetDateTime current, OffsetDateTime candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    private static OffsetDateTime latest(OffsetDateTime current, OffsetDateTime candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
