package com.sni.curation.service;

import com.sni.curation.dto.DashboardItem;
import com.sni.curation.dto.IntegrityCheck;
import com.sni.curation.dto.IntegrityReport;
import com.sni.curation.dto.PendingReviewItem;
import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.ManualClusterGroup;
import com.sni.curation.model.Narrative;
import com.sni.curation.model.NarrativeHierarchyCacheEntry;
import com.sni.curation.repository.NarrativeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only editorial views: the curation dashboard, the pending review queue and workflow health checks.
 */
@Service
public class CurationDashboardService {

    private static final Logger logger = LoggerFactory.getLogger(CurationDashboardService.class);

    public static final int DEFAULT_LIMIT = 50;
    private static final int LOWEST_PRIORITY = 5;
    private static final int BUSY_PARENT_CHILD_COUNT = 3;
    private static final Set<CurationSource> CURATED_SOURCES =
            EnumSet.of(CurationSource.MANUAL, CurationSource.HYBRID_ASSISTED);
    private static final Set<CurationStatus> REVIEW_STATUSES =
            EnumSet.of(CurationStatus.PENDING_REVIEW, CurationStatus.REVIEWED);

    public static final String CHECK_ORPHANED_MANUAL_PARENTS = "orphaned_manual_parents";
    public static final String CHECK_INVALID_PARENT_REFERENCES = "invalid_parent_references";
    public static final String CHECK_STATUS_WORKFLOW = "status_workflow_issues";
    public static final String CHECK_OVERDUE_REVIEWS = "overdue_reviews";
    public static final String CHECK_ORPHANED_CLUSTER_GROUPS = "orphaned_cluster_groups";

    private final NarrativeRepository narrativeRepository;
    private final HierarchyCacheService hierarchyCache;
    private final ClusterGroupRegistry clusterGroupRegistry;
    private final CurationAuditLog auditLog;
    private final Clock clock;
    private final Duration dueSoonWindow;

    public CurationDashboardService(NarrativeRepository narrativeRepository,
                                    HierarchyCacheService hierarchyCache,
                                    ClusterGroupRegistry clusterGroupRegistry,
                                    CurationAuditLog auditLog,
                                    Clock clock,
                                    @Value("${app.curation.review-due-soon-hours:24}") long dueSoonHours) {
        this.narrativeRepository = narrativeRepository;
        this.hierarchyCache = hierarchyCache;
        this.clusterGroupRegistry = clusterGroupRegistry;
        this.auditLog = auditLog;
        this.clock = clock;
        this.dueSoonWindow = Duration.ofHours(Math.max(0, dueSoonHours));
    }

    /**
     * Narratives that are curated or have left auto generation, highest priority first and most recently
     * updated first within a priority.
     */
    @Transactional(readOnly = true)
    public List<DashboardItem> getDashboard(String curatorId, Collection<CurationStatus> statuses, Integer limit) {
        int max = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        OffsetDateTime now = OffsetDateTime.now(clock);
        return narrativeRepository.findDashboardCandidates(CURATED_SOURCES, CurationStatus.AUTO_GENERATED)
                .stream()
                .filter(n -> curatorId == null || curatorId.equals(n.getCuratorId()))
                .filter(n -> statuses == null || statuses.isEmpty() || statuses.contains(n.getCurationStatus()))
                .sorted(Comparator.comparingInt(CurationDashboardService::priorityOf)
                        .thenComparing(Narrative::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(max)
                .map(n -> toDashboardItem(n, now))
                .collect(Collectors.toList());
    }

    /**
     * Narratives awaiting review, most urgent first; ties go to the earliest deadline, with undated reviews last.
     *
     * @param reviewerId only reviews assigned to this reviewer, or all when null
     */
    @Transactional(readOnly = true)
    public List<PendingReviewItem> getPendingReviews(String reviewerId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return narrativeRepository.findAllByCurationStatusIn(REVIEW_STATUSES)
                .stream()
                .filter(n -> reviewerId == null || reviewerId.equals(n.getReviewerId()))
                .map(n -> toPendingReviewItem(n, now))
                .sorted(Comparator.comparingInt(PendingReviewItem::reviewUrgency).reversed()
                        .thenComparing(PendingReviewItem::reviewDeadline, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    /**
     * Urgency from 1 (low) to 5 (overdue).
     */
    int reviewUrgency(Narrative narrative, int childCount, OffsetDateTime now) {
        OffsetDateTime deadline = narrative.getReviewDeadline();
        if (deadline != null && deadline.isBefore(now)) {
            return 5;
        }
        if (deadline != null && deadline.isBefore(now.plus(dueSoonWindow))) {
            return 4;
        }
        int priority = priorityOf(narrative);
        if (priority <= 2) {
            return 3;
        }
        if (narrative.isRoot() && childCount > BUSY_PARENT_CHILD_COUNT) {
            return 3;
        }
        return priority;
    }

    @Transactional(readOnly = true)
    public IntegrityReport validateWorkflow() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<IntegrityCheck> checks = new ArrayList<>();
        checks.add(IntegrityCheck.of(CHECK_ORPHANED_MANUAL_PARENTS,
                "Manual parent narratives with no children",
                IntegrityCheck.WARNING,
                narrativeRepository.findChildlessRootIdsBySource(CurationSource.MANUAL)));
        checks.add(IntegrityCheck.of(CHECK_INVALID_PARENT_REFERENCES,
                "Child narratives with non-existent parent_id",
                IntegrityCheck.FAIL,
                narrativeRepository.findDanglingParentReferenceIds()));
        checks.add(IntegrityCheck.of(CHECK_STATUS_WORKFLOW,
                "Published without published_at, or pending review without a curator",
                IntegrityCheck.WARNING,
                narrativeRepository.findStatusWorkflowIssueIds(CurationStatus.PUBLISHED, CurationStatus.PENDING_REVIEW)));
        checks.add(IntegrityCheck.of(CHECK_OVERDUE_REVIEWS,
                "Reviews past their deadline",
                IntegrityCheck.WARNING,
                narrativeRepository.findAllByCurationStatusInAndReviewDeadlineBefore(REVIEW_STATUSES, now)
                        .stream().map(Narrative::getId).collect(Collectors.toList())));
        checks.add(IntegrityCheck.of(CHECK_ORPHANED_CLUSTER_GROUPS,
                "Manual cluster groups not linked to narratives",
                IntegrityCheck.WARNING,
                clusterGroupRegistry.findOrphaned().stream().map(ManualClusterGroup::getId).collect(Collectors.toList())));
        IntegrityReport report = IntegrityReport.of(now, checks);
        logger.info("Curation workflow validation finished with status {}", report.overallStatus());
        return report;
    }

    private DashboardItem toDashboardItem(Narrative n, OffsetDateTime now) {
        int childCount = childCountOf(n);
        boolean overdue = n.getReviewDeadline() != null && n.getReviewDeadline().isBefore(now);
        OffsetDateTime lastActivity = auditLog.lastActivity(n.getId()).orElse(n.getUpdatedAt());
        return new DashboardItem(
                n.getId(),
                n.getNarrativeId(),
                n.getTitle(),
                n.getCurationStatus(),
                n.getCurationSource(),
                n.getCuratorId(),
                n.getReviewerId(),
                n.getEditorialPriority(),
                n.getReviewDeadline(),
                n.getCreatedAt(),
                n.getUpdatedAt(),
                n.getPublishedAt(),
                childCount,
                n.getManualClusterIds() != null ? n.getManualClusterIds().size() : 0,
                n.isRoot(),
                n.getCurationSource() == CurationSource.MANUAL,
                overdue,
                lastActivity
        );
    }

    private PendingReviewItem toPendingReviewItem(Narrative n, OffsetDateTime now) {
        int childCount = childCountOf(n);
        Integer daysUntilDeadline = n.getReviewDeadline() != null
                ? (int) Duration.between(now, n.getReviewDeadline()).toDays()
                : null;
        return new PendingReviewItem(
                n.getId(),
                n.getNarrativeId(),
                n.getTitle(),
                n.getCurationStatus(),
                n.getCuratorId(),
                n.getReviewerId(),
                n.getEditorialPriority(),
                n.getReviewDeadline(),
                childCount,
                reviewUrgency(n, childCount, now),
                daysUntilDeadline,
                n.getCreatedAt(),
                n.getUpdatedAt()
        );
    }

    private int childCountOf(Narrative n) {
        if (!n.isRoot()) {
            return 0;
        }
        UUID id = n.getId();
        return hierarchyCache.getEntry(id).map(NarrativeHierarchyCacheEntry::getChildCount).orElse(0);
    }

    private static int priorityOf(Narrative n) {
        return n.getEditorialPriority() != null ? n.getEditorialPriority() : LOWEST_PRIORITY;
    }
}
