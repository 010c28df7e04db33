package com.sni.curation.repository;

import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NarrativeRepository extends JpaRepository<Narrative, UUID> {

    /**
     * Loads a narrative holding a row lock ({@code SELECT ... FOR UPDATE}) until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select n from Narrative n where n.id = :id")
    Optional<Narrative> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Loads the children of a root, oldest first.
     */
    List<Narrative> findAllByParentIdOrderByCreatedAtAsc(UUID parentId);

    /**
     * Same as {@link #findAllByParentIdOrderByCreatedAtAsc(UUID)} but locks every child row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select n from Narrative n where n.parentId = :parentId order by n.createdAt asc")
    List<Narrative> findChildrenForUpdate(@Param("parentId") UUID parentId);

    boolean existsByParentId(UUID parentId);

    boolean existsByNarrativeId(String narrativeId);

    List<Narrative> findAllByParentIdIsNull();

    List<Narrative> findAllByParentIdIsNotNull();

    List<Narrative> findAllByCurationStatusIn(Collection<CurationStatus> statuses);

    List<Narrative> findAllByCurationStatusInAndReviewDeadlineBefore(Collection<CurationStatus> statuses,
                                                                      OffsetDateTime deadline);

    /**
     * Narratives shown on the curation dashboard: curated provenance, or anything past auto generation.
     */
    @Query("select n from Narrative n where n.curationSource in :sources or n.curationStatus <> :excluded")
    List<Narrative> findDashboardCandidates(@Param("sources") Collection<CurationSource> sources,
                                            @Param("excluded") CurationStatus excluded);

    // Integrity checks

    @Query("select n.id from Narrative n where n.parentId = n.id")
    List<UUID> findSelfReferencingIds();

    @Query("select c.id from Narrative c where c.parentId is not null "
            + "and not exists (select p.id from Narrative p where p.id = c.parentId)")
    List<UUID> findDanglingParentReferenceIds();

    @Query("select c.id from Narrative c, Narrative p where c.parentId = p.id and p.parentId is not null")
    List<UUID> findDepthViolationIds();

    @Query("select n.id from Narrative n where n.parentId is null "
            + "and n.curationSource = :source and n.curationStatus = :status")
    List<UUID> findRootIdsBySourceAndStatus(@Param("source") CurationSource source,
                                            @Param("status") CurationStatus status);

    @Query("select n.id from Narrative n where n.parentId is null and n.curationSource = :source "
            + "and not exists (select c.id from Narrative c where c.parentId = n.id)")
    List<UUID> findChildlessRootIdsBySource(@Param("source") CurationSource source);

    @Query("select n.id from Narrative n where (n.curationStatus = :published and n.publishedAt is null) "
            + "or (n.curationStatus = :pending and n.curatorId is null)")
    List<UUID> findStatusWorkflowIssueIds(@Param("published") CurationStatus published,
                                          @Param("pending") CurationStatus pending);
}
