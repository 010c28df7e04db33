package com.sni.curation.repository;

import com.sni.curation.model.ClusterGroupStatus;
import com.sni.curation.model.ManualClusterGroup;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ManualClusterGroupRepository extends JpaRepository<ManualClusterGroup, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from ManualClusterGroup g where g.id = :id")
    Optional<ManualClusterGroup> findByIdForUpdate(@Param("id") UUID id);

    List<ManualClusterGroup> findAllByParentNarrativeId(UUID parentNarrativeId);

    List<ManualClusterGroup> findAllByStatusOrderByCreatedAtDesc(ClusterGroupStatus status);

    List<ManualClusterGroup> findAllByCuratorIdOrderByCreatedAtDesc(String curatorId);

    List<ManualClusterGroup> findAllByOrderByCreatedAtDesc();

    /**
     * Groups that are not linked to a parent, or whose linked parent no longer exists.
     */
    @Query("select g from ManualClusterGroup g where g.parentNarrativeId is null "
            + "or not exists (select n.id from Narrative n where n.id = g.parentNarrativeId)")
    List<ManualClusterGroup> findOrphaned();
}
