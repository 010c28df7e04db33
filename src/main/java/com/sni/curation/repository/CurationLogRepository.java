package com.sni.curation.repository;

import com.sni.curation.model.CurationLogEntry;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only access to {@code narrative_curation_log}. Exposes no update or delete operations.
 */
@org.springframework.stereotype.Repository
public interface CurationLogRepository extends Repository<CurationLogEntry, UUID> {

    <S extends CurationLogEntry> S save(S entry);

    Optional<CurationLogEntry> findById(UUID id);

    long count();

    /**
     * Loads all entries for a narrative, newest first.
     */
    List<CurationLogEntry> findAllByNarrativeIdOrderByCreatedAtDesc(UUID narrativeId);

    /**
     * Loads all entries recorded by an actor, newest first.
     */
    List<CurationLogEntry> findAllByActorIdOrderByCreatedAtDesc(String actorId);

    Optional<CurationLogEntry> findFirstByNarrativeIdOrderByCreatedAtDesc(UUID narrativeId);

    long countByNarrativeIdAndActionType(UUID narrativeId, String actionType);
}
