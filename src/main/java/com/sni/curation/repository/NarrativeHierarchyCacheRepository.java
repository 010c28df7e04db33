package com.sni.curation.repository;

import com.sni.curation.model.NarrativeHierarchyCacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface NarrativeHierarchyCacheRepository extends JpaRepository<NarrativeHierarchyCacheEntry, UUID> {

    List<NarrativeHierarchyCacheEntry> findAllByOrderByChildCountDesc();
}
