package com.sni.curation.service;

import com.sni.curation.model.ActorType;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.repository.CurationLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only audit trail of curation actions. Entries are written in the caller's transaction so that a
 * rolled-back mutation leaves no entry behind.
 */
@Service
public class CurationAuditLog {

    private static final Logger logger = LoggerFactory.getLogger(CurationAuditLog.class);

    private final CurationLogRepository logRepository;
    private final Clock clock;

    public CurationAuditLog(CurationLogRepository logRepository, Clock clock) {
        this.logRepository = logRepository;
        this.clock = clock;
    }

    /**
     * Persists one entry. Stamps {@code createdAt} and defaults the actor type to {@link ActorType#USER}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CurationLogEntry append(CurationLogEntry.CurationLogEntryBuilder builder) {
        CurationLogEntry draft = builder.build();
        if (draft.getNarrativeId() == null) {
            throw new IllegalArgumentException("Audit entries require a narrative id");
        }
        if (draft.getActionType() == null || draft.getActionType().isBlank()) {
            throw new IllegalArgumentException("Audit entries require an action type");
        }
        if (draft.getActorType() == null) {
            builder.actorType(ActorType.USER);
        }
        if (draft.getActorId() == null) {
            builder.actorId("unknown");
        }
        CurationLogEntry saved = logRepository.save(builder.createdAt(OffsetDateTime.now(clock)).build());
        logger.debug("Audit {} on narrative {} by {}", saved.getActionType(), saved.getNarrativeId(), saved.getActorId());
        return saved;
    }

    /**
     * Generates the id shared by all entries written by one logical operation.
     */
    public String newSessionId() {
        return UUID.randomUUID().toString();
    }

    @Transactional(readOnly = true)
    public List<CurationLogEntry> entriesFor(UUID narrativeId) {
        return logRepository.findAllByNarrativeIdOrderByCreatedAtDesc(narrativeId);
    }

    @Transactional(readOnly = true)
    public List<CurationLogEntry> entriesByActor(String actorId) {
        return logRepository.findAllByActorIdOrderByCreatedAtDesc(actorId);
    }

    @Transactional(readOnly = true)
    public Optional<OffsetDateTime> lastActivity(UUID narrativeId) {
        return logRepository.findFirstByNarrativeIdOrderByCreatedAtDesc(narrativeId)
                .map(CurationLogEntry::getCreatedAt);
    }

    @Transactional(readOnly = true)
    public long count() {
        return logRepository.count();
    }
}
