package com.sni.curation.service;

import com.sni.curation.dto.StatusChangeResult;
import com.sni.curation.model.CurationActions;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.exception.ConcurrentNarrativeModificationException;
import com.sni.curation.service.exception.CurationValidationException;
import com.sni.curation.service.exception.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Drives the editorial status of narratives through the fixed transition table and records every
 * accepted change in the audit log.
 */
@Service
public class CurationWorkflowService {

    private static final Logger logger = LoggerFactory.getLogger(CurationWorkflowService.class);
    private static final String DEFAULT_REASON = "Status updated";

    private final NarrativeStore narrativeStore;
    private final CurationAuditLog auditLog;
    private final Clock clock;

    public CurationWorkflowService(NarrativeStore narrativeStore, CurationAuditLog auditLog, Clock clock) {
        this.narrativeStore = narrativeStore;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    @Transactional
    public StatusChangeResult updateStatus(UUID narrativeId, CurationStatus newStatus, String actorId, String notes) {
        return updateStatus(narrativeId, newStatus, actorId, notes, null);
    }

    /**
     * Moves a narrative to {@code newStatus}.
     *
     * <p>A transition outside the table raises {@link InvalidTransitionException} before anything is written.
     * Staying in the current state is accepted and still audited. Entering {@code published} stamps
     * {@code published_at}; leaving it clears the stamp.
     *
     * @param expectedVersion version the caller last read, or {@code null} to skip the check
     */
    @Transactional
    public StatusChangeResult updateStatus(UUID narrativeId,
                                           CurationStatus newStatus,
                                           String actorId,
                                           String notes,
                                           Long expectedVersion) {
        if (newStatus == null) {
            throw new CurationValidationException("New status is required");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new CurationValidationException("Actor id is required");
        }
        Narrative narrative = narrativeStore.lockNarrative(narrativeId);
        if (expectedVersion != null && !expectedVersion.equals(narrative.getVersion())) {
            throw new ConcurrentNarrativeModificationException("Narrative " + narrativeId + " is at version "
                    + narrative.getVersion() + ", expected " + expectedVersion);
        }

        CurationStatus current = narrative.getCurationStatus();
        if (!current.canTransitionTo(newStatus)) {
            logger.warn("Rejected status change of narrative {} from {} to {} by {}",
                    narrativeId, current, newStatus, actorId);
            throw new InvalidTransitionException(current.getValue(), newStatus.getValue());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        narrative.setCurationStatus(newStatus);
        if (newStatus == CurationStatus.PUBLISHED && current != CurationStatus.PUBLISHED) {
            narrative.setPublishedAt(now);
            narrative.setPublishedBy(actorId);
        } else if (current == CurationStatus.PUBLISHED && newStatus != CurationStatus.PUBLISHED) {
            narrative.setPublishedAt(null);
            narrative.setPublishedBy(null);
        }
        String reason = notes != null && !notes.isBlank() ? notes : DEFAULT_REASON;
        Narrative saved = narrativeStore.saveUpdated(narrative);

        Map<String, Object> oldValues = new HashMap<>();
        oldValues.put("status", current.getValue());
        Map<String, Object> newValues = new HashMap<>();
        newValues.put("status", newStatus.getValue());
        auditLog.append(CurationLogEntry.builder()
                .narrativeId(narrativeId)
                .actionType(CurationActions.STATUS_CHANGED)
                .oldValues(oldValues)
                .newValues(newValues)
                .reason(reason)
                .actorId(actorId));

        if (current == newStatus) {
            logger.info("Narrative {} kept status {} ({})", narrativeId, current, actorId);
        } else {
            logger.info("Narrative {} moved from {} to {} by {}", narrativeId, current, newStatus, actorId);
        }
        return new StatusChangeResult(narrativeId, current, newStatus, saved.getPublishedAt(), saved.getVersion());
    }

    /**
     * Statuses the narrative can move to in one step from where it is now.
     */
    @Transactional(readOnly = true)
    public Set<CurationStatus> allowedTransitions(UUID narrativeId) {
        return narrativeStore.get(narrativeId).getCurationStatus().allowedTargets();
    }
}
