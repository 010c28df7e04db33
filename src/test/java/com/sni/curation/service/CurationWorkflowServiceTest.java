package com.sni.curation.service;

import com.sni.curation.dto.StatusChangeResult;
import com.sni.curation.model.CurationActions;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.exception.ConcurrentNarrativeModificationException;
import com.sni.curation.service.exception.InvalidTransitionException;
import com.sni.curation.service.exception.NarrativeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class CurationWorkflowServiceTest {

    private InMemoryCurationFixture fixture;
    private CurationWorkflowService workflow;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryCurationFixture();
        workflow = fixture.workflowService;
    }

    @Test
    void everyPairEitherSucceedsOrIsRejectedWithoutSideEffects() {
        for (CurationStatus from : CurationStatus.values()) {
            for (CurationStatus to : CurationStatus.values()) {
                Narrative narrative = fixture.manualRoot("Narrative " + from + " to " + to);
                narrative.setCurationStatus(from);
                long entriesBefore = fixture.logEntries.size();

                if (from.canTransitionTo(to)) {
                    StatusChangeResult result = workflow.updateStatus(narrative.getId(), to, "editor", null);
                    assertThat(result.newStatus()).isEqualTo(to);
                    assertThat(narrative.getCurationStatus()).isEqualTo(to);
                    assertThat(fixture.logEntries).hasSize((int) entriesBefore + 1);
                } else {
                    assertThatThrownBy(() -> workflow.updateStatus(narrative.getId(), to, "editor", null))
                            .as("%s -> %s", from, to)
                            .isInstanceOf(InvalidTransitionException.class);
                    assertThat(narrative.getCurationStatus()).isEqualTo(from);
                    assertThat(fixture.logEntries).hasSize((int) entriesBefore);
                }
            }
        }
    }

    @Test
    void rejectedTransitionNamesTheStatePair() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");
        workflow.updateStatus(narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", null);

        assertThatThrownBy(() -> workflow.updateStatus(narrative.getId(), CurationStatus.PUBLISHED, "reviewer1", null))
                .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                    assertThat(e.getFrom()).isEqualTo("pending_review");
                    assertThat(e.getTo()).isEqualTo("published");
                    assertThat(e.getErrorCode()).isEqualTo("INVALID_TRANSITION");
                });
        assertThat(narrative.getPublishedAt()).isNull();
    }

    @Test
    void publishingStampsPublishedAtFromTheClock() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");
        workflow.updateStatus(narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", null);
        workflow.updateStatus(narrative.getId(), CurationStatus.APPROVED, "reviewer1", null);
        fixture.clock.advance(Duration.ofHours(2));
        OffsetDateTime expected = fixture.now();

        StatusChangeResult result = workflow.updateStatus(narrative.getId(), CurationStatus.PUBLISHED, "reviewer1", null);

        assertThat(result.publishedAt()).isEqualTo(expected);
        assertThat(narrative.getPublishedAt()).isEqualTo(expected);
        assertThat(narrative.getPublishedBy()).isEqualTo("reviewer1");
    }

    @Test
    void republishingKeepsOriginalTimestamp() {
        Narrative narrative = publishedNarrative();
        OffsetDateTime firstPublished = narrative.getPublishedAt();
        fixture.clock.advance(Duration.ofDays(1));

        StatusChangeResult result = workflow.updateStatus(narrative.getId(), CurationStatus.PUBLISHED, "reviewer1", "re-check");

        assertThat(result.changed()).isFalse();
        assertThat(narrative.getPublishedAt()).isEqualTo(firstPublished);
    }

    @Test
    void leavingPublishedClearsTimestamp() {
        Narrative narrative = publishedNarrative();

        workflow.updateStatus(narrative.getId(), CurationStatus.REVIEWED, "reviewer1", "Needs corrections");

        assertThat(narrative.getCurationStatus()).isEqualTo(CurationStatus.REVIEWED);
        assertThat(narrative.getPublishedAt()).isNull();
        assertThat(narrative.getPublishedBy()).isNull();

        workflow.updateStatus(narrative.getId(), CurationStatus.MANUAL_DRAFT, "curator1", null);
        assertThat(narrative.getPublishedAt()).isNull();
    }

    @Test
    void archivingPublishedNarrativeClearsTimestamp() {
        Narrative narrative = publishedNarrative();

        workflow.updateStatus(narrative.getId(), CurationStatus.ARCHIVED, "reviewer1", null);

        assertThat(narrative.getPublishedAt()).isNull();
        assertThat(workflow.allowedTransitions(narrative.getId())).isEmpty();
    }

    @Test
    void selfTransitionIsAuditedAsReviewPass() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");

        StatusChangeResult result = workflow.updateStatus(narrative.getId(), CurationStatus.MANUAL_DRAFT, "curator1", null);

        assertThat(result.changed()).isFalse();
        List<CurationLogEntry> entries = fixture.entries(narrative.getId(), CurationActions.STATUS_CHANGED);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getOldValues()).containsEntry("status", "manual_draft");
        assertThat(entries.get(0).getNewValues()).containsEntry("status", "manual_draft");
        assertThat(entries.get(0).getReason()).isEqualTo("Status updated");
    }

    @Test
    void auditEntryRecordsActorNotesAndTime() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");
        OffsetDateTime expected = fixture.now();

        workflow.updateStatus(narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", "Ready for review");

        CurationLogEntry entry = fixture.entries(narrative.getId(), CurationActions.STATUS_CHANGED).get(0);
        assertThat(entry.getActorId()).isEqualTo("curator1");
        assertThat(entry.getReason()).isEqualTo("Ready for review");
        assertThat(entry.getCreatedAt()).isEqualTo(expected);
        assertThat(entry.getOldValues()).containsEntry("status", "manual_draft");
        assertThat(entry.getNewValues()).containsEntry("status", "pending_review");
    }

    @Test
    void staleExpectedVersionIsRejected() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");
        Long readVersion = narrative.getVersion();
        workflow.updateStatus(narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", null, readVersion);

        assertThatThrownBy(() -> workflow.updateStatus(
                narrative.getId(), CurationStatus.REVIEWED, "reviewer1", null, readVersion))
                .isInstanceOf(ConcurrentNarrativeModificationException.class);
        assertThat(narrative.getCurationStatus()).isEqualTo(CurationStatus.PENDING_REVIEW);
    }

    @Test
    void unknownNarrativeIsNotFound() {
        assertThatThrownBy(() -> workflow.updateStatus(UUID.randomUUID(), CurationStatus.APPROVED, "editor", null))
                .isInstanceOf(NarrativeNotFoundException.class);
    }

    private Narrative publishedNarrative() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");
        workflow.updateStatus(narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", null);
        workflow.updateStatus(narrative.getId(), CurationStatus.APPROVED, "reviewer1", null);
        workflow.updateStatus(narrative.getId(), CurationStatus.PUBLISHED, "reviewer1", null);
        assertThat(narrative.getPublishedAt()).isNotNull();
        return narrative;
    }

    @Test
    void returnedVersionIsTheOneTheNextChangeMustSend() {
        Narrative narrative = fixture.manualRoot("Greenland dispute");

        StatusChangeResult submitted = workflow.updateStatus(
                narrative.getId(), CurationStatus.PENDING_REVIEW, "curator1", null, narrative.getVersion());
        StatusChangeResult reviewed = workflow.updateStatus(
                narrative.getId(), CurationStatus.REVIEWED, "reviewer1", null, submitted.version());

        assertThat(submitted.version()).isEqualTo(1L);
        assertThat(reviewed.version()).isEqualTo(2L).isEqualTo(narrative.getVersion());
        verify(fixture.narrativeRepository, times(2)).saveAndFlush(narrative);
    }
}
