package com.sni.curation.service;

import com.sni.curation.dto.CreateClusterGroupRequest;
import com.sni.curation.model.ClusterGroupStatus;
import com.sni.curation.model.CurationActions;
import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.model.CurationNote;
import com.sni.curation.model.ManualClusterGroup;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.exception.CurationValidationException;
import com.sni.curation.service.exception.InvalidParentReferenceException;
import com.sni.curation.service.exception.InvalidTransitionException;
import com.sni.curation.service.exception.NarrativeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterGroupRegistryTest {

    private InMemoryCurationFixture fixture;
    private ClusterGroupRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryCurationFixture();
        registry = fixture.clusterGroupRegistry;
    }

    @Test
    void createGroupStartsInDraftWithDistinctClusterIds() {
        ManualClusterGroup group = registry.createGroup("  Arctic sovereignty ", "Greenland coverage",
                List.of("cl-17", "cl-22", "cl-17", " "), "curator1", "Same geopolitical storyline");

        assertThat(group.getId()).isNotNull();
        assertThat(group.getName()).isEqualTo("Arctic sovereignty");
        assertThat(group.getStatus()).isEqualTo(ClusterGroupStatus.DRAFT);
        assertThat(group.getClusterIds()).containsExactly("cl-17", "cl-22");
        assertThat(group.getParentNarrativeId()).isNull();
        assertThat(group.getCreatedAt()).isEqualTo(fixture.now());
    }

    @Test
    void createGroupFromRequestKeepsMetadata() {
        CreateClusterGroupRequest request = new CreateClusterGroupRequest();
        request.setName("Arctic sovereignty");
        request.setClusterIds(List.of("cl-17"));
        request.setCuratorId("curator1");
        request.setStrategicSignificance("NATO northern flank");
        request.setClusterMetadata(Map.of("cl-17", Map.of("articles", 12)));

        ManualClusterGroup group = registry.createGroup(request);

        assertThat(group.getStrategicSignificance()).isEqualTo("NATO northern flank");
        assertThat(group.getClusterMetadata()).containsKey("cl-17");
    }

    @Test
    void createGroupValidatesInput() {
        List<String> tooMany = new ArrayList<>();
        for (int i = 0; i < 51; i++) {
            tooMany.add("cl-" + i);
        }

        assertThatThrownBy(() -> registry.createGroup(" ", null, List.of("cl-1"), "curator1", null))
                .isInstanceOf(CurationValidationException.class);
        assertThatThrownBy(() -> registry.createGroup("Arctic sovereignty", null, List.of(), "curator1", null))
                .isInstanceOf(CurationValidationException.class);
        assertThatThrownBy(() -> registry.createGroup("Arctic sovereignty", null, List.of("cl-1"), null, null))
                .isInstanceOf(CurationValidationException.class);
        assertThatThrownBy(() -> registry.createGroup("Arctic sovereignty", null, tooMany, "curator1", null))
                .isInstanceOf(CurationValidationException.class);
        assertThat(fixture.groups).isEmpty();
    }

    @Test
    void linkToManualRootIsAuditedOnTheParent() {
        Narrative parent = fixture.manualRoot("Greenland Dispute");
        ManualClusterGroup group = registry.createGroup("Arctic sovereignty", null, List.of("cl-17"), "curator1", null);

        ManualClusterGroup linked = registry.linkToParent(group.getId(), parent.getId(), "curator2");

        assertThat(linked.getParentNarrativeId()).isEqualTo(parent.getId());
        assertThat(registry.findForParent(parent.getId())).containsExactly(group);
        CurationLogEntry entry = fixture.entries(parent.getId(), CurationActions.CLUSTER_GROUP_LINKED).get(0);
        assertThat(entry.getActorId()).isEqualTo("curator2");
        assertThat(entry.getNewValues()).containsEntry("cluster_group_id", group.getId().toString());
    }

    @Test
    void linkRejectsNonManualOrMissingParents() {
        Narrative pipeline = fixture.pipelineRoot("Pipeline story");
        Narrative parent = fixture.manualRoot("Greenland Dispute");
        Narrative child = fixture.manualRoot("Curated child");
        fixture.narrativeStore.setParent(child.getId(), parent.getId());
        ManualClusterGroup group = registry.createGroup("Arctic sovereignty", null, List.of("cl-17"), "curator1", null);

        assertThatThrownBy(() -> registry.linkToParent(group.getId(), pipeline.getId(), "curator1"))
                .isInstanceOf(InvalidParentReferenceException.class);
        assertThatThrownBy(() -> registry.linkToParent(group.getId(), child.getId(), "curator1"))
                .isInstanceOf(InvalidParentReferenceException.class);
        assertThatThrownBy(() -> registry.linkToParent(group.getId(), UUID.randomUUID(), "curator1"))
                .isInstanceOf(InvalidParentReferenceException.class);
        assertThatThrownBy(() -> registry.linkToParent(UUID.randomUUID(), parent.getId(), "curator1"))
                .isInstanceOf(NarrativeNotFoundException.class);
        assertThat(group.getParentNarrativeId()).isNull();
    }

    @Test
    void approvalAdvancesOneStepAtATime() {
        ManualClusterGroup group = registry.createGroup("Arctic sovereignty", null, List.of("cl-17"), "curator1", null);

        registry.approve(group.getId(), "reviewer1", "Looks coherent");
        assertThat(group.getStatus()).isEqualTo(ClusterGroupStatus.PENDING_REVIEW);
        assertThat(group.getApprovedAt()).isNull();

        fixture.clock.tick();
        registry.approve(group.getId(), "reviewer2", null);
        assertThat(group.getStatus()).isEqualTo(ClusterGroupStatus.APPROVED);
        assertThat(group.getApprovedAt()).isEqualTo(fixture.now());
        assertThat(group.getReviewerId()).isEqualTo("reviewer2");
        assertThat(group.getReviewNotes()).extracting(CurationNote::getAction)
                .containsExactly(CurationActions.GROUP_SUBMITTED, CurationActions.GROUP_APPROVED);

        assertThatThrownBy(() -> registry.approve(group.getId(), "reviewer1", null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void listFiltersByStatusAndCurator() {
        ManualClusterGroup first = registry.createGroup("Arctic sovereignty", null, List.of("cl-1"), "curator1", null);
        fixture.clock.tick();
        ManualClusterGroup second = registry.createGroup("Baltic shipping", null, List.of("cl-2"), "curator2", null);
        fixture.clock.tick();
        ManualClusterGroup third = registry.createGroup("Suez transit", null, List.of("cl-3"), "curator1", null);
        registry.approve(third.getId(), "reviewer1", null);

        assertThat(registry.list(null, null)).containsExactly(third, second, first);
        assertThat(registry.list(null, "curator1")).containsExactly(third, first);
        assertThat(registry.list(ClusterGroupStatus.DRAFT, null)).containsExactly(second, first);
        assertThat(registry.list(ClusterGroupStatus.DRAFT, "curator1")).containsExactly(first);
    }

    @Test
    void orphanedGroupsAreReportedButKept() {
        Narrative parent = fixture.manualRoot("Greenland Dispute");
        ManualClusterGroup unlinked = registry.createGroup("Arctic sovereignty", null, List.of("cl-1"), "curator1", null);
        ManualClusterGroup linked = registry.createGroup("Baltic shipping", null, List.of("cl-2"), "curator1", null);
        registry.linkToParent(linked.getId(), parent.getId(), "curator1");

        assertThat(registry.findOrphaned()).containsExactly(unlinked);
        assertThat(fixture.groups).hasSize(2);
    }

    @Test
    void deleteGroupsLinkedToRemovesOnlyThatParentsGroups() {
        Narrative parent = fixture.manualRoot("Greenland Dispute");
        Narrative other = fixture.manualRoot("Baltic Sea Tensions");
        ManualClusterGroup mine = registry.createGroup("Arctic sovereignty", null, List.of("cl-1"), "curator1", null);
        ManualClusterGroup theirs = registry.createGroup("Baltic shipping", null, List.of("cl-2"), "curator1", null);
        registry.linkToParent(mine.getId(), parent.getId(), "curator1");
        registry.linkToParent(theirs.getId(), other.getId(), "curator1");

        assertThat(registry.deleteGroupsLinkedTo(parent.getId())).isEqualTo(1);
        assertThat(registry.deleteGroupsLinkedTo(parent.getId())).isZero();
        assertThat(fixture.groups).containsOnlyKeys(theirs.getId());
    }
}
