package com.sni.curation.controller;

import com.sni.curation.config.WebConfig;
import com.sni.curation.dto.AssignmentResult;
import com.sni.curation.dto.StatusChangeResult;
import com.sni.curation.model.CurationSource;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.CurationDashboardService;
import com.sni.curation.service.CurationWorkflowService;
import com.sni.curation.service.EditorialCurationService;
import com.sni.curation.service.exception.DepthViolationException;
import com.sni.curation.service.exception.InvalidTransitionException;
import com.sni.curation.service.exception.NarrativeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.format.support.FormattingConversionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CurationControllerTest {

    private static final String SUMMARY = "Competing territorial and resource claims over Greenland and its waters.";

    @Mock
    private EditorialCurationService editorialService;

    @Mock
    private CurationWorkflowService workflowService;

    @Mock
    private CurationDashboardService dashboardService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        FormattingConversionService conversionService = new DefaultFormattingConversionService();
        new WebConfig().addFormatters(conversionService);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new CurationController(editorialService, workflowService, dashboardService))
                .setControllerAdvice(new CurationExceptionHandler())
                .setConversionService(conversionService)
                .build();
    }

    @Test
    void createManualParentReturnsCreatedNarrative() throws Exception {
        Narrative parent = Narrative.builder()
                .id(UUID.randomUUID())
                .narrativeId("EN-20250301-M123456")
                .title("Greenland Dispute")
                .curationSource(CurationSource.MANUAL)
                .curationStatus(CurationStatus.MANUAL_DRAFT)
                .editorialPriority(2)
                .createdAt(OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC))
                .build();
        when(editorialService.createManualParent(eq("Greenland Dispute"), eq(SUMMARY), eq("curator1"),
                anyList(), eq(2))).thenReturn(parent);

        mockMvc.perform(post("/api/curation/manual-parents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Greenland Dispute\",\"summary\":\"" + SUMMARY + "\","
                                + "\"curatorId\":\"curator1\",\"clusterIds\":[\"cl-17\"],\"editorialPriority\":2}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.narrativeId").value("EN-20250301-M123456"))
                .andExpect(jsonPath("$.curationStatus").value("manual_draft"));
    }

    @Test
    void createManualParentRejectsShortSummaryBeforeReachingTheService() throws Exception {
        mockMvc.perform(post("/api/curation/manual-parents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Greenland Dispute\",\"summary\":\"Too short\",\"curatorId\":\"curator1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(editorialService);
    }

    @Test
    void assignChildrenReportsSkippedChildren() throws Exception {
        UUID parentId = UUID.randomUUID();
        UUID assigned = UUID.randomUUID();
        UUID skipped = UUID.randomUUID();
        when(editorialService.assignChildren(eq(parentId), anyList(), eq("curator1"), isNull()))
                .thenReturn(new AssignmentResult(parentId, 1, List.of(assigned), List.of(skipped)));

        mockMvc.perform(post("/api/curation/manual-parents/{parentId}/children", parentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childIds\":[\"" + assigned + "\",\"" + skipped + "\"],\"curatorId\":\"curator1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assignedCount").value(1))
                .andExpect(jsonPath("$.skippedIds[0]").value(skipped.toString()));
    }

    @Test
    void unknownNarrativeMapsToNotFound() throws Exception {
        UUID parentId = UUID.randomUUID();
        when(editorialService.assignChildren(eq(parentId), anyList(), anyString(), any()))
                .thenThrow(new NarrativeNotFoundException("Narrative not found: " + parentId));

        mockMvc.perform(post("/api/curation/manual-parents/{parentId}/children", parentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childIds\":[\"" + UUID.randomUUID() + "\"],\"curatorId\":\"curator1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void depthViolationMapsToConflictWithMaxDepth() throws Exception {
        UUID parentId = UUID.randomUUID();
        when(editorialService.assignChildren(eq(parentId), anyList(), anyString(), any()))
                .thenThrow(new DepthViolationException("Narrative already has children"));

        mockMvc.perform(post("/api/curation/manual-parents/{parentId}/children", parentId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"childIds\":[\"" + UUID.randomUUID() + "\"],\"curatorId\":\"curator1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DEPTH_VIOLATION"))
                .andExpect(jsonPath("$.maxDepth").value(2));
    }

    @Test
    void statusUpdatePassesExpectedVersion() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.updateStatus(id, CurationStatus.PENDING_REVIEW, "curator1", "Ready", 4L))
                .thenReturn(new StatusChangeResult(id, CurationStatus.MANUAL_DRAFT, CurationStatus.PENDING_REVIEW,
                        null, 5L));

        mockMvc.perform(put("/api/curation/narratives/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newStatus\":\"pending_review\",\"actorId\":\"curator1\","
                                + "\"notes\":\"Ready\",\"expectedVersion\":4}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previousStatus").value("manual_draft"))
                .andExpect(jsonPath("$.newStatus").value("pending_review"))
                .andExpect(jsonPath("$.version").value(5));
    }

    @Test
    void invalidTransitionNamesTheStatePair() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.updateStatus(id, CurationStatus.PUBLISHED, "reviewer1", null, null))
                .thenThrow(new InvalidTransitionException("pending_review", "published"));

        mockMvc.perform(put("/api/curation/narratives/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newStatus\":\"published\",\"actorId\":\"reviewer1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.from").value("pending_review"))
                .andExpect(jsonPath("$.to").value("published"));
    }

    @Test
    void unknownStatusValueIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/curation/narratives/{id}/status", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newStatus\":\"shipped\",\"actorId\":\"reviewer1\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(workflowService);
    }

    @Test
    void optimisticLockFailureMapsToConcurrentModification() throws Exception {
        UUID id = UUID.randomUUID();
        when(workflowService.updateStatus(id, CurationStatus.APPROVED, "reviewer1", null, null))
                .thenThrow(new ObjectOptimisticLockingFailureException(Narrative.class, id));

        mockMvc.perform(put("/api/curation/narratives/{id}/status", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newStatus\":\"approved\",\"actorId\":\"reviewer1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    void dashboardAcceptsWireStatusNames() throws Exception {
        mockMvc.perform(get("/api/curation/dashboard")
                        .param("status", "pending_review")
                        .param("status", "reviewed"))
                .andExpect(status().isOk());

        verify(dashboardService).getDashboard(null,
                List.of(CurationStatus.PENDING_REVIEW, CurationStatus.REVIEWED), null);
    }

    @Test
    void malformedPathIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/curation/narratives/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unexpectedFailureIsHiddenBehindGenericMessage() throws Exception {
        when(dashboardService.getPendingReviews(null)).thenThrow(new IllegalStateException("pool exhausted"));

        mockMvc.perform(get("/api/curation/pending-reviews"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("Unexpected server error"));
    }

    @Test
    void errorCodesMapToHttpStatuses() {
        assertThat(CurationExceptionHandler.statusFor("NOT_FOUND")).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(CurationExceptionHandler.statusFor("SELF_REFERENCE")).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(CurationExceptionHandler.statusFor("INVALID_PARENT_REFERENCE")).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(CurationExceptionHandler.statusFor("ALREADY_PARENTED")).isEqualTo(HttpStatus.CONFLICT);
        assertThat(CurationExceptionHandler.statusFor("SOMETHING_ELSE")).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
