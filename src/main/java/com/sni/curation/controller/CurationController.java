package com.sni.curation.controller;

import com.sni.curation.dto.AddNoteRequest;
import com.sni.curation.dto.AssignChildrenRequest;
import com.sni.curation.dto.AssignmentResult;
import com.sni.curation.dto.CreateManualParentRequest;
import com.sni.curation.dto.DashboardItem;
import com.sni.curation.dto.IntegrityReport;
import com.sni.curation.dto.NarrativeDetailsResponse;
import com.sni.curation.dto.PendingReviewItem;
import com.sni.curation.dto.ReviewAssignmentRequest;
import com.sni.curation.dto.StatusChangeResult;
import com.sni.curation.dto.UpdatePriorityRequest;
import com.sni.curation.dto.UpdateStatusRequest;
import com.sni.curation.model.CurationStatus;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.CurationDashboardService;
import com.sni.curation.service.CurationWorkflowService;
import com.sni.curation.service.EditorialCurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Editorial curation API used by the curator UI.
 */
@RestController
@RequestMapping("/api/curation")
public class CurationController {

    private static final Logger logger = LoggerFactory.getLogger(CurationController.class);

    private final EditorialCurationService editorialService;
    private final CurationWorkflowService workflowService;
    private final CurationDashboardService dashboardService;

    public CurationController(EditorialCurationService editorialService,
                              CurationWorkflowService workflowService,
                              CurationDashboardService dashboardService) {
        this.editorialService = editorialService;
        this.workflowService = workflowService;
        this.dashboardService = dashboardService;
    }

    /**
     * Creates a manual parent narrative in {@code manual_draft}.
     */
    @Operation(
            summary = "Create a manual parent narrative",
            description = "Creates a curator-owned root narrative that can receive assigned children."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Manual parent created"),
            @ApiResponse(responseCode = "400", description = "Invalid title, summary, priority or cluster ids")
    })
    @PostMapping("/manual-parents")
    public ResponseEntity<Narrative> createManualParent(@Valid @RequestBody CreateManualParentRequest request) {
        Narrative parent = editorialService.createManualParent(
                request.getTitle(),
                request.getSummary(),
                request.getCuratorId(),
                request.getClusterIds(),
                request.getEditorialPriority());
        return ResponseEntity.status(HttpStatus.CREATED).body(parent);
    }

    /**
     * Assigns orphaned narratives to a manual parent. Already-parented children are reported as skipped.
     */
    @Operation(
            summary = "Assign child narratives to a manual parent",
            description = "Links each orphaned narrative under the parent; children that already have a parent are skipped."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Assignment finished"),
            @ApiResponse(responseCode = "400", description = "Parent is not a manual root, or invalid child list"),
            @ApiResponse(responseCode = "404", description = "Parent or child not found"),
            @ApiResponse(responseCode = "409", description = "A child has children of its own")
    })
    @PostMapping("/manual-parents/{parentId}/children")
    public ResponseEntity<AssignmentResult> assignChildren(
            @Parameter(description = "Manual parent narrative UUID", required = true)
            @PathVariable UUID parentId,
            @Valid @RequestBody AssignChildrenRequest request) {
        AssignmentResult result = editorialService.assignChildren(
                parentId, request.getChildIds(), request.getCuratorId(), request.getRationale());
        if (!result.skippedIds().isEmpty()) {
            logger.info("Skipped {} already-parented children for parent {}", result.skippedIds().size(), parentId);
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Remove a child narrative from its parent")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Child detached"),
            @ApiResponse(responseCode = "400", description = "Narrative has no parent"),
            @ApiResponse(responseCode = "404", description = "Narrative not found")
    })
    @DeleteMapping("/narratives/{childId}/parent")
    public ResponseEntity<Narrative> detachChild(
            @PathVariable UUID childId,
            @RequestParam String curatorId,
            @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(editorialService.detachChild(childId, curatorId, reason));
    }

    /**
     * Moves a narrative through the editorial workflow.
     */
    @Operation(
            summary = "Update the curation status of a narrative",
            description = "Applies a workflow transition. Disallowed transitions return 409 naming the state pair."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status updated"),
            @ApiResponse(responseCode = "404", description = "Narrative not found"),
            @ApiResponse(responseCode = "409", description = "Invalid transition or stale version")
    })
    @PutMapping("/narratives/{id}/status")
    public ResponseEntity<StatusChangeResult> updateStatus(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateStatusRequest request) {
        StatusChangeResult result = workflowService.updateStatus(id, request.getNewStatus(), request.getActorId(),
                request.getNotes(), request.getExpectedVersion());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List the statuses a narrative can move to next")
    @GetMapping("/narratives/{id}/allowed-transitions")
    public ResponseEntity<Set<CurationStatus>> allowedTransitions(@PathVariable UUID id) {
        return ResponseEntity.ok(workflowService.allowedTransitions(id));
    }

    @Operation(summary = "Change the editorial priority of a narrative")
    @PutMapping("/narratives/{id}/priority")
    public ResponseEntity<Narrative> updatePriority(
            @PathVariable UUID id,
            @Valid @RequestBody UpdatePriorityRequest request) {
        return ResponseEntity.ok(editorialService.updatePriority(
                id, request.getEditorialPriority(), request.getActorId(), request.getReason()));
    }

    @Operation(summary = "Assign a reviewer and review deadline")
    @PutMapping("/narratives/{id}/review-assignment")
    public ResponseEntity<Narrative> assignReview(
            @PathVariable UUID id,
            @Valid @RequestBody ReviewAssignmentRequest request) {
        return ResponseEntity.ok(editorialService.assignReview(
                id, request.getReviewerId(), request.getReviewDeadline(), request.getActorId()));
    }

    @PostMapping("/narratives/{id}/notes")
    public ResponseEntity<Narrative> addNote(@PathVariable UUID id, @Valid @RequestBody AddNoteRequest request) {
        return ResponseEntity.ok(editorialService.addNote(id, request.getDetail(), request.getActorId()));
    }

    @Operation(
            summary = "Get a narrative with its hierarchy and recent activity",
            description = "Returns the narrative, its parent, its children, the cache entry of its root and recent audit entries."
    )
    @GetMapping("/narratives/{id}")
    public ResponseEntity<NarrativeDetailsResponse> getNarrativeDetails(@PathVariable UUID id) {
        return ResponseEntity.ok(editorialService.getNarrativeDetails(id));
    }

    @Operation(
            summary = "Curation dashboard",
            description = "Curated narratives and narratives past auto generation, by priority then most recent update."
    )
    @GetMapping("/dashboard")
    public ResponseEntity<List<DashboardItem>> getDashboard(
            @RequestParam(required = false) String curatorId,
            @RequestParam(required = false) List<CurationStatus> status,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(dashboardService.getDashboard(curatorId, status, limit));
    }

    @Operation(
            summary = "Pending review queue",
            description = "Narratives in pending_review or reviewed, ordered by review urgency then deadline."
    )
    @GetMapping("/pending-reviews")
    public ResponseEntity<List<PendingReviewItem>> getPendingReviews(
            @RequestParam(required = false) String reviewerId) {
        return ResponseEntity.ok(dashboardService.getPendingReviews(reviewerId));
    }

    @Operation(summary = "Validate curation workflow health")
    @GetMapping("/validate")
    public ResponseEntity<IntegrityReport> validateWorkflow() {
        return ResponseEntity.ok(dashboardService.validateWorkflow());
    }
}
