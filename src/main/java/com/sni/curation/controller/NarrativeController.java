package com.sni.curation.controller;

import com.sni.curation.dto.CreateNarrativeRequest;
import com.sni.curation.dto.HierarchyTreeNode;
import com.sni.curation.dto.IntegrityReport;
import com.sni.curation.model.Narrative;
import com.sni.curation.service.EditorialCurationService;
import com.sni.curation.service.NarrativeFields;
import com.sni.curation.service.NarrativeStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/narratives")
public class NarrativeController {

    private final NarrativeStore narrativeStore;
    private final EditorialCurationService editorialService;

    public NarrativeController(NarrativeStore narrativeStore, EditorialCurationService editorialService) {
        this.narrativeStore = narrativeStore;
        this.editorialService = editorialService;
    }

    /**
     * Entry point for the pipeline producer. Creates a root narrative, {@code auto_generated} by default.
     */
    @Operation(
            summary = "Register a root narrative",
            description = "Creates a root narrative. Source defaults to pipeline and status to the source's entry state."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Narrative created"),
            @ApiResponse(responseCode = "400", description = "Status inconsistent with source, or invalid fields")
    })
    @PostMapping
    public ResponseEntity<Narrative> createNarrative(@Valid @RequestBody CreateNarrativeRequest request) {
        NarrativeFields fields = NarrativeFields.builder()
                .narrativeId(request.getNarrativeId())
                .title(request.getTitle())
                .summary(request.getSummary())
                .confidenceRating(request.getConfidenceRating())
                .editorialPriority(request.getEditorialPriority())
                .build();
        Narrative created = editorialService.registerNarrative(request.getCurationSource(),
                request.getCurationStatus(), fields, request.getActorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Get a narrative")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Narrative returned"),
            @ApiResponse(responseCode = "404", description = "Narrative not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Narrative> getNarrative(
            @Parameter(description = "Narrative UUID", required = true) @PathVariable UUID id) {
        return ResponseEntity.ok(narrativeStore.get(id));
    }

    @Operation(summary = "List the children of a narrative, oldest first")
    @GetMapping("/{id}/children")
    public ResponseEntity<List<Narrative>> getChildren(@PathVariable UUID id) {
        return ResponseEntity.ok(narrativeStore.getChildren(id));
    }

    /**
     * Returns 204 for a root narrative.
     */
    @Operation(summary = "Get the parent of a narrative")
    @GetMapping("/{id}/parent")
    public ResponseEntity<Narrative> getParent(@PathVariable UUID id) {
        return narrativeStore.getParent(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(summary = "Get the root of a narrative's hierarchy")
    @GetMapping("/{id}/root")
    public ResponseEntity<Narrative> getRoot(@PathVariable UUID id) {
        return ResponseEntity.ok(narrativeStore.getRoot(id));
    }

    @Operation(
            summary = "Get the hierarchy tree of a root narrative",
            description = "Returns the root at level 0 followed by its children at level 1."
    )
    @GetMapping("/{id}/tree")
    public ResponseEntity<List<HierarchyTreeNode>> getTree(@PathVariable UUID id) {
        return ResponseEntity.ok(narrativeStore.getHierarchyTree(id));
    }

    @Operation(
            summary = "Delete a narrative",
            description = "Deleting a root also deletes its children and its linked cluster groups."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Narrative deleted"),
            @ApiResponse(responseCode = "404", description = "Narrative not found"),
            @ApiResponse(responseCode = "409", description = "Concurrent modification")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> deleteNarrative(
            @PathVariable UUID id,
            @RequestParam String actorId,
            @RequestParam(required = false) String reason) {
        List<UUID> deleted = editorialService.deleteNarrative(id, actorId, reason);
        return ResponseEntity.ok(Map.of("deletedIds", deleted, "deletedCount", deleted.size()));
    }

    @Operation(
            summary = "Scan the hierarchy for integrity violations",
            description = "Checks self references, dangling parent references, depth and manual root provenance."
    )
    @GetMapping("/integrity")
    public ResponseEntity<IntegrityReport> validateIntegrity() {
        return ResponseEntity.ok(narrativeStore.validateIntegrity());
    }
}
