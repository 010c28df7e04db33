package com.sni.curation.controller;

import com.sni.curation.dto.ApproveClusterGroupRequest;
import com.sni.curation.dto.CreateClusterGroupRequest;
import com.sni.curation.dto.LinkClusterGroupRequest;
import com.sni.curation.model.ClusterGroupStatus;
import com.sni.curation.model.ManualClusterGroup;
import com.sni.curation.service.ClusterGroupRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/curation/cluster-groups")
public class ClusterGroupController {

    private final ClusterGroupRegistry clusterGroupRegistry;

    public ClusterGroupController(ClusterGroupRegistry clusterGroupRegistry) {
        this.clusterGroupRegistry = clusterGroupRegistry;
    }

    @Operation(
            summary = "Create a manual cluster group",
            description = "Records a curator grouping of external cluster ids in draft status."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Cluster group created"),
            @ApiResponse(responseCode = "400", description = "Missing name or cluster ids, or too many clusters")
    })
    @PostMapping
    public ResponseEntity<ManualClusterGroup> createGroup(@Valid @RequestBody CreateClusterGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(clusterGroupRegistry.createGroup(request));
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<ManualClusterGroup> getGroup(@PathVariable UUID groupId) {
        return ResponseEntity.ok(clusterGroupRegistry.get(groupId));
    }

    @Operation(summary = "List cluster groups, newest first, optionally by status and curator")
    @GetMapping
    public ResponseEntity<List<ManualClusterGroup>> listGroups(
            @RequestParam(required = false) ClusterGroupStatus status,
            @RequestParam(required = false) String curatorId) {
        return ResponseEntity.ok(clusterGroupRegistry.list(status, curatorId));
    }

    @Operation(summary = "List cluster groups not linked to an existing narrative")
    @GetMapping("/orphaned")
    public ResponseEntity<List<ManualClusterGroup>> listOrphaned() {
        return ResponseEntity.ok(clusterGroupRegistry.findOrphaned());
    }

    @Operation(summary = "Link a cluster group to a manual parent narrative")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cluster group linked"),
            @ApiResponse(responseCode = "400", description = "Target is not a manual root narrative"),
            @ApiResponse(responseCode = "404", description = "Cluster group not found")
    })
    @PutMapping("/{groupId}/parent")
    public ResponseEntity<ManualClusterGroup> linkToParent(
            @PathVariable UUID groupId,
            @Valid @RequestBody LinkClusterGroupRequest request) {
        return ResponseEntity.ok(clusterGroupRegistry.linkToParent(
                groupId, request.getParentNarrativeId(), request.getActorId()));
    }

    /**
     * Each call advances the group one review step.
     */
    @Operation(
            summary = "Advance a cluster group's review",
            description = "Moves draft to pending_review, then pending_review to approved."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Review advanced"),
            @ApiResponse(responseCode = "404", description = "Cluster group not found"),
            @ApiResponse(responseCode = "409", description = "Cluster group already approved")
    })
    @PostMapping("/{groupId}/approve")
    public ResponseEntity<ManualClusterGroup> approve(
            @PathVariable UUID groupId,
            @Valid @RequestBody ApproveClusterGroupRequest request) {
        return ResponseEntity.ok(clusterGroupRegistry.approve(groupId, request.getReviewerId(), request.getNotes()));
    }
}
