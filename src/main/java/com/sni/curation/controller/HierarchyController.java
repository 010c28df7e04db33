package com.sni.curation.controller;

import com.sni.curation.dto.HierarchyStatistics;
import com.sni.curation.model.NarrativeHierarchyCacheEntry;
import com.sni.curation.service.HierarchyCacheService;
import com.sni.curation.service.NarrativeStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the hierarchy cache, plus the manual rebuild trigger.
 */
@RestController
@RequestMapping("/api/hierarchy")
public class HierarchyController {

    private static final Logger logger = LoggerFactory.getLogger(HierarchyController.class);

    private final HierarchyCacheService hierarchyCache;
    private final NarrativeStore narrativeStore;

    public HierarchyController(HierarchyCacheService hierarchyCache, NarrativeStore narrativeStore) {
        this.hierarchyCache = hierarchyCache;
        this.narrativeStore = narrativeStore;
    }

    @Operation(summary = "List hierarchy cache entries, largest families first")
    @GetMapping("/cache")
    public ResponseEntity<List<NarrativeHierarchyCacheEntry>> listEntries() {
        return ResponseEntity.ok(hierarchyCache.listEntries());
    }

    @Operation(summary = "Get the hierarchy cache entry of a root narrative")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cache entry returned"),
            @ApiResponse(responseCode = "404", description = "No cache entry for this id")
    })
    @GetMapping("/cache/{rootId}")
    public ResponseEntity<NarrativeHierarchyCacheEntry> getEntry(@PathVariable UUID rootId) {
        return hierarchyCache.getEntry(rootId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Rebuild the hierarchy cache",
            description = "Recomputes every entry from the narratives table. Safe to repeat."
    )
    @PostMapping("/cache/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        int changed = hierarchyCache.refreshHierarchyCache();
        logger.info("Manual hierarchy cache refresh changed {} rows", changed);
        return ResponseEntity.ok(Map.of("changedEntries", changed));
    }

    @GetMapping("/statistics")
    public ResponseEntity<HierarchyStatistics> statistics() {
        return ResponseEntity.ok(narrativeStore.getHierarchyStatistics());
    }
}
