package com.sni.curation.controller;

import com.sni.curation.model.CurationLogEntry;
import com.sni.curation.service.CurationAuditLog;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/curation/audit")
public class AuditLogController {

    private final CurationAuditLog auditLog;

    public AuditLogController(CurationAuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @Operation(summary = "Audit entries for a narrative, newest first")
    @GetMapping("/narratives/{narrativeId}")
    public ResponseEntity<List<CurationLogEntry>> entriesForNarrative(@PathVariable UUID narrativeId) {
        return ResponseEntity.ok(auditLog.entriesFor(narrativeId));
    }

    @Operation(summary = "Audit entries recorded by an actor, newest first")
    @GetMapping("/actors/{actorId}")
    public ResponseEntity<List<CurationLogEntry>> entriesForActor(@PathVariable String actorId) {
        return ResponseEntity.ok(auditLog.entriesByActor(actorId));
    }
}
