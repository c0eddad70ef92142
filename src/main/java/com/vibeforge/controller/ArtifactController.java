package com.vibeforge.controller;

import com.vibeforge.core.artifact.Artifact;
import com.vibeforge.core.artifact.InvalidRequestException;
import com.vibeforge.core.audit.AuditLevel;
import com.vibeforge.core.audit.AuditReport;
import com.vibeforge.core.audit.AuditService;
import com.vibeforge.core.generation.GenerationProgress;
import com.vibeforge.core.maintenance.ClearScope;
import com.vibeforge.core.maintenance.StoreMaintenanceService;
import com.vibeforge.orchestrator.ArtifactOrchestrator;
import com.vibeforge.orchestrator.dto.ArtifactRequest;
import com.vibeforge.orchestrator.dto.ArtifactResponse;
import com.vibeforge.orchestrator.dto.RuntimeErrorReport;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/artifacts")
public class ArtifactController {

    private final ArtifactOrchestrator    orchestrator;
    private final AuditService            auditService;
    private final StoreMaintenanceService maintenance;

    public ArtifactController(ArtifactOrchestrator orchestrator,
                              AuditService auditService,
                              StoreMaintenanceService maintenance) {
        this.orchestrator = orchestrator;
        this.auditService = auditService;
        this.maintenance  = maintenance;
    }

    @PostMapping
    public ResponseEntity<ArtifactResponse> create(@RequestBody ArtifactRequest request) {
        return ResponseEntity.ok(orchestrator.request(request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable("id") String id) {
        Artifact artifact = orchestrator.getArtifact(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("artifact", artifact);
        body.put("code", orchestrator.getCode(id));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/fix")
    public ResponseEntity<ArtifactResponse> fix(
            @PathVariable("id") String id,
            @RequestBody RuntimeErrorReport report
    ) {
        return ResponseEntity.ok(orchestrator.fixRuntimeError(id, report.getErrorText()));
    }

    @PostMapping("/{id}/audit")
    public ResponseEntity<AuditReport> audit(
            @PathVariable("id") String id,
            @RequestParam(value = "level", defaultValue = "fast") String level,
            @RequestParam(value = "reuse", defaultValue = "true") boolean reuse
    ) {
        AuditLevel auditLevel;
        try {
            auditLevel = AuditLevel.fromWire(level);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown audit level: " + level);
        }
        return ResponseEntity.ok(auditService.runAudit(id, auditLevel, reuse));
    }

    @PostMapping("/external")
    public ResponseEntity<Artifact> registerExternal(@RequestBody Map<String, String> request) {
        return ResponseEntity.ok(orchestrator.registerExternal(request.get("code"), request.get("label")));
    }

    @GetMapping("/requests")
    public ResponseEntity<List<GenerationProgress>> recentRequests() {
        return ResponseEntity.ok(orchestrator.getRecentProgress());
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<GenerationProgress> progress(@PathVariable("requestId") String requestId) {
        return orchestrator.getProgress(requestId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear(
            @RequestParam(value = "scope", defaultValue = "all") String scope,
            @RequestParam(value = "target", required = false) String target
    ) {
        ClearScope clearScope;
        try {
            clearScope = ClearScope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown clear scope: " + scope);
        }
        int removed = maintenance.clear(clearScope, target);
        return ResponseEntity.ok(Map.of("scope", clearScope, "removed", removed));
    }
}
