package com.skillgraph.audit.api;

import com.skillgraph.audit.registry.RegistryLoadException;
import com.skillgraph.audit.report.ReportFormat;
import com.skillgraph.audit.service.AuditService;
import com.skillgraph.audit.service.AuditService.AuditOptions;
import com.skillgraph.audit.service.AuditService.AuditOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/audit")
public class AuditController {
    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @PostMapping(consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> audit(@RequestBody String export,
                                        @RequestParam(defaultValue = "structured") String format,
                                        @RequestParam(required = false) Integer minClusterSize) {
        ReportFormat reportFormat = ReportFormat.parse(format);
        int clusterSize = minClusterSize == null ? auditService.defaultOptions().minClusterSize() : minClusterSize;
        AuditOutcome outcome = auditService.run(auditService.parse(export), new AuditOptions(reportFormat, clusterSize, false));

        MediaType type = reportFormat == ReportFormat.STRUCTURED ? MediaType.APPLICATION_JSON : MediaType.TEXT_PLAIN;
        return ResponseEntity.ok().contentType(type).body(auditService.render(outcome.report(), reportFormat));
    }

    @ExceptionHandler(RegistryLoadException.class)
    public ResponseEntity<Map<String, Object>> rejected(RegistryLoadException e) {
        List<String> issues = e.getIssues().stream().map(RegistryLoadException.LoadIssue::describe).toList();
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", e.getKind().name(), "issues", issues));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "BAD_REQUEST", "message", e.getMessage()));
    }
}
