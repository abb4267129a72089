package com.di.phaselink.executionlog;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API over the execution log.
 * e.g. GET /api/executions?stage=team_stats&amp;limit=20, GET /api/executions/summary/team_stats
 */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
public class ExecutionLogController {

    private final ExecutionLogService executionLogService;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ExecutionLogEntry>> recent(
            @RequestParam(required = false) String stage,
            @RequestParam(required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(executionLogService.recent(stage != null && !stage.isBlank() ? stage : null, limit));
    }

    @GetMapping(value = "/{invocationId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExecutionLogEntry> byId(@PathVariable String invocationId) {
        return executionLogService.get(invocationId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/summary/{stage}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExecutionLogSummary> summary(
            @PathVariable String stage,
            @RequestParam(required = false, defaultValue = "100") int window) {
        return ResponseEntity.ok(executionLogService.summarize(stage, window));
    }
}
