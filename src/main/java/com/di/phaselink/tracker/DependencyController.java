package com.di.phaselink.tracker;

import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.store.SourceUsageRecord;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API over the dependency tracker: record usage, query readiness and changed sources.
 * e.g. GET /api/dependencies/team_stats/readiness?date=2024-11-20&amp;entityIds=1610612747
 */
@RestController
@RequestMapping("/api/dependencies")
@RequiredArgsConstructor
public class DependencyController {

    private final DependencyTracker tracker;
    private final PipelineTopology topology;

    @PostMapping(value = "/usage", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> recordUsage(@Valid @RequestBody UsageRequest request) {
        topology.requireStage(request.getStage());
        boolean replaced = tracker.recordUsage(request.getStage(), request.getSource(), request.getScopeKey(),
                request.getObservedAt(), request.getRowsFound(), request.getExpectedRows());
        return ResponseEntity.ok(Map.of("replaced", replaced));
    }

    @GetMapping(value = "/{stage}/readiness", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReadinessReport> readiness(
            @PathVariable String stage,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) List<String> entityIds) {
        return ResponseEntity.ok(tracker.checkReadiness(topology.requireStage(stage), scopeOf(date, entityIds)));
    }

    /**
     * Required sources updated after {@code since}; without {@code since} every source with a record.
     */
    @GetMapping(value = "/{stage}/changed", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Set<String>> changed(
            @PathVariable String stage,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) List<String> entityIds,
            @RequestParam(required = false) Instant since) {
        return ResponseEntity.ok(tracker.changedSince(stage, scopeOf(date, entityIds), since));
    }

    @GetMapping(value = "/{stage}/usage", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<SourceUsageRecord>> usage(@PathVariable String stage) {
        topology.requireStage(stage);
        return ResponseEntity.ok(tracker.usageFor(stage));
    }

    private static EventScope scopeOf(LocalDate date, List<String> entityIds) {
        return entityIds != null && !entityIds.isEmpty()
                ? EventScope.ofEntities(date, entityIds)
                : EventScope.ofDate(date);
    }
}
