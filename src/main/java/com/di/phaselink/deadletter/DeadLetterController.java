package com.di.phaselink.deadletter;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator API for dead-lettered messages: list, count, replay, discard.
 * e.g. POST /api/dead-letters/{id}/replay
 */
@RestController
@RequestMapping("/api/dead-letters")
@RequiredArgsConstructor
public class DeadLetterController {

    private final DeadLetterMonitor monitor;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<DeadLetterRecord>> list(
            @RequestParam(required = false, defaultValue = "PENDING") String status,
            @RequestParam(required = false, defaultValue = "50") int limit) {
        DeadLetterStatus filter = "ANY".equalsIgnoreCase(status) ? null : DeadLetterStatus.valueOf(status.trim().toUpperCase());
        return ResponseEntity.ok(monitor.list(filter, limit));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pending", monitor.pendingCount());
        body.put("oldestPendingAgeSeconds", monitor.oldestPendingAge().map(Duration::getSeconds).orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DeadLetterRecord> get(@PathVariable String id) {
        return monitor.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/{id}/replay", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> replay(@PathVariable String id) {
        String messageId = monitor.replay(id);
        return ResponseEntity.ok(Map.of("id", id, "status", DeadLetterStatus.REPLAYED.name(), "messageId", messageId));
    }

    @PostMapping(value = "/{id}/discard", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, String>> discard(@PathVariable String id) {
        monitor.discard(id);
        return ResponseEntity.ok(Map.of("id", id, "status", DeadLetterStatus.DISCARDED.name()));
    }
}
