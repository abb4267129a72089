package com.di.phaselink.stage;

import com.di.phaselink.executionlog.ExecutionLogEntry;
import com.di.phaselink.fallback.FallbackTrigger;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Operator surface for stages: manual runs and the armed fallback timers.
 * <pre>
 * POST /api/stages/{stage}/trigger?date=2024-03-01&amp;force=false   body (optional): ["player-1", "player-2"]
 * GET  /api/stages/fallbacks
 * </pre>
 */
@RestController
@RequestMapping("/api/stages")
@RequiredArgsConstructor
public class StageTriggerController {

    private final StageWorker worker;
    private final FallbackTrigger fallback;

    @PostMapping("/{stage}/trigger")
    public ResponseEntity<ExecutionLogEntry> trigger(
            @PathVariable String stage,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean force,
            @RequestBody(required = false) List<String> entityIds) {
        return ResponseEntity.ok(worker.runManual(stage, date, entityIds, force));
    }

    @GetMapping("/fallbacks")
    public List<FallbackTrigger.ArmedFallback> armedFallbacks() {
        return fallback.armed();
    }
}
