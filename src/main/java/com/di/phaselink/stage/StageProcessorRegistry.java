package com.di.phaselink.stage;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers all {@link StageProcessor} beans and registers them by stage name.
 * Two processors claiming the same stage fail startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageProcessorRegistry {

    private final List<StageProcessor> processors;

    private Map<String, StageProcessor> processorsByStage;

    @PostConstruct
    void initialize() {
        if (processors == null || processors.isEmpty()) {
            log.warn("[REGISTRY] No StageProcessor beans found. Only the dependency API will be active.");
            processorsByStage = Collections.emptyMap();
            return;
        }
        Map<String, StageProcessor> map = new LinkedHashMap<>();
        for (StageProcessor processor : processors) {
            String stage = processor.stageName();
            if (stage == null || stage.isBlank()) {
                throw new IllegalStateException("StageProcessor " + processor.getClass().getName() + " has no stage name");
            }
            StageProcessor existing = map.putIfAbsent(stage.trim(), processor);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate StageProcessor for stage '%s': %s and %s",
                        stage, existing.getClass().getName(), processor.getClass().getName()));
            }
        }
        processorsByStage = Collections.unmodifiableMap(map);
        log.info("[REGISTRY] Registered processors for {} stage(s): {}", processorsByStage.size(), processorsByStage.keySet());
    }

    public Optional<StageProcessor> find(String stage) {
        return stage == null ? Optional.empty() : Optional.ofNullable(processorsByStage.get(stage.trim()));
    }

    public Set<String> getRegisteredStages() {
        return processorsByStage.keySet();
    }
}
