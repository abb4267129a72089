package com.di.phaselink.stage;

import com.di.phaselink.bus.EventBus;
import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.StageDescriptor;
import com.di.phaselink.deadletter.DeadLetterMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the topology to the bus once the context is up.
 * <ul>
 *   <li>Main subscription per stage with a registered processor. Stages without one are logged and skipped.</li>
 *   <li>One fallback subscription per phase; the worker dispatches by the event's target stage.</li>
 *   <li>Dead-letter monitor on every dead-letter topic.</li>
 * </ul>
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class PipelineWorkerStartup implements ApplicationRunner {

    private final PipelineTopology topology;
    private final StageProcessorRegistry registry;
    private final StageWorker worker;
    private final EventBus bus;
    private final DeadLetterMonitor deadLetterMonitor;
    private final PhaseLinkProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        Map<String, String> fallbackSubscriptions = new LinkedHashMap<>();
        int subscribed = 0;
        for (StageDescriptor stage : topology.getStages()) {
            if (stage.isSourceStage()) {
                continue;
            }
            if (registry.find(stage.getName()).isEmpty()) {
                log.warn("[STARTUP] No processor for stage '{}'; its events are left on {}",
                        stage.getName(), topology.mainSubscription(stage));
                continue;
            }
            String topic = topology.inputTopic(stage).orElseThrow();
            String subscription = topology.mainSubscription(stage);
            int parallelism = stage.getParallelism() != null
                    ? stage.getParallelism() : properties.getBus().getDefaultParallelism();
            bus.subscribe(topic, subscription, parallelism, message -> worker.onCompletionEvent(stage, message));
            subscribed++;
            log.info("[STARTUP] {} <- {} via {} (parallelism={})", stage.getName(), topic, subscription, parallelism);
            fallbackSubscriptions.putIfAbsent(topology.fallbackTopic(stage), topology.fallbackSubscription(stage));
        }
        fallbackSubscriptions.forEach((topic, subscription) -> {
            bus.subscribe(topic, subscription, 1, worker::onFallbackEvent);
            log.info("[STARTUP] Fallback events <- {} via {}", topic, subscription);
        });
        deadLetterMonitor.start();
        log.info("[STARTUP] {} stage subscription(s), {} fallback subscription(s), processors={}",
                subscribed, fallbackSubscriptions.size(), registry.getRegisteredStages());
    }
}
