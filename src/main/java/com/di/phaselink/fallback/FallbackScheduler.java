package com.di.phaselink.fallback;

import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.StageDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Arms today's fallback timer for every downstream stage on a cron, so a date whose upstream
 * completion message was lost entirely still gets processed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "phaselink.fallback.enabled", havingValue = "true", matchIfMissing = true)
public class FallbackScheduler {

    private final FallbackTrigger fallbackTrigger;
    private final PipelineTopology topology;
    private final PhaseLinkProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${phaselink.fallback.arm-cron:0 0 6 * * *}", zone = "${phaselink.fallback.zone:America/New_York}")
    public void armToday() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneId.of(properties.getFallback().getZone())));
        int armed = 0;
        for (StageDescriptor stage : topology.getStages()) {
            if (!stage.isSourceStage() && fallbackTrigger.arm(stage.getName(), today)) {
                armed++;
            }
        }
        log.info("[FALLBACK] Daily arming for {}: {} new timer(s)", today, armed);
    }
}
