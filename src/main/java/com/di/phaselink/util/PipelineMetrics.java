package com.di.phaselink.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for readiness checks, bus deliveries, stage invocations and the fallback trigger.
 * Meters are tagged per stage / subscription; Micrometer caches them by name and tags.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordPublish(String topic) {
        Counter.builder("phaselink.bus.publish.total")
                .description("Messages published")
                .tag("topic", topic)
                .register(meterRegistry)
                .increment();
    }

    /** outcome: ack, retry, dead_letter, duplicate. */
    public void recordDelivery(String subscription, String outcome) {
        Counter.builder("phaselink.bus.delivery.total")
                .description("Message deliveries by outcome")
                .tag("subscription", subscription)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordReadiness(String stage, boolean ready) {
        Counter.builder("phaselink.tracker.readiness.total")
                .description("Readiness checks by result")
                .tag("stage", stage)
                .tag("ready", String.valueOf(ready))
                .register(meterRegistry)
                .increment();
    }

    public void recordInvocation(String stage, String triggerKind, String outcome, long durationMs) {
        Timer.builder("phaselink.stage.invocation.duration")
                .description("Wall-clock duration of stage invocations")
                .tag("stage", stage)
                .tag("trigger", triggerKind)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /** Scope size / active population (1.0 = full run). */
    public void recordScopeRatio(String stage, double ratio) {
        DistributionSummary.builder("phaselink.stage.scope.ratio")
                .description("Fraction of the active population processed per invocation")
                .tag("stage", stage)
                .register(meterRegistry)
                .record(ratio);
    }

    public void recordFanOutCeiling(String stage) {
        Counter.builder("phaselink.detector.ceiling.total")
                .description("Change sets widened to all by the fan-out ceiling")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    public void recordFallbackFired(String stage) {
        Counter.builder("phaselink.fallback.fired.total")
                .description("Fallback timers that expired and published a run-anyway event")
                .tag("stage", stage)
                .register(meterRegistry)
                .increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
