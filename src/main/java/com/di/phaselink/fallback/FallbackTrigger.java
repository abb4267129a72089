package com.di.phaselink.fallback;

import com.di.phaselink.bus.EventBus;
import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.StageDescriptor;
import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ContentHash;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Per-(stage, date) timers that publish one synthetic ALL-scope event on the stage's fallback
 * topic when no qualifying completion event was processed before the deadline.
 *
 * <p>Arming an armed key is a no-op (the original deadline stands). A timer fires at most once:
 * expiry and disarm race on {@link ConcurrentHashMap#remove(Object, Object)}, and only the winner
 * acts.
 */
@Slf4j
@Component
public class FallbackTrigger implements DisposableBean {

    private final EventBus bus;
    private final PipelineTopology topology;
    private final PhaseLinkProperties.Fallback settings;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final Map<PendingKey, ArmedTimer> timers = new ConcurrentHashMap<>();

    record PendingKey(String stage, LocalDate date) {
    }

    private static final class ArmedTimer {
        final Instant armedAt;
        final Instant expiresAt;
        volatile ScheduledFuture<?> future;

        ArmedTimer(Instant armedAt, Duration deadline) {
            this.armedAt = armedAt;
            this.expiresAt = armedAt.plus(deadline);
        }
    }

    /** Snapshot of one armed timer, for the REST view. */
    public record ArmedFallback(String stage, LocalDate date, Instant armedAt, Instant expiresAt) {
    }

    public FallbackTrigger(EventBus bus, PipelineTopology topology, PhaseLinkProperties properties,
                           PipelineMetrics metrics, Clock clock) {
        this.bus = bus;
        this.topology = topology;
        this.settings = properties.getFallback();
        this.metrics = metrics;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "fallback-timer");
            t.setDaemon(true);
            return t;
        });
    }

    /** Arms the stage's timer for the date with the stage's fallback deadline. */
    public boolean arm(String stage, LocalDate date) {
        StageDescriptor descriptor = topology.requireStage(stage);
        Duration deadline = descriptor.getFallbackDeadline() != null
                ? descriptor.getFallbackDeadline() : settings.getDefaultDeadline();
        return arm(stage, date, deadline);
    }

    /** @return true when a new timer was armed, false when one was already armed (or fallback is disabled) */
    public boolean arm(String stage, LocalDate date, Duration deadline) {
        if (!settings.isEnabled() || date == null) {
            return false;
        }
        PendingKey key = new PendingKey(stage, date);
        boolean[] created = {false};
        ArmedTimer timer = timers.computeIfAbsent(key, k -> {
            created[0] = true;
            return new ArmedTimer(clock.instant(), deadline);
        });
        if (!created[0]) {
            return false;
        }
        timer.future = scheduler.schedule(() -> fire(key, timer), Math.max(0, deadline.toMillis()), TimeUnit.MILLISECONDS);
        log.info("[FALLBACK] Armed stage={} date={} deadline={}", stage, date, deadline);
        return true;
    }

    /** @return true when an armed timer was cancelled */
    public boolean disarm(String stage, LocalDate date) {
        if (date == null) {
            return false;
        }
        ArmedTimer timer = timers.remove(new PendingKey(stage, date));
        if (timer == null) {
            return false;
        }
        ScheduledFuture<?> future = timer.future;
        if (future != null) {
            future.cancel(false);
        }
        log.info("[FALLBACK] Disarmed stage={} date={}", stage, date);
        return true;
    }

    public boolean isArmed(String stage, LocalDate date) {
        return timers.containsKey(new PendingKey(stage, date));
    }

    public List<ArmedFallback> armed() {
        List<ArmedFallback> out = new ArrayList<>();
        timers.forEach((k, t) -> out.add(new ArmedFallback(k.stage(), k.date(), t.armedAt, t.expiresAt)));
        return out;
    }

    void fire(PendingKey key, ArmedTimer timer) {
        if (!timers.remove(key, timer)) {
            return;
        }
        StageDescriptor stage = topology.requireStage(key.stage());
        ChangeEvent event = new ChangeEvent(
                PipelineTopology.FALLBACK_PRODUCER_PREFIX + key.stage(),
                EventScope.all(key.date()),
                clock.instant(),
                ContentHash.of("fallback", key.stage(), key.date().toString(), timer.armedAt.toString()));
        String topic = topology.fallbackTopic(stage);
        try {
            String messageId = bus.publish(topic, event);
            metrics.recordFallbackFired(key.stage());
            log.warn("[FALLBACK] No qualifying event for stage={} date={} since {}; published {} on {}",
                    key.stage(), key.date(), timer.armedAt, messageId, topic);
        } catch (RuntimeException e) {
            log.error("[FALLBACK] Publish failed for stage={} date={}; re-arming", key.stage(), key.date(), e);
            arm(key.stage(), key.date());
        }
    }

    @Override
    public void destroy() {
        scheduler.shutdownNow();
    }
}
