package com.di.phaselink.stage;

import com.di.phaselink.bus.BusMessage;
import com.di.phaselink.bus.DeliveryDeduplicator;
import com.di.phaselink.bus.EventBus;
import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.config.StageDescriptor;
import com.di.phaselink.detector.ActiveRoster;
import com.di.phaselink.detector.ChangeDetector;
import com.di.phaselink.detector.EntityChangeSet;
import com.di.phaselink.detector.EntityKey;
import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.event.ContentHash;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.exception.DeadlineExceededException;
import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.exception.NotReadyException;
import com.di.phaselink.exception.StageProcessingException;
import com.di.phaselink.executionlog.ExecutionLogEntry;
import com.di.phaselink.executionlog.ExecutionLogService;
import com.di.phaselink.executionlog.ExecutionOutcome;
import com.di.phaselink.executionlog.TriggerKind;
import com.di.phaselink.fallback.FallbackTrigger;
import com.di.phaselink.tracker.DependencyTracker;
import com.di.phaselink.tracker.SourceObservation;
import com.di.phaselink.tracker.SourceProbe;
import com.di.phaselink.util.MdcPropagation;
import com.di.phaselink.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Receiver side of a stage: turns a delivered event into (at most) one processor invocation.
 *
 * <ol>
 *   <li>decode (malformed events are dead-lettered by the bus) and drop content-hash duplicates</li>
 *   <li>narrow the scope with the {@link ChangeDetector} when the stage accepts entity lists</li>
 *   <li>probe and record source usage, then check readiness; not ready fails the delivery so the
 *       bus retries it, and arms the stage's fallback timer</li>
 *   <li>verify a narrowed scope against the store; if no required source changed since the last
 *       successful run the hint is not trusted and the run widens to the full date, which is
 *       gated again on the date-level keys</li>
 *   <li>run the processor under the stage deadline, log the invocation, publish the completion
 *       event and disarm the fallback timer</li>
 * </ol>
 *
 * Fallback-timer events skip readiness gating and always run the full date.
 */
@Slf4j
@Service
public class StageWorker implements DisposableBean {

    public static final String MANUAL_PRODUCER = "manual";

    private final PipelineTopology topology;
    private final StageProcessorRegistry registry;
    private final ChangeEventCodec codec;
    private final ChangeDetector detector;
    private final ActiveRoster roster;
    private final DependencyTracker tracker;
    private final SourceProbe probe;
    private final ExecutionLogService executionLog;
    private final FallbackTrigger fallback;
    private final DeliveryDeduplicator deduplicator;
    private final EventBus bus;
    private final PipelineMetrics metrics;
    private final PhaseLinkProperties properties;
    private final Clock clock;

    private final ExecutorService invocationExecutor;

    public StageWorker(PipelineTopology topology, StageProcessorRegistry registry, ChangeEventCodec codec,
                       ChangeDetector detector, ActiveRoster roster, DependencyTracker tracker, SourceProbe probe,
                       ExecutionLogService executionLog, FallbackTrigger fallback, DeliveryDeduplicator deduplicator,
                       EventBus bus, PipelineMetrics metrics, PhaseLinkProperties properties, Clock clock) {
        this.topology = topology;
        this.registry = registry;
        this.codec = codec;
        this.detector = detector;
        this.roster = roster;
        this.tracker = tracker;
        this.probe = probe;
        this.executionLog = executionLog;
        this.fallback = fallback;
        this.deduplicator = deduplicator;
        this.bus = bus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.invocationExecutor = MdcPropagation.wrapExecutor(Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "stage-invocation-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    // ------------------------------------------------------------------------------------------
    // Bus entry points
    // ------------------------------------------------------------------------------------------

    /** Handler for a stage's main subscription (upstream completion events). */
    public void onCompletionEvent(StageDescriptor stage, BusMessage message) {
        ChangeEvent event = codec.decode(message.getPayload());
        if (!stage.getUpstream().contains(event.producingStage())) {
            log.debug("[WORKER] {} ignores event from {} (not an upstream stage)", stage.getName(), event.producingStage());
            return;
        }
        handle(stage, event, TriggerKind.COMPLETION_EVENT, message);
    }

    /**
     * Handler for a phase's fallback subscription. The event names its target stage; events for
     * stages without a local processor are acknowledged and ignored.
     */
    public void onFallbackEvent(BusMessage message) {
        ChangeEvent event = codec.decode(message.getPayload());
        String target = PipelineTopology.fallbackTarget(event.producingStage());
        Optional<StageDescriptor> stage = target == null ? Optional.empty() : topology.stage(target);
        if (stage.isEmpty() || registry.find(target).isEmpty()) {
            log.warn("[WORKER] Fallback event for unknown or unhandled stage '{}' ignored", event.producingStage());
            return;
        }
        handle(stage.get(), event, TriggerKind.FALLBACK_TIMER, message);
    }

    /**
     * Operator-triggered run. Readiness is enforced unless {@code force} is set.
     *
     * @throws NotReadyException when not forced and a critical source blocks the run
     */
    public ExecutionLogEntry runManual(String stageName, LocalDate date, List<String> entityIds, boolean force) {
        StageDescriptor stage = topology.requireStage(stageName);
        if (registry.find(stageName).isEmpty()) {
            throw new IllegalArgumentException("No processor registered for stage " + stageName);
        }
        EventScope scope = entityIds != null && !entityIds.isEmpty() && stage.acceptsEntityScope()
                ? EventScope.ofEntities(date, entityIds)
                : EventScope.ofDate(date);
        ChangeEvent event = new ChangeEvent(MANUAL_PRODUCER, scope, clock.instant(),
                ContentHash.of(MANUAL_PRODUCER, stageName, UUID.randomUUID().toString()));
        return execute(stage, event, force ? TriggerKind.FALLBACK_TIMER : TriggerKind.MANUAL, TriggerKind.MANUAL, null, null);
    }

    private void handle(StageDescriptor stage, ChangeEvent event, TriggerKind trigger, BusMessage message) {
        String subscription = message.getSubscription();
        if (deduplicator.isDuplicate(subscription, event.producingStage(), event.contentHash())) {
            log.info("[WORKER] Duplicate event {} from {} on {}; acknowledged without running",
                    shortHash(event.contentHash()), event.producingStage(), subscription);
            metrics.recordDelivery(subscription, "duplicate");
            return;
        }
        execute(stage, event, trigger, trigger, message.getId(), subscription);
        deduplicator.markProcessed(subscription, event.producingStage(), event.contentHash());
    }

    // ------------------------------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------------------------------

    /**
     * @param gating   FALLBACK_TIMER skips readiness gating
     * @param recorded trigger kind written to the execution log
     */
    ExecutionLogEntry execute(StageDescriptor stage, ChangeEvent event, TriggerKind gating, TriggerKind recorded,
                              String messageId, String subscription) {
        String invocationId = UUID.randomUUID().toString();
        MDC.put(MdcPropagation.STAGE, stage.getName());
        MDC.put(MdcPropagation.INVOCATION_ID, invocationId);
        try {
            return doExecute(stage, event, gating, recorded, invocationId, messageId);
        } finally {
            MDC.remove(MdcPropagation.STAGE);
            MDC.remove(MdcPropagation.INVOCATION_ID);
        }
    }

    private ExecutionLogEntry doExecute(StageDescriptor stage, ChangeEvent event, TriggerKind gating,
                                        TriggerKind recorded, String invocationId, String messageId) {
        StageProcessor processor = registry.find(stage.getName())
                .orElseThrow(() -> new IllegalStateException("No processor registered for stage " + stage.getName()));
        LocalDate date = event.scope().date();
        Instant startedAt = clock.instant();
        long population = populationOf(stage, date);
        Attempt attempt = new Attempt(invocationId, stage, recorded, date, startedAt, population, messageId,
                event.contentHash());

        EventScope scope = resolveScope(stage, event, recorded);
        if (scope == null) {
            ExecutionLogEntry skipped = entry(attempt, "entities", 0, 1.0, ExecutionOutcome.SKIPPED, null, null,
                    event.contentHash());
            executionLog.record(skipped);
            fallback.disarm(stage.getName(), date);
            return skipped;
        }

        gate(attempt, scope, gating);

        Set<String> changedSources = Set.of();
        // operator-supplied entity lists are taken as given; only detector output is verified
        if (scope.isEntityScoped() && recorded == TriggerKind.COMPLETION_EVENT) {
            Optional<Instant> lastSuccess;
            try {
                lastSuccess = executionLog.lastSuccessfulStart(stage.getName());
                changedSources = tracker.changedSince(stage.getName(), scope, lastSuccess.orElse(null));
            } catch (RuntimeException e) {
                recordFailure(attempt, scope, e);
                throw e;
            }
            if (changedSources.isEmpty() && !stage.getRequiredSources().isEmpty()) {
                log.info("[WORKER] {}: no required source changed since {} for {} entities; running full date {}",
                        stage.getName(), lastSuccess.orElse(null), scope.entityIds().size(), date);
                scope = EventScope.ofDate(date);
                // the entity keys were checked above; the date keys gate the wider run
                gate(attempt, scope, gating);
            }
        }

        StageInvocation invocation = StageInvocation.builder()
                .invocationId(invocationId)
                .stage(stage.getName())
                .triggerKind(recorded)
                .date(date)
                .entityIds(scope.isEntityScoped() ? scope.entityIds() : null)
                .changedSources(changedSources)
                .triggeringEvent(event)
                .build();

        StageResult result;
        ChangeEvent completion;
        String published;
        try {
            result = runWithDeadline(stage, processor, invocation);
            completion = completionEvent(stage, invocation, result);
            published = bus.publish(topology.completionTopic(stage), completion);
        } catch (RuntimeException e) {
            recordFailure(attempt, scope, e);
            throw e;
        }

        long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
        double ratio = ratioOf(scope, population);
        ExecutionLogEntry success = entry(attempt, scope.kind().getWireName(), sizeOf(scope, population), ratio,
                ExecutionOutcome.SUCCESS, null, null, completion.contentHash());
        executionLog.record(success);
        metrics.recordInvocation(stage.getName(), recorded.name(), ExecutionOutcome.SUCCESS.name(), durationMs);
        metrics.recordScopeRatio(stage.getName(), ratio);
        fallback.disarm(stage.getName(), date);
        log.info("[WORKER] {} completed ({} rows, scope={}) and published {}", stage.getName(),
                result != null ? result.getRowsWritten() : 0, completion.scope().kind().getWireName(), published);
        return success;
    }

    /**
     * Probes the sources for the scope and enforces readiness. Not ready writes a DEFERRED entry
     * (arming the fallback timer for completion events); any other failure writes a FAILURE entry.
     */
    private void gate(Attempt attempt, EventScope scope, TriggerKind gating) {
        StageDescriptor stage = attempt.stage();
        try {
            probeSources(stage, scope);
            if (gating != TriggerKind.FALLBACK_TIMER) {
                tracker.requireReady(stage, scope);
            } else if (attempt.date() != null) {
                var report = tracker.checkReadiness(stage, scope);
                if (!report.isReady()) {
                    log.warn("[WORKER] {} running without ready inputs ({}): blocking={}",
                            stage.getName(), attempt.trigger(), report.blockingSources());
                }
            }
        } catch (NotReadyException e) {
            executionLog.record(entry(attempt, scope.kind().getWireName(), sizeOf(scope, attempt.population()),
                    ratioOf(scope, attempt.population()), ExecutionOutcome.DEFERRED, ErrorKind.NOT_READY.name(),
                    e.getMessage(), attempt.eventHash()));
            if (attempt.trigger() == TriggerKind.COMPLETION_EVENT) {
                fallback.arm(stage.getName(), attempt.date());
            }
            throw e;
        } catch (RuntimeException e) {
            recordFailure(attempt, scope, e);
            throw e;
        }
    }

    /**
     * Scope to run with; null when the change set is empty for this stage (nothing to recompute).
     */
    private EventScope resolveScope(StageDescriptor stage, ChangeEvent event, TriggerKind recorded) {
        EventScope scope = event.scope();
        LocalDate date = scope.date();
        if (!stage.acceptsEntityScope()) {
            return date == null ? scope : EventScope.ofDate(date);
        }
        if (recorded != TriggerKind.COMPLETION_EVENT) {
            return scope.isAll() && date != null ? EventScope.ofDate(date) : scope;
        }
        String producerType = topology.stage(event.producingStage()).map(StageDescriptor::getEntityType).orElse(null);
        EntityChangeSet changeSet = detector.detect(event, producerType, stage.getEntityType(),
                topology.getGraph(), roster.activeOn(date));
        if (changeSet.isAll()) {
            if (scope.isEntityScoped()) {
                metrics.recordFanOutCeiling(stage.getName());
            }
            log.info("[DETECTOR] {} runs full date {}: {}", stage.getName(), date, changeSet.getReasonForAll());
            return date == null ? scope : EventScope.ofDate(date);
        }
        if (changeSet.isEmpty()) {
            log.info("[DETECTOR] {}: change from {} reaches no {} entities; nothing to do",
                    stage.getName(), event.producingStage(), stage.getEntityType());
            return null;
        }
        log.info("[DETECTOR] {} narrowed to {} entities for {}", stage.getName(), changeSet.size(), date);
        return EventScope.ofEntities(date, changeSet.entityIds());
    }

    private void probeSources(StageDescriptor stage, EventScope scope) {
        for (SourceRequirement source : stage.getRequiredSources()) {
            for (SourceObservation o : probe.observe(source, scope)) {
                tracker.recordUsage(stage.getName(), o.source(), o.scopeKey(), o.observedAt(), o.rowsFound(),
                        source.getExpectedRows());
            }
        }
    }

    private StageResult runWithDeadline(StageDescriptor stage, StageProcessor processor, StageInvocation invocation) {
        Duration deadline = stage.getDeadline() != null ? stage.getDeadline() : properties.getExecution().getDefaultDeadline();
        Future<StageResult> future = invocationExecutor.submit(() -> processor.process(invocation));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // left running: a half-finished write is completed rather than torn
            log.warn("[WORKER] {} exceeded its deadline of {}; failing the delivery", stage.getName(), deadline);
            throw new DeadlineExceededException(stage.getName(), deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageProcessingException("Interrupted while waiting for " + stage.getName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new StageProcessingException("Stage " + stage.getName() + " failed: " + cause.getMessage(), cause);
        }
    }

    private ChangeEvent completionEvent(StageDescriptor stage, StageInvocation invocation, StageResult result) {
        EventScope scope;
        if (invocation.isFullScope()) {
            scope = EventScope.ofDate(invocation.getDate());
        } else {
            List<String> changed = result != null && result.getChangedEntityIds() != null
                    && !result.getChangedEntityIds().isEmpty()
                    ? result.getChangedEntityIds() : invocation.getEntityIds();
            scope = EventScope.ofEntities(invocation.getDate(), changed);
        }
        String hash = result != null && result.getContentHash() != null
                ? result.getContentHash()
                : derivedHash(stage, invocation, scope, result);
        return new ChangeEvent(stage.getName(), scope, clock.instant(), hash);
    }

    /**
     * Without a processor fingerprint the output cannot be compared between runs, so the hash is
     * unique per invocation: downstream deduplication then only drops redeliveries of this event.
     */
    private static String derivedHash(StageDescriptor stage, StageInvocation invocation, EventScope scope,
                                      StageResult result) {
        List<String> parts = new ArrayList<>();
        parts.add("stage=" + stage.getName());
        parts.add("invocation=" + invocation.getInvocationId());
        parts.add("date=" + scope.date());
        parts.add("rows=" + (result != null ? result.getRowsWritten() : 0));
        if (scope.isEntityScoped()) {
            scope.entityIds().forEach(id -> parts.add("entity=" + id));
        }
        return ContentHash.of(parts);
    }

    private long populationOf(StageDescriptor stage, LocalDate date) {
        if (date == null) {
            return 0;
        }
        Set<EntityKey> active = roster.activeOn(date);
        if (stage.getEntityType() == null) {
            return active.size();
        }
        return active.stream().filter(k -> stage.getEntityType().equals(k.type())).count();
    }

    private static int sizeOf(EventScope scope, long population) {
        return scope.isEntityScoped() ? scope.entityIds().size() : (int) population;
    }

    private static double ratioOf(EventScope scope, long population) {
        return ExecutionLogEntry.ratio(sizeOf(scope, population), population, !scope.isEntityScoped());
    }

    private void recordFailure(Attempt attempt, EventScope scope, RuntimeException e) {
        ExecutionLogEntry failed = entry(attempt, scope.kind().getWireName(), sizeOf(scope, attempt.population()),
                ratioOf(scope, attempt.population()), ExecutionOutcome.FAILURE, ErrorKind.categorize(e).name(),
                e.getMessage(), attempt.eventHash());
        executionLog.record(failed);
        metrics.recordInvocation(attempt.stage().getName(), attempt.trigger().name(), ExecutionOutcome.FAILURE.name(),
                failed.getDurationMs());
    }

    private ExecutionLogEntry entry(Attempt attempt, String scopeKind, int scopeSize, double ratio,
                                    ExecutionOutcome outcome, String errorKind, String errorMessage, String contentHash) {
        return ExecutionLogEntry.builder()
                .invocationId(attempt.invocationId())
                .stage(attempt.stage().getName())
                .triggerKind(attempt.trigger())
                .scopeDate(attempt.date())
                .scopeKind(scopeKind)
                .scopeSize(scopeSize)
                .activePopulation(attempt.population())
                .scopeRatio(ratio)
                .startedAt(attempt.startedAt())
                .durationMs(Duration.between(attempt.startedAt(), clock.instant()).toMillis())
                .outcome(outcome)
                .errorKind(errorKind)
                .errorMessage(errorMessage)
                .messageId(attempt.messageId())
                .contentHash(contentHash)
                .build();
    }

    /** Fixed facts of one invocation, shared by every log entry it writes. */
    private record Attempt(String invocationId, StageDescriptor stage, TriggerKind trigger, LocalDate date,
                           Instant startedAt, long population, String messageId, String eventHash) {
    }

    private static String shortHash(String hash) {
        return hash == null || hash.length() <= 12 ? hash : hash.substring(0, 12);
    }

    @Override
    public void destroy() {
        invocationExecutor.shutdownNow();
    }
}
