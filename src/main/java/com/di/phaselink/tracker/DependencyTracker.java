package com.di.phaselink.tracker;

import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.config.StageDescriptor;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.exception.NotReadyException;
import com.di.phaselink.exception.StoreUnavailableException;
import com.di.phaselink.store.DependencyStore;
import com.di.phaselink.store.SourceUsageRecord;
import com.di.phaselink.util.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads and writes the dependency store on behalf of stages: records what a stage consumed and
 * answers whether a stage is ready for a scope and which of its sources changed since it last ran.
 *
 * <p>Readiness fails closed: a missing record, a scope without a date, or an unreachable store all
 * mean "not ready".
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DependencyTracker {

    private final DependencyStore store;
    private final PipelineTopology topology;
    private final PipelineMetrics metrics;
    private final Clock clock;

    /**
     * Records one observation. Completeness is derived from rowsFound / expectedRows.
     *
     * @return true when the observation became the latest for its key (false for a replay or an
     *         older, out-of-order write)
     */
    public boolean recordUsage(String stage, String source, String scopeKey, Instant observedAt,
                               long rowsFound, long expectedRows) {
        if (observedAt == null) {
            throw new IllegalArgumentException("observedAt is required");
        }
        SourceUsageRecord record = SourceUsageRecord.builder()
                .stage(stage)
                .source(source)
                .scopeKey(scopeKey)
                .lastUpdatedAt(observedAt)
                .rowsFound(rowsFound)
                .completenessPct(SourceUsageRecord.completeness(rowsFound, expectedRows))
                .recordedAt(clock.instant())
                .build();
        boolean replaced = store.upsert(record);
        log.debug("[TRACKER] recordUsage stage={} source={} key={} rows={}/{} completeness={}% replaced={}",
                stage, source, scopeKey, rowsFound, expectedRows, record.getCompletenessPct(), replaced);
        return replaced;
    }

    /**
     * Evaluates every required source for every key implied by the scope.
     *
     * @throws StoreUnavailableException when the store cannot be read
     */
    public ReadinessReport checkReadiness(StageDescriptor stage, EventScope scope) {
        String scopeLabel = describe(scope);
        if (scope == null || scope.date() == null) {
            return ReadinessReport.notReady(stage.getName(), scopeLabel, "scope has no date");
        }
        List<String> missing = new ArrayList<>();
        List<String> below = new ArrayList<>();
        List<String> staleFail = new ArrayList<>();
        List<String> staleWarn = new ArrayList<>();
        List<String> optionalMissing = new ArrayList<>();
        Instant now = clock.instant();

        for (SourceRequirement source : stage.getRequiredSources()) {
            for (String key : ScopeKeys.keysFor(source, scope)) {
                String entry = source.getName() + "@" + key;
                Optional<SourceUsageRecord> found = store.find(stage.getName(), source.getName(), key);
                if (!source.isCritical()) {
                    if (found.isEmpty() || found.get().getCompletenessPct() < source.getMinCompletenessPct()) {
                        optionalMissing.add(entry);
                    }
                    continue;
                }
                if (found.isEmpty()) {
                    missing.add(entry);
                    continue;
                }
                SourceUsageRecord record = found.get();
                if (record.getCompletenessPct() < source.getMinCompletenessPct()) {
                    below.add(entry + "=" + record.getCompletenessPct() + "%<" + source.getMinCompletenessPct() + "%");
                }
                Duration age = record.getLastUpdatedAt() != null ? Duration.between(record.getLastUpdatedAt(), now) : null;
                if (age != null && source.getMaxAgeFail() != null && age.compareTo(source.getMaxAgeFail()) > 0) {
                    staleFail.add(entry);
                } else if (age != null && source.getMaxAgeWarn() != null && age.compareTo(source.getMaxAgeWarn()) > 0) {
                    staleWarn.add(entry);
                }
            }
        }

        ReadinessReport report = ReadinessReport.builder()
                .stage(stage.getName())
                .scope(scopeLabel)
                .missing(missing)
                .belowThreshold(below)
                .staleFail(staleFail)
                .staleWarn(staleWarn)
                .optionalMissing(optionalMissing)
                .build();
        if (!staleWarn.isEmpty()) {
            log.warn("[TRACKER] Stale sources for stage={} scope={}: {}", stage.getName(), scopeLabel, staleWarn);
        }
        if (!optionalMissing.isEmpty()) {
            log.info("[TRACKER] Optional sources missing for stage={} scope={}: {}", stage.getName(), scopeLabel, optionalMissing);
        }
        metrics.recordReadiness(stage.getName(), report.isReady());
        return report;
    }

    /** True only when every critical source meets its thresholds. Fails closed on store errors. */
    public boolean isReady(String stageName, EventScope scope) {
        try {
            return checkReadiness(topology.requireStage(stageName), scope).isReady();
        } catch (StoreUnavailableException e) {
            log.warn("[TRACKER] Store unavailable during readiness check for stage={}: {}", stageName, e.getMessage());
            metrics.recordReadiness(stageName, false);
            return false;
        }
    }

    /**
     * @throws NotReadyException listing the blocking sources
     * @throws StoreUnavailableException when the store cannot be read
     */
    public ReadinessReport requireReady(StageDescriptor stage, EventScope scope) {
        ReadinessReport report = checkReadiness(stage, scope);
        if (!report.isReady()) {
            log.info("[TRACKER] Not ready stage={} scope={} missing={} below={} stale={}",
                    stage.getName(), report.getScope(), report.getMissing(), report.getBelowThreshold(), report.getStaleFail());
            throw new NotReadyException(stage.getName(), report.blockingSources());
        }
        return report;
    }

    /**
     * Required sources (critical or not) with a record for the scope updated after the reference.
     * A null reference (stage never ran) returns every source that has a record.
     */
    public Set<String> changedSince(String stageName, EventScope scope, Instant reference) {
        StageDescriptor stage = topology.requireStage(stageName);
        Set<String> changed = new LinkedHashSet<>();
        for (SourceRequirement source : stage.getRequiredSources()) {
            for (String key : ScopeKeys.keysFor(source, scope)) {
                Optional<SourceUsageRecord> found = store.find(stageName, source.getName(), key);
                if (found.isPresent() && found.get().getLastUpdatedAt() != null
                        && (reference == null || found.get().getLastUpdatedAt().isAfter(reference))) {
                    changed.add(source.getName());
                    break;
                }
            }
        }
        log.debug("[TRACKER] changedSince stage={} scope={} ref={} -> {}", stageName, describe(scope), reference, changed);
        return changed;
    }

    public List<SourceUsageRecord> usageFor(String stageName) {
        return store.findByStage(stageName);
    }

    static String describe(EventScope scope) {
        if (scope == null) {
            return "none";
        }
        if (scope.isEntityScoped()) {
            return scope.date() + "[" + scope.entityIds().size() + " entities]";
        }
        return scope.kind().getWireName() + (scope.date() != null ? ":" + scope.date() : "");
    }
}
