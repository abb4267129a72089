package com.di.phaselink.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;

/**
 * Immutable description of a pipeline stage, loaded from the topology file at startup.
 *
 * <p>{@code phase} and {@code content} name the stage's completion topic;
 * {@code destinationType} names the subscription through which it receives upstream events.
 */
@Value
@Builder
@Jacksonized
public class StageDescriptor {

    String name;
    int phase;
    String content;
    String destinationType;

    /** Type of entity the stage produces (player, team, ...). Null = untyped. */
    String entityType;

    @Builder.Default
    EntityGranularity granularity = EntityGranularity.DATE_ONLY;

    @Builder.Default
    List<String> upstream = List.of();

    @Builder.Default
    List<SourceRequirement> requiredSources = List.of();

    /** Fallback deadline; null = phaselink.fallback.default-deadline. */
    Duration fallbackDeadline;

    /** Invocation deadline; null = phaselink.execution.default-deadline. */
    Duration deadline;

    /** Concurrent invocations; null = phaselink.bus.default-parallelism. */
    Integer parallelism;

    public boolean acceptsEntityScope() {
        return granularity == EntityGranularity.DATE_AND_ENTITIES;
    }

    public boolean isSourceStage() {
        return upstream == null || upstream.isEmpty();
    }
}
