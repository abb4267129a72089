package com.di.phaselink.detector;

import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.event.ScopeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns a completion event into the set of entities a consuming stage must recompute.
 *
 * <p>Pure: the result depends only on the event, the edge graph, the active roster and the
 * {@link FanOutPolicy}. Traversal goes from dependency to dependent one hop at a time; an entity
 * reached through several paths is included once, with the reason from its first discovery.
 * When the closure cannot be bounded by the policy the "all" sentinel is returned.
 */
@Slf4j
@Component
public class ChangeDetector {

    private final FanOutPolicy policy;

    @Autowired
    public ChangeDetector(PhaseLinkProperties properties) {
        this(FanOutPolicy.from(properties.getFanOut()));
    }

    public ChangeDetector(FanOutPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param event         the triggering completion event
     * @param producerType  entity type of the producing stage (ids in the event are of this type)
     * @param consumerType  entity type of the consuming stage; null keeps every reached entity
     * @param graph         static dependency edges
     * @param active        entities active on the event's date
     */
    public EntityChangeSet detect(ChangeEvent event, String producerType, String consumerType,
                                  DependencyGraph graph, Set<EntityKey> active) {
        EventScope scope = event.scope();
        LocalDate date = scope.date();

        if (scope.isAll()) {
            return EntityChangeSet.all(date, "event scope is all");
        }
        if (producerType == null) {
            return EntityChangeSet.all(date, "producer stage declares no entity type");
        }

        Set<EntityKey> seeds = new LinkedHashSet<>();
        if (scope.kind() == ScopeKind.ENTITIES) {
            if (scope.entityIds() == null || scope.entityIds().isEmpty()) {
                return EntityChangeSet.all(date, "empty entity scope");
            }
            for (String id : scope.entityIds()) {
                seeds.add(new EntityKey(producerType, id));
            }
        } else {
            for (EntityKey key : active) {
                if (producerType.equals(key.type())) {
                    seeds.add(key);
                }
            }
            if (seeds.isEmpty()) {
                return EntityChangeSet.all(date, "no active " + producerType + " entities on " + date);
            }
        }

        if (seeds.size() > policy.getMaxEntities()) {
            return EntityChangeSet.all(date, "direct scope " + seeds.size()
                    + " exceeds max-entities " + policy.getMaxEntities());
        }

        Map<EntityKey, InclusionReason> closure = new LinkedHashMap<>();
        seeds.forEach(k -> closure.put(k, InclusionReason.DIRECT));

        int population = active.size();
        Set<EntityKey> frontier = seeds;
        for (int hop = 1; hop <= policy.getMaxHops() && !frontier.isEmpty(); hop++) {
            Set<EntityKey> next = new LinkedHashSet<>();
            for (EntityKey from : frontier) {
                for (EntityKey dependent : graph.dependentsOf(from)) {
                    if (closure.putIfAbsent(dependent, InclusionReason.TRANSITIVE) == null) {
                        next.add(dependent);
                    }
                }
            }
            // roster unknown: the population share cannot be computed, only the absolute ceiling applies
            if (population > 0) {
                double hopPct = next.size() * 100.0 / population;
                if (hopPct > policy.getMaxHopPopulationPct()) {
                    return EntityChangeSet.all(date, String.format(
                            "hop %d added %.1f%% of active population (limit %.1f%%)",
                            hop, hopPct, policy.getMaxHopPopulationPct()));
                }
            }
            if (closure.size() > policy.getMaxEntities()) {
                return EntityChangeSet.all(date, "closure " + closure.size()
                        + " exceeds max-entities " + policy.getMaxEntities() + " at hop " + hop);
            }
            frontier = next;
        }

        Map<EntityKey, InclusionReason> result = closure;
        if (consumerType != null) {
            result = new LinkedHashMap<>();
            for (Map.Entry<EntityKey, InclusionReason> e : closure.entrySet()) {
                if (consumerType.equals(e.getKey().type())) {
                    result.put(e.getKey(), e.getValue());
                }
            }
        }
        log.debug("[DETECTOR] producer={} consumer={} seeds={} closure={} result={}",
                event.producingStage(), consumerType, seeds.size(), closure.size(), result.size());
        return EntityChangeSet.of(date, result);
    }

    public FanOutPolicy getPolicy() {
        return policy;
    }
}
