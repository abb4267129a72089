package com.di.phaselink.detector;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable index over the configured {@link DependencyEdge}s, keyed dependency -> dependents.
 * Built once at startup from the topology file.
 */
public final class DependencyGraph {

    private final List<DependencyEdge> edges;
    private final Map<EntityKey, Set<EntityKey>> dependentsByDependency;

    public DependencyGraph(Collection<DependencyEdge> edges) {
        this.edges = List.copyOf(edges);
        Map<EntityKey, Set<EntityKey>> index = new LinkedHashMap<>();
        for (DependencyEdge edge : this.edges) {
            index.computeIfAbsent(edge.dependency(), k -> new LinkedHashSet<>()).add(edge.dependent());
        }
        index.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.dependentsByDependency = Collections.unmodifiableMap(index);
    }

    public static DependencyGraph empty() {
        return new DependencyGraph(List.of());
    }

    public Set<EntityKey> dependentsOf(EntityKey dependency) {
        return dependentsByDependency.getOrDefault(dependency, Set.of());
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public int size() {
        return edges.size();
    }
}
