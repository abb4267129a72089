package com.di.phaselink.detector;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Static edge: the dependent entity's output is computed from the dependency entity's output
 * (team 1610612747 depends on player 2544 through {@code ROSTER}). Read-only at runtime.
 */
public record DependencyEdge(
        @JsonProperty("dependentType") String dependentType,
        @JsonProperty("dependentId") String dependentId,
        @JsonProperty("dependencyType") String dependencyType,
        @JsonProperty("dependencyId") String dependencyId,
        @JsonProperty("relation") String relation) {

    @JsonIgnore
    public EntityKey dependent() {
        return new EntityKey(dependentType, dependentId);
    }

    @JsonIgnore
    public EntityKey dependency() {
        return new EntityKey(dependencyType, dependencyId);
    }
}
