package com.di.phaselink.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Scope carried by a {@link ChangeEvent}: a date, a date plus an ordered entity list, or the
 * "all" sentinel (optionally still bound to a date).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventScope(
        @JsonProperty("kind") ScopeKind kind,
        @JsonProperty("date") LocalDate date,
        @JsonProperty("entity_ids") List<String> entityIds) {

    public EventScope {
        entityIds = entityIds == null ? null : List.copyOf(entityIds);
    }

    public static EventScope ofDate(LocalDate date) {
        return new EventScope(ScopeKind.DATE, date, null);
    }

    public static EventScope ofEntities(LocalDate date, List<String> entityIds) {
        return new EventScope(ScopeKind.ENTITIES, date, entityIds);
    }

    public static EventScope all(LocalDate date) {
        return new EventScope(ScopeKind.ALL, date, null);
    }

    @JsonIgnore
    public boolean isAll() {
        return kind == ScopeKind.ALL;
    }

    @JsonIgnore
    public boolean isEntityScoped() {
        return kind == ScopeKind.ENTITIES && entityIds != null && !entityIds.isEmpty();
    }

    /** Same date, widened to the "all" sentinel. */
    public EventScope widen() {
        return all(date);
    }
}
