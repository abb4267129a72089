package com.di.phaselink.tracker;

import com.di.phaselink.config.SourceGranularity;
import com.di.phaselink.config.SourceRequirement;
import com.di.phaselink.event.EventScope;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Store keys implied by a scope for one source. Date-keyed sources use the ISO date; entity-keyed
 * sources use {@code date/entityId} when the scope names entities, otherwise the date.
 */
public final class ScopeKeys {

    public static final char SEPARATOR = '/';

    private ScopeKeys() {
    }

    /** @return keys to check, empty when the scope carries no date (callers fail closed). */
    public static List<String> keysFor(SourceRequirement source, EventScope scope) {
        if (scope == null || scope.date() == null) {
            return List.of();
        }
        String date = dateKey(scope.date());
        if (source.getGranularity() == SourceGranularity.ENTITY && scope.isEntityScoped()) {
            List<String> keys = new ArrayList<>(scope.entityIds().size());
            for (String id : scope.entityIds()) {
                keys.add(entityKey(scope.date(), id));
            }
            return keys;
        }
        return List.of(date);
    }

    public static String dateKey(LocalDate date) {
        return date.toString();
    }

    public static String entityKey(LocalDate date, String entityId) {
        return date.toString() + SEPARATOR + entityId;
    }
}
