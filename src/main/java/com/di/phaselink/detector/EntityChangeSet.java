package com.di.phaselink.detector;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entities a consuming stage has to recompute for one triggering event, or the "all" sentinel.
 * Never a partial list: when the closure cannot be bounded the set is {@link #isAll()}.
 */
@Value
public class EntityChangeSet {

    boolean all;
    /** Why the sentinel was chosen; null for a narrowed set. */
    String reasonForAll;
    LocalDate date;
    Map<EntityKey, InclusionReason> entities;

    private EntityChangeSet(boolean all, String reasonForAll, LocalDate date,
                            Map<EntityKey, InclusionReason> entities) {
        this.all = all;
        this.reasonForAll = reasonForAll;
        this.date = date;
        this.entities = entities;
    }

    public static EntityChangeSet all(LocalDate date, String reason) {
        return new EntityChangeSet(true, reason, date, Map.of());
    }

    public static EntityChangeSet of(LocalDate date, Map<EntityKey, InclusionReason> entities) {
        return new EntityChangeSet(false, null, date,
                Collections.unmodifiableMap(new LinkedHashMap<>(entities)));
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return !all && entities.isEmpty();
    }

    /** Entity ids in discovery order, for an {@code entities} scope. */
    public List<String> entityIds() {
        return entities.keySet().stream().map(EntityKey::id).collect(Collectors.toList());
    }

    public InclusionReason reasonFor(EntityKey key) {
        return entities.get(key);
    }

    @Override
    public String toString() {
        return all
                ? "EntityChangeSet{ALL, date=" + date + ", reason=" + reasonForAll + "}"
                : "EntityChangeSet{date=" + date + ", entities=" + entities.size() + "}";
    }
}
