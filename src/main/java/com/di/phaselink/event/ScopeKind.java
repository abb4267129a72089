package com.di.phaselink.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Unit of work a change event covers. Serialized with the lower-case wire names. */
public enum ScopeKind {
    DATE("date"),
    ENTITIES("entities"),
    ALL("all");

    private final String wireName;

    ScopeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static ScopeKind fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (ScopeKind k : values()) {
            if (k.wireName.equalsIgnoreCase(value.trim())) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown scope kind: " + value);
    }
}
