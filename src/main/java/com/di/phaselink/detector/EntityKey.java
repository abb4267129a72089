package com.di.phaselink.detector;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Typed entity reference. Ids are only unique within a type (player 42 is not team 42). */
public record EntityKey(@JsonProperty("type") String type, @JsonProperty("id") String id) {

    public EntityKey {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static EntityKey of(String type, String id) {
        return new EntityKey(type, id);
    }

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
