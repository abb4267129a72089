package com.di.phaselink.event;

import com.di.phaselink.exception.MalformedEventException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON wire codec for {@link ChangeEvent}.
 *
 * <p>Encoding degrades gracefully: when an entity-scoped event would exceed the per-message size
 * limit it is re-encoded with {@code scope.kind = "all"} for the same date.
 * Decoding validates the schema and raises {@link MalformedEventException} on any violation.
 */
@Slf4j
@Component
public class ChangeEventCodec {

    private final ObjectMapper om;
    private final int maxMessageBytes;

    public ChangeEventCodec(@Value("${phaselink.bus.max-message-bytes:10000000}") int maxMessageBytes) {
        this.maxMessageBytes = maxMessageBytes;
        this.om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public int getMaxMessageBytes() {
        return maxMessageBytes;
    }

    /**
     * Serializes the event, widening an entity scope to "all" when the payload would not fit in a
     * single bus message.
     */
    public byte[] encode(ChangeEvent event) {
        byte[] bytes = write(event);
        if (bytes.length <= maxMessageBytes) {
            return bytes;
        }
        if (event.scope() != null && event.scope().kind() == ScopeKind.ENTITIES) {
            log.info("[CODEC] event from {} is {} bytes (limit {}); publishing with scope=all instead of {} entities",
                    event.producingStage(), bytes.length, maxMessageBytes, event.scope().entityIds().size());
            return write(event.withWidenedScope());
        }
        throw new IllegalStateException("Change event of " + bytes.length
                + " bytes exceeds limit " + maxMessageBytes + " and cannot be narrowed further");
    }

    /** Parses and validates a payload. */
    public ChangeEvent decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedEventException("Empty change event payload");
        }
        ChangeEvent event;
        try {
            event = om.readValue(payload, ChangeEvent.class);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Unparseable change event: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new MalformedEventException("Invalid change event: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<String> violations = validate(event);
        if (!violations.isEmpty()) {
            throw new MalformedEventException("Change event failed validation: " + String.join("; ", violations));
        }
        return event;
    }

    static List<String> validate(ChangeEvent event) {
        List<String> violations = new ArrayList<>();
        if (event == null) {
            violations.add("event is null");
            return violations;
        }
        if (event.producingStage() == null || event.producingStage().isBlank()) {
            violations.add("producing_stage is required");
        }
        if (event.producedAt() == null) {
            violations.add("produced_at is required");
        }
        if (event.contentHash() == null || event.contentHash().isBlank()) {
            violations.add("content_hash is required");
        }
        EventScope scope = event.scope();
        if (scope == null || scope.kind() == null) {
            violations.add("scope.kind is required");
            return violations;
        }
        switch (scope.kind()) {
            case DATE -> {
                if (scope.date() == null) violations.add("scope.date is required for kind=date");
                if (scope.entityIds() != null) violations.add("scope.entity_ids only allowed for kind=entities");
            }
            case ENTITIES -> {
                if (scope.date() == null) violations.add("scope.date is required for kind=entities");
                if (scope.entityIds() == null) violations.add("scope.entity_ids is required for kind=entities");
                else if (scope.entityIds().stream().anyMatch(id -> id == null || id.isBlank())) {
                    violations.add("scope.entity_ids must not contain blank ids");
                }
            }
            case ALL -> {
                if (scope.entityIds() != null) violations.add("scope.entity_ids only allowed for kind=entities");
            }
        }
        return violations;
    }

    private byte[] write(ChangeEvent event) {
        try {
            return om.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize change event from " + event.producingStage(), e);
        }
    }
}
