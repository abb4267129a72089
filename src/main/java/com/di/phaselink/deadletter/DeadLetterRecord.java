package com.di.phaselink.deadletter;

import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

/** A message that exhausted its retries (or was malformed), with the last error seen. */
@Value
@Builder(toBuilder = true)
public class DeadLetterRecord {
    String id;
    String sourceTopic;
    String subscription;
    String messageId;
    byte[] payload;
    Map<String, String> attributes;
    String lastError;
    String errorKind;
    int attempts;
    Instant deadLetteredAt;
    DeadLetterStatus status;

    /** Payload as text, for the REST view. */
    public String getPayloadText() {
        return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
    }
}
