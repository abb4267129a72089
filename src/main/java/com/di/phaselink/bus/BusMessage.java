package com.di.phaselink.bus;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** One delivery of a message to a subscription. {@code attempt} starts at 1. */
@Value
@Builder(toBuilder = true)
public class BusMessage {
    String id;
    String topic;
    String subscription;
    byte[] payload;
    @Builder.Default
    Map<String, String> attributes = Map.of();
    @Builder.Default
    int attempt = 1;

    public String attribute(String name) {
        return attributes == null ? null : attributes.get(name);
    }
}
