package com.di.phaselink.bus;

import com.di.phaselink.config.PhaseLinkProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry ceiling and exponential backoff for redelivery:
 * {@code delay(n) = min(initial * multiplier^(n-1), max)} after the n-th failed attempt.
 */
@Value
@Builder
public class DeliveryPolicy {

    int maxDeliveryAttempts;
    Duration initialBackoff;
    Duration maxBackoff;
    double multiplier;

    public static DeliveryPolicy from(PhaseLinkProperties.Bus bus) {
        return DeliveryPolicy.builder()
                .maxDeliveryAttempts(bus.getMaxDeliveryAttempts())
                .initialBackoff(bus.getInitialBackoff())
                .maxBackoff(bus.getMaxBackoff())
                .multiplier(bus.getBackoffMultiplier())
                .build();
    }

    /** Delay before redelivering a message whose {@code failedAttempt}-th delivery failed. */
    public Duration backoffAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        double millis = initialBackoff.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }

    public boolean isExhausted(int attempt) {
        return attempt >= maxDeliveryAttempts;
    }
}
