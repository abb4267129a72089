package com.di.phaselink.deadletter;

import com.di.phaselink.bus.BusAttributes;
import com.di.phaselink.bus.BusMessage;
import com.di.phaselink.bus.EventBus;
import com.di.phaselink.bus.TopicNames;
import com.di.phaselink.config.PipelineTopology;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Subscribes to every dead-letter subscription and records what arrives. Exposes the pending count
 * and the age of the oldest pending record (also as gauges {@code phaselink.dlq.pending} and
 * {@code phaselink.dlq.oldest.age.seconds}). Takes no corrective action on its own: replay and
 * discard are operator calls.
 */
@Slf4j
@Component
public class DeadLetterMonitor {

    private final DeadLetterStore store;
    private final EventBus bus;
    private final PipelineTopology topology;
    private final Clock clock;

    public DeadLetterMonitor(DeadLetterStore store, EventBus bus, PipelineTopology topology,
                             Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.bus = bus;
        this.topology = topology;
        this.clock = clock;
        Gauge.builder("phaselink.dlq.pending", this, m -> m.pendingCount())
                .description("Dead-lettered messages awaiting an operator decision")
                .register(meterRegistry);
        Gauge.builder("phaselink.dlq.oldest.age.seconds", this, m -> m.oldestPendingAge().map(Duration::getSeconds).orElse(0L))
                .description("Age of the oldest pending dead-lettered message")
                .register(meterRegistry);
    }

    /** Subscribes to {@code {dlq-topic}-sub} for every dead-letter topic of the topology. */
    public void start() {
        for (String dlqTopic : topology.deadLetterTopics()) {
            bus.subscribe(dlqTopic, TopicNames.subscriptionFor(dlqTopic), 1, this::onDeadLetter);
        }
        log.info("[DLQ] Monitoring {} dead-letter topic(s)", topology.deadLetterTopics().size());
    }

    void onDeadLetter(BusMessage message) {
        Map<String, String> attrs = message.getAttributes();
        String sourceTopic = attrs.getOrDefault(BusAttributes.DLQ_SOURCE_TOPIC,
                message.getTopic().substring(0, message.getTopic().length() - TopicNames.DLQ_SUFFIX.length()));
        DeadLetterRecord record = DeadLetterRecord.builder()
                .id(UUID.randomUUID().toString())
                .sourceTopic(sourceTopic)
                .subscription(attrs.get(BusAttributes.DLQ_SUBSCRIPTION))
                .messageId(attrs.getOrDefault(BusAttributes.DLQ_ORIGINAL_MESSAGE_ID, message.getId()))
                .payload(message.getPayload())
                .attributes(originalAttributes(attrs))
                .lastError(attrs.get(BusAttributes.DLQ_LAST_ERROR))
                .errorKind(attrs.get(BusAttributes.DLQ_ERROR_KIND))
                .attempts(parseAttempts(attrs.get(BusAttributes.DLQ_ATTEMPTS)))
                .deadLetteredAt(clock.instant())
                .status(DeadLetterStatus.PENDING)
                .build();
        store.save(record);
        log.warn("[DLQ] Recorded {} from {} (subscription={}, kind={}, attempts={}): {}",
                record.getId(), sourceTopic, record.getSubscription(), record.getErrorKind(),
                record.getAttempts(), record.getLastError());
    }

    private static Map<String, String> originalAttributes(Map<String, String> attrs) {
        Map<String, String> original = new HashMap<>(attrs);
        original.keySet().removeIf(k -> k.startsWith("dlq."));
        return original;
    }

    private static int parseAttempts(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("[DLQ] Non-numeric attempts attribute '{}'", value);
            return 0;
        }
    }

    public long pendingCount() {
        return store.countByStatus(DeadLetterStatus.PENDING);
    }

    public Optional<Duration> oldestPendingAge() {
        return store.findOldestPending()
                .map(r -> Duration.between(r.getDeadLetteredAt(), clock.instant()));
    }

    public List<DeadLetterRecord> list(DeadLetterStatus status, int limit) {
        return store.findByStatus(status, limit);
    }

    public Optional<DeadLetterRecord> get(String id) {
        return store.findById(id);
    }

    /**
     * Re-publishes the original payload on its source topic and marks the record REPLAYED.
 * A failed publish leaves the record PENDING.
     *
     * @return the new message id
     * @throws IllegalArgumentException when the record does not exist
     * @throws IllegalStateException when the record is not pending
     */
    public String replay(String id) {
        DeadLetterRecord record = store.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown dead-letter record: " + id));
        if (record.getStatus() != DeadLetterStatus.PENDING) {
            throw new IllegalStateException("Dead-letter record " + id + " is " + record.getStatus());
        }
        if (!store.updateStatus(id, DeadLetterStatus.PENDING, DeadLetterStatus.REPLAYED)) {
            throw new IllegalStateException("Dead-letter record " + id + " was resolved concurrently");
        }
        String messageId;
        try {
            messageId = bus.publishRaw(record.getSourceTopic(), record.getPayload(), record.getAttributes());
        } catch (RuntimeException e) {
            store.updateStatus(id, DeadLetterStatus.REPLAYED, DeadLetterStatus.PENDING);
            log.warn("[DLQ] Replay of {} to {} failed; record is pending again: {}", id, record.getSourceTopic(), e.getMessage());
            throw e;
        }
        log.info("[DLQ] Replayed {} to {} as {}", id, record.getSourceTopic(), messageId);
        return messageId;
    }

    /**
     * Marks a pending record DISCARDED.
     *
     * @throws IllegalArgumentException when the record does not exist
     * @throws IllegalStateException when the record is not pending
     */
    public void discard(String id) {
        DeadLetterRecord record = store.findById(id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown dead-letter record: " + id));
        if (!store.updateStatus(id, DeadLetterStatus.PENDING, DeadLetterStatus.DISCARDED)) {
            throw new IllegalStateException("Dead-letter record " + id + " is " + record.getStatus());
        }
        log.info("[DLQ] Discarded {}", id);
    }
}
