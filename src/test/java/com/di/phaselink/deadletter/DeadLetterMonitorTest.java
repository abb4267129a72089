package com.di.phaselink.deadletter;

import com.di.phaselink.bus.BusAttributes;
import com.di.phaselink.bus.BusMessage;
import com.di.phaselink.bus.DeliveryPolicy;
import com.di.phaselink.bus.EventBus;
import com.di.phaselink.bus.LocalEventBus;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.TopologyFixtures;
import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.exception.BusPublishException;
import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.util.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("DeadLetterMonitor Tests")
class DeadLetterMonitorTest {

    private static final Instant NOW = Instant.parse("2024-11-21T06:00:00Z");
    private static final String PLAYER_TOPIC = "nba-phase2-player-stats-complete";

    private SimpleMeterRegistry registry;
    private LocalEventBus bus;
    private InMemoryDeadLetterStore store;
    private DeadLetterMonitor monitor;
    private ChangeEventCodec codec;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        codec = new ChangeEventCodec(100_000);
        DeliveryPolicy policy = DeliveryPolicy.builder()
                .maxDeliveryAttempts(2)
                .initialBackoff(Duration.ofMillis(5))
                .maxBackoff(Duration.ofMillis(10))
                .multiplier(2.0)
                .build();
        bus = new LocalEventBus(codec, policy, new PipelineMetrics(registry));
        store = new InMemoryDeadLetterStore();
        PipelineTopology topology = TopologyFixtures.load();
        monitor = new DeadLetterMonitor(store, bus, topology, Clock.fixed(NOW, ZoneOffset.UTC), registry);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static ChangeEvent event() {
        return new ChangeEvent("player-game-stats", EventScope.ofDate(LocalDate.of(2024, 11, 20)),
                Instant.parse("2024-11-21T03:00:00Z"), "hash-1");
    }

    @Test
    @DisplayName("Should record an exhausted message and replay it onto its source topic")
    void testRecordAndReplay() throws Exception {
        AtomicBoolean healthy = new AtomicBoolean(false);
        AtomicInteger processed = new AtomicInteger();
        bus.subscribe(PLAYER_TOPIC, "nba-phase3-team-stats-sub", 1, m -> {
            if (!healthy.get()) {
                throw new IllegalStateException("team processor down");
            }
            codec.decode(m.getPayload());
            processed.incrementAndGet();
        });
        monitor.start();

        bus.publish(PLAYER_TOPIC, event());
        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));

        assertEquals(1, monitor.pendingCount());
        DeadLetterRecord record = monitor.list(DeadLetterStatus.PENDING, 10).get(0);
        assertEquals(PLAYER_TOPIC, record.getSourceTopic());
        assertEquals("nba-phase3-team-stats-sub", record.getSubscription());
        assertEquals(ErrorKind.DELIVERY_EXHAUSTED.name(), record.getErrorKind());
        assertEquals(2, record.getAttempts());
        assertEquals("team processor down", record.getLastError());
        assertEquals("player-game-stats", record.getAttributes().get(BusAttributes.PRODUCING_STAGE));
        assertFalse(record.getAttributes().containsKey(BusAttributes.DLQ_LAST_ERROR));
        assertEquals(1.0, registry.get("phaselink.dlq.pending").gauge().value());

        healthy.set(true);
        assertNotNull(monitor.replay(record.getId()));
        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));

        assertEquals(1, processed.get());
        assertEquals(0, monitor.pendingCount());
        assertEquals(DeadLetterStatus.REPLAYED, monitor.get(record.getId()).orElseThrow().getStatus());
        assertThrows(IllegalStateException.class, () -> monitor.replay(record.getId()));
    }

    @Test
    @DisplayName("Should report the age of the oldest pending record")
    void testOldestPendingAge() {
        store.save(record("a", NOW.minus(Duration.ofMinutes(5))));
        store.save(record("b", NOW.minus(Duration.ofMinutes(1))));

        assertEquals(Duration.ofMinutes(5), monitor.oldestPendingAge().orElseThrow());
        assertEquals(300.0, registry.get("phaselink.dlq.oldest.age.seconds").gauge().value());

        monitor.discard("a");
        assertEquals(Duration.ofMinutes(1), monitor.oldestPendingAge().orElseThrow());
        assertEquals(DeadLetterStatus.DISCARDED, monitor.get("a").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("Should keep the source topic when the dead-letter attributes are missing")
    void testSourceTopicFromDlqName() {
        monitor.onDeadLetter(BusMessage.builder()
                .id("m-1")
                .topic(PLAYER_TOPIC + "-dlq")
                .payload(new byte[]{'{', '}'})
                .attributes(Map.of())
                .build());

        List<DeadLetterRecord> pending = monitor.list(DeadLetterStatus.PENDING, 10);
        assertEquals(1, pending.size());
        assertEquals(PLAYER_TOPIC, pending.get(0).getSourceTopic());
        assertEquals("m-1", pending.get(0).getMessageId());
    }

    @Test
    @DisplayName("Should reject operator actions on unknown or resolved records")
    void testInvalidOperatorActions() {
        assertThrows(IllegalArgumentException.class, () -> monitor.replay("missing"));
        assertThrows(IllegalArgumentException.class, () -> monitor.discard("missing"));

        store.save(record("x", NOW));
        monitor.discard("x");
        assertThrows(IllegalStateException.class, () -> monitor.discard("x"));
        assertThrows(IllegalStateException.class, () -> monitor.replay("x"));
    }

    @Test
    @DisplayName("Should keep the record pending when the replay cannot be published")
    void testFailedReplayStaysPending() {
        EventBus failingBus = mock(EventBus.class);
        when(failingBus.publishRaw(anyString(), any(), anyMap()))
                .thenThrow(new BusPublishException("publish to " + PLAYER_TOPIC + " failed", new IllegalStateException("broker unreachable")));
        DeadLetterMonitor failing = new DeadLetterMonitor(store, failingBus, TopologyFixtures.load(),
                Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry());
        store.save(record("r", NOW.minus(Duration.ofMinutes(3))));

        assertThrows(BusPublishException.class, () -> failing.replay("r"));

        assertEquals(DeadLetterStatus.PENDING, failing.get("r").orElseThrow().getStatus());
        assertEquals(1, failing.pendingCount());
        assertEquals(Duration.ofMinutes(3), failing.oldestPendingAge().orElseThrow());
    }

    private static DeadLetterRecord record(String id, Instant at) {
        return DeadLetterRecord.builder()
                .id(id)
                .sourceTopic(PLAYER_TOPIC)
                .payload(new byte[0])
                .attributes(Map.of())
                .deadLetteredAt(at)
                .status(DeadLetterStatus.PENDING)
                .build();
    }
}
