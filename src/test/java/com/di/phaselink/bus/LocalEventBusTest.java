package com.di.phaselink.bus;

import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.ChangeEventCodec;
import com.di.phaselink.event.EventScope;
import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.exception.NotReadyException;
import com.di.phaselink.util.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalEventBus Tests")
class LocalEventBusTest {

    private static final String TOPIC = "nba-phase2-player-stats-complete";
    private static final String DLQ = TOPIC + "-dlq";
    private static final String SUB = "nba-phase3-team-stats-sub";

    private ChangeEventCodec codec;
    private LocalEventBus bus;
    private final List<BusMessage> deadLetters = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        codec = new ChangeEventCodec(100_000);
        DeliveryPolicy policy = DeliveryPolicy.builder()
                .maxDeliveryAttempts(3)
                .initialBackoff(Duration.ofMillis(5))
                .maxBackoff(Duration.ofMillis(20))
                .multiplier(2.0)
                .build();
        bus = new LocalEventBus(codec, policy, new PipelineMetrics(new SimpleMeterRegistry()));
        bus.subscribe(DLQ, TopicNames.subscriptionFor(DLQ), 1, deadLetters::add);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private static ChangeEvent event() {
        return new ChangeEvent("player-game-stats", EventScope.ofEntities(LocalDate.of(2024, 11, 20), List.of("2544")),
                Instant.parse("2024-11-21T03:00:00Z"), "hash-1");
    }

    @Test
    @DisplayName("Should deliver the decoded event with producer attributes")
    void testPublishAndDeliver() throws Exception {
        List<ChangeEvent> received = new CopyOnWriteArrayList<>();
        List<BusMessage> messages = new CopyOnWriteArrayList<>();
        bus.subscribe(TOPIC, SUB, 2, m -> {
            messages.add(m);
            received.add(codec.decode(m.getPayload()));
        });

        String id = bus.publish(TOPIC, event());

        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));
        assertEquals(List.of(event()), received);
        assertEquals(id, messages.get(0).getId());
        assertEquals(SUB, messages.get(0).getSubscription());
        assertEquals("player-game-stats", messages.get(0).attribute(BusAttributes.PRODUCING_STAGE));
        assertEquals("hash-1", messages.get(0).attribute(BusAttributes.CONTENT_HASH));
    }

    @Test
    @DisplayName("Should redeliver after a transient failure and then acknowledge")
    void testRetryThenSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        List<Integer> seenAttempts = new CopyOnWriteArrayList<>();
        bus.subscribe(TOPIC, SUB, 1, m -> {
            seenAttempts.add(m.getAttempt());
            if (attempts.incrementAndGet() < 3) {
                throw new NotReadyException("team-game-stats", List.of("derived.player_game_stats"));
            }
        });

        bus.publish(TOPIC, event());

        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));
        assertEquals(List.of(1, 2, 3), seenAttempts);
        assertTrue(deadLetters.isEmpty());
    }

    @Test
    @DisplayName("Should dead-letter a message once the retry ceiling is reached")
    void testExhaustionDeadLetters() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(TOPIC, SUB, 1, m -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("processor down");
        });

        bus.publish(TOPIC, event());

        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));
        assertEquals(3, attempts.get());
        assertEquals(1, deadLetters.size());
        BusMessage dead = deadLetters.get(0);
        assertEquals(TOPIC, dead.attribute(BusAttributes.DLQ_SOURCE_TOPIC));
        assertEquals(SUB, dead.attribute(BusAttributes.DLQ_SUBSCRIPTION));
        assertEquals("3", dead.attribute(BusAttributes.DLQ_ATTEMPTS));
        assertEquals(ErrorKind.DELIVERY_EXHAUSTED.name(), dead.attribute(BusAttributes.DLQ_ERROR_KIND));
        assertEquals("processor down", dead.attribute(BusAttributes.DLQ_LAST_ERROR));
        assertEquals(event(), codec.decode(dead.getPayload()));
    }

    @Test
    @DisplayName("Should dead-letter a malformed message without retrying")
    void testMalformedDeadLettersImmediately() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        bus.subscribe(TOPIC, SUB, 1, m -> {
            attempts.incrementAndGet();
            codec.decode(m.getPayload());
        });

        bus.publishRaw(TOPIC, "{broken".getBytes(StandardCharsets.UTF_8), Map.of());

        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));
        assertEquals(1, attempts.get());
        assertEquals(1, deadLetters.size());
        assertEquals(ErrorKind.MALFORMED_EVENT.name(), deadLetters.get(0).attribute(BusAttributes.DLQ_ERROR_KIND));
    }

    @Test
    @DisplayName("Should fan a message out to every subscription on the topic")
    void testFanOutToSubscriptions() throws Exception {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        bus.subscribe(TOPIC, SUB, 1, m -> first.incrementAndGet());
        bus.subscribe(TOPIC, "audit-sub", 1, m -> second.incrementAndGet());

        bus.publish(TOPIC, event());

        assertTrue(bus.awaitQuiescence(Duration.ofSeconds(5)));
        assertEquals(1, first.get());
        assertEquals(1, second.get());
    }

    @Test
    @DisplayName("Should refuse to publish after close")
    void testClosed() {
        bus.close();
        assertThrows(IllegalStateException.class, () -> bus.publish(TOPIC, event()));
    }
}
