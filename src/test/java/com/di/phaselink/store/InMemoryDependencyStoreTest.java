package com.di.phaselink.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDependencyStore Tests")
class InMemoryDependencyStoreTest {

    private static final Instant T0 = Instant.parse("2024-11-20T10:00:00Z");

    private InMemoryDependencyStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDependencyStore();
    }

    private static SourceUsageRecord record(Instant lastUpdatedAt, long rows) {
        return SourceUsageRecord.builder()
                .stage("player-game-stats")
                .source("raw.boxscores")
                .scopeKey("2024-11-20")
                .lastUpdatedAt(lastUpdatedAt)
                .rowsFound(rows)
                .completenessPct(SourceUsageRecord.completeness(rows, 450))
                .recordedAt(Instant.now())
                .build();
    }

    @Test
    @DisplayName("Should keep the newer observation when an older one arrives late")
    void testUpsert_LastWriterWins() {
        assertTrue(store.upsert(record(T0.plusSeconds(60), 450)));
        assertFalse(store.upsert(record(T0, 300)));

        SourceUsageRecord latest = store.find("player-game-stats", "raw.boxscores", "2024-11-20").orElseThrow();
        assertEquals(450, latest.getRowsFound());
        assertEquals(T0.plusSeconds(60), latest.getLastUpdatedAt());
    }

    @Test
    @DisplayName("Should treat an equal timestamp as a no-op")
    void testUpsert_EqualTimestampNoOp() {
        assertTrue(store.upsert(record(T0, 450)));
        assertFalse(store.upsert(record(T0, 10)));
        assertEquals(450, store.find("player-game-stats", "raw.boxscores", "2024-11-20").orElseThrow().getRowsFound());
    }

    @Test
    @DisplayName("Should keep every observation in history, newest first")
    void testHistory() {
        store.upsert(record(T0, 100));
        store.upsert(record(T0.plusSeconds(1), 200));
        store.upsert(record(T0.minusSeconds(1), 50));

        List<SourceUsageRecord> history = store.history("player-game-stats", "raw.boxscores", 10);
        assertEquals(3, history.size());
        assertEquals(50, history.get(0).getRowsFound());
        assertEquals(2, store.history("player-game-stats", "raw.boxscores", 2).size());
    }

    @Test
    @DisplayName("Should reject records without a key")
    void testUpsert_MissingKey() {
        assertThrows(IllegalArgumentException.class, () -> store.upsert(null));
        assertThrows(IllegalArgumentException.class,
                () -> store.upsert(record(T0, 1).toBuilder().scopeKey(null).build()));
    }

    @Test
    @DisplayName("Should settle on the newest timestamp under concurrent writers")
    void testUpsert_Concurrent() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            int offset = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    store.upsert(record(T0.plusSeconds(i * writers + offset), i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Instant newest = T0.plusSeconds(199L * writers + (writers - 1));
        assertEquals(newest, store.find("player-game-stats", "raw.boxscores", "2024-11-20").orElseThrow().getLastUpdatedAt());
    }

    @ParameterizedTest
    @CsvSource({
            "450, 450, 100.0",
            "360, 450, 80.0",
            "900, 450, 100.0",
            "0, 450, 0.0",
            "5, 0, 100.0"
    })
    @DisplayName("Should compute completeness capped at 100")
    void testCompleteness(long rows, long expected, double pct) {
        assertEquals(pct, SourceUsageRecord.completeness(rows, expected), 0.0001);
    }

    @Test
    @DisplayName("Should keep only the most recent observations in the usage history")
    void testHistory_Capped() {
        InMemoryDependencyStore small = new InMemoryDependencyStore(3);
        for (int i = 0; i < 5; i++) {
            small.upsert(record(T0.plusSeconds(i), 100 + i));
        }

        List<SourceUsageRecord> history = small.history("player-game-stats", "raw.boxscores", 10);
        assertEquals(3, history.size());
        assertEquals(104, history.get(0).getRowsFound());
        assertEquals(102, history.get(2).getRowsFound());
        assertEquals(104, small.find("player-game-stats", "raw.boxscores", "2024-11-20").orElseThrow().getRowsFound());
    }
}
