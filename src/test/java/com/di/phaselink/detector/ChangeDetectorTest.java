package com.di.phaselink.detector;

import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.event.EventScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

    private static final LocalDate DATE = LocalDate.of(2024, 11, 20);

    private static final FanOutPolicy DEFAULT_POLICY = FanOutPolicy.builder()
            .maxEntities(500).maxHopPopulationPct(50).maxHops(2).build();

    private static DependencyEdge roster(String team, String player) {
        return new DependencyEdge("team", team, "player", player, "ROSTER");
    }

    private static ChangeEvent entityEvent(String... ids) {
        return new ChangeEvent("player-game-stats", EventScope.ofEntities(DATE, List.of(ids)), Instant.now(), "h");
    }

    private static Set<EntityKey> activePopulation(int players, int teams) {
        Set<EntityKey> active = new LinkedHashSet<>();
        for (int i = 0; i < players; i++) {
            active.add(new EntityKey("player", "p" + i));
        }
        for (int i = 0; i < teams; i++) {
            active.add(new EntityKey("team", "t" + i));
        }
        return active;
    }

    private final DependencyGraph graph = new DependencyGraph(List.of(
            roster("LAL", "2544"), roster("LAL", "203076"),
            roster("GSW", "201939"), roster("GSW", "1628398")));

    @Test
    @DisplayName("Should map changed players to their teams")
    void testPlayerToTeam() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        EntityChangeSet set = detector.detect(entityEvent("2544"), "player", "team", graph, activePopulation(400, 30));

        assertFalse(set.isAll());
        assertEquals(List.of("LAL"), set.entityIds());
        assertEquals(InclusionReason.TRANSITIVE, set.reasonFor(new EntityKey("team", "LAL")));
    }

    @Test
    @DisplayName("Should include an entity reached through several paths once")
    void testMultiPathIncludedOnce() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        EntityChangeSet set = detector.detect(entityEvent("2544", "203076"), "player", "team", graph,
                activePopulation(400, 30));

        assertEquals(List.of("LAL"), set.entityIds());
    }

    @Test
    @DisplayName("Should keep direct entities with their reason when the consumer shares the producer type")
    void testSameTypeConsumer() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        EntityChangeSet set = detector.detect(entityEvent("2544", "201939"), "player", "player", graph,
                activePopulation(400, 30));

        assertEquals(List.of("2544", "201939"), set.entityIds());
        assertEquals(InclusionReason.DIRECT, set.reasonFor(new EntityKey("player", "2544")));
    }

    @Test
    @DisplayName("Should follow edges for the configured number of hops")
    void testTransitiveClosure() {
        DependencyGraph twoLevels = new DependencyGraph(List.of(
                roster("LAL", "2544"),
                new DependencyEdge("conference", "WEST", "team", "LAL", "MEMBER")));
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);
        ChangeDetector oneHop = new ChangeDetector(DEFAULT_POLICY.toBuilder().maxHops(1).build());

        assertEquals(List.of("WEST"),
                detector.detect(entityEvent("2544"), "player", "conference", twoLevels, activePopulation(400, 30)).entityIds());
        assertTrue(oneHop.detect(entityEvent("2544"), "player", "conference", twoLevels, activePopulation(400, 30)).isEmpty());
    }

    @Test
    @DisplayName("Should fall back to all when the closure exceeds max-entities")
    void testCeiling_MaxEntities() {
        List<DependencyEdge> edges = new ArrayList<>();
        List<String> players = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            players.add("p" + i);
            edges.add(roster("t" + i, "p" + i));
        }
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY.toBuilder().maxEntities(30).build());

        EntityChangeSet set = detector.detect(entityEvent(players.toArray(new String[0])), "player", "team",
                new DependencyGraph(edges), activePopulation(1000, 30));

        assertTrue(set.isAll());
        assertNotNull(set.getReasonForAll());
        assertEquals(DATE, set.getDate());
    }

    @Test
    @DisplayName("Should fall back to all when the direct scope alone exceeds max-entities")
    void testCeiling_DirectScope() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY.toBuilder().maxEntities(1).build());

        assertTrue(detector.detect(entityEvent("2544", "201939"), "player", "team", graph, activePopulation(400, 30)).isAll());
    }

    @Test
    @DisplayName("Should fall back to all when one hop reaches too much of the active population")
    void testCeiling_HopPopulationShare() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        // 2 teams added out of 3 active entities
        EntityChangeSet set = detector.detect(entityEvent("2544", "201939"), "player", "team", graph,
                activePopulation(1, 2));

        assertTrue(set.isAll());
    }

    @Test
    @DisplayName("Should apply only the absolute ceiling when the roster is unknown")
    void testUnknownPopulation() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        EntityChangeSet set = detector.detect(entityEvent("2544"), "player", "team", graph, Set.of());

        assertEquals(List.of("LAL"), set.entityIds());
    }

    @Test
    @DisplayName("Should return all for an empty entity list or an all-scoped event")
    void testEmptyAndAllScopes() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        assertTrue(detector.detect(entityEvent(), "player", "team", graph, activePopulation(10, 2)).isAll());
        ChangeEvent all = new ChangeEvent("player-game-stats", EventScope.all(DATE), Instant.now(), "h");
        assertTrue(detector.detect(all, "player", "team", graph, activePopulation(10, 2)).isAll());
    }

    @Test
    @DisplayName("Should return all when the producer declares no entity type")
    void testUntypedProducer() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        assertTrue(detector.detect(entityEvent("2544"), null, "team", graph, activePopulation(10, 2)).isAll());
    }

    @Test
    @DisplayName("Should seed a date-scoped event from the active roster")
    void testDateScopeSeedsFromRoster() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);
        Set<EntityKey> active = new LinkedHashSet<>(List.of(
                new EntityKey("player", "2544"), new EntityKey("player", "201939"),
                new EntityKey("team", "LAL"), new EntityKey("team", "GSW"), new EntityKey("team", "BOS"),
                new EntityKey("team", "NYK")));
        ChangeEvent dateEvent = new ChangeEvent("player-game-stats", EventScope.ofDate(DATE), Instant.now(), "h");

        EntityChangeSet set = detector.detect(dateEvent, "player", "team", graph, active);

        assertEquals(List.of("LAL", "GSW"), set.entityIds());
    }

    @Test
    @DisplayName("Should return an empty set when nothing of the consumer type is reached")
    void testNoDependents() {
        ChangeDetector detector = new ChangeDetector(DEFAULT_POLICY);

        EntityChangeSet set = detector.detect(entityEvent("unknown-player"), "player", "team", graph,
                activePopulation(400, 30));

        assertTrue(set.isEmpty());
        assertFalse(set.isAll());
    }
}
