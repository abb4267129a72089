package com.di.phaselink.stage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StageProcessorRegistry Tests")
class StageProcessorRegistryTest {

    private static StageProcessor processor(String stage) {
        return new StageProcessor() {
            @Override
            public String stageName() {
                return stage;
            }

            @Override
            public StageResult process(StageInvocation invocation) {
                return StageResult.of(0);
            }
        };
    }

    @Test
    @DisplayName("Should register processors by stage name")
    void testRegister() {
        StageProcessorRegistry registry = new StageProcessorRegistry(
                List.of(processor("team-game-stats"), processor("league-standings")));
        registry.initialize();

        assertTrue(registry.find("team-game-stats").isPresent());
        assertTrue(registry.find("raw-boxscores").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertEquals(Set.of("team-game-stats", "league-standings"), registry.getRegisteredStages());
    }

    @Test
    @DisplayName("Should fail on two processors for one stage")
    void testDuplicate() {
        StageProcessorRegistry registry = new StageProcessorRegistry(
                List.of(processor("team-game-stats"), processor("team-game-stats")));
        assertThrows(IllegalStateException.class, registry::initialize);
    }

    @Test
    @DisplayName("Should fail on a processor without a stage name")
    void testBlankName() {
        StageProcessorRegistry registry = new StageProcessorRegistry(List.of(processor(" ")));
        assertThrows(IllegalStateException.class, registry::initialize);
    }

    @Test
    @DisplayName("Should start empty when no processors are registered")
    void testEmpty() {
        StageProcessorRegistry registry = new StageProcessorRegistry(List.of());
        registry.initialize();
        assertTrue(registry.getRegisteredStages().isEmpty());
    }
}
