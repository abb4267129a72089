package com.di.phaselink.fallback;

import com.di.phaselink.bus.EventBus;
import com.di.phaselink.config.PhaseLinkProperties;
import com.di.phaselink.config.PipelineTopology;
import com.di.phaselink.config.TopologyFixtures;
import com.di.phaselink.event.ChangeEvent;
import com.di.phaselink.exception.BusPublishException;
import com.di.phaselink.util.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("FallbackTrigger Tests")
class FallbackTriggerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 11, 20);
    private static final String TEAM_STAGE = "team-game-stats";
    private static final String PLAYER_STAGE = "player-game-stats";

    private EventBus bus;
    private PhaseLinkProperties properties;
    private FallbackTrigger trigger;

    @BeforeEach
    void setUp() {
        bus = mock(EventBus.class);
        when(bus.publish(anyString(), any())).thenReturn("msg-1");
        properties = new PhaseLinkProperties();
        PipelineTopology topology = TopologyFixtures.load();
        trigger = new FallbackTrigger(bus, topology, properties, new PipelineMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        trigger.destroy();
    }

    @Test
    @DisplayName("Should publish exactly one all-scope event on the phase fallback topic at expiry")
    void testFiresOnce() throws Exception {
        assertTrue(trigger.arm(TEAM_STAGE, DATE, Duration.ofMillis(30)));

        ArgumentCaptor<ChangeEvent> captor = ArgumentCaptor.forClass(ChangeEvent.class);
        verify(bus, timeout(2_000)).publish(eq("nba-phase3-fallback-trigger"), captor.capture());
        Thread.sleep(200);
        verify(bus, times(1)).publish(anyString(), any());

        ChangeEvent event = captor.getValue();
        assertEquals("fallback:" + TEAM_STAGE, event.producingStage());
        assertTrue(event.scope().isAll());
        assertEquals(DATE, event.scope().date());
        assertEquals(TEAM_STAGE, PipelineTopology.fallbackTarget(event.producingStage()));
        assertFalse(trigger.isArmed(TEAM_STAGE, DATE));
    }

    @Test
    @DisplayName("Should keep the first deadline when armed twice")
    void testArmIsIdempotent() throws Exception {
        assertTrue(trigger.arm(TEAM_STAGE, DATE, Duration.ofMillis(30)));
        assertFalse(trigger.arm(TEAM_STAGE, DATE, Duration.ofMillis(30)));

        verify(bus, timeout(2_000)).publish(anyString(), any());
        Thread.sleep(200);
        verify(bus, times(1)).publish(anyString(), any());
    }

    @Test
    @DisplayName("Should not fire after disarm")
    void testDisarm() throws Exception {
        trigger.arm(TEAM_STAGE, DATE, Duration.ofMillis(150));
        assertTrue(trigger.disarm(TEAM_STAGE, DATE));
        assertFalse(trigger.disarm(TEAM_STAGE, DATE));

        Thread.sleep(400);
        verify(bus, never()).publish(anyString(), any());
        assertTrue(trigger.armed().isEmpty());
    }

    @Test
    @DisplayName("Should re-arm when the fallback publish fails")
    void testRearmOnPublishFailure() {
        properties.getFallback().setDefaultDeadline(Duration.ofMillis(30));
        when(bus.publish(anyString(), any()))
                .thenThrow(new BusPublishException("pubsub unavailable", null))
                .thenReturn("msg-2");

        assertTrue(trigger.arm(PLAYER_STAGE, DATE));

        verify(bus, timeout(2_000).times(2)).publish(eq("nba-phase2-fallback-trigger"), any());
    }

    @Test
    @DisplayName("Should use the stage's own fallback deadline")
    void testStageDeadline() {
        trigger.arm(TEAM_STAGE, DATE);

        List<FallbackTrigger.ArmedFallback> armed = trigger.armed();
        assertEquals(1, armed.size());
        assertEquals(Duration.ofHours(2), Duration.between(armed.get(0).armedAt(), armed.get(0).expiresAt()));
        assertTrue(trigger.isArmed(TEAM_STAGE, DATE));
    }

    @Test
    @DisplayName("Should not arm when fallback is disabled")
    void testDisabled() {
        properties.getFallback().setEnabled(false);
        FallbackTrigger disabled = new FallbackTrigger(bus, TopologyFixtures.load(), properties,
                new PipelineMetrics(new SimpleMeterRegistry()), Clock.systemUTC());

        assertFalse(disabled.arm(TEAM_STAGE, DATE));
        assertFalse(disabled.isArmed(TEAM_STAGE, DATE));
        disabled.destroy();
    }

    @Test
    @DisplayName("Should reject an unknown stage")
    void testUnknownStage() {
        assertThrows(IllegalArgumentException.class, () -> trigger.arm("no-such-stage", DATE));
    }
}
