package com.di.phaselink.event;

import com.di.phaselink.exception.ErrorKind;
import com.di.phaselink.exception.MalformedEventException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeEventCodec Tests")
class ChangeEventCodecTest {

    private static final LocalDate DATE = LocalDate.of(2024, 11, 20);
    private static final Instant PRODUCED_AT = Instant.parse("2024-11-21T03:15:00Z");

    private final ChangeEventCodec codec = new ChangeEventCodec(10_000);

    @Test
    @DisplayName("Should write wire field names and lower-case scope kind")
    void testEncode_WireFormat() {
        ChangeEvent event = new ChangeEvent("player-game-stats",
                EventScope.ofEntities(DATE, List.of("2544", "201939")), PRODUCED_AT, "abc123");

        String json = new String(codec.encode(event), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"producing_stage\":\"player-game-stats\""));
        assertTrue(json.contains("\"kind\":\"entities\""));
        assertTrue(json.contains("\"entity_ids\":[\"2544\",\"201939\"]"));
        assertTrue(json.contains("\"date\":\"2024-11-20\""));
        assertTrue(json.contains("\"content_hash\":\"abc123\""));
    }

    @Test
    @DisplayName("Should decode an event written by another producer")
    void testDecode_ExternalPayload() {
        String json = "{\"producing_stage\":\"raw-boxscores\",\"scope\":{\"kind\":\"date\",\"date\":\"2024-11-20\"},"
                + "\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h1\"}";

        ChangeEvent event = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertEquals("raw-boxscores", event.producingStage());
        assertEquals(ScopeKind.DATE, event.scope().kind());
        assertEquals(DATE, event.scope().date());
        assertNull(event.scope().entityIds());
        assertEquals(PRODUCED_AT, event.producedAt());
    }

    @Test
    @DisplayName("Should widen an oversize entity list to scope all for the same date")
    void testEncode_OversizeWidensToAll() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            ids.add("player-" + i);
        }
        ChangeEvent event = new ChangeEvent("player-game-stats", EventScope.ofEntities(DATE, ids), PRODUCED_AT, "h");

        byte[] payload = codec.encode(event);
        ChangeEvent decoded = codec.decode(payload);

        assertTrue(payload.length <= codec.getMaxMessageBytes());
        assertEquals(ScopeKind.ALL, decoded.scope().kind());
        assertEquals(DATE, decoded.scope().date());
        assertNull(decoded.scope().entityIds());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json",
            "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"weekly\",\"date\":\"2024-11-20\"},\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\"}",
            "{\"scope\":{\"kind\":\"date\",\"date\":\"2024-11-20\"},\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\"}",
            "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"date\"},\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\"}",
            "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"entities\",\"date\":\"2024-11-20\"},\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\"}",
            "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"date\",\"date\":\"2024-11-20\"},\"produced_at\":\"2024-11-21T03:15:00Z\"}",
            "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"date\",\"date\":\"2024-11-20\"},\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\",\"extra\":1}"
    })
    @DisplayName("Should reject malformed payloads with MalformedEventException")
    void testDecode_Malformed(String payload) {
        MalformedEventException ex = assertThrows(MalformedEventException.class,
                () -> codec.decode(payload.getBytes(StandardCharsets.UTF_8)));
        assertEquals(ErrorKind.MALFORMED_EVENT, ex.getErrorKind());
        assertFalse(ex.isRetryable());
    }

    @Test
    @DisplayName("Should reject an empty payload")
    void testDecode_Empty() {
        assertThrows(MalformedEventException.class, () -> codec.decode(new byte[0]));
        assertThrows(MalformedEventException.class, () -> codec.decode(null));
    }

    @Test
    @DisplayName("Should accept scope all without a date")
    void testDecode_AllWithoutDate() {
        String json = "{\"producing_stage\":\"x\",\"scope\":{\"kind\":\"all\"},"
                + "\"produced_at\":\"2024-11-21T03:15:00Z\",\"content_hash\":\"h\"}";
        ChangeEvent event = codec.decode(json.getBytes(StandardCharsets.UTF_8));
        assertTrue(event.scope().isAll());
        assertNull(event.scope().date());
    }
}
