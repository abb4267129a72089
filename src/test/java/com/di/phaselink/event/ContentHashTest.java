package com.di.phaselink.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContentHash Tests")
class ContentHashTest {

    @Test
    @DisplayName("Should ignore row order")
    void testRowOrderIgnored() {
        assertEquals(ContentHash.of(List.of("a,1", "b,2")), ContentHash.of(List.of("b,2", "a,1")));
    }

    @Test
    @DisplayName("Should change when a row changes")
    void testRowChange() {
        assertNotEquals(ContentHash.of(List.of("a,1", "b,2")), ContentHash.of(List.of("a,1", "b,3")));
    }

    @Test
    @DisplayName("Should keep part boundaries")
    void testPartBoundaries() {
        assertNotEquals(ContentHash.of("ab", "c"), ContentHash.of("a", "bc"));
        assertEquals(64, ContentHash.of("x").length());
    }
}
