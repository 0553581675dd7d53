package com.overseer.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextValuesTest {

    @Test
    @DisplayName("keeps insertion order and supported value types")
    void keepsOrderAndTypes() {
        var source = new LinkedHashMap<String, Object>();
        source.put("limit", 100_000);
        source.put("currency", "EUR");
        source.put("urgent", true);
        source.put("desk", Map.of("name", "fx"));
        source.put("tags", List.of("budget", 2));

        var copy = ContextValues.copyOf(source);

        assertEquals(List.of("limit", "currency", "urgent", "desk", "tags"), List.copyOf(copy.keySet()));
        assertEquals(Map.of("name", "fx"), copy.get("desk"));
        assertThrows(UnsupportedOperationException.class, () -> copy.put("x", 1));
    }

    @Test
    @DisplayName("enums are stored by name")
    void enumsByName() {
        assertEquals("HIGH", ContextValues.copyOf(Map.of("priority", Priority.HIGH)).get("priority"));
    }

    @Test
    @DisplayName("other values are stored as text, also inside nested maps and lists")
    void coercesOtherValues() {
        var copy = ContextValues.copyOf(Map.of(
                "at", Instant.EPOCH,
                "nested", Map.of("day", LocalDate.of(2026, 1, 1)),
                "ids", Set.of(7)));

        assertEquals("1970-01-01T00:00:00Z", copy.get("at"));
        assertEquals(Map.of("day", "2026-01-01"), copy.get("nested"));
        assertEquals(List.of(7), copy.get("ids"));
    }

    @Test
    @DisplayName("null and non-string keys become text keys")
    void textKeys() {
        var source = new HashMap<String, Object>();
        source.put(null, "x");
        Map<Object, Object> nested = new HashMap<>();
        nested.put(1, "one");
        source.put("nested", nested);

        var copy = ContextValues.copyOf(source);

        assertEquals("x", copy.get("null"));
        assertEquals(Map.of("1", "one"), copy.get("nested"));
    }

    @Test
    @DisplayName("null and empty maps become an empty map")
    void nullAndEmpty() {
        assertTrue(ContextValues.copyOf(null).isEmpty());
        assertTrue(ContextValues.copyOf(Map.of()).isEmpty());
    }
}
