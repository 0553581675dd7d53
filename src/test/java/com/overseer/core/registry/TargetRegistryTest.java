package com.overseer.core.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TargetRegistryTest {

    private TargetRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TargetRegistry();
    }

    private static Target target(String id) {
        return () -> id;
    }

    @Test
    @DisplayName("exact lookup is case-insensitive")
    void exactLookup() {
        registry.register("Trading", target("crew-1"), null);
        assertEquals(Optional.of("crew-1"), registry.resolve("TRADING"));
        assertEquals(List.of("trading"), registry.names());
    }

    @Test
    @DisplayName("fuzzy lookup matches substrings in both directions")
    void fuzzyLookup() {
        registry.register("trading", target("crew-1"), null);
        assertEquals(Optional.of("crew-1"), registry.resolve("trad"));
        assertEquals(Optional.of("crew-1"), registry.resolve("tradingdesk"));
    }

    @Test
    @DisplayName("exact match beats fuzzy match")
    void exactBeatsFuzzy() {
        registry.register("risk-management", target("crew-1"), null);
        registry.register("risk", target("crew-2"), null);
        assertEquals(Optional.of("crew-2"), registry.resolve("risk"));
    }

    @Test
    @DisplayName("several fuzzy matches resolve to the lexicographically smallest name")
    void fuzzyTieBreak() {
        registry.register("risk-ops", target("crew-ops"), null);
        registry.register("risk-fx", target("crew-fx"), null);
        registry.register("risk-credit", target("crew-credit"), null);
        assertEquals(Optional.of("crew-credit"), registry.resolve("isk"));
    }

    @Test
    @DisplayName("unregister then resolve returns empty")
    void unregister() {
        registry.register("trading", target("crew-1"), null);
        assertTrue(registry.unregister("Trading"));
        assertFalse(registry.unregister("trading"));
        assertTrue(registry.resolve("trading").isEmpty());
    }

    @Test
    @DisplayName("never-registered and blank names do not resolve")
    void unknownNames() {
        registry.register("trading", target("crew-1"), null);
        assertTrue(registry.resolve("compliance").isEmpty());
        assertTrue(registry.resolve("  ").isEmpty());
        assertTrue(registry.resolve(null).isEmpty());
    }

    @Test
    @DisplayName("re-registering a name replaces the target")
    void lastWriteWins() {
        registry.register("trading", target("crew-1"), null);
        registry.register("TRADING", target("crew-2"), null);
        assertEquals(1, registry.size());
        assertEquals(Optional.of("crew-2"), registry.resolve("trading"));
    }

    @Test
    @DisplayName("byId scans registered targets")
    void byId() {
        Target trading = target("crew-1");
        registry.register("trading", trading, null);
        assertSame(trading, registry.byId("crew-1").orElseThrow());
        assertTrue(registry.byId("crew-9").isEmpty());
    }

    @Test
    @DisplayName("supervisable targets report to the overseer exactly once")
    void supervisableTargetsAreLinked() {
        var crew = new SupervisedCrew("crew-1");
        OverseerChannel channel = mock(OverseerChannel.class);
        when(channel.overseerId()).thenReturn("OVS-1");

        registry.register("trading", crew, channel);
        registry.register("trading-desk", crew, channel);

        assertEquals(List.of("OVS-1"), crew.reportsTo());
        assertSame(channel, crew.channel);
    }

    private static class SupervisedCrew implements Target, Supervisable {
        private final String id;
        private final List<String> reportsTo = new ArrayList<>();
        private OverseerChannel channel;

        SupervisedCrew(String id) {
            this.id = id;
        }

        @Override public String id() { return id; }
        @Override public List<String> reportsTo() { return reportsTo; }
        @Override public void addReportsTo(String supervisorId) { reportsTo.add(supervisorId); }
        @Override public void attachOverseer(OverseerChannel channel) { this.channel = channel; }
    }
}
