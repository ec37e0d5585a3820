package com.toolhub.engine;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void argumentOrderDoesNotChangeTheKey() {
        ResultCache cache = new ResultCache(10, null, clock);
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", "x");
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", "x");
        ba.put("a", 1);

        cache.put("Search", ab, "result");

        assertEquals(Optional.of("result"), cache.get("Search", ba));
        assertTrue(cache.get("Other", ab).isEmpty());
    }

    @Test
    void leastRecentlyUsedEntryIsEvicted() {
        ResultCache cache = new ResultCache(2, null, clock);
        cache.put("t", Map.of("q", 1), "one");
        cache.put("t", Map.of("q", 2), "two");
        cache.get("t", Map.of("q", 1));
        cache.put("t", Map.of("q", 3), "three");

        assertTrue(cache.get("t", Map.of("q", 1)).isPresent());
        assertTrue(cache.get("t", Map.of("q", 2)).isEmpty());
        assertTrue(cache.get("t", Map.of("q", 3)).isPresent());
    }

    @Test
    void entriesExpireAfterTtl() {
        ResultCache cache = new ResultCache(10, Duration.ofMinutes(5), clock);
        cache.put("t", Map.of(), "value");

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get("t", Map.of()).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get("t", Map.of()).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void zeroSizeDisablesCaching() {
        ResultCache cache = new ResultCache(0, Duration.ofMinutes(5), clock);
        cache.put("t", Map.of(), "value");

        assertFalse(cache.isEnabled());
        assertTrue(cache.get("t", Map.of()).isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    void everyHitReturnsAnIndependentCopy() {
        ResultCache cache = new ResultCache(10, null, clock);
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("list", new ArrayList<>(List.of(1)));
        cache.put("t", Map.of(), value);
        ((List<Object>) value.get("list")).add(2);

        Map<String, Object> hit = (Map<String, Object>) cache.get("t", Map.of()).orElseThrow();
        assertEquals(Map.of("list", List.of(1)), hit);
        hit.put("injected", true);

        assertEquals(Map.of("list", List.of(1)), cache.get("t", Map.of()).orElseThrow());
    }

    @Test
    void hitsAndMissesAreCounted() {
        ResultCache cache = new ResultCache(10, null, clock);
        cache.get("t", Map.of());
        cache.put("t", Map.of(), "value");
        cache.get("t", Map.of());
        cache.get("t", Map.of());

        assertEquals(2, cache.getHits());
        assertEquals(1, cache.getMisses());
    }

    @Test
    void invalidateDropsOnlyThatTool() {
        ResultCache cache = new ResultCache(10, null, clock);
        cache.put("a", Map.of("q", 1), "x");
        cache.put("a", Map.of("q", 2), "y");
        cache.put("ab", Map.of("q", 1), "z");

        assertEquals(2, cache.invalidate("a"));
        assertTrue(cache.get("ab", Map.of("q", 1)).isPresent());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
