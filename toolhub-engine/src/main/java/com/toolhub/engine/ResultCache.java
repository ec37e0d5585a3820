package com.toolhub.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory LRU cache of successful results for tools marked cacheable. Keys are the tool name
 * plus the arguments as canonical JSON (map keys sorted), so argument order does not matter.
 * Entries expire after the configured TTL. A cache with size 0 stores nothing.
 * <p>
 * Values are held as JSON trees and every hit returns a fresh copy, so a caller mutating its
 * result never changes what later callers see.
 */
public final class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Entry> entries;
    private long hits;
    private long misses;

    /**
     * @param maxEntries maximum cached results; 0 or negative disables the cache
     * @param ttl        entry lifetime; null or non-positive = no expiry
     */
    public ResultCache(int maxEntries, Duration ttl, Clock clock) {
        this.maxEntries = Math.max(0, maxEntries);
        this.ttl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : null;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > ResultCache.this.maxEntries;
            }
        };
    }

    public static ResultCache disabled() {
        return new ResultCache(0, null, Clock.systemUTC());
    }

    public boolean isEnabled() {
        return maxEntries > 0;
    }

    public synchronized Optional<Object> get(String toolName, Map<String, Object> arguments) {
        if (!isEnabled()) return Optional.empty();
        String key = key(toolName, arguments);
        if (key == null) return Optional.empty();
        Entry e = entries.get(key);
        if (e == null) {
            misses++;
            return Optional.empty();
        }
        if (e.expiresAt != null && !clock.instant().isBefore(e.expiresAt)) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.ofNullable(CANONICAL.convertValue(e.value, Object.class));
    }

    /** Caches a successful result. Null results are not cached. */
    public synchronized void put(String toolName, Map<String, Object> arguments, Object value) {
        if (!isEnabled() || value == null) return;
        String key = key(toolName, arguments);
        if (key == null) return;
        JsonNode tree;
        try {
            tree = CANONICAL.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.debug("Result of {} is not cacheable: {}", toolName, e.getMessage());
            return;
        }
        entries.put(key, new Entry(tree, ttl != null ? clock.instant().plus(ttl) : null));
    }

    /** Drops every cached result of the tool. */
    public synchronized int invalidate(String toolName) {
        String prefix = toolName + "\u0000";
        int before = entries.size();
        entries.keySet().removeIf(k -> k.startsWith(prefix));
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    private static String key(String toolName, Map<String, Object> arguments) {
        try {
            return toolName + "\u0000" + CANONICAL.writeValueAsString(arguments != null ? arguments : Map.of());
        } catch (JsonProcessingException e) {
            log.debug("Arguments of {} are not cacheable: {}", toolName, e.getMessage());
            return null;
        }
    }

    private static final class Entry {
        final JsonNode value;
        final Instant expiresAt;

        Entry(JsonNode value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
