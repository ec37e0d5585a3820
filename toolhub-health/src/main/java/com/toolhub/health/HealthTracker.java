package com.toolhub.health;

import com.toolhub.tools.error.ToolError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single source of truth for "is tool X currently usable". Records are created lazily on the
 * first construction attempt and updated per name with atomic {@code compute}, so unrelated tools
 * never contend.
 * <p>
 * Recording is best-effort and never throws: an internal failure is logged and dropped. Memory is
 * bounded by {@code maxRecords} (oldest available records are evicted first) and by
 * {@link #retainOnly(Set)}, which drops records for names no longer in the catalog.
 */
public final class HealthTracker {

    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    /** Default bound on tracked names; generous for catalogs of several thousand tools. */
    public static final int DEFAULT_MAX_RECORDS = 10_000;

    private final Map<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxRecords;

    public HealthTracker() {
        this(Clock.systemUTC(), DEFAULT_MAX_RECORDS);
    }

    /**
     * @param clock      time source for record timestamps
     * @param maxRecords maximum tracked names; non-positive = {@link #DEFAULT_MAX_RECORDS}
     */
    public HealthTracker(Clock clock, int maxRecords) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxRecords = maxRecords > 0 ? maxRecords : DEFAULT_MAX_RECORDS;
    }

    /** Marks the tool available. A recovery from unavailable sets {@code recoveredAt} and keeps the error count. */
    public void recordSuccess(String name) {
        if (name == null) return;
        try {
            Instant now = clock.instant();
            HealthRecord updated = records.compute(name, (k, current) ->
                    current == null ? HealthRecord.firstSuccess(k, now) : current.withSuccess(now));
            if (updated.getRecoveredAt() != null && now.equals(updated.getRecoveredAt())) {
                log.info("Tool {} recovered after {} error(s)", name, updated.getErrorCount());
            }
            pruneIfNeeded();
        } catch (RuntimeException e) {
            log.warn("Failed to record success for tool {}: {}", name, e.getMessage(), e);
        }
    }

    /** Marks the tool unavailable, increments its error count and overwrites the last error. */
    public void recordFailure(String name, ToolError error) {
        if (name == null) return;
        try {
            Instant now = clock.instant();
            HealthRecord updated = records.compute(name, (k, current) ->
                    current == null ? HealthRecord.firstFailure(k, error, now) : current.withFailure(error, now));
            log.debug("Tool {} marked unavailable (errorCount={}): {}", name, updated.getErrorCount(), error);
            pruneIfNeeded();
        } catch (RuntimeException e) {
            log.warn("Failed to record failure for tool {}: {}", name, e.getMessage(), e);
        }
    }

    /** Health of the tool, or empty if it was never constructed (unknown). */
    public Optional<HealthRecord> status(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(records.get(name));
    }

    /** Unavailable tools sorted by name, for diagnostics. */
    public List<HealthRecord> allUnhealthy() {
        List<HealthRecord> out = new ArrayList<>();
        for (HealthRecord r : records.values()) {
            if (!r.isAvailable()) out.add(r);
        }
        out.sort(Comparator.comparing(HealthRecord::getName));
        return Collections.unmodifiableList(out);
    }

    /** All records keyed by name, sorted by name. */
    public Map<String, HealthRecord> all() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }

    /**
     * Drops records whose name is not in {@code names} (e.g. after a catalog reload).
     *
     * @return number of records removed
     */
    public int retainOnly(Set<String> names) {
        Set<String> keep = names != null ? names : Set.of();
        int before = records.size();
        records.keySet().removeIf(n -> !keep.contains(n));
        int removed = before - records.size();
        if (removed > 0) {
            log.info("Pruned {} health record(s) for tools no longer in the catalog", removed);
        }
        return Math.max(0, removed);
    }

    /** Forgets the tool's record; its status becomes unknown. */
    public void clear(String name) {
        if (name != null) records.remove(name);
    }

    public int size() {
        return records.size();
    }

    private void pruneIfNeeded() {
        int excess = records.size() - maxRecords;
        if (excess <= 0) return;
        List<HealthRecord> candidates = new ArrayList<>(records.values());
        candidates.sort(Comparator.comparing(HealthRecord::isAvailable).reversed()
                .thenComparing(HealthRecord::getUpdatedAt));
        for (int i = 0; i < excess && i < candidates.size(); i++) {
            HealthRecord victim = candidates.get(i);
            records.remove(victim.getName(), victim);
        }
        log.debug("Health tracker over capacity ({}); evicted up to {} oldest record(s)", maxRecords, excess);
    }
}
