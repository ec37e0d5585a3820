package com.toolhub.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolhub.tools.error.ToolError;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one tool's runtime health: availability, last error with its time, error count,
 * and recovery time. Immutable; the tracker replaces records atomically. Timestamps serialize to
 * JSON as epoch milliseconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HealthRecord {

    private final String name;
    private final boolean available;
    private final ToolError lastError;
    private final Instant lastErrorAt;
    private final long errorCount;
    private final Instant recoveredAt;
    private final Instant lastSuccessAt;
    private final Instant updatedAt;

    HealthRecord(String name, boolean available, ToolError lastError, Instant lastErrorAt, long errorCount,
                 Instant recoveredAt, Instant lastSuccessAt, Instant updatedAt) {
        this.name = Objects.requireNonNull(name, "name");
        this.available = available;
        this.lastError = lastError;
        this.lastErrorAt = lastErrorAt;
        this.errorCount = errorCount;
        this.recoveredAt = recoveredAt;
        this.lastSuccessAt = lastSuccessAt;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }

    static HealthRecord firstSuccess(String name, Instant now) {
        return new HealthRecord(name, true, null, null, 0, null, now, now);
    }

    static HealthRecord firstFailure(String name, ToolError error, Instant now) {
        return new HealthRecord(name, false, error, now, 1, null, null, now);
    }

    /** Available again; error history is kept and {@code recoveredAt} is set if this was a recovery. */
    HealthRecord withSuccess(Instant now) {
        Instant recovered = available ? recoveredAt : now;
        return new HealthRecord(name, true, lastError, lastErrorAt, errorCount, recovered, now, now);
    }

    HealthRecord withFailure(ToolError error, Instant now) {
        return new HealthRecord(name, false, error, now, errorCount + 1, recoveredAt, lastSuccessAt, now);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("available")
    public boolean isAvailable() {
        return available;
    }

    /** Last construction or permanent execution error; kept after recovery as history. */
    @JsonProperty("lastError")
    public ToolError getLastError() {
        return lastError;
    }

    @JsonIgnore
    public Instant getLastErrorAt() {
        return lastErrorAt;
    }

    @JsonProperty("errorCount")
    public long getErrorCount() {
        return errorCount;
    }

    /** Time of the most recent transition from unavailable back to available; null if never recovered. */
    @JsonIgnore
    public Instant getRecoveredAt() {
        return recoveredAt;
    }

    @JsonIgnore
    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    @JsonIgnore
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @JsonProperty("lastErrorAt")
    Long lastErrorAtMillis() {
        return lastErrorAt != null ? lastErrorAt.toEpochMilli() : null;
    }

    @JsonProperty("recoveredAt")
    Long recoveredAtMillis() {
        return recoveredAt != null ? recoveredAt.toEpochMilli() : null;
    }

    @JsonProperty("lastSuccessAt")
    Long lastSuccessAtMillis() {
        return lastSuccessAt != null ? lastSuccessAt.toEpochMilli() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HealthRecord that = (HealthRecord) o;
        return available == that.available && errorCount == that.errorCount && name.equals(that.name)
                && Objects.equals(lastError, that.lastError) && Objects.equals(lastErrorAt, that.lastErrorAt)
                && Objects.equals(recoveredAt, that.recoveredAt) && Objects.equals(lastSuccessAt, that.lastSuccessAt)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, available, lastError, lastErrorAt, errorCount, recoveredAt, lastSuccessAt, updatedAt);
    }

    @Override
    public String toString() {
        return "HealthRecord{" + name + (available ? " available" : " unavailable") + ", errors=" + errorCount
                + (lastError != null ? ", lastError=" + lastError : "") + "}";
    }
}
