package com.medusa.core;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * A stored value plus its optional absolute expiration time.
 * The value is owned exclusively by the entry. Only the store mutates an entry, under its lock.
 */
public final class Entry {

    /** Marker for an entry that never expires. */
    public static final long NO_EXPIRATION = -1L;

    /** Remaining TTL reported for an entry that is present but already expired. */
    public static final long EXPIRED = -1L;

    private final Value value;
    private long expiresAt; // epoch millis, NO_EXPIRATION if none

    /**
     * Create an entry that never expires.
     *
     * @param value the value to own
     */
    public Entry(Value value) {
        this(value, NO_EXPIRATION);
    }

    /**
     * Create an entry with an explicit expiration instant.
     *
     * @param value     the value to own
     * @param expiresAt expiration time in epoch millis, or {@link #NO_EXPIRATION}
     */
    public Entry(Value value, long expiresAt) {
        this.value = Objects.requireNonNull(value, "value");
        this.expiresAt = expiresAt;
    }

    public Value getValue() {
        return value;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean hasExpiration() {
        return expiresAt != NO_EXPIRATION;
    }

    void setExpiresAt(long expiresAt) {
        this.expiresAt = expiresAt;
    }

    /**
     * Check if this entry has expired.
     *
     * @param now current time in epoch millis
     * @return true once {@code now} is at or past the expiration instant
     */
    public boolean isExpired(long now) {
        return hasExpiration() && now >= expiresAt;
    }

    /**
     * Remaining time to live in whole seconds, rounded up.
     * A live entry never reports less than one second.
     *
     * @param now current time in epoch millis
     * @return empty if no expiration is set, {@link #EXPIRED} if expired, otherwise the seconds left
     */
    public OptionalLong remainingTtl(long now) {
        if (!hasExpiration()) {
            return OptionalLong.empty();
        }
        long remainingMillis = expiresAt - now;
        if (remainingMillis <= 0) {
            return OptionalLong.of(EXPIRED);
        }
        long seconds = (remainingMillis + 999) / 1000;
        return OptionalLong.of(Math.max(1, seconds));
    }

    @Override
    public String toString() {
        return "Entry{" +
               "type=" + value.getType() +
               ", expiresAt=" + expiresAt +
               '}';
    }
}
