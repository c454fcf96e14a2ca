package com.apex.decision.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<T>(T value, Instant refreshedAt, String key) {

    /**
     * Usable only while {@code now - refreshedAt < ttl}.
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(refreshedAt, now).compareTo(ttl) < 0;
    }
}
