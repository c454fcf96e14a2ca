package com.apex.decision.cache;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Freshness-bounded cache keyed by instrument symbol.
 * <p>
 * While {@code bypass} reports true every lookup misses and every put is dropped,
 * so callers always recompute from live collaborators.
 */
@Slf4j
public class TtlCache<T> {

    @Getter
    private final String name;
    @Getter
    private final Duration ttl;
    private final Clock clock;
    private final BooleanSupplier bypass;
    private final Map<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public TtlCache(String name, Duration ttl, Clock clock, BooleanSupplier bypass) {
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
        this.bypass = bypass;
    }

    public Optional<T> get(String key) {
        if (key == null || bypass.getAsBoolean()) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        CacheEntry<T> entry = entries.get(key);
        if (entry == null || !entry.isFresh(clock.instant(), ttl)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.ofNullable(entry.value());
    }

    public void put(String key, T value) {
        if (key == null || value == null || bypass.getAsBoolean()) {
            return;
        }
        entries.put(key, new CacheEntry<>(value, clock.instant(), key));
    }

    /**
     * Raw entry regardless of freshness, for diagnostics.
     */
    public Optional<CacheEntry<T>> peek(String key) {
        return Optional.ofNullable(key == null ? null : entries.get(key));
    }

    public boolean isFresh(String key) {
        if (key == null || bypass.getAsBoolean()) {
            return false;
        }
        CacheEntry<T> entry = entries.get(key);
        return entry != null && entry.isFresh(clock.instant(), ttl);
    }

    public void invalidate(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    public void invalidateAll() {
        int removed = entries.size();
        entries.clear();
        if (removed > 0) {
            log.debug("Cache {} invalidated ({} entries)", name, removed);
        }
    }

    /**
     * Drops expired entries; returns how many were removed.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isFresh(now, ttl));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public void resetCounters() {
        hits.set(0);
        misses.set(0);
    }
}
