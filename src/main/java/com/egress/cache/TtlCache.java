package com.egress.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent key/value cache whose entries stop counting once they are older than the ttl.
 * Stale entries stay visible through {@link #get(Object)} until {@link #sweepExpired()} runs,
 * so callers that want a usable value go through {@link #getFresh(Object)}.
 */
@Slf4j
public class TtlCache<K, V> {

    private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be zero or positive");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Optional<V> getFresh(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (!CacheEntry.isFresh(entry, ttl, clock.instant())) {
            return Optional.empty();
        }
        return Optional.ofNullable(entry.value());
    }

    // last write wins
    public void put(K key, V value) {
        entries.put(key, new CacheEntry<>(value, clock.instant()));
    }

    public List<Map.Entry<K, V>> freshEntries() {
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(e -> e.getValue().isFresh(ttl, now))
                .map(e -> Map.entry(e.getKey(), e.getValue().value()))
                .toList();
    }

    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            // conditional remove keeps an entry rewritten since the scan started
            if (!e.getValue().isFresh(ttl, now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired cache entries ({} remaining)", removed, entries.size());
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
