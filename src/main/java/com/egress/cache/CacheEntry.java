package com.egress.cache;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry<V>(V value, Instant insertedAt) {

    public static boolean isFresh(CacheEntry<?> entry, Duration ttl, Instant now) {
        return entry != null && Duration.between(entry.insertedAt(), now).compareTo(ttl) < 0;
    }

    public boolean isFresh(Duration ttl, Instant now) {
        return isFresh(this, ttl, now);
    }
}
