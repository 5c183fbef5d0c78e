package com.egress.cache;

import com.egress.bean.ProxyIdentity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the outcome of recent proxy probes so a candidate is not probed twice within the ttl.
 * When disabled every operation is a no-op and lookups always miss.
 */
@Slf4j
public class ValidationCache {

    private final TtlCache<ProxyIdentity, Boolean> cache;
    private final boolean enabled;

    public ValidationCache(boolean enabled, Duration ttl, Clock clock) {
        this.enabled = enabled;
        this.cache = new TtlCache<>(ttl, clock);
    }

    public Optional<CacheEntry<Boolean>> get(ProxyIdentity identity) {
        return enabled ? cache.get(identity) : Optional.empty();
    }

    public Optional<Boolean> freshOutcome(ProxyIdentity identity) {
        return enabled ? cache.getFresh(identity) : Optional.empty();
    }

    public void put(ProxyIdentity identity, boolean valid) {
        if (enabled) {
            cache.put(identity, valid);
        }
    }

    public void markInvalid(ProxyIdentity identity) {
        if (enabled) {
            cache.put(identity, false);
            log.debug("Marked {} invalid in validation cache", identity.address());
        }
    }

    /**
     * Identities whose last probe passed and is still within the ttl.
     */
    public List<ProxyIdentity> freshValidIdentities() {
        if (!enabled) {
            return List.of();
        }
        return cache.freshEntries().stream()
                .filter(e -> Boolean.TRUE.equals(e.getValue()))
                .map(Map.Entry::getKey)
                .toList();
    }

    public int sweepExpired() {
        return enabled ? cache.sweepExpired() : 0;
    }

    public int size() {
        return cache.size();
    }

    public boolean isEnabled() {
        return enabled;
    }
}
