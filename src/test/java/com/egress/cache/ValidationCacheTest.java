package com.egress.cache;

import com.egress.bean.ProxyIdentity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void freshValidIdentitiesSkipsInvalidAndStaleOutcomes() {
        ValidationCache cache = new ValidationCache(true, Duration.ofMinutes(30), clock);
        ProxyIdentity stale = ProxyIdentity.of("1.1.1.1", 80);
        ProxyIdentity valid = ProxyIdentity.of("2.2.2.2", 80);
        ProxyIdentity invalid = ProxyIdentity.of("3.3.3.3", 80);

        cache.put(stale, true);
        clock.advance(Duration.ofMinutes(31));
        cache.put(valid, true);
        cache.put(invalid, false);

        assertThat(cache.freshValidIdentities()).containsExactly(valid);
        assertThat(cache.freshOutcome(invalid)).contains(false);
        assertThat(cache.freshOutcome(stale)).isEmpty();
    }

    @Test
    void markInvalidOverridesValidOutcome() {
        ValidationCache cache = new ValidationCache(true, Duration.ofMinutes(30), clock);
        ProxyIdentity identity = new ProxyIdentity("4.4.4.4", 3128, "u", "p");

        cache.put(identity, true);
        cache.markInvalid(identity);

        assertThat(cache.freshOutcome(identity)).contains(false);
        assertThat(cache.freshValidIdentities()).isEmpty();
    }

    @Test
    void disabledCacheRemembersNothing() {
        ValidationCache cache = new ValidationCache(false, Duration.ofMinutes(30), clock);
        ProxyIdentity identity = ProxyIdentity.of("5.5.5.5", 80);

        cache.put(identity, true);

        assertThat(cache.get(identity)).isEmpty();
        assertThat(cache.freshOutcome(identity)).isEmpty();
        assertThat(cache.freshValidIdentities()).isEmpty();
        assertThat(cache.sweepExpired()).isZero();
        assertThat(cache.size()).isZero();
    }
}
