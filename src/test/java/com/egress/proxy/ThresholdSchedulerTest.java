package com.egress.proxy;

import com.egress.bean.ProxyIdentity;
import com.egress.cache.MutableClock;
import com.egress.cache.ValidationCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ThresholdSchedulerTest {

    private static final Duration INTERVAL = Duration.ofSeconds(30);

    @Mock
    private RefillController refillController;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private VirtualTimeScheduler timer;
    private ProxyPool pool;
    private ValidationCache cache;
    private ThresholdScheduler scheduler;

    @BeforeEach
    void setUp() {
        timer = VirtualTimeScheduler.create();
        pool = new ProxyPool();
        cache = new ValidationCache(true, Duration.ofHours(1), clock);
        scheduler = new ThresholdScheduler(pool, cache, refillController, 1, INTERVAL, timer);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        timer.dispose();
    }

    @Test
    void tickAtOrBelowThresholdStartsRefill() {
        pool.insertIfAbsent(ProxyPoolTest.proxy("1.1.1.1", 80));
        when(refillController.isRefilling()).thenReturn(false);
        when(refillController.refill()).thenReturn(Mono.just(new RefillResult(1, 2, 2, 1, 1, false)));

        scheduler.start();
        timer.advanceTimeBy(INTERVAL.minusSeconds(1));
        verify(refillController, never()).refill();

        timer.advanceTimeBy(Duration.ofSeconds(1));
        verify(refillController, times(1)).refill();

        timer.advanceTimeBy(INTERVAL);
        verify(refillController, times(2)).refill();
    }

    @Test
    void tickAboveThresholdDoesNothing() {
        pool.insertIfAbsent(ProxyPoolTest.proxy("1.1.1.1", 80));
        pool.insertIfAbsent(ProxyPoolTest.proxy("2.2.2.2", 80));

        scheduler.start();
        timer.advanceTimeBy(INTERVAL.multipliedBy(3));

        verify(refillController, never()).refill();
    }

    @Test
    void tickDuringRunningRefillDoesNotStartAnother() {
        when(refillController.isRefilling()).thenReturn(true);

        scheduler.start();
        timer.advanceTimeBy(INTERVAL.multipliedBy(2));

        verify(refillController, never()).refill();
    }

    @Test
    void startIsIdempotentAndStopCancelsTicks() {
        when(refillController.isRefilling()).thenReturn(false);
        when(refillController.refill()).thenReturn(Mono.empty());

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        timer.advanceTimeBy(INTERVAL);
        verify(refillController, times(1)).refill();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
        timer.advanceTimeBy(INTERVAL.multipliedBy(5));
        verify(refillController, times(1)).refill();
    }

    @Test
    void tickSweepsExpiredCacheEntries() {
        pool.insertIfAbsent(ProxyPoolTest.proxy("1.1.1.1", 80));
        pool.insertIfAbsent(ProxyPoolTest.proxy("2.2.2.2", 80));
        cache.put(ProxyIdentity.of("3.3.3.3", 80), true);
        clock.advance(Duration.ofHours(2));

        scheduler.start();
        timer.advanceTimeBy(INTERVAL);

        assertThat(cache.size()).isZero();
    }

    @Test
    void failingCheckKeepsTimerAlive() {
        when(refillController.isRefilling()).thenReturn(false);
        when(refillController.refill()).thenThrow(new IllegalStateException("boom"));

        scheduler.start();
        timer.advanceTimeBy(INTERVAL.multipliedBy(2));

        verify(refillController, times(2)).refill();
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    void directCheckReportsWhetherRefillStarted() {
        when(refillController.isRefilling()).thenReturn(false, true);
        when(refillController.refill()).thenReturn(Mono.empty());

        assertThat(scheduler.checkAndRefill()).isTrue();
        assertThat(scheduler.checkAndRefill()).isFalse();
    }
}
