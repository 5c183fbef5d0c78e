package com.egress.proxy;

import com.egress.cache.ValidationCache;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Periodic low-water check. Each tick sweeps expired cache entries and starts a refill
 * when the pool is at or below {@code min-threshold}.
 */
@Slf4j
public class ThresholdScheduler {

    private final ProxyPool pool;
    private final ValidationCache cache;
    private final RefillController refillController;
    private final int minThreshold;
    private final Duration checkInterval;
    private final Scheduler timer;

    private Disposable ticker;

    public ThresholdScheduler(ProxyPool pool,
                              ValidationCache cache,
                              RefillController refillController,
                              int minThreshold,
                              Duration checkInterval,
                              Scheduler timer) {
        this.pool = pool;
        this.cache = cache;
        this.refillController = refillController;
        this.minThreshold = minThreshold;
        this.checkInterval = checkInterval;
        this.timer = timer;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        ticker = Flux.interval(checkInterval, checkInterval, timer)
                .onBackpressureDrop()
                .subscribe(tick -> onTick(),
                        e -> log.error("Threshold scheduler stopped unexpectedly: {}", e.getMessage(), e));
        log.info("Threshold scheduler started (every {}, threshold {})", checkInterval, minThreshold);
    }

    public synchronized void stop() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
            log.info("Threshold scheduler stopped");
        }
    }

    public synchronized boolean isRunning() {
        return ticker != null && !ticker.isDisposed();
    }

    /**
     * Start a refill if the pool is at or below the threshold and no cycle is running.
     * @return whether a refill was started
     */
    public boolean checkAndRefill() {
        int size = pool.size();
        if (size > minThreshold || refillController.isRefilling()) {
            return false;
        }
        log.info("Available proxies ({}) at or below threshold ({}), refilling", size, minThreshold);
        refillController.refill()
                .subscribe(result -> { },
                        e -> log.error("Triggered refill failed: {}", e.getMessage(), e));
        return true;
    }

    private void onTick() {
        try {
            cache.sweepExpired();
            checkAndRefill();
        } catch (RuntimeException e) {
            // keep the timer alive for the next tick
            log.error("Threshold check failed: {}", e.getMessage(), e);
        }
    }
}
