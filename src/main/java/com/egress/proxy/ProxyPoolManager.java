package com.egress.proxy;

import com.egress.bean.ProxyCountry;
import com.egress.bean.ProxyPoolProperties;
import com.egress.cache.ValidationCache;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for consumers of the proxy pool.
 * <p>
 * {@link #acquire()}, {@link #remove(String, int)}, {@link #snapshot()} and {@link #size()} are
 * synchronous and never throw; a pool running below target is the only sign of degraded health.
 */
@Slf4j
public class ProxyPoolManager {

    private final ProxyPool pool;
    private final ValidationCache cache;
    private final ProviderClient provider;
    private final RefillController refillController;
    private final ThresholdScheduler scheduler;
    private final ProxyPoolProperties props;

    private final AtomicBoolean initialized = new AtomicBoolean(false);

    public ProxyPoolManager(ProxyPool pool,
                            ValidationCache cache,
                            ProviderClient provider,
                            RefillController refillController,
                            ThresholdScheduler scheduler,
                            ProxyPoolProperties props) {
        this.pool = pool;
        this.cache = cache;
        this.provider = provider;
        this.refillController = refillController;
        this.scheduler = scheduler;
        this.props = props;
    }

    /**
     * Fill the pool once, then start the periodic threshold check. Later calls complete empty.
     */
    public Mono<RefillResult> initialize() {
        return Mono.defer(() -> {
            if (!initialized.compareAndSet(false, true)) {
                log.debug("Proxy pool already initialized");
                return Mono.empty();
            }
            log.info("Initializing proxy pool: target {}, threshold {}, country {}, protocol {}",
                    props.getTargetSize(), props.getMinThreshold(), provider.getCountry().code(), props.getProtocol());
            return refillController.refill()
                    .doOnNext(result -> log.info("Proxy pool initialized with {}/{} proxies",
                            result.endSize(), result.targetSize()))
                    .doOnTerminate(scheduler::start)
                    .doOnCancel(scheduler::start);
        });
    }

    public Optional<ValidatedProxy> acquire() {
        Optional<ValidatedProxy> proxy = pool.acquire();
        if (proxy.isEmpty()) {
            log.warn("No proxy available (pool empty, refilling={})", refillController.isRefilling());
        }
        return proxy;
    }

    /**
     * Drop a proxy the caller found bad and check right away whether a refill is due.
     * @return whether a proxy at host:port was pooled
     */
    public boolean remove(String host, int port) {
        Optional<ValidatedProxy> removed = pool.removeByAddress(host, port);
        removed.ifPresent(proxy -> cache.markInvalid(proxy.identity()));

        if (removed.isPresent()) {
            log.debug("Removed proxy {}:{}, {} remaining", host, port, pool.size());
        } else {
            log.debug("Proxy {}:{} not in pool", host, port);
        }

        try {
            scheduler.checkAndRefill();
        } catch (RuntimeException e) {
            log.error("Threshold check after removal failed: {}", e.getMessage(), e);
        }
        return removed.isPresent();
    }

    public List<ValidatedProxy> snapshot() {
        return pool.snapshot();
    }

    public int size() {
        return pool.size();
    }

    public Mono<RefillResult> refill() {
        return refillController.refill();
    }

    public void setCountry(String code) {
        setCountry(ProxyCountry.fromCode(code));
    }

    public void setCountry(ProxyCountry country) {
        provider.setCountry(country);
    }

    public ProxyCountry getCountry() {
        return provider.getCountry();
    }

    public boolean isRefilling() {
        return refillController.isRefilling();
    }

    public PoolStats stats() {
        return new PoolStats(
                pool.size(),
                props.getTargetSize(),
                props.getMinThreshold(),
                refillController.isRefilling(),
                initialized.get(),
                scheduler.isRunning(),
                provider.getCountry().code(),
                props.getProtocol(),
                cache.size());
    }

    /**
     * Cancel the periodic check. A refill already running is left to finish.
     */
    public void stop() {
        scheduler.stop();
        log.info("Proxy pool service stopped ({} proxies pooled)", pool.size());
    }
}
