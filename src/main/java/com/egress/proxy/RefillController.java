package com.egress.proxy;

import com.egress.bean.ProxyIdentity;
import com.egress.bean.ProxyPoolProperties;
import com.egress.cache.ValidationCache;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brings the pool back up to its target size.
 * <p>
 * A cycle first re-probes recently valid proxies from the validation cache, then loops over
 * provider batches: fetch, drop already pooled candidates, probe the rest in sub-batches of
 * {@code concurrency}, insert survivors. It stops when the target is met or the attempt budget
 * is spent. Only one cycle runs at a time; a trigger during a cycle completes empty.
 */
@Slf4j
public class RefillController {

    private final ProxyPool pool;
    private final ValidationCache cache;
    private final ProviderClient provider;
    private final ProxyValidator validator;
    private final ProxyPoolProperties props;
    private final RefillObserver observer;
    private final Clock clock;

    private final AtomicBoolean refilling = new AtomicBoolean(false);

    public RefillController(ProxyPool pool,
                            ValidationCache cache,
                            ProviderClient provider,
                            ProxyValidator validator,
                            ProxyPoolProperties props,
                            RefillObserver observer,
                            Clock clock) {
        this.pool = pool;
        this.cache = cache;
        this.provider = provider;
        this.validator = validator;
        this.props = props;
        this.observer = observer == null ? RefillObserver.NONE : observer;
        this.clock = clock;
    }

    /**
     * Run one refill cycle.
     * @return the cycle outcome, or empty when another cycle was already running
     */
    public Mono<RefillResult> refill() {
        return Mono.defer(() -> {
            if (!refilling.compareAndSet(false, true)) {
                log.debug("Refill already in progress, trigger ignored");
                return Mono.empty();
            }

            Cycle cycle = new Cycle(pool.size());
            return Mono.defer(() -> runCycle(cycle))
                    .onErrorResume(e -> {
                        log.error("Refill cycle aborted after {} attempts at {}/{} proxies: {}",
                                cycle.attempts.get(), pool.size(), props.getTargetSize(), e.getMessage(), e);
                        return Mono.just(cycle.result(pool.size(), props.getTargetSize(), true));
                    })
                    // cleared before the result reaches the subscriber
                    .doOnTerminate(() -> refilling.set(false))
                    .doOnCancel(() -> refilling.set(false));
        });
    }

    public boolean isRefilling() {
        return refilling.get();
    }

    private Mono<RefillResult> runCycle(Cycle cycle) {
        int target = props.getTargetSize();
        if (cycle.startSize >= target) {
            log.debug("Pool already at {}/{}, nothing to refill", cycle.startSize, target);
            return Mono.just(cycle.result(cycle.startSize, target, false));
        }

        log.info("Starting refill: {}/{} proxies available", cycle.startSize, target);
        return cacheFirstPass(cycle)
                .then(Mono.defer(() -> attemptLoop(1, cycle)))
                .then(Mono.fromSupplier(() -> report(cycle.result(pool.size(), target, false))));
    }

    private Mono<Void> cacheFirstPass(Cycle cycle) {
        if (!cache.isEnabled() || !props.getCache().isCacheFirst()) {
            return Mono.empty();
        }
        int needed = props.getTargetSize() - pool.size();
        List<Candidate> hints = cache.freshValidIdentities().stream()
                .filter(identity -> !pool.contains(identity))
                .limit(Math.max(0, needed))
                .map(Candidate::from)
                .toList();
        if (hints.isEmpty()) {
            return Mono.empty();
        }

        log.debug("Re-validating {} recently valid proxies from cache", hints.size());
        // a cached pass is only a hint, so these are always probed again
        return validateInSubBatches(hints, false, cycle)
                .doOnNext(outcome -> log.debug("Cache pass restored {} of {} proxies", outcome.inserted(), hints.size()))
                .then();
    }

    private Mono<Void> attemptLoop(int attempt, Cycle cycle) {
        int target = props.getTargetSize();
        int maxAttempts = props.getMaxRefillAttempts();
        if (pool.size() >= target || attempt > maxAttempts) {
            return Mono.empty();
        }

        cycle.attempts.set(attempt);
        return runAttempt(attempt, cycle)
                .flatMap(pauseAfter -> {
                    Duration delay = props.getRetryDelay();
                    boolean pause = pauseAfter
                            && attempt < maxAttempts
                            && pool.size() < target
                            && delay != null && !delay.isZero();
                    Mono<Void> next = Mono.defer(() -> attemptLoop(attempt + 1, cycle));
                    return pause ? Mono.delay(delay).then(next) : next;
                });
    }

    /**
     * @return whether the loop should wait {@code retry-delay} before the next attempt
     */
    private Mono<Boolean> runAttempt(int attempt, Cycle cycle) {
        int maxAttempts = props.getMaxRefillAttempts();
        int needed = props.getTargetSize() - pool.size();
        // over-fetch, most public candidates fail the probe
        int requested = Math.max(props.getBatchSize(), needed * props.getOverFetchMultiplier());
        log.debug("Refill attempt {}/{}: pool {}/{}, requesting {} candidates",
                attempt, maxAttempts, pool.size(), props.getTargetSize(), requested);

        return provider.fetchCandidates(requested)
                .defaultIfEmpty(List.of())
                .flatMap(candidates -> {
                    if (candidates.isEmpty()) {
                        log.debug("Attempt {}: provider returned no candidates, retrying in {}",
                                attempt, props.getRetryDelay());
                        notifyObserver(attempt, 0, BatchOutcome.NONE);
                        return Mono.just(true);
                    }

                    List<Candidate> fresh = withoutPooled(candidates);
                    if (fresh.isEmpty()) {
                        log.debug("Attempt {}: all {} candidates are already pooled", attempt, candidates.size());
                        notifyObserver(attempt, candidates.size(), BatchOutcome.NONE);
                        return Mono.just(false);
                    }

                    return validateInSubBatches(fresh, true, cycle)
                            .map(outcome -> {
                                notifyObserver(attempt, candidates.size(), outcome);
                                return true;
                            });
                });
    }

    private List<Candidate> withoutPooled(List<Candidate> candidates) {
        Map<ProxyIdentity, Candidate> unique = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            ProxyIdentity identity = candidate.identity();
            if (!pool.contains(identity)) {
                unique.putIfAbsent(identity, candidate);
            }
        }
        return List.copyOf(unique.values());
    }

    /**
     * Probe candidates {@code concurrency} at a time. A sub-batch starts only after the previous
     * one fully resolved, and not at all once the pool has reached its target.
     */
    private Mono<BatchOutcome> validateInSubBatches(List<Candidate> candidates, boolean honorCache, Cycle cycle) {
        int target = props.getTargetSize();
        AtomicInteger probed = new AtomicInteger();
        AtomicInteger inserted = new AtomicInteger();

        return Flux.fromIterable(candidates)
                .buffer(props.getConcurrency())
                .concatMap(batch -> Mono.defer(() -> {
                    if (pool.size() >= target) {
                        log.debug("Target {} reached, skipping sub-batch of {} candidates", target, batch.size());
                        return Mono.<Void>empty();
                    }
                    return validateBatch(batch, honorCache, probed, inserted, cycle);
                }))
                .then(Mono.fromSupplier(() -> new BatchOutcome(probed.get(), inserted.get())));
    }

    private Mono<Void> validateBatch(List<Candidate> batch,
                                     boolean honorCache,
                                     AtomicInteger probed,
                                     AtomicInteger inserted,
                                     Cycle cycle) {
        return Flux.fromIterable(batch)
                .flatMap(candidate -> check(candidate, honorCache, probed)
                        .filter(Boolean::booleanValue)
                        .map(valid -> candidate), batch.size())
                .doOnNext(candidate -> {
                    ValidatedProxy proxy = ValidatedProxy.of(candidate, props.getProtocol(), clock.instant());
                    if (pool.insertIfAbsent(proxy)) {
                        inserted.incrementAndGet();
                        cycle.inserted.incrementAndGet();
                        log.debug("Added proxy {}, pool {}/{}", proxy.identity().address(), pool.size(), props.getTargetSize());
                    }
                })
                .then();
    }

    private Mono<Boolean> check(Candidate candidate, boolean honorCache, AtomicInteger probed) {
        return Mono.defer(() -> {
            ProxyIdentity identity = candidate.identity();
            if (honorCache) {
                Optional<Boolean> cached = cache.freshOutcome(identity);
                if (cached.isPresent()) {
                    log.debug("Using cached outcome for {}: valid={}", identity.address(), cached.get());
                    return Mono.just(cached.get());
                }
            }
            probed.incrementAndGet();
            return validator.validate(candidate)
                    .defaultIfEmpty(false)
                    .onErrorReturn(false)
                    .doOnNext(valid -> cache.put(identity, valid));
        });
    }

    private void notifyObserver(int attempt, int fetched, BatchOutcome outcome) {
        try {
            observer.onAttempt(new RefillProgress(attempt, props.getMaxRefillAttempts(), fetched,
                    outcome.probed(), outcome.inserted(), pool.size(), props.getTargetSize()));
        } catch (RuntimeException e) {
            log.warn("Refill observer failed: {}", e.getMessage());
        }
    }

    private RefillResult report(RefillResult result) {
        if (result.targetReached()) {
            log.info("✓ Refill complete: {}/{} proxies after {} attempts ({} added)",
                    result.endSize(), result.targetSize(), result.attempts(), result.inserted());
        } else {
            log.warn("Refill stopped after {} attempts with {}/{} proxies ({} added), will retry on next check",
                    result.attempts(), result.endSize(), result.targetSize(), result.inserted());
        }
        return result;
    }

    private record BatchOutcome(int probed, int inserted) {
        static final BatchOutcome NONE = new BatchOutcome(0, 0);
    }

    private static final class Cycle {
        private final int startSize;
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger inserted = new AtomicInteger();

        private Cycle(int startSize) {
            this.startSize = startSize;
        }

        private RefillResult result(int endSize, int targetSize, boolean faulted) {
            return new RefillResult(startSize, endSize, targetSize, attempts.get(), inserted.get(), faulted);
        }
    }
}
