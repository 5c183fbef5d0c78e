package com.egress.proxy;

/**
 * Snapshot handed to a {@link RefillObserver} after each fetch attempt.
 */
public record RefillProgress(
        int attempt,
        int maxAttempts,
        int fetched,
        int probed,
        int inserted,
        int poolSize,
        int targetSize
) {}
