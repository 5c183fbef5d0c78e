package com.egress.proxy;

/**
 * Outcome of one refill cycle. Falling short of the target is a normal outcome, not a failure.
 */
public record RefillResult(
        int startSize,
        int endSize,
        int targetSize,
        int attempts,
        int inserted,
        boolean faulted
) {

    public boolean targetReached() {
        return endSize >= targetSize;
    }
}
