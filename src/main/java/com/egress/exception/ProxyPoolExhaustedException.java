package com.egress.exception;

/**
 * Exception thrown at the REST edge when the pool has no validated proxy to hand out
 */
public class ProxyPoolExhaustedException extends RuntimeException {

    private final int poolSize;
    private final int targetSize;

    public ProxyPoolExhaustedException(int poolSize, int targetSize) {
        super(String.format("No proxy available (pool size %d, target %d)", poolSize, targetSize));
        this.poolSize = poolSize;
        this.targetSize = targetSize;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public int getTargetSize() {
        return targetSize;
    }
}
