package com.egress.proxy;

public record PoolStats(
        int size,
        int targetSize,
        int minThreshold,
        boolean refilling,
        boolean initialized,
        boolean schedulerRunning,
        String country,
        String protocol,
        int cachedOutcomes
) {}
