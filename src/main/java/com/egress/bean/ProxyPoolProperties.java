package com.egress.bean;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "proxy-pool")
public class ProxyPoolProperties {
    private int targetSize = 20;
    private int batchSize = 20;
    // connect timeout towards the candidate proxy
    private Duration validationTimeout = Duration.ofSeconds(5);
    // response timeout of the probe request, also the overall bound of one probe
    private Duration probeRequestTimeout = Duration.ofSeconds(10);
    private String probeUrl = "https://www.notion.so";
    private List<String> probeMarkers = new ArrayList<>(List.of("notion", "Notion"));
    private int maxRedirects = 10;
    private int concurrency = 10;
    private int minThreshold = 5;
    private Duration checkInterval = Duration.ofSeconds(30);
    private String protocol = "http";
    private String country = "us";
    private int maxRefillAttempts = 20;
    private Duration retryDelay = Duration.ofSeconds(1);
    private int overFetchMultiplier = 2;
    private boolean autoStart = true;
    private Cache cache = new Cache();
    private Provider provider = new Provider();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private boolean cacheFirst = true;
    }

    @Data
    public static class Provider {
        private String baseUrl = "https://proxy.doudouzi.me";
        private int maxPerRequest = 10;
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Fails fast on settings the refill loop cannot work with.
     */
    public void validate() {
        requirePositive("target-size", targetSize);
        requirePositive("batch-size", batchSize);
        requirePositive("concurrency", concurrency);
        requirePositive("max-refill-attempts", maxRefillAttempts);
        requirePositive("over-fetch-multiplier", overFetchMultiplier);
        requirePositive("max-redirects", maxRedirects);
        requirePositive("provider.max-per-request", provider.getMaxPerRequest());
        if (minThreshold < 0 || minThreshold >= targetSize) {
            throw new IllegalStateException(String.format(
                    "proxy-pool.min-threshold must be in [0, %d), got %d", targetSize, minThreshold));
        }
        if (probeUrl == null || probeUrl.isBlank()) {
            throw new IllegalStateException("proxy-pool.probe-url must be set");
        }
        if (probeMarkers == null || probeMarkers.isEmpty()) {
            throw new IllegalStateException("proxy-pool.probe-markers must contain at least one marker");
        }
        if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalStateException("proxy-pool.check-interval must be positive");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalStateException("proxy-pool." + name + " must be positive, got " + value);
        }
    }
}
