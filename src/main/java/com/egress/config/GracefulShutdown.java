package com.egress.config;

import com.egress.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import jakarta.annotation.PreDestroy;

/**
 * Stops the pool's periodic check on shutdown
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GracefulShutdown {

    private final ProxyPoolManager proxyPoolManager;

    @PreDestroy
    public void shutdown() {
        log.info("Starting graceful shutdown...");

        try {
            // in-flight probes are bounded by their own timeout and finish on their own
            proxyPoolManager.stop();
            log.info("Graceful shutdown completed ({} proxies were pooled)", proxyPoolManager.size());
        } catch (Exception e) {
            log.error("Error during graceful shutdown", e);
        }
    }
}
