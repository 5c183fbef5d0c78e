package com.egress.service;

import com.egress.bean.ProxyPoolProperties;
import com.egress.proxy.ProxyPoolManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class PoolStartupService {

    private final ProxyPoolManager proxyPoolManager;
    private final ProxyPoolProperties props;

    /**
     * Fills the pool in the background so the application starts even when the provider is down.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startup() {
        if (!props.isAutoStart()) {
            log.info("proxy-pool.auto-start is off, pool waits for an explicit initialize");
            return;
        }

        log.info("=== Application Ready - Initializing Proxy Pool ===");
        proxyPoolManager.initialize()
                .subscribe(
                        result -> log.info("=== Proxy Pool Ready: {}/{} proxies ({} attempts) ===",
                                result.endSize(), result.targetSize(), result.attempts()),
                        e -> log.error("CRITICAL: Proxy pool initialization failed: {}", e.getMessage(), e));
    }
}
