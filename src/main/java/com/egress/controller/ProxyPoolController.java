package com.egress.controller;

import com.egress.exception.ProxyPoolExhaustedException;
import com.egress.proxy.PoolStats;
import com.egress.proxy.ProxyPoolManager;
import com.egress.proxy.ValidatedProxy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Admin API over the proxy pool
 */
@RestController
@RequestMapping("/api/admin/proxies")
@RequiredArgsConstructor
@Slf4j
public class ProxyPoolController {

    private final ProxyPoolManager proxyPoolManager;

    /**
     * All pooled proxies in round-robin order, credentials masked
     * GET /api/admin/proxies
     */
    @GetMapping
    public ResponseEntity<List<ProxyView>> listProxies() {
        return ResponseEntity.ok(proxyPoolManager.snapshot().stream()
                .map(ProxyView::of)
                .toList());
    }

    /**
     * Next proxy in rotation, 503 when the pool is empty
     * GET /api/admin/proxies/next
     */
    @GetMapping("/next")
    public ResponseEntity<ProxyView> nextProxy() {
        ValidatedProxy proxy = proxyPoolManager.acquire()
                .orElseThrow(() -> new ProxyPoolExhaustedException(
                        proxyPoolManager.size(), proxyPoolManager.stats().targetSize()));
        return ResponseEntity.ok(ProxyView.of(proxy));
    }

    /**
     * Report a bad proxy
     * DELETE /api/admin/proxies/{host}/{port}
     */
    @DeleteMapping("/{host}/{port}")
    public ResponseEntity<Map<String, Object>> removeProxy(@PathVariable String host, @PathVariable int port) {
        boolean removed = proxyPoolManager.remove(host, port);
        log.info("Removal requested for {}:{} (removed={})", host, port, removed);
        return ResponseEntity.ok(Map.of(
                "removed", removed,
                "size", proxyPoolManager.size()
        ));
    }

    /**
     * PUT /api/admin/proxies/country/{code}
     */
    @PutMapping("/country/{code}")
    public ResponseEntity<Map<String, Object>> setCountry(@PathVariable String code) {
        proxyPoolManager.setCountry(code);
        return ResponseEntity.ok(Map.of("country", proxyPoolManager.getCountry().code()));
    }

    /**
     * Start a refill in the background; a no-op if one is already running
     * POST /api/admin/proxies/refill
     */
    @PostMapping("/refill")
    public ResponseEntity<Map<String, Object>> triggerRefill() {
        boolean alreadyRunning = proxyPoolManager.isRefilling();
        if (!alreadyRunning) {
            proxyPoolManager.refill()
                    .subscribe(result -> { },
                            e -> log.error("Manual refill failed: {}", e.getMessage(), e));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "alreadyRunning", alreadyRunning,
                "size", proxyPoolManager.size()
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<PoolStats> stats() {
        return ResponseEntity.ok(proxyPoolManager.stats());
    }

    public record ProxyView(
            String host,
            int port,
            String protocol,
            boolean authenticated,
            String uri,
            Instant addedAt
    ) {
        static ProxyView of(ValidatedProxy proxy) {
            boolean authenticated = proxy.identity().hasCredentials();
            String uri = authenticated
                    ? proxy.protocol() + "://***:***@" + proxy.identity().address()
                    : proxy.uri();
            return new ProxyView(proxy.host(), proxy.port(), proxy.protocol(), authenticated, uri, proxy.addedAt());
        }
    }
}
