package com.egress.proxy;

import com.egress.bean.ProxyIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of validated proxies handed out round-robin.
 * The entry list and the cursor are guarded by this object's monitor, so every mutation
 * re-clamps the cursor atomically and snapshots never see a half-applied change.
 */
public class ProxyPool {

    private final List<ValidatedProxy> proxies = new ArrayList<>();
    private int cursor = 0;

    // next proxy for single-shot use; rotates over the current entries
    public synchronized Optional<ValidatedProxy> acquire() {
        if (proxies.isEmpty()) {
            return Optional.empty();
        }
        ValidatedProxy proxy = proxies.get(cursor);
        cursor = (cursor + 1) % proxies.size();
        return Optional.of(proxy);
    }

    public synchronized boolean insertIfAbsent(ValidatedProxy proxy) {
        if (contains(proxy.identity())) {
            return false;
        }
        proxies.add(proxy);
        return true;
    }

    public synchronized boolean contains(ProxyIdentity identity) {
        for (ValidatedProxy p : proxies) {
            if (p.identity().equals(identity)) {
                return true;
            }
        }
        return false;
    }

    public boolean remove(String host, int port) {
        return removeByAddress(host, port).isPresent();
    }

    /**
     * Remove the entry at host:port whatever its credentials.
     * @return the removed entry, empty if nothing matched
     */
    public synchronized Optional<ValidatedProxy> removeByAddress(String host, int port) {
        for (int i = 0; i < proxies.size(); i++) {
            ValidatedProxy p = proxies.get(i);
            if (p.identity().matchesAddress(host, port)) {
                proxies.remove(i);
                // entries after i shift left, keep the cursor on the same next proxy
                if (i < cursor) {
                    cursor--;
                }
                if (cursor >= proxies.size()) {
                    cursor = 0;
                }
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    public synchronized List<ValidatedProxy> snapshot() {
        return List.copyOf(proxies);
    }

    public synchronized int size() {
        return proxies.size();
    }

    synchronized int cursor() {
        return cursor;
    }
}
