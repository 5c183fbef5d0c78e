package com.egress.bean;

import java.util.Objects;

/**
 * Identity of an egress proxy. Two proxies with the same host, port and credentials
 * are the same proxy no matter when or how they were validated.
 */
public record ProxyIdentity(String host, int port, String username, String password) {

    public ProxyIdentity {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range: " + port);
        }
    }

    public static ProxyIdentity of(String host, int port) {
        return new ProxyIdentity(host, port, null, null);
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    // removal is keyed by address only
    public boolean matchesAddress(String otherHost, int otherPort) {
        return port == otherPort && host.equals(otherHost);
    }

    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return hasCredentials() ? address() + ":" + username + ":" + password : address();
    }
}
