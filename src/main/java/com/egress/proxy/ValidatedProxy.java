package com.egress.proxy;

import com.egress.bean.ProxyIdentity;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * A proxy that passed a live probe. Equality follows the identity only.
 */
public record ValidatedProxy(ProxyIdentity identity, String protocol, String uri, Instant addedAt) {

    public static ValidatedProxy of(Candidate candidate, String protocol, Instant addedAt) {
        ProxyIdentity identity = candidate.identity();
        UriComponentsBuilder uri = UriComponentsBuilder.newInstance()
                .scheme(protocol)
                .host(identity.host())
                .port(identity.port());
        if (identity.hasCredentials()) {
            // reserved characters in credentials must not leak into the authority
            uri.userInfo(UriUtils.encode(identity.username(), StandardCharsets.UTF_8)
                    + ":" + UriUtils.encode(identity.password(), StandardCharsets.UTF_8));
        }
        return new ValidatedProxy(identity, protocol, uri.build().toUriString(), addedAt);
    }

    public String host() {
        return identity.host();
    }

    public int port() {
        return identity.port();
    }

    public String username() {
        return identity.username();
    }

    public String password() {
        return identity.password();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidatedProxy other && identity.equals(other.identity);
    }

    @Override
    public int hashCode() {
        return identity.hashCode();
    }
}
