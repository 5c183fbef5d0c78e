package com.egress.proxy;

import com.egress.bean.ProxyIdentity;
import lombok.Builder;
import lombok.Value;

/**
 * An unvalidated proxy as returned by the provider.
 */
@Value
@Builder
public class Candidate {
    String host;
    int port;
    String username;
    String password;

    public ProxyIdentity identity() {
        return new ProxyIdentity(host, port, username, password);
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    public static Candidate from(ProxyIdentity identity) {
        return Candidate.builder()
                .host(identity.host())
                .port(identity.port())
                .username(identity.username())
                .password(identity.password())
                .build();
    }
}
