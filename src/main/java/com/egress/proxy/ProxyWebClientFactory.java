package com.egress.proxy;

import com.egress.bean.ProxyPoolProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.transport.ProxyProvider;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Builds one-off WebClients that route through a single candidate proxy.
 */
public class ProxyWebClientFactory {

    private static final int MAX_BUFFER_SIZE = 2 * 1024 * 1024; // 2MB, probe pages only

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(
            HttpResponseStatus.MOVED_PERMANENTLY.code(),
            HttpResponseStatus.FOUND.code(),
            HttpResponseStatus.SEE_OTHER.code(),
            HttpResponseStatus.TEMPORARY_REDIRECT.code(),
            HttpResponseStatus.PERMANENT_REDIRECT.code());

    private final ProxyPoolProperties props;

    public ProxyWebClientFactory(ProxyPoolProperties props) {
        this.props = props;
    }

    public WebClient build(Candidate candidate) {
        return build(candidate, props.getProbeRequestTimeout());
    }

    /**
     * @param responseTimeout how long to wait for the probe response once connected
     */
    public WebClient build(Candidate candidate, Duration responseTimeout) {
        int maxRedirects = props.getMaxRedirects();
        long connectTimeoutMs = props.getValidationTimeout().toMillis();

        // No pooling: a probe connection is never reused for another candidate
        HttpClient http = HttpClient.newConnection()
                .compress(true)
                .followRedirect((req, res) ->
                        followsRedirect(res.status().code(), req.redirectedFrom().length, maxRedirects))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeoutMs)
                .responseTimeout(responseTimeout)
                .proxy(spec -> {
                    ProxyProvider.Builder builder = spec
                            .type(proxyType(props.getProtocol()))
                            .host(candidate.getHost())
                            .port(candidate.getPort())
                            .connectTimeoutMillis(connectTimeoutMs);
                    if (candidate.hasCredentials()) {
                        builder.username(candidate.getUsername())
                                .password(u -> candidate.getPassword());
                    }
                });

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_BUFFER_SIZE))
                        .build())
                .build();
    }

    static boolean followsRedirect(int status, int priorHops, int maxRedirects) {
        return REDIRECT_STATUSES.contains(status) && priorHops < maxRedirects;
    }

    static ProxyProvider.Proxy proxyType(String protocol) {
        String p = protocol == null ? "http" : protocol.toLowerCase(Locale.ROOT);
        return switch (p) {
            case "socks4" -> ProxyProvider.Proxy.SOCKS4;
            case "socks5", "socks" -> ProxyProvider.Proxy.SOCKS5;
            case "http", "https" -> ProxyProvider.Proxy.HTTP;
            default -> throw new IllegalArgumentException("Unsupported proxy protocol: " + protocol);
        };
    }
}
