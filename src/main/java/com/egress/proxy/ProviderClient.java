package com.egress.proxy;

import com.egress.bean.ProxyCountry;
import com.egress.bean.ProxyPoolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fetches candidate batches from the proxy provider.
 * Failures of any kind come back as an empty batch so the refill loop can simply retry.
 */
@Slf4j
public class ProviderClient {

    private static final String RANDOM_PATH = "/random/{country}?number={number}&protocol={protocol}&type=json";

    private final WebClient webClient;
    private final CandidateParser parser;
    private final ProxyPoolProperties props;
    private final AtomicReference<ProxyCountry> country;

    public ProviderClient(WebClient webClient, CandidateParser parser, ProxyPoolProperties props) {
        this.webClient = webClient;
        this.parser = parser;
        this.props = props;
        this.country = new AtomicReference<>(ProxyCountry.fromCode(props.getCountry()));
    }

    /**
     * Fetch up to {@code requested} candidates for the current country.
     * The provider serves at most {@code provider.max-per-request} per call, larger requests are capped.
     * @param requested number of candidates the caller would like
     * @return parsed candidates, possibly empty, never an error
     */
    public Mono<List<Candidate>> fetchCandidates(int requested) {
        int number = Math.max(1, Math.min(requested, props.getProvider().getMaxPerRequest()));
        ProxyCountry selected = country.get();
        String protocol = props.getProtocol();
        String url = props.getProvider().getBaseUrl() + RANDOM_PATH;

        return Mono.defer(() -> {
                    log.debug("Requesting {} candidates from provider (country={}, protocol={})",
                            number, selected.code(), protocol);
                    return webClient.get()
                            .uri(url, selected.code(), number, protocol)
                            .header(HttpHeaders.ACCEPT, MediaType.ALL_VALUE)
                            .retrieve()
                            .bodyToMono(String.class);
                })
                .timeout(props.getProvider().getTimeout())
                .map(parser::parseBatch)
                .doOnNext(candidates -> log.debug("Provider returned {} candidates", candidates.size()))
                .onErrorResume(WebClientResponseException.class, e -> {
                    log.warn("Provider responded {} for country {}: {}",
                            e.getStatusCode().value(), selected.code(), e.getMessage());
                    return Mono.just(List.of());
                })
                .onErrorResume(e -> {
                    log.error("Failed to fetch candidates from provider: {}", e.toString());
                    return Mono.just(List.of());
                })
                .defaultIfEmpty(List.of());
    }

    public void setCountry(ProxyCountry selected) {
        ProxyCountry previous = country.getAndSet(selected);
        if (previous != selected) {
            log.info("Provider country changed {} -> {}", previous.code(), selected.code());
        }
    }

    public ProxyCountry getCountry() {
        return country.get();
    }
}
