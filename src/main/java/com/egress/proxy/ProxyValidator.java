package com.egress.proxy;

import com.egress.bean.ProxyPoolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Probes a candidate by fetching the probe page through it.
 * A probe never errors: every failure is reported as {@code false}.
 */
@Slf4j
public class ProxyValidator {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8";

    private final ProxyWebClientFactory clientFactory;
    private final ProxyPoolProperties props;

    public ProxyValidator(ProxyWebClientFactory clientFactory, ProxyPoolProperties props) {
        this.clientFactory = clientFactory;
        this.props = props;
    }

    public Mono<Boolean> validate(Candidate candidate) {
        return validate(candidate, props.getProbeUrl(), props.getProbeRequestTimeout());
    }

    public Mono<Boolean> validate(Candidate candidate, String probeUrl, Duration timeout) {
        List<String> markers = props.getProbeMarkers();
        String address = candidate.getHost() + ":" + candidate.getPort();

        return Mono.defer(() -> clientFactory.build(candidate, timeout)
                        .get()
                        .uri(probeUrl)
                        .header(HttpHeaders.USER_AGENT, USER_AGENT)
                        .header(HttpHeaders.ACCEPT, ACCEPT)
                        .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5")
                        .exchangeToMono(response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> {
                                    int status = response.statusCode().value();
                                    boolean valid = status == 200 && containsMarker(body, markers);
                                    log.debug("Probe via {} -> status {}, valid={}", address, status, valid);
                                    return valid;
                                })))
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.debug("Probe via {} failed: {}", address, e.getClass().getSimpleName());
                    return Mono.just(false);
                })
                .defaultIfEmpty(false);
    }

    private static boolean containsMarker(String body, List<String> markers) {
        for (String marker : markers) {
            if (body.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
