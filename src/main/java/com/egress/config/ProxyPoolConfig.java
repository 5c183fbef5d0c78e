package com.egress.config;

import com.egress.bean.ProxyPoolProperties;
import com.egress.cache.ValidationCache;
import com.egress.proxy.CandidateParser;
import com.egress.proxy.LoggingRefillObserver;
import com.egress.proxy.ProviderClient;
import com.egress.proxy.ProxyPool;
import com.egress.proxy.ProxyPoolManager;
import com.egress.proxy.ProxyValidator;
import com.egress.proxy.ProxyWebClientFactory;
import com.egress.proxy.RefillController;
import com.egress.proxy.RefillObserver;
import com.egress.proxy.ThresholdScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires the pool components. Everything below is a plain object so tests can build it by hand.
 */
@Configuration
@EnableConfigurationProperties(ProxyPoolProperties.class)
@Slf4j
public class ProxyPoolConfig {

    @Bean
    Clock proxyPoolClock() {
        return Clock.systemUTC();
    }

    @Bean
    CandidateParser candidateParser(ObjectMapper objectMapper) {
        return new CandidateParser(objectMapper);
    }

    @Bean
    ProviderClient providerClient(WebClient.Builder webClientBuilder, CandidateParser parser, ProxyPoolProperties props) {
        return new ProviderClient(webClientBuilder.build(), parser, props);
    }

    @Bean
    ProxyWebClientFactory proxyWebClientFactory(ProxyPoolProperties props) {
        return new ProxyWebClientFactory(props);
    }

    @Bean
    ProxyValidator proxyValidator(ProxyWebClientFactory clientFactory, ProxyPoolProperties props) {
        return new ProxyValidator(clientFactory, props);
    }

    @Bean
    ValidationCache validationCache(ProxyPoolProperties props, Clock proxyPoolClock) {
        return new ValidationCache(props.getCache().isEnabled(), props.getCache().getTtl(), proxyPoolClock);
    }

    @Bean
    ProxyPool proxyPool() {
        return new ProxyPool();
    }

    @Bean
    RefillObserver refillObserver() {
        return new LoggingRefillObserver();
    }

    @Bean
    RefillController refillController(ProxyPool pool,
                                      ValidationCache cache,
                                      ProviderClient provider,
                                      ProxyValidator validator,
                                      ProxyPoolProperties props,
                                      ObjectProvider<RefillObserver> observer,
                                      Clock proxyPoolClock) {
        return new RefillController(pool, cache, provider, validator, props,
                observer.getIfAvailable(() -> RefillObserver.NONE), proxyPoolClock);
    }

    @Bean
    ThresholdScheduler thresholdScheduler(ProxyPool pool,
                                          ValidationCache cache,
                                          RefillController refillController,
                                          ProxyPoolProperties props) {
        return new ThresholdScheduler(pool, cache, refillController,
                props.getMinThreshold(), props.getCheckInterval(), Schedulers.parallel());
    }

    @Bean
    ProxyPoolManager proxyPoolManager(ProxyPool pool,
                                      ValidationCache cache,
                                      ProviderClient provider,
                                      RefillController refillController,
                                      ThresholdScheduler scheduler,
                                      ProxyPoolProperties props) {
        props.validate();
        log.info("Proxy pool configured: target={}, batch={}, concurrency={}, probe={}",
                props.getTargetSize(), props.getBatchSize(), props.getConcurrency(), props.getProbeUrl());
        return new ProxyPoolManager(pool, cache, provider, refillController, scheduler, props);
    }
}
