package com.navtracker.ingestion.adapter.debank;

import com.navtracker.ingestion.config.DebankProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * DeBank Pro OpenAPI client using WebClient. Every call carries the AccessKey header, waits for a
 * rate-limiter permit and is bounded by the configured timeout.
 */
@Slf4j
public class WebClientDebankClient implements DebankClient {

    private static final ParameterizedTypeReference<List<RawToken>> TOKEN_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<RawProtocol>> PROTOCOL_LIST = new ParameterizedTypeReference<>() {
    };

    private final WebClient webClient;
    private final DebankProperties properties;
    private final RateLimiter rateLimiter;

    public WebClientDebankClient(WebClient.Builder builder, DebankProperties properties, RateLimiter rateLimiter) {
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("AccessKey", properties.getAccessKey() == null ? "" : properties.getAccessKey())
                .build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Mono<List<RawToken>> fetchTokens(String walletAddress) {
        return permitted()
                .then(webClient.get()
                        .uri(uri -> uri.path("/user/token_list")
                                .queryParam("id", walletAddress)
                                .queryParam("is_all", false)
                                .build())
                        .retrieve()
                        .bodyToMono(TOKEN_LIST))
                .defaultIfEmpty(List.of())
                .timeout(timeout())
                .onErrorMap(e -> !(e instanceof UpstreamFetchException), e -> toUpstream("token_list", walletAddress, e));
    }

    @Override
    public Mono<List<RawProtocol>> fetchProtocols(String walletAddress) {
        return Flux.fromIterable(properties.getChains())
                .concatMap(chain -> fetchProtocols(walletAddress, chain))
                .concatMapIterable(list -> list)
                .collectList()
                .timeout(timeout())
                .onErrorMap(e -> !(e instanceof UpstreamFetchException), e -> toUpstream("all_complex_protocol_list", walletAddress, e));
    }

    private Mono<List<RawProtocol>> fetchProtocols(String walletAddress, String chain) {
        return permitted()
                .then(webClient.get()
                        .uri(uri -> uri.path("/user/all_complex_protocol_list")
                                .queryParam("id", walletAddress)
                                .queryParam("chain_ids", chain)
                                .build())
                        .retrieve()
                        .bodyToMono(PROTOCOL_LIST))
                .defaultIfEmpty(List.of())
                .doOnNext(list -> log.debug("DeBank {} protocols on {} for {}", list.size(), chain, walletAddress));
    }

    private Mono<Void> permitted() {
        return Mono.fromRunnable(() -> {
            if (!rateLimiter.acquirePermission()) {
                throw RequestNotPermitted.createRequestNotPermitted(rateLimiter);
            }
        });
    }

    private Duration timeout() {
        return Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds()));
    }

    private static UpstreamFetchException toUpstream(String endpoint, String walletAddress, Throwable e) {
        String reason;
        if (e instanceof TimeoutException) {
            reason = "timed out";
        } else if (e instanceof WebClientResponseException http) {
            reason = "HTTP " + http.getStatusCode().value();
        } else {
            reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
        return new UpstreamFetchException("DeBank " + endpoint + " failed for " + walletAddress + ": " + reason, e);
    }
}
