package com.navtracker.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Upstream aggregator (DeBank Pro OpenAPI). Documented in application.yml under navtracker.debank.
 */
@ConfigurationProperties(prefix = "navtracker.debank")
@Getter
@Setter
public class DebankProperties {

    /**
     * API base URL.
     */
    private String baseUrl = "https://pro-openapi.debank.com/v1";

    /**
     * Value of the AccessKey header. Usually injected from the DEBANK_API_KEY environment variable.
     */
    private String accessKey;

    /**
     * Chains queried for protocol positions, in this order.
     */
    private List<String> chains = List.of("eth", "bsc", "arb", "matic", "base", "op");

    /**
     * Timeout in seconds for one upstream call (all chains for protocols).
     */
    private int timeoutSeconds = 10;

    /**
     * Requests per second allowed towards the aggregator across all wallets.
     */
    private int maxRequestsPerSecond = 20;

    /**
     * How long in milliseconds a call waits for a rate-limiter permit before failing.
     */
    private long limiterTimeoutMs = 2_000;
}
