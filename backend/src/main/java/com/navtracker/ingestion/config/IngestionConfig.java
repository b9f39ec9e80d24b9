package com.navtracker.ingestion.config;

import com.navtracker.ingestion.adapter.debank.DebankClient;
import com.navtracker.ingestion.adapter.debank.WebClientDebankClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Upstream adapters: DeBank client behind a shared Resilience4j rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ DebankProperties.class, PricingProperties.class, SpamTokenProperties.class })
public class IngestionConfig {

    @Bean(name = "debankRateLimiter")
    public RateLimiter debankRateLimiter(DebankProperties debankProperties) {
        int rps = Math.max(1, debankProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, debankProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("debank", config);
    }

    @Bean
    public DebankClient debankClient(WebClient.Builder webClientBuilder,
                                     DebankProperties debankProperties,
                                     @Qualifier("debankRateLimiter") RateLimiter debankRateLimiter) {
        return new WebClientDebankClient(webClientBuilder, debankProperties, debankRateLimiter);
    }
}
