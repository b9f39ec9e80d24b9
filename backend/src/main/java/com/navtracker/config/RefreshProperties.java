package com.navtracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Wallet refresh fan-out. Documented in application.yml under navtracker.refresh.
 */
@ConfigurationProperties(prefix = "navtracker.refresh")
@Getter
@Setter
public class RefreshProperties {

    /**
     * Threads processing wallets of one or more refresh requests concurrently.
     */
    private int poolSize = 4;

    /**
     * Pending wallet tasks before the pool rejects new ones.
     */
    private int queueCapacity = 200;
}
