package com.navtracker.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        ClockConfig.class
}, properties = {
        "navtracker.refresh.pool-size=3",
        "navtracker.refresh.queue-capacity=10",
        "navtracker.snapshot.reference-zone=Europe/Berlin"
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.REFRESH_EXECUTOR)
    ThreadPoolTaskExecutor refreshExecutor;

    @Autowired
    Clock clock;

    @Test
    @DisplayName("spot price cache is created and usable")
    void spotPriceCacheUsable() {
        Cache cache = cacheManager.getCache(CaffeineConfig.SPOT_PRICE_CACHE);
        assertThat(cache).isNotNull();

        cache.put("eth,usdc", "prices");
        assertThat(cache.get("eth,usdc").get()).isEqualTo("prices");
    }

    @Test
    @DisplayName("refresh executor is sized from navtracker.refresh")
    void refreshExecutorSized() {
        assertThat(refreshExecutor.getCorePoolSize()).isEqualTo(3);
        assertThat(refreshExecutor.getMaxPoolSize()).isEqualTo(3);
        assertThat(refreshExecutor.getThreadNamePrefix()).isEqualTo("refresh-");
    }

    @Test
    @DisplayName("reference clock uses the configured snapshot zone")
    void clockZone() {
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    }
}
