package com.address.resolution.infrastructure.cache;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Test cache configuration using in-memory ConcurrentMapCacheManager.
 * Keeps tests independent of the configured cache type, Redis included.
 */
@TestConfiguration
public class TestCacheConfig {

    @Bean
    @Primary
    public CacheManager testCacheManager() {
        return new ConcurrentMapCacheManager(GeocodeResponseCache.CACHE_NAME);
    }
}
