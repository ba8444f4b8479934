package com.address.resolution.infrastructure.cache;

import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CacheConfigTest {

    @Test
    void testSimpleCacheManager_IsBoundedCaffeineCache() {
        CacheConfig config = new CacheConfig();
        ReflectionTestUtils.setField(config, "cacheTtlSeconds", 60L);
        ReflectionTestUtils.setField(config, "cacheMaxEntries", 100L);

        CacheManager cacheManager = config.cacheManager();

        assertThat(cacheManager).isInstanceOf(CaffeineCacheManager.class);
        assertThat(cacheManager.getCacheNames()).containsExactly(GeocodeResponseCache.CACHE_NAME);
        assertThat(cacheManager.getCache(GeocodeResponseCache.CACHE_NAME)).isInstanceOf(CaffeineCache.class);
    }

    @Test
    void testSimpleCache_EntryExpiresAfterTtl() {
        AtomicLong nanos = new AtomicLong();
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(CacheConfig.boundedCaffeine(Duration.ofSeconds(60), 100).ticker(nanos::get));
        cacheManager.setCacheNames(List.of(GeocodeResponseCache.CACHE_NAME));
        GeocodeResponseCache cache = new GeocodeResponseCache(cacheManager);

        cache.put("/maps/api/geocode/json?address=Springfield", "{\"status\":\"OK\"}");
        assertThat(cache.get("/maps/api/geocode/json?address=Springfield")).isPresent();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(61));

        assertThat(cache.get("/maps/api/geocode/json?address=Springfield")).isEmpty();
    }

    @Test
    void testSimpleCache_EvictsBeyondMaxEntries() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(CacheConfig.boundedCaffeine(Duration.ofSeconds(60), 2).executor(Runnable::run));
        cacheManager.setCacheNames(List.of(GeocodeResponseCache.CACHE_NAME));
        GeocodeResponseCache cache = new GeocodeResponseCache(cacheManager);

        for (int i = 0; i < 10; i++) {
            cache.put("/maps/api/geocode/json?address=query-" + i, "{\"status\":\"OK\"}");
        }

        CaffeineCache caffeineCache = (CaffeineCache) cacheManager.getCache(GeocodeResponseCache.CACHE_NAME);
        caffeineCache.getNativeCache().cleanUp();
        assertThat(caffeineCache.getNativeCache().estimatedSize()).isLessThanOrEqualTo(2);
    }
}
