package com.address.resolution.infrastructure.cache;

import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GeocodeResponseCacheTest {

    @Test
    void testPutThenGet_ReturnsStoredBody() {
        GeocodeResponseCache cache = new GeocodeResponseCache(
                new ConcurrentMapCacheManager(GeocodeResponseCache.CACHE_NAME));

        cache.put("/maps/api/geocode/json?latlng=1.0,2.0", "{\"status\":\"OK\"}");

        assertThat(cache.get("/maps/api/geocode/json?latlng=1.0,2.0")).contains("{\"status\":\"OK\"}");
        assertThat(cache.get("/maps/api/geocode/json?latlng=3.0,4.0")).isEmpty();

        cache.clear();
        assertThat(cache.get("/maps/api/geocode/json?latlng=1.0,2.0")).isEmpty();
    }

    @Test
    void testCacheBackendFailure_IsIgnored() {
        CacheManager failing = mock(CacheManager.class);
        when(failing.getCache(GeocodeResponseCache.CACHE_NAME))
                .thenThrow(new IllegalStateException("Redis connection refused"));
        GeocodeResponseCache cache = new GeocodeResponseCache(failing);

        cache.put("key", "body");

        assertThat(cache.get("key")).isEmpty();
    }
}
