package com.address.resolution.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Raw provider response bodies keyed by request (path and query, API key excluded).
 *
 * Purely a latency optimization: entries may be evicted or the whole cache dropped at any
 * time, and cache failures (e.g., Redis connection errors) never fail a lookup.
 */
@Component
public class GeocodeResponseCache {

    public static final String CACHE_NAME = "geocodeResponses";

    private static final Logger logger = LoggerFactory.getLogger(GeocodeResponseCache.class);

    private final CacheManager cacheManager;

    public GeocodeResponseCache(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    public Optional<String> get(String key) {
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                Cache.ValueWrapper wrapper = cache.get(key);
                if (wrapper != null && wrapper.get() instanceof String body) {
                    logger.debug("Geocode cache hit for key: {}", key);
                    return Optional.of(body);
                }
            }
        } catch (Exception e) {
            logger.warn("Failed to read geocode cache, continuing without cache: {}", e.getMessage());
        }
        return Optional.empty();
    }

    public void put(String key, String body) {
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                cache.put(key, body);
                logger.debug("Geocode cache populated for key: {}", key);
            }
        } catch (Exception e) {
            logger.warn("Failed to populate geocode cache, continuing without cache: {}", e.getMessage());
        }
    }

    /**
     * Drop every cached response.
     */
    public void clear() {
        try {
            Cache cache = cacheManager.getCache(CACHE_NAME);
            if (cache != null) {
                cache.clear();
            }
        } catch (Exception e) {
            logger.warn("Failed to clear geocode cache: {}", e.getMessage());
        }
    }
}
