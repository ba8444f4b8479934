package com.address.resolution.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.support.NoOpCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.List;

/**
 * Cache configuration for provider responses, selected by {@code app.cache.type}:
 * - simple (default): in-process Caffeine cache per instance, bounded by TTL and entry count
 * - redis: RedisCacheManager shared across console back-end instances, with TTL
 * - none: NoOpCacheManager, every lookup goes to the provider
 *
 * Values are raw JSON strings, so plain string serializers are enough for Redis.
 */
@Configuration
public class CacheConfig {

    @Value("${app.cache.ttl-seconds:600}")
    private long cacheTtlSeconds;

    @Value("${app.cache.max-entries:10000}")
    private long cacheMaxEntries;

    @Bean
    @ConditionalOnProperty(name = "app.cache.type", havingValue = "simple", matchIfMissing = true)
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(boundedCaffeine(Duration.ofSeconds(cacheTtlSeconds), cacheMaxEntries));
        cacheManager.setAllowNullValues(false);
        cacheManager.setCacheNames(List.of(GeocodeResponseCache.CACHE_NAME));
        return cacheManager;
    }

    static Caffeine<Object, Object> boundedCaffeine(Duration ttl, long maxEntries) {
        return Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries);
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.type", havingValue = "redis")
    public CacheManager redisCacheManager(RedisConnectionFactory redisConnectionFactory) {
        RedisCacheConfiguration cacheConfig = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(Duration.ofSeconds(cacheTtlSeconds))
            .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
            .disableCachingNullValues();

        return RedisCacheManager.builder(redisConnectionFactory)
            .cacheDefaults(cacheConfig)
            .withCacheConfiguration(GeocodeResponseCache.CACHE_NAME, cacheConfig)
            .build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.cache.type", havingValue = "none")
    public CacheManager noOpCacheManager() {
        return new NoOpCacheManager();
    }
}
