package com.fleetmanager.analytics.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Caching configuration using Caffeine.
 *
 *   fleetRoster  — driver and vehicle id lists. Every ranking and every
 *                  existence check reads one of them.
 *   fleetEntities — full driver / vehicle lists served by /api/fleet.
 *
 * Records (movements, fuel) are never cached: analytics must see every write.
 * Entries expire after the configured TTL and are evicted explicitly by
 * CacheableDataService.evictFleetCaches() when the fleet changes.
 *
 * The manager is transaction-aware: an eviction issued inside a transaction
 * runs after commit, so a roster read racing the registration cannot put the
 * pre-commit list back into the cache.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_ROSTER = "fleetRoster";

    public static final String CACHE_FLEET = "fleetEntities";

    @Value("${analytics.cache.ttl-minutes:60}")
    private int ttlMinutes;

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}', '{}', TTL: {} min",
                CACHE_ROSTER, CACHE_FLEET, ttlMinutes);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_ROSTER, ttlMinutes, 10),
                buildCache(CACHE_FLEET,  ttlMinutes, 10)
        ));
        manager.afterPropertiesSet();
        return new TransactionAwareCacheManagerProxy(manager);
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
