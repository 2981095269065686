package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.config.CacheConfig;
import com.fleetmanager.analytics.entity.Driver;
import com.fleetmanager.analytics.entity.Vehicle;
import com.fleetmanager.analytics.repository.DriverRepository;
import com.fleetmanager.analytics.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Fleet roster reads wrapped with Spring Cache annotations.
 *
 * Kept in its own bean: @Cacheable works through the Spring proxy, and a
 * self-call inside the same bean would skip it.
 *
 *   READ  → @Cacheable  : rosters are served from Caffeine after the first load
 *   EVICT → @CacheEvict : fired whenever a driver or vehicle is registered
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheableDataService {

    private final DriverRepository  driverRepository;
    private final VehicleRepository vehicleRepository;

    /**
     * Driver ids, ascending. Read by every driver ranking and existence check.
     */
    @Cacheable(value = CacheConfig.CACHE_ROSTER, key = "'driver-ids'")
    public List<Long> getDriverIds() {
        log.debug("[CACHE MISS] driver roster — loading from DB");
        return List.copyOf(driverRepository.findAllIds());
    }

    /**
     * Vehicle ids, ascending.
     */
    @Cacheable(value = CacheConfig.CACHE_ROSTER, key = "'vehicle-ids'")
    public List<Long> getVehicleIds() {
        log.debug("[CACHE MISS] vehicle roster — loading from DB");
        return List.copyOf(vehicleRepository.findAllIds());
    }

    @Cacheable(value = CacheConfig.CACHE_FLEET, key = "'drivers'")
    public List<Driver> getDrivers() {
        log.debug("[CACHE MISS] drivers — loading from DB");
        return driverRepository.findAll();
    }

    @Cacheable(value = CacheConfig.CACHE_FLEET, key = "'vehicles'")
    public List<Vehicle> getVehicles() {
        log.debug("[CACHE MISS] vehicles — loading from DB");
        return vehicleRepository.findAll();
    }

    /**
     * Clears both caches so the next read reloads the fleet from the DB.
     */
    @Caching(evict = {
            @CacheEvict(value = CacheConfig.CACHE_ROSTER, allEntries = true),
            @CacheEvict(value = CacheConfig.CACHE_FLEET,  allEntries = true)
    })
    public void evictFleetCaches() {
        log.info("[CACHE EVICT] Fleet caches cleared — next read will reload from DB");
    }
}
