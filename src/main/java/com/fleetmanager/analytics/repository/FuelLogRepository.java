package com.fleetmanager.analytics.repository;

import com.fleetmanager.analytics.entity.FuelLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for FuelLog. Window queries are half-open on the fill timestamp.
 */
@Repository
public interface FuelLogRepository extends JpaRepository<FuelLog, Long> {

    @Query("SELECT f FROM FuelLog f "
            + "WHERE f.timestamp >= :from AND f.timestamp < :to "
            + "AND (:driverId IS NULL OR f.driverId = :driverId) "
            + "AND (:vehicleId IS NULL OR f.vehicleId = :vehicleId) "
            + "ORDER BY f.timestamp ASC, f.id ASC")
    List<FuelLog> findInWindow(@Param("driverId") Long driverId,
                               @Param("vehicleId") Long vehicleId,
                               @Param("from") LocalDateTime from,
                               @Param("to") LocalDateTime to);
}
