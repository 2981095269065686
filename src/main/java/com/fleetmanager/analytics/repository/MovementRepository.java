package com.fleetmanager.analytics.repository;

import com.fleetmanager.analytics.entity.Movement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for Movement. Window queries are half-open on start_time: [from, to).
 */
@Repository
public interface MovementRepository extends JpaRepository<Movement, Long> {

    /**
     * Movements started inside the window, optionally narrowed to one driver and/or vehicle.
     * A null driverId or vehicleId matches every driver or vehicle.
     * Ordered by start time then id so repeated reads aggregate in the same order.
     */
    @Query("SELECT m FROM Movement m "
            + "WHERE m.startTime >= :from AND m.startTime < :to "
            + "AND (:driverId IS NULL OR m.driverId = :driverId) "
            + "AND (:vehicleId IS NULL OR m.vehicleId = :vehicleId) "
            + "ORDER BY m.startTime ASC, m.id ASC")
    List<Movement> findInWindow(@Param("driverId") Long driverId,
                                @Param("vehicleId") Long vehicleId,
                                @Param("from") LocalDateTime from,
                                @Param("to") LocalDateTime to);
}
