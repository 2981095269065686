package com.fleetmanager.analytics.repository;

import com.fleetmanager.analytics.entity.Vehicle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Vehicle entity
 */
@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    @Query("SELECT v.id FROM Vehicle v ORDER BY v.id ASC")
    List<Long> findAllIds();

    boolean existsByPlate(String plate);
}
