package com.fleetmanager.analytics.repository;

import com.fleetmanager.analytics.entity.Driver;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Driver entity
 */
@Repository
public interface DriverRepository extends JpaRepository<Driver, Long> {

    /** Driver roster in ascending id order; ranking tie-breaks rely on it being stable. */
    @Query("SELECT d.id FROM Driver d ORDER BY d.id ASC")
    List<Long> findAllIds();
}
