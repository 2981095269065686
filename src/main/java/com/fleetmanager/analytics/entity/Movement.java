package com.fleetmanager.analytics.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A vehicle journey driven by one driver.
 *
 * Created when the trip starts; endTime is filled in when it ends.
 * Driver and vehicle are kept as plain ids so analytics reads need no joins.
 *
 * DB Indexes:
 *  - idx_movement_driver_start  : driver-scoped window queries
 *  - idx_movement_vehicle_start : vehicle-scoped window queries
 */
@Entity
@Table(
    name = "movements",
    indexes = {
        @Index(name = "idx_movement_driver_start",  columnList = "driver_id, start_time"),
        @Index(name = "idx_movement_vehicle_start", columnList = "vehicle_id, start_time")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Movement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time")
    private LocalDateTime endTime;

    @Column(name = "distance_km", nullable = false)
    private Double distanceKm;

    @Column(name = "purpose_id")
    private Long purposeId;

    private String notes;

}
