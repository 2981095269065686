package com.fleetmanager.analytics.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A refueling event. driverId stays null for refills not tied to a driver.
 */
@Entity
@Table(
    name = "fuel_logs",
    indexes = {
        @Index(name = "idx_fuel_log_driver_ts",  columnList = "driver_id, fuel_timestamp"),
        @Index(name = "idx_fuel_log_vehicle_ts", columnList = "vehicle_id, fuel_timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FuelLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "driver_id")
    private Long driverId;

    @Column(name = "fuel_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false)
    private Double liters;

    private Double cost;

    @Column(name = "odometer_km")
    private Double odometerKm;

}
