package com.fleetmanager.analytics.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.*;

import java.time.LocalDateTime;

/**
 * DTO for recording a refueling. Zero or negative liters are rejected here,
 * so they never reach the analytics engine through this endpoint.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FuelRecordRequest {

    @NotNull(message = "Vehicle ID is required")
    private Long vehicleId;

    // optional: pump refills are not always tied to a driver
    private Long driverId;

    @NotNull(message = "Timestamp is required")
    private LocalDateTime timestamp;

    @NotNull(message = "Liters are required")
    @Positive(message = "Liters must be greater than zero")
    private Double liters;

    @PositiveOrZero(message = "Cost must not be negative")
    private Double cost;

    @PositiveOrZero(message = "Odometer must not be negative")
    private Double odometerKm;

}
