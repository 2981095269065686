package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A refueling event. The driver and odometer reading are optional.
 */
@Value
@Builder
public class FuelRecord {

    Long id;
    Long vehicleId;
    Long driverId;
    LocalDateTime timestamp;
    double liters;
    double cost;
    Double odometerAtFill;
}
