package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A single vehicle journey as handed to the analytics engine.
 * The end timestamp stays null while the trip is still open.
 */
@Value
@Builder
public class MovementRecord {

    Long id;
    Long vehicleId;
    Long driverId;
    LocalDateTime startTimestamp;
    LocalDateTime endTimestamp;
    double distanceKm;
    Long purposeId;
    String notes;

    public boolean isClosed() {
        return endTimestamp != null;
    }
}
