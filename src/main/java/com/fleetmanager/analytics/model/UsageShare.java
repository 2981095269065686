package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * How much a counterpart entity was used: a vehicle driven by a driver, or a driver of a vehicle.
 */
@Value
@Builder
public class UsageShare {

    Long entityId;
    int tripCount;
    double totalKm;
}
