package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trips and distance per movement purpose. A null purposeId groups trips recorded without one.
 */
@Value
@Builder
public class PurposeUsage {

    Long purposeId;
    int tripCount;
    double totalKm;
}
