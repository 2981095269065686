package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregated performance of one vehicle over one period. Derived on demand, never persisted.
 */
@Value
@Builder
public class VehicleMetrics implements FleetMetrics {

    Long vehicleId;
    Period period;
    double totalKm;
    double totalLiters;
    double totalCost;
    int tripCount;
    Double efficiencyLPer100Km;
    double avgTripDistanceKm;
    Double kmPerLiter;
    Double costPerKm;
    int refuelCount;
    Double avgLitersPerRefuel;

    /** Drivers of the vehicle in the period, most active first, at most five. */
    List<UsageShare> driverUsage;

    List<PurposeUsage> purposeBreakdown;
    int skippedRecords;
    boolean empty;
}
