package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregated performance of one driver over one period. Derived on demand, never persisted.
 */
@Value
@Builder
public class DriverMetrics implements FleetMetrics {

    Long driverId;
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

    /** Vehicles driven in the period, most used first, at most five. */
    List<UsageShare> vehicleUsage;

    List<PurposeUsage> purposeBreakdown;
    int skippedRecords;
    boolean empty;
}
