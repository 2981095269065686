package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw totals for one entity over one period, with the ratios derived from them.
 * Ratios whose denominator is zero are reported as null.
 */
@Value
@Builder
public class MetricsSnapshot {

    double totalKm;
    double totalLiters;
    double totalCost;
    int tripCount;
    int refuelCount;
    int skippedRecords;

    public Double efficiencyLPer100Km() {
        return totalKm > 0 ? totalLiters * 100.0 / totalKm : null;
    }

    public Double kmPerLiter() {
        return totalLiters > 0 ? totalKm / totalLiters : null;
    }

    public Double costPerKm() {
        return totalKm > 0 ? totalCost / totalKm : null;
    }

    public Double avgLitersPerRefuel() {
        return refuelCount > 0 ? totalLiters / refuelCount : null;
    }

    public double avgTripDistanceKm() {
        return tripCount > 0 ? totalKm / tripCount : 0.0;
    }

    public boolean hasNoTrips() {
        return tripCount == 0;
    }
}
