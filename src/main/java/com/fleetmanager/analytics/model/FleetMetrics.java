package com.fleetmanager.analytics.model;

import java.util.List;

/**
 * Fields shared by driver and vehicle metrics.
 */
public interface FleetMetrics {

    Period getPeriod();

    double getTotalKm();

    double getTotalLiters();

    double getTotalCost();

    int getTripCount();

    /** Liters per 100 km; null when no distance was driven. */
    Double getEfficiencyLPer100Km();

    double getAvgTripDistanceKm();

    Double getKmPerLiter();

    Double getCostPerKm();

    int getRefuelCount();

    Double getAvgLitersPerRefuel();

    List<PurposeUsage> getPurposeBreakdown();

    int getSkippedRecords();

    /** True when no valid movement fell in the period. */
    boolean isEmpty();
}
