package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;

/**
 * Totals for a single calendar month. Months without records are zero-valued.
 */
@Value
@Builder
public class MonthlySummary {

    YearMonth month;
    double totalKm;
    double totalLiters;
    double totalCost;
    int tripCount;
    Double efficiencyLPer100Km;
    int skippedRecords;
}
