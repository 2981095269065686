package com.fleetmanager.analytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Twelve monthly summaries, January to December, for one driver or vehicle.
 */
@Value
@Builder
public class MonthlyBreakdown {

    Long entityId;
    EntityKind kind;
    int year;
    List<MonthlySummary> months;

    /** Every month's skipped records plus those with no timestamp to place them by. */
    int skippedRecords;
}
