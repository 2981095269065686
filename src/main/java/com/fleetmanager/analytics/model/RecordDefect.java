package com.fleetmanager.analytics.model;

import java.util.Optional;

/**
 * Reasons a record is excluded from aggregation and counted as skipped.
 */
public enum RecordDefect {

    MISSING_TIMESTAMP,
    END_BEFORE_START,
    NEGATIVE_DISTANCE,
    NON_FINITE_DISTANCE,
    NON_POSITIVE_LITERS,
    NEGATIVE_COST;

    /** Open movements are not defective; only the closed part of the record is checked. */
    public static Optional<RecordDefect> of(MovementRecord movement) {
        if (movement.getStartTimestamp() == null) {
            return Optional.of(MISSING_TIMESTAMP);
        }
        if (movement.isClosed() && movement.getEndTimestamp().isBefore(movement.getStartTimestamp())) {
            return Optional.of(END_BEFORE_START);
        }
        if (!Double.isFinite(movement.getDistanceKm())) {
            return Optional.of(NON_FINITE_DISTANCE);
        }
        if (movement.getDistanceKm() < 0) {
            return Optional.of(NEGATIVE_DISTANCE);
        }
        return Optional.empty();
    }

    public static Optional<RecordDefect> of(FuelRecord fuel) {
        if (fuel.getTimestamp() == null) {
            return Optional.of(MISSING_TIMESTAMP);
        }
        // NaN fails the comparison as well
        if (!(fuel.getLiters() > 0) || Double.isInfinite(fuel.getLiters())) {
            return Optional.of(NON_POSITIVE_LITERS);
        }
        if (fuel.getCost() < 0 || !Double.isFinite(fuel.getCost())) {
            return Optional.of(NEGATIVE_COST);
        }
        return Optional.empty();
    }
}
