package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.model.EntityKind;
import com.fleetmanager.analytics.model.FuelRecord;
import com.fleetmanager.analytics.model.MetricsSnapshot;
import com.fleetmanager.analytics.model.MovementRecord;
import com.fleetmanager.analytics.model.PurposeUsage;
import com.fleetmanager.analytics.model.RecordDefect;
import com.fleetmanager.analytics.model.UsageShare;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Running totals for one entity. Not thread-safe; each engine call builds its own.
 *
 * Malformed records are counted and dropped. Open movements are dropped without
 * being counted: they are unfinished, not wrong.
 */
@Slf4j
final class MetricsAccumulator {

    static final int USAGE_LIMIT = 5;

    private final EntityKind kind;

    private double totalKm;
    private double totalLiters;
    private double totalCost;
    private int tripCount;
    private int refuelCount;
    private int skippedRecords;

    private final Map<Long, Tally> counterpartUsage = new HashMap<>();
    private final Map<Long, Tally> purposeUsage = new HashMap<>();

    MetricsAccumulator(EntityKind kind) {
        this.kind = kind;
    }

    void addMovement(MovementRecord movement) {
        Optional<RecordDefect> defect = RecordDefect.of(movement);
        if (defect.isPresent()) {
            skippedRecords++;
            log.warn("Skipping malformed movement #{} ({}) — start: {}, end: {}, distance: {}",
                    movement.getId(), defect.get(), movement.getStartTimestamp(),
                    movement.getEndTimestamp(), movement.getDistanceKm());
            return;
        }
        if (!movement.isClosed()) {
            log.debug("Movement #{} still open — excluded from totals", movement.getId());
            return;
        }

        double km = movement.getDistanceKm();
        totalKm += km;
        tripCount++;

        Long counterpart = kind.counterpartOf(movement);
        if (counterpart != null) {
            counterpartUsage.computeIfAbsent(counterpart, id -> new Tally()).add(km);
        }
        // HashMap takes the null key: trips without a purpose are grouped together
        purposeUsage.computeIfAbsent(movement.getPurposeId(), id -> new Tally()).add(km);
    }

    void addFuel(FuelRecord fuel) {
        Optional<RecordDefect> defect = RecordDefect.of(fuel);
        if (defect.isPresent()) {
            skippedRecords++;
            log.warn("Skipping malformed fuel record #{} ({}) — liters: {}, cost: {}",
                    fuel.getId(), defect.get(), fuel.getLiters(), fuel.getCost());
            return;
        }
        totalLiters += fuel.getLiters();
        totalCost += fuel.getCost();
        refuelCount++;
    }

    MetricsSnapshot snapshot() {
        return MetricsSnapshot.builder()
                .totalKm(totalKm)
                .totalLiters(totalLiters)
                .totalCost(totalCost)
                .tripCount(tripCount)
                .refuelCount(refuelCount)
                .skippedRecords(skippedRecords)
                .build();
    }

    int getSkippedRecords() {
        return skippedRecords;
    }

    /** Most used counterparts first: trip count desc, then km desc, then id asc. */
    List<UsageShare> usageShares() {
        return counterpartUsage.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<Long, Tally> e) -> e.getValue().trips, Comparator.reverseOrder())
                        .thenComparing(e -> e.getValue().km, Comparator.reverseOrder())
                        .thenComparing(e -> e.getKey()))
                .limit(USAGE_LIMIT)
                .map(e -> UsageShare.builder()
                        .entityId(e.getKey())
                        .tripCount(e.getValue().trips)
                        .totalKm(e.getValue().km)
                        .build())
                .toList();
    }

    /** Trip count desc, then purpose id asc with trips lacking a purpose last. */
    List<PurposeUsage> purposeBreakdown() {
        return purposeUsage.entrySet().stream()
                .sorted(Comparator.comparing((Map.Entry<Long, Tally> e) -> e.getValue().trips, Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(e -> PurposeUsage.builder()
                        .purposeId(e.getKey())
                        .tripCount(e.getValue().trips)
                        .totalKm(e.getValue().km)
                        .build())
                .toList();
    }

    private static final class Tally {
        private int trips;
        private double km;

        void add(double distanceKm) {
            trips++;
            km += distanceKm;
        }
    }
}
