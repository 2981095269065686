package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.model.DriverMetrics;
import com.fleetmanager.analytics.model.EntityKind;
import com.fleetmanager.analytics.model.FuelRecord;
import com.fleetmanager.analytics.model.MetricsSnapshot;
import com.fleetmanager.analytics.model.MonthlyBreakdown;
import com.fleetmanager.analytics.model.MonthlySummary;
import com.fleetmanager.analytics.model.MovementRecord;
import com.fleetmanager.analytics.model.Period;
import com.fleetmanager.analytics.model.Ranking;
import com.fleetmanager.analytics.model.RankingEntry;
import com.fleetmanager.analytics.model.RankingMetric;
import com.fleetmanager.analytics.model.VehicleMetrics;
import com.fleetmanager.analytics.store.RecordFilter;
import com.fleetmanager.analytics.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Driver and vehicle performance analytics.
 *
 * Every operation reads from the injected {@link RecordStore} and computes its
 * result from those records alone. The engine keeps no state between calls, so
 * concurrent calls need no coordination and repeated calls over unchanged
 * records return equal results.
 *
 * Per-record problems never fail a call: malformed records are left out and
 * counted in {@code skippedRecords}. The only hard failure is an invalid window
 * (start after end), raised before the store is read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsEngine {

    static final int MIN_YEAR = 1;
    static final int MAX_YEAR = 9999;

    private final RecordStore recordStore;

    /**
     * Aggregates one driver's movements and fuel records over [periodStart, periodEnd).
     *
     * When no valid movement falls in the window the result is zero-valued and
     * flagged {@code empty}; fuel recorded in the window is still reported.
     *
     * A record the store returns without a timestamp cannot be placed in time, so
     * it is counted as skipped by every window that receives it. Totals add up
     * across a partition of the period; {@code skippedRecords} may not.
     *
     * @throws com.fleetmanager.analytics.exception.InvalidWindowException if periodStart is after periodEnd
     */
    public DriverMetrics computeDriverMetrics(Long driverId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        Period period = Period.of(periodStart, periodEnd);
        log.info("Computing driver metrics — driver: {}, window: [{}, {})", driverId, periodStart, periodEnd);

        MetricsAccumulator acc = aggregate(EntityKind.DRIVER, driverId, period);
        MetricsSnapshot s = acc.snapshot();

        log.info("Driver #{} — trips: {}, km: {}, liters: {}, skipped: {}",
                driverId, s.getTripCount(), s.getTotalKm(), s.getTotalLiters(), s.getSkippedRecords());

        return DriverMetrics.builder()
                .driverId(driverId)
                .period(period)
                .totalKm(s.getTotalKm())
                .totalLiters(s.getTotalLiters())
                .totalCost(s.getTotalCost())
                .tripCount(s.getTripCount())
                .efficiencyLPer100Km(s.efficiencyLPer100Km())
                .avgTripDistanceKm(s.avgTripDistanceKm())
                .kmPerLiter(s.kmPerLiter())
                .costPerKm(s.costPerKm())
                .refuelCount(s.getRefuelCount())
                .avgLitersPerRefuel(s.avgLitersPerRefuel())
                .vehicleUsage(acc.usageShares())
                .purposeBreakdown(acc.purposeBreakdown())
                .skippedRecords(s.getSkippedRecords())
                .empty(s.hasNoTrips())
                .build();
    }

    /**
     * Vehicle counterpart of {@link #computeDriverMetrics}.
     */
    public VehicleMetrics computeVehicleMetrics(Long vehicleId, LocalDateTime periodStart, LocalDateTime periodEnd) {
        Period period = Period.of(periodStart, periodEnd);
        log.info("Computing vehicle metrics — vehicle: {}, window: [{}, {})", vehicleId, periodStart, periodEnd);

        MetricsAccumulator acc = aggregate(EntityKind.VEHICLE, vehicleId, period);
        MetricsSnapshot s = acc.snapshot();

        log.info("Vehicle #{} — trips: {}, km: {}, liters: {}, skipped: {}",
                vehicleId, s.getTripCount(), s.getTotalKm(), s.getTotalLiters(), s.getSkippedRecords());

        return VehicleMetrics.builder()
                .vehicleId(vehicleId)
                .period(period)
                .totalKm(s.getTotalKm())
                .totalLiters(s.getTotalLiters())
                .totalCost(s.getTotalCost())
                .tripCount(s.getTripCount())
                .efficiencyLPer100Km(s.efficiencyLPer100Km())
                .avgTripDistanceKm(s.avgTripDistanceKm())
                .kmPerLiter(s.kmPerLiter())
                .costPerKm(s.costPerKm())
                .refuelCount(s.getRefuelCount())
                .avgLitersPerRefuel(s.avgLitersPerRefuel())
                .driverUsage(acc.usageShares())
                .purposeBreakdown(acc.purposeBreakdown())
                .skippedRecords(s.getSkippedRecords())
                .empty(s.hasNoTrips())
                .build();
    }

    /**
     * Ranks every driver on the roster, plus any driver appearing in the period's records.
     *
     * Efficiency ranks ascending, the other metrics descending. Equal values are
     * ordered by driver id ascending. Drivers whose metric is undefined (efficiency
     * with zero km) come last, flagged insufficientData, with no value.
     */
    public Ranking rankDrivers(LocalDateTime periodStart, LocalDateTime periodEnd, RankingMetric metric) {
        return rank(EntityKind.DRIVER, Period.of(periodStart, periodEnd), metric);
    }

    /**
     * Vehicle counterpart of {@link #rankDrivers}.
     */
    public Ranking rankVehicles(LocalDateTime periodStart, LocalDateTime periodEnd, RankingMetric metric) {
        return rank(EntityKind.VEHICLE, Period.of(periodStart, periodEnd), metric);
    }

    /**
     * Twelve calendar-month summaries for one driver or vehicle, January first.
     * Months without records are present and zero-valued.
     *
     * Records without a timestamp belong to no month; they are counted only in the
     * breakdown's own {@code skippedRecords}, which also sums every month's skips.
     *
     * @throws IllegalArgumentException if year is outside 1..9999
     */
    public MonthlyBreakdown monthlyBreakdown(Long entityId, EntityKind entityKind, int year) {
        Objects.requireNonNull(entityKind, "entityKind");
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException(
                    "Year must be between " + MIN_YEAR + " and " + MAX_YEAR + ". Received: " + year);
        }
        log.info("Computing monthly breakdown — {} #{}, year: {}", entityKind, entityId, year);

        Period yearPeriod = Period.ofYear(year);
        RecordFilter filter = RecordFilter.forEntity(entityKind, entityId, yearPeriod);

        MetricsAccumulator[] months = new MetricsAccumulator[12];
        int undated = 0;
        for (int i = 0; i < months.length; i++) {
            months[i] = new MetricsAccumulator(entityKind);
        }

        for (MovementRecord m : recordStore.fetchMovements(filter)) {
            if (!Objects.equals(entityKind.idOf(m), entityId)) {
                continue;
            }
            if (m.getStartTimestamp() == null) {
                log.warn("Skipping movement #{} (MISSING_TIMESTAMP) — cannot be placed in a month", m.getId());
                undated++;
                continue;
            }
            if (yearPeriod.contains(m.getStartTimestamp())) {
                months[m.getStartTimestamp().getMonthValue() - 1].addMovement(m);
            }
        }
        for (FuelRecord f : recordStore.fetchFuelRecords(filter)) {
            if (!Objects.equals(entityKind.idOf(f), entityId)) {
                continue;
            }
            if (f.getTimestamp() == null) {
                log.warn("Skipping fuel record #{} (MISSING_TIMESTAMP) — cannot be placed in a month", f.getId());
                undated++;
                continue;
            }
            if (yearPeriod.contains(f.getTimestamp())) {
                months[f.getTimestamp().getMonthValue() - 1].addFuel(f);
            }
        }

        List<MonthlySummary> summaries = new ArrayList<>(12);
        int skipped = undated;
        for (int i = 0; i < months.length; i++) {
            MetricsSnapshot s = months[i].snapshot();
            skipped += s.getSkippedRecords();
            summaries.add(MonthlySummary.builder()
                    .month(YearMonth.of(year, i + 1))
                    .totalKm(s.getTotalKm())
                    .totalLiters(s.getTotalLiters())
                    .totalCost(s.getTotalCost())
                    .tripCount(s.getTripCount())
                    .efficiencyLPer100Km(s.efficiencyLPer100Km())
                    .skippedRecords(s.getSkippedRecords())
                    .build());
        }

        return MonthlyBreakdown.builder()
                .entityId(entityId)
                .kind(entityKind)
                .year(year)
                .months(List.copyOf(summaries))
                .skippedRecords(skipped)
                .build();
    }

    private MetricsAccumulator aggregate(EntityKind kind, Long entityId, Period period) {
        RecordFilter filter = RecordFilter.forEntity(kind, entityId, period);
        MetricsAccumulator acc = new MetricsAccumulator(kind);

        for (MovementRecord m : recordStore.fetchMovements(filter)) {
            if (Objects.equals(kind.idOf(m), entityId) && inWindow(period, m.getStartTimestamp())) {
                acc.addMovement(m);
            } else {
                log.debug("Movement #{} outside {} #{} / window — ignored", m.getId(), kind, entityId);
            }
        }
        for (FuelRecord f : recordStore.fetchFuelRecords(filter)) {
            if (Objects.equals(kind.idOf(f), entityId) && inWindow(period, f.getTimestamp())) {
                acc.addFuel(f);
            } else {
                log.debug("Fuel record #{} outside {} #{} / window — ignored", f.getId(), kind, entityId);
            }
        }
        return acc;
    }

    private Ranking rank(EntityKind kind, Period period, RankingMetric metric) {
        Objects.requireNonNull(metric, "metric");
        log.info("Ranking {}s by {} — window: [{}, {})", kind, metric.getParamName(), period.getStart(), period.getEnd());

        // TreeMap keeps iteration in id order, independent of record order
        Map<Long, MetricsAccumulator> byEntity = new TreeMap<>();
        List<Long> roster = kind == EntityKind.DRIVER ? recordStore.fetchDriverIds() : recordStore.fetchVehicleIds();
        for (Long id : roster) {
            if (id != null) {
                byEntity.put(id, new MetricsAccumulator(kind));
            }
        }

        RecordFilter filter = RecordFilter.forPeriod(period);
        for (MovementRecord m : recordStore.fetchMovements(filter)) {
            Long id = kind.idOf(m);
            if (id == null || !inWindow(period, m.getStartTimestamp())) {
                log.debug("Movement #{} not attributable to a {} in window — ignored", m.getId(), kind);
                continue;
            }
            byEntity.computeIfAbsent(id, k -> new MetricsAccumulator(kind)).addMovement(m);
        }
        for (FuelRecord f : recordStore.fetchFuelRecords(filter)) {
            Long id = kind.idOf(f);
            if (id == null || !inWindow(period, f.getTimestamp())) {
                log.debug("Fuel record #{} not attributable to a {} in window — ignored", f.getId(), kind);
                continue;
            }
            byEntity.computeIfAbsent(id, k -> new MetricsAccumulator(kind)).addFuel(f);
        }

        List<Scored> scored = new ArrayList<>(byEntity.size());
        int skipped = 0;
        for (Map.Entry<Long, MetricsAccumulator> e : byEntity.entrySet()) {
            scored.add(new Scored(e.getKey(), metric.valueOf(e.getValue().snapshot())));
            skipped += e.getValue().getSkippedRecords();
        }
        scored.sort(rankingOrder(metric));

        List<RankingEntry> entries = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored s = scored.get(i);
            entries.add(RankingEntry.builder()
                    .position(i + 1)
                    .entityId(s.getId())
                    .value(s.getValue())
                    .insufficientData(s.getValue() == null)
                    .build());
        }

        log.info("Ranked {} {}(s) by {} — skipped records: {}", entries.size(), kind, metric.getParamName(), skipped);
        return Ranking.builder()
                .kind(kind)
                .metric(metric)
                .period(period)
                .entries(List.copyOf(entries))
                .skippedRecords(skipped)
                .build();
    }

    /** Defined values first in metric direction, undefined last, id ascending on ties. */
    static Comparator<Scored> rankingOrder(RankingMetric metric) {
        Comparator<Double> direction = metric.isAscending()
                ? Comparator.<Double>naturalOrder()
                : Comparator.<Double>reverseOrder();
        return Comparator.comparing((Scored s) -> s.getValue() == null)
                .thenComparing(Scored::getValue, Comparator.nullsLast(direction))
                .thenComparing(Scored::getId);
    }

    // A record without a timestamp is handed on so the accumulator can count it as malformed;
    // it adds to skippedRecords only, never to totals
    private static boolean inWindow(Period period, LocalDateTime timestamp) {
        return timestamp == null || period.contains(timestamp);
    }

    @Value
    static class Scored {
        Long id;
        Double value;
    }
}
