package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.model.DriverMetrics;
import com.fleetmanager.analytics.model.Period;
import com.fleetmanager.analytics.store.RecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fleet-wide driver summary.
 *
 * Each driver's metrics are computed independently on the "reportTaskExecutor"
 * pool; the engine is stateless, so the calls need no coordination.
 */
@Service
@Slf4j
public class FleetReportService {

    private final AnalyticsEngine analyticsEngine;
    private final RecordStore recordStore;
    private final Executor reportTaskExecutor;

    public FleetReportService(AnalyticsEngine analyticsEngine,
                              RecordStore recordStore,
                              @Qualifier("reportTaskExecutor") Executor reportTaskExecutor) {
        this.analyticsEngine = analyticsEngine;
        this.recordStore = recordStore;
        this.reportTaskExecutor = reportTaskExecutor;
    }

    /**
     * Metrics for every registered driver, highest total km first, driver id ascending on ties.
     *
     * @throws com.fleetmanager.analytics.exception.InvalidWindowException if periodStart is after periodEnd
     */
    public List<DriverMetrics> summarizeDrivers(LocalDateTime periodStart, LocalDateTime periodEnd) {
        // fail before fanning out
        Period.of(periodStart, periodEnd);

        List<Long> driverIds = recordStore.fetchDriverIds();
        log.info("Fleet summary started — {} driver(s), window: [{}, {})", driverIds.size(), periodStart, periodEnd);

        List<CompletableFuture<DriverMetrics>> futures = driverIds.stream()
                .map(id -> CompletableFuture.supplyAsync(
                        () -> analyticsEngine.computeDriverMetrics(id, periodStart, periodEnd), reportTaskExecutor))
                .toList();

        List<DriverMetrics> summary = futures.stream()
                .map(FleetReportService::await)
                .sorted(Comparator.comparingDouble(DriverMetrics::getTotalKm).reversed()
                        .thenComparing(DriverMetrics::getDriverId))
                .toList();

        int skipped = summary.stream().mapToInt(DriverMetrics::getSkippedRecords).sum();
        log.info("Fleet summary complete — drivers: {}, skipped records: {}", summary.size(), skipped);
        return summary;
    }

    private static DriverMetrics await(CompletableFuture<DriverMetrics> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
