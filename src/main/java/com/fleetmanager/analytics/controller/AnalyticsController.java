package com.fleetmanager.analytics.controller;

import com.fleetmanager.analytics.dto.ApiResponse;
import com.fleetmanager.analytics.exception.ResourceNotFoundException;
import com.fleetmanager.analytics.model.DriverMetrics;
import com.fleetmanager.analytics.model.EntityKind;
import com.fleetmanager.analytics.model.FleetMetrics;
import com.fleetmanager.analytics.model.MonthlyBreakdown;
import com.fleetmanager.analytics.model.Ranking;
import com.fleetmanager.analytics.model.RankingMetric;
import com.fleetmanager.analytics.model.VehicleMetrics;
import com.fleetmanager.analytics.service.AnalyticsEngine;
import com.fleetmanager.analytics.service.CacheableDataService;
import com.fleetmanager.analytics.service.FleetReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Analytics REST API
 *
 * Periods are half-open: records with a timestamp in [from, to) are included.
 * Datetime format: ISO 8601, yyyy-MM-ddTHH:mm:ss
 *
 * Endpoints:
 *  GET /api/analytics/drivers/{driverId}?from=&to=           — driver metrics
 *  GET /api/analytics/vehicles/{vehicleId}?from=&to=         — vehicle metrics
 *  GET /api/analytics/drivers/ranking?from=&to=&metric=      — driver ranking
 *  GET /api/analytics/vehicles/ranking?from=&to=&metric=     — vehicle ranking
 *  GET /api/analytics/drivers/{driverId}/monthly?year=       — 12-month breakdown
 *  GET /api/analytics/vehicles/{vehicleId}/monthly?year=     — 12-month breakdown
 *  GET /api/analytics/drivers/summary?from=&to=              — all drivers, by km
 *
 * Results are returned unformatted; units, rounding and currency belong to the client.
 */
@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
@Slf4j
public class AnalyticsController {

    private final AnalyticsEngine analyticsEngine;
    private final FleetReportService fleetReportService;
    private final CacheableDataService cacheableDataService;

    @GetMapping("/drivers/{driverId}")
    public ResponseEntity<ApiResponse> getDriverMetrics(
            @PathVariable Long driverId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        log.info("ANALYTICS API: GET metrics for driver #{} [{}, {})", driverId, from, to);
        requireDriver(driverId);

        DriverMetrics metrics = analyticsEngine.computeDriverMetrics(driverId, from, to);
        return ResponseEntity.ok(ApiResponse.success(metrics, summaryMessage("driver", driverId, metrics)));
    }

    @GetMapping("/vehicles/{vehicleId}")
    public ResponseEntity<ApiResponse> getVehicleMetrics(
            @PathVariable Long vehicleId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        log.info("ANALYTICS API: GET metrics for vehicle #{} [{}, {})", vehicleId, from, to);
        requireVehicle(vehicleId);

        VehicleMetrics metrics = analyticsEngine.computeVehicleMetrics(vehicleId, from, to);
        return ResponseEntity.ok(ApiResponse.success(metrics, summaryMessage("vehicle", vehicleId, metrics)));
    }

    /**
     * metric: total_km | efficiency_l_per_100km | total_cost | trip_count
     */
    @GetMapping("/drivers/ranking")
    public ResponseEntity<ApiResponse> rankDrivers(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "total_km") String metric) {

        log.info("ANALYTICS API: GET driver ranking by {} [{}, {})", metric, from, to);
        Ranking ranking = analyticsEngine.rankDrivers(from, to, RankingMetric.fromParam(metric));
        return ResponseEntity.ok(ApiResponse.success(ranking,
                "Ranked " + ranking.getEntries().size() + " driver(s) by " + ranking.getMetric().getParamName()));
    }

    @GetMapping("/vehicles/ranking")
    public ResponseEntity<ApiResponse> rankVehicles(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "total_km") String metric) {

        log.info("ANALYTICS API: GET vehicle ranking by {} [{}, {})", metric, from, to);
        Ranking ranking = analyticsEngine.rankVehicles(from, to, RankingMetric.fromParam(metric));
        return ResponseEntity.ok(ApiResponse.success(ranking,
                "Ranked " + ranking.getEntries().size() + " vehicle(s) by " + ranking.getMetric().getParamName()));
    }

    @GetMapping("/drivers/{driverId}/monthly")
    public ResponseEntity<ApiResponse> getDriverMonthly(@PathVariable Long driverId, @RequestParam int year) {
        log.info("ANALYTICS API: GET monthly breakdown for driver #{} ({})", driverId, year);
        requireDriver(driverId);
        MonthlyBreakdown breakdown = analyticsEngine.monthlyBreakdown(driverId, EntityKind.DRIVER, year);
        return ResponseEntity.ok(ApiResponse.success(breakdown,
                "Monthly breakdown for driver #" + driverId + ", " + year));
    }

    @GetMapping("/vehicles/{vehicleId}/monthly")
    public ResponseEntity<ApiResponse> getVehicleMonthly(@PathVariable Long vehicleId, @RequestParam int year) {
        log.info("ANALYTICS API: GET monthly breakdown for vehicle #{} ({})", vehicleId, year);
        requireVehicle(vehicleId);
        MonthlyBreakdown breakdown = analyticsEngine.monthlyBreakdown(vehicleId, EntityKind.VEHICLE, year);
        return ResponseEntity.ok(ApiResponse.success(breakdown,
                "Monthly breakdown for vehicle #" + vehicleId + ", " + year));
    }

    @GetMapping("/drivers/summary")
    public ResponseEntity<ApiResponse> summarizeDrivers(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {

        log.info("ANALYTICS API: GET driver summary [{}, {})", from, to);
        List<DriverMetrics> summary = fleetReportService.summarizeDrivers(from, to);
        return ResponseEntity.ok(ApiResponse.success(summary, "Summary for " + summary.size() + " driver(s)"));
    }

    private static String summaryMessage(String label, Long id, FleetMetrics metrics) {
        if (metrics.isEmpty()) {
            return "No trips for " + label + " #" + id + " in the requested period";
        }
        return "Metrics for " + label + " #" + id + ": " + metrics.getTripCount() + " trip(s)";
    }

    private void requireDriver(Long driverId) {
        if (!cacheableDataService.getDriverIds().contains(driverId)) {
            throw new ResourceNotFoundException("Driver not found with ID: " + driverId);
        }
    }

    private void requireVehicle(Long vehicleId) {
        if (!cacheableDataService.getVehicleIds().contains(vehicleId)) {
            throw new ResourceNotFoundException("Vehicle not found with ID: " + vehicleId);
        }
    }
}
