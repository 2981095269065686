package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.exception.InvalidWindowException;
import com.fleetmanager.analytics.model.DriverMetrics;
import com.fleetmanager.analytics.store.RecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FleetReportService — all-drivers summary.
 *
 * The executor runs tasks on the calling thread so results are deterministic.
 *
 * Test cases:
 *  1. summarizeDrivers_sortedByKmThenId
 *  2. summarizeDrivers_invalidWindow_failsBeforeFanOut
 *  3. summarizeDrivers_engineFailure_propagatesOriginalException
 *  4. summarizeDrivers_noDrivers_emptySummary
 */
@ExtendWith(MockitoExtension.class)
class FleetReportServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private AnalyticsEngine analyticsEngine;
    @Mock private RecordStore     recordStore;

    private FleetReportService fleetReportService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final LocalDateTime FROM = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime TO   = LocalDateTime.of(2025, 1, 1, 0, 0);

    @BeforeEach
    void setUp() {
        fleetReportService = new FleetReportService(analyticsEngine, recordStore, Runnable::run);
    }

    private static DriverMetrics metrics(Long driverId, double km) {
        return DriverMetrics.builder()
                .driverId(driverId)
                .totalKm(km)
                .tripCount(km > 0 ? 1 : 0)
                .empty(km == 0)
                .vehicleUsage(List.of())
                .purposeBreakdown(List.of())
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 1 — Highest km first, driver id on ties
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Summary ordered by total km descending, then driver id ascending")
    void summarizeDrivers_sortedByKmThenId() {
        when(recordStore.fetchDriverIds()).thenReturn(List.of(1L, 2L, 3L, 4L));
        when(analyticsEngine.computeDriverMetrics(1L, FROM, TO)).thenReturn(metrics(1L, 150.0));
        when(analyticsEngine.computeDriverMetrics(2L, FROM, TO)).thenReturn(metrics(2L, 300.0));
        when(analyticsEngine.computeDriverMetrics(3L, FROM, TO)).thenReturn(metrics(3L, 150.0));
        when(analyticsEngine.computeDriverMetrics(4L, FROM, TO)).thenReturn(metrics(4L, 0.0));

        List<DriverMetrics> summary = fleetReportService.summarizeDrivers(FROM, TO);

        assertThat(summary).extracting(DriverMetrics::getDriverId).containsExactly(2L, 1L, 3L, 4L);
        verify(analyticsEngine, times(4)).computeDriverMetrics(anyLong(), eq(FROM), eq(TO));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 2 — Invalid window rejected before any work is scheduled
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Start after end → InvalidWindowException, nothing fetched or computed")
    void summarizeDrivers_invalidWindow_failsBeforeFanOut() {
        assertThatThrownBy(() -> fleetReportService.summarizeDrivers(TO, FROM))
                .isInstanceOf(InvalidWindowException.class);

        verifyNoInteractions(recordStore, analyticsEngine);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 3 — Failure inside a task surfaces unwrapped
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Engine failure for one driver → the original exception, not a CompletionException")
    void summarizeDrivers_engineFailure_propagatesOriginalException() {
        when(recordStore.fetchDriverIds()).thenReturn(List.of(1L));
        when(analyticsEngine.computeDriverMetrics(1L, FROM, TO))
                .thenThrow(new IllegalStateException("store unavailable"));

        assertThatThrownBy(() -> fleetReportService.summarizeDrivers(FROM, TO))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("store unavailable");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 4 — Empty roster
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("No registered drivers → empty summary")
    void summarizeDrivers_noDrivers_emptySummary() {
        when(recordStore.fetchDriverIds()).thenReturn(List.of());

        assertThat(fleetReportService.summarizeDrivers(FROM, TO)).isEmpty();
        verifyNoInteractions(analyticsEngine);
    }
}
