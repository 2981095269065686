package com.fleetmanager.analytics.store;

import com.fleetmanager.analytics.entity.Driver;
import com.fleetmanager.analytics.entity.FuelLog;
import com.fleetmanager.analytics.entity.Movement;
import com.fleetmanager.analytics.entity.Vehicle;
import com.fleetmanager.analytics.model.DriverMetrics;
import com.fleetmanager.analytics.model.EntityKind;
import com.fleetmanager.analytics.model.FuelRecord;
import com.fleetmanager.analytics.model.MovementRecord;
import com.fleetmanager.analytics.model.Period;
import com.fleetmanager.analytics.model.Ranking;
import com.fleetmanager.analytics.model.RankingEntry;
import com.fleetmanager.analytics.model.RankingMetric;
import com.fleetmanager.analytics.repository.DriverRepository;
import com.fleetmanager.analytics.repository.FuelLogRepository;
import com.fleetmanager.analytics.repository.MovementRepository;
import com.fleetmanager.analytics.repository.VehicleRepository;
import com.fleetmanager.analytics.service.AnalyticsEngine;
import com.fleetmanager.analytics.service.CacheableDataService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * JpaRecordStore against the embedded H2 schema, plus the engine on top of it.
 */
@DataJpaTest
@Import({JpaRecordStore.class, CacheableDataService.class, AnalyticsEngine.class})
class JpaRecordStoreTest {

    @Autowired private JpaRecordStore     recordStore;
    @Autowired private AnalyticsEngine    analyticsEngine;
    @Autowired private DriverRepository   driverRepository;
    @Autowired private VehicleRepository  vehicleRepository;
    @Autowired private MovementRepository movementRepository;
    @Autowired private FuelLogRepository  fuelLogRepository;

    private static final LocalDateTime MAR_1 = LocalDateTime.of(2024, 3, 1, 0, 0);
    private static final LocalDateTime APR_1 = LocalDateTime.of(2024, 4, 1, 0, 0);

    private Long nikos;
    private Long maria;
    private Long van;

    @BeforeEach
    void setUp() {
        nikos = driverRepository.save(Driver.builder().name("Nikos").surname("Papadopoulos").build()).getId();
        maria = driverRepository.save(Driver.builder().name("Maria").surname("Georgiou").build()).getId();
        van = vehicleRepository.save(Vehicle.builder().plate("IKY-1234").brand("Ford Transit").build()).getId();
    }

    private Movement saveTrip(Long driverId, LocalDateTime start, double km) {
        return movementRepository.save(Movement.builder()
                .driverId(driverId)
                .vehicleId(van)
                .startTime(start)
                .endTime(start.plusHours(1))
                .distanceKm(km)
                .build());
    }

    private FuelLog saveFuel(Long driverId, LocalDateTime at, double liters, Double cost) {
        return fuelLogRepository.save(FuelLog.builder()
                .driverId(driverId)
                .vehicleId(van)
                .timestamp(at)
                .liters(liters)
                .cost(cost)
                .build());
    }

    @Test
    @DisplayName("Movements filtered by driver and half-open window, ordered by start then id")
    void fetchMovements_filteredAndOrdered() {
        Movement late = saveTrip(nikos, MAR_1.plusDays(20), 70.0);
        Movement early = saveTrip(nikos, MAR_1, 50.0);
        saveTrip(nikos, APR_1, 99.0);                 // end bound excluded
        saveTrip(maria, MAR_1.plusDays(3), 10.0);     // other driver

        List<MovementRecord> records = recordStore.fetchMovements(
                RecordFilter.forEntity(EntityKind.DRIVER, nikos, Period.of(MAR_1, APR_1)));

        assertThat(records).extracting(MovementRecord::getId).containsExactly(early.getId(), late.getId());
        assertThat(records.get(0).getDriverId()).isEqualTo(nikos);
        assertThat(records.get(0).getDistanceKm()).isEqualTo(50.0);
        assertThat(records.get(0).isClosed()).isTrue();
    }

    @Test
    @DisplayName("Period-wide filter returns every driver's records")
    void fetchMovements_periodFilter_allDrivers() {
        saveTrip(nikos, MAR_1.plusDays(1), 5.0);
        saveTrip(maria, MAR_1.plusDays(2), 6.0);

        List<MovementRecord> records = recordStore.fetchMovements(RecordFilter.forPeriod(Period.of(MAR_1, APR_1)));

        assertThat(records).extracting(MovementRecord::getDriverId).containsExactly(nikos, maria);
    }

    @Test
    @DisplayName("Fuel without a recorded cost is read back as zero cost")
    void fetchFuelRecords_missingCostIsZero() {
        saveFuel(null, MAR_1.plusDays(1), 30.0, null);

        List<FuelRecord> records = recordStore.fetchFuelRecords(
                RecordFilter.forEntity(EntityKind.VEHICLE, van, Period.of(MAR_1, APR_1)));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getCost()).isZero();
        assertThat(records.get(0).getDriverId()).isNull();
        assertThat(records.get(0).getLiters()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Driver roster is returned in ascending id order")
    void fetchDriverIds_ascending() {
        assertThat(recordStore.fetchDriverIds()).containsExactly(nikos, maria);
        assertThat(recordStore.fetchVehicleIds()).containsExactly(van);
    }

    @Test
    @DisplayName("End to end: two March trips and one refill → 120 km at 10.0 L/100km")
    void engineOverJpaStore_marchScenario() {
        saveTrip(nikos, MAR_1.plusDays(4), 50.0);
        saveTrip(nikos, MAR_1.plusDays(19), 70.0);
        saveFuel(nikos, MAR_1.plusDays(9), 12.0, 21.6);

        DriverMetrics metrics = analyticsEngine.computeDriverMetrics(nikos, MAR_1, APR_1);

        assertThat(metrics.getTotalKm()).isEqualTo(120.0);
        assertThat(metrics.getTotalLiters()).isEqualTo(12.0);
        assertThat(metrics.getEfficiencyLPer100Km()).isEqualTo(10.0);
        assertThat(metrics.getTripCount()).isEqualTo(2);
        assertThat(metrics.getVehicleUsage()).singleElement()
                .satisfies(usage -> assertThat(usage.getEntityId()).isEqualTo(van));

        Ranking ranking = analyticsEngine.rankDrivers(MAR_1, APR_1, RankingMetric.EFFICIENCY_L_PER_100KM);
        assertThat(ranking.getEntries()).extracting(RankingEntry::getEntityId).containsExactly(nikos, maria);
        assertThat(ranking.getEntries().get(1).isInsufficientData()).isTrue();
    }
}
