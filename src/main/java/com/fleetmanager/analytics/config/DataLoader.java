package com.fleetmanager.analytics.config;

import com.fleetmanager.analytics.entity.*;
import com.fleetmanager.analytics.repository.*;
import com.fleetmanager.analytics.service.CacheableDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Data loader that runs on application startup
 * Inserts a small fleet with a year of trips and refuels for trying the analytics API
 *
 * Enabled with analytics.sample-data.enabled=true
 */
@Component
@ConditionalOnProperty(name = "analytics.sample-data.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private final DriverRepository driverRepository;
    private final VehicleRepository vehicleRepository;
    private final MovementRepository movementRepository;
    private final FuelLogRepository fuelLogRepository;
    private final CacheableDataService cacheableDataService;

    @Override
    public void run(String... args) {
        log.info("Starting sample data initialization...");

        if (driverRepository.count() > 0) {
            log.info("Data already exists, skipping initialization");
            return;
        }

        Driver nikos = driverRepository.save(Driver.builder().name("Nikos").surname("Papadopoulos").build());
        Driver maria = driverRepository.save(Driver.builder().name("Maria").surname("Georgiou").build());
        // no trips: shows up last in efficiency rankings
        Driver eleni = driverRepository.save(Driver.builder().name("Eleni").surname("Dimitriou")
                .notes("Relief driver").build());

        Vehicle van = vehicleRepository.save(Vehicle.builder()
                .plate("IKY-1234").brand("Ford Transit").vehicleType("VAN").build());
        Vehicle car = vehicleRepository.save(Vehicle.builder()
                .plate("IKY-5678").brand("Toyota Corolla").vehicleType("CAR").build());

        int year = LocalDate.now().getYear();
        int trips = 0;
        int refuels = 0;
        for (int month = 1; month <= 12; month += 2) {
            LocalDateTime day = LocalDate.of(year, month, 10).atTime(8, 0);

            movementRepository.save(movement(van, nikos, day, 3, 45.0 + month, 1L));
            movementRepository.save(movement(car, nikos, day.plusDays(2), 1, 18.5, 2L));
            movementRepository.save(movement(car, maria, day.plusDays(5), 2, 62.0 + month * 2, 1L));
            trips += 3;

            fuelLogRepository.save(fuel(van, nikos, day.plusDays(3), 6.0, 10.8));
            fuelLogRepository.save(fuel(car, maria, day.plusDays(6), 5.5, 9.6));
            refuels += 2;
        }

        // end before start: kept so the skippedRecords counter has something to show
        movementRepository.save(Movement.builder()
                .vehicleId(van.getId())
                .driverId(maria.getId())
                .startTime(LocalDate.of(year, 3, 15).atTime(17, 0))
                .endTime(LocalDate.of(year, 3, 15).atTime(9, 0))
                .distanceKm(30.0)
                .notes("Imported with swapped times")
                .build());
        fuelLogRepository.save(fuel(car, eleni, LocalDate.of(year, 4, 2).atTime(12, 0), 20.0, 36.0));

        cacheableDataService.evictFleetCaches();

        log.info("Sample data initialization completed successfully!");
        log.info("========================================");
        log.info("Drivers: {} ({}, {}, {})", driverRepository.count(), nikos.getId(), maria.getId(), eleni.getId());
        log.info("Vehicles: {} ({} {}, {} {})", vehicleRepository.count(),
                van.getId(), van.getPlate(), car.getId(), car.getPlate());
        log.info("Movements: {} valid + 1 malformed, fuel records: {}, year: {}", trips, refuels + 1, year);
        log.info("========================================");
    }

    private static Movement movement(Vehicle vehicle, Driver driver, LocalDateTime start, int hours,
                                     double km, Long purposeId) {
        return Movement.builder()
                .vehicleId(vehicle.getId())
                .driverId(driver.getId())
                .startTime(start)
                .endTime(start.plusHours(hours))
                .distanceKm(km)
                .purposeId(purposeId)
                .build();
    }

    private static FuelLog fuel(Vehicle vehicle, Driver driver, LocalDateTime at, double liters, double cost) {
        return FuelLog.builder()
                .vehicleId(vehicle.getId())
                .driverId(driver.getId())
                .timestamp(at)
                .liters(liters)
                .cost(cost)
                .build();
    }
}
