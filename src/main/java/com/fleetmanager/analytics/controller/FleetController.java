package com.fleetmanager.analytics.controller;

import com.fleetmanager.analytics.dto.ApiResponse;
import com.fleetmanager.analytics.dto.DriverRequest;
import com.fleetmanager.analytics.dto.VehicleRequest;
import com.fleetmanager.analytics.entity.Driver;
import com.fleetmanager.analytics.entity.Vehicle;
import com.fleetmanager.analytics.repository.DriverRepository;
import com.fleetmanager.analytics.repository.VehicleRepository;
import com.fleetmanager.analytics.service.CacheableDataService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Driver and vehicle registration.
 * Every write evicts the roster caches so rankings pick up the new entity at once.
 */
@RestController
@RequestMapping("/api/fleet")
@RequiredArgsConstructor
@Slf4j
public class FleetController {

    private final DriverRepository driverRepository;
    private final VehicleRepository vehicleRepository;
    private final CacheableDataService cacheableDataService;

    @GetMapping("/drivers")
    public ResponseEntity<ApiResponse> listDrivers() {
        List<Driver> drivers = cacheableDataService.getDrivers();
        return ResponseEntity.ok(ApiResponse.success(drivers, "Found " + drivers.size() + " driver(s)"));
    }

    @GetMapping("/vehicles")
    public ResponseEntity<ApiResponse> listVehicles() {
        List<Vehicle> vehicles = cacheableDataService.getVehicles();
        return ResponseEntity.ok(ApiResponse.success(vehicles, "Found " + vehicles.size() + " vehicle(s)"));
    }

    @PostMapping("/drivers")
    @Transactional
    public ResponseEntity<ApiResponse> registerDriver(@Valid @RequestBody DriverRequest req) {
        Driver driver = driverRepository.save(Driver.builder()
                .name(req.getName().trim())
                .surname(req.getSurname().trim())
                .notes(req.getNotes())
                .build());
        cacheableDataService.evictFleetCaches();

        log.info("Driver #{} registered: {} {}", driver.getId(), driver.getName(), driver.getSurname());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(driver, "Driver #" + driver.getId() + " registered"));
    }

    @PostMapping("/vehicles")
    @Transactional
    public ResponseEntity<ApiResponse> registerVehicle(@Valid @RequestBody VehicleRequest req) {
        String plate = req.getPlate().trim().toUpperCase(Locale.ROOT);
        if (vehicleRepository.existsByPlate(plate)) {
            return ResponseEntity.badRequest().body(
                    ApiResponse.error("Vehicle with plate " + plate + " already exists"));
        }

        Vehicle vehicle = vehicleRepository.save(Vehicle.builder()
                .plate(plate)
                .brand(req.getBrand())
                .vehicleType(req.getVehicleType())
                .build());
        cacheableDataService.evictFleetCaches();

        log.info("Vehicle #{} registered: {}", vehicle.getId(), vehicle.getPlate());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(vehicle, "Vehicle #" + vehicle.getId() + " registered"));
    }
}
