package com.fleetmanager.analytics.service;

import com.fleetmanager.analytics.dto.FuelRecordRequest;
import com.fleetmanager.analytics.dto.MovementRequest;
import com.fleetmanager.analytics.entity.FuelLog;
import com.fleetmanager.analytics.entity.Movement;
import com.fleetmanager.analytics.exception.ResourceNotFoundException;
import com.fleetmanager.analytics.repository.FuelLogRepository;
import com.fleetmanager.analytics.repository.MovementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes movement and fuel records. The only writer of the record tables;
 * the analytics side reads them through the RecordStore.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordService {

    private final MovementRepository movementRepository;
    private final FuelLogRepository fuelLogRepository;
    private final CacheableDataService cacheableDataService;

    @Transactional
    public Movement recordMovement(MovementRequest request) {
        requireDriver(request.getDriverId());
        requireVehicle(request.getVehicleId());

        Movement movement = movementRepository.save(Movement.builder()
                .vehicleId(request.getVehicleId())
                .driverId(request.getDriverId())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .distanceKm(request.getDistanceKm())
                .purposeId(request.getPurposeId())
                .notes(request.getNotes())
                .build());

        if (movement.getEndTime() != null && movement.getEndTime().isBefore(movement.getStartTime())) {
            // stored as submitted; analytics will skip it
            log.warn("Movement #{} ends before it starts ({} < {})",
                    movement.getId(), movement.getEndTime(), movement.getStartTime());
        }
        log.info("Movement #{} recorded — driver: {}, vehicle: {}, km: {}",
                movement.getId(), movement.getDriverId(), movement.getVehicleId(), movement.getDistanceKm());
        return movement;
    }

    @Transactional
    public FuelLog recordFuel(FuelRecordRequest request) {
        requireVehicle(request.getVehicleId());
        if (request.getDriverId() != null) {
            requireDriver(request.getDriverId());
        }

        FuelLog fuelLog = fuelLogRepository.save(FuelLog.builder()
                .vehicleId(request.getVehicleId())
                .driverId(request.getDriverId())
                .timestamp(request.getTimestamp())
                .liters(request.getLiters())
                .cost(request.getCost() != null ? request.getCost() : 0.0)
                .odometerKm(request.getOdometerKm())
                .build());

        log.info("Fuel record #{} saved — vehicle: {}, driver: {}, liters: {}",
                fuelLog.getId(), fuelLog.getVehicleId(), fuelLog.getDriverId(), fuelLog.getLiters());
        return fuelLog;
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
