package com.fleetmanager.analytics.controller;

import com.fleetmanager.analytics.dto.ApiResponse;
import com.fleetmanager.analytics.dto.FuelRecordRequest;
import com.fleetmanager.analytics.dto.MovementRequest;
import com.fleetmanager.analytics.entity.FuelLog;
import com.fleetmanager.analytics.entity.Movement;
import com.fleetmanager.analytics.service.RecordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for recording movements and refuels
 */
@RestController
@RequestMapping("/api/records")
@RequiredArgsConstructor
@Slf4j
public class RecordController {

    private final RecordService recordService;

    @PostMapping("/movements")
    public ResponseEntity<ApiResponse> recordMovement(@Valid @RequestBody MovementRequest request) {
        log.info("Received movement for driver: {}, vehicle: {}", request.getDriverId(), request.getVehicleId());
        Movement movement = recordService.recordMovement(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(movement, "Movement #" + movement.getId() + " recorded"));
    }

    @PostMapping("/fuel")
    public ResponseEntity<ApiResponse> recordFuel(@Valid @RequestBody FuelRecordRequest request) {
        log.info("Received fuel record for vehicle: {}, liters: {}", request.getVehicleId(), request.getLiters());
        FuelLog fuelLog = recordService.recordFuel(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(fuelLog, "Fuel record #" + fuelLog.getId() + " recorded"));
    }
}
