package com.fleetmanager.analytics.store;

import com.fleetmanager.analytics.entity.FuelLog;
import com.fleetmanager.analytics.entity.Movement;
import com.fleetmanager.analytics.model.FuelRecord;
import com.fleetmanager.analytics.model.MovementRecord;
import com.fleetmanager.analytics.repository.FuelLogRepository;
import com.fleetmanager.analytics.repository.MovementRepository;
import com.fleetmanager.analytics.service.CacheableDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * RecordStore backed by the JPA repositories.
 * Rosters come through CacheableDataService so rankings do not hit the DB on every call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaRecordStore implements RecordStore {

    private final MovementRepository movementRepository;
    private final FuelLogRepository fuelLogRepository;
    private final CacheableDataService cacheableDataService;

    @Override
    @Transactional(readOnly = true)
    public List<MovementRecord> fetchMovements(RecordFilter filter) {
        List<MovementRecord> records = movementRepository
                .findInWindow(filter.getDriverId(), filter.getVehicleId(), filter.getFrom(), filter.getTo())
                .stream()
                .map(JpaRecordStore::toRecord)
                .toList();
        log.debug("Fetched {} movement(s) — driver: {}, vehicle: {}, window: [{}, {})",
                records.size(), filter.getDriverId(), filter.getVehicleId(), filter.getFrom(), filter.getTo());
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FuelRecord> fetchFuelRecords(RecordFilter filter) {
        List<FuelRecord> records = fuelLogRepository
                .findInWindow(filter.getDriverId(), filter.getVehicleId(), filter.getFrom(), filter.getTo())
                .stream()
                .map(JpaRecordStore::toRecord)
                .toList();
        log.debug("Fetched {} fuel record(s) — driver: {}, vehicle: {}, window: [{}, {})",
                records.size(), filter.getDriverId(), filter.getVehicleId(), filter.getFrom(), filter.getTo());
        return records;
    }

    @Override
    public List<Long> fetchDriverIds() {
        return cacheableDataService.getDriverIds();
    }

    @Override
    public List<Long> fetchVehicleIds() {
        return cacheableDataService.getVehicleIds();
    }

    static MovementRecord toRecord(Movement m) {
        return MovementRecord.builder()
                .id(m.getId())
                .vehicleId(m.getVehicleId())
                .driverId(m.getDriverId())
                .startTimestamp(m.getStartTime())
                .endTimestamp(m.getEndTime())
                .distanceKm(m.getDistanceKm() != null ? m.getDistanceKm() : Double.NaN)
                .purposeId(m.getPurposeId())
                .notes(m.getNotes())
                .build();
    }

    static FuelRecord toRecord(FuelLog f) {
        return FuelRecord.builder()
                .id(f.getId())
                .vehicleId(f.getVehicleId())
                .driverId(f.getDriverId())
                .timestamp(f.getTimestamp())
                .liters(f.getLiters() != null ? f.getLiters() : Double.NaN)
                .cost(f.getCost() != null ? f.getCost() : 0.0)
                .odometerAtFill(f.getOdometerKm())
                .build();
    }
}
