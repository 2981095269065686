package com.fleetmanager.analytics.store;

import com.fleetmanager.analytics.model.FuelRecord;
import com.fleetmanager.analytics.model.MovementRecord;

import java.util.List;

/**
 * Read-only source of the records the analytics engine aggregates.
 *
 * Implementations return records already narrowed to the filter, ordered by
 * timestamp then id. The engine never writes through this interface.
 */
public interface RecordStore {

    List<MovementRecord> fetchMovements(RecordFilter filter);

    List<FuelRecord> fetchFuelRecords(RecordFilter filter);

    /** Every registered driver id, ascending. */
    List<Long> fetchDriverIds();

    /** Every registered vehicle id, ascending. */
    List<Long> fetchVehicleIds();
}
