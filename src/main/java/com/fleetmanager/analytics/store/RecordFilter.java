package com.fleetmanager.analytics.store;

import com.fleetmanager.analytics.model.EntityKind;
import com.fleetmanager.analytics.model.Period;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Selects records in [from, to), optionally for one driver and/or one vehicle.
 */
@Value
@Builder
public class RecordFilter {

    Long driverId;
    Long vehicleId;
    LocalDateTime from;
    LocalDateTime to;

    public static RecordFilter forEntity(EntityKind kind, Long entityId, Period period) {
        RecordFilterBuilder builder = RecordFilter.builder()
                .from(period.getStart())
                .to(period.getEnd());
        if (kind == EntityKind.DRIVER) {
            builder.driverId(entityId);
        } else {
            builder.vehicleId(entityId);
        }
        return builder.build();
    }

    public static RecordFilter forPeriod(Period period) {
        return RecordFilter.builder().from(period.getStart()).to(period.getEnd()).build();
    }
}
