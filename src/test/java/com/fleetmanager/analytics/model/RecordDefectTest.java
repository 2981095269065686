package com.fleetmanager.analytics.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

class RecordDefectTest {

    private static final LocalDateTime T = LocalDateTime.of(2024, 3, 5, 8, 0);

    private static MovementRecord.MovementRecordBuilder movement() {
        return MovementRecord.builder().id(1L).driverId(1L).vehicleId(1L)
                .startTimestamp(T).endTimestamp(T.plusHours(1)).distanceKm(10.0);
    }

    private static FuelRecord.FuelRecordBuilder fuel() {
        return FuelRecord.builder().id(1L).vehicleId(1L).timestamp(T).liters(10.0).cost(18.0);
    }

    @Test
    @DisplayName("Movement defects are detected; open and zero-km movements are fine")
    void movementDefects() {
        assertThat(RecordDefect.of(movement().build())).isEmpty();
        assertThat(RecordDefect.of(movement().endTimestamp(null).build())).isEmpty();
        assertThat(RecordDefect.of(movement().distanceKm(0.0).build())).isEmpty();

        assertThat(RecordDefect.of(movement().startTimestamp(null).build())).contains(RecordDefect.MISSING_TIMESTAMP);
        assertThat(RecordDefect.of(movement().endTimestamp(T.minusMinutes(1)).build()))
                .contains(RecordDefect.END_BEFORE_START);
        assertThat(RecordDefect.of(movement().distanceKm(-0.5).build())).contains(RecordDefect.NEGATIVE_DISTANCE);
        assertThat(RecordDefect.of(movement().distanceKm(Double.NaN).build())).contains(RecordDefect.NON_FINITE_DISTANCE);
        assertThat(RecordDefect.of(movement().distanceKm(Double.POSITIVE_INFINITY).build()))
                .contains(RecordDefect.NON_FINITE_DISTANCE);
    }

    @Test
    @DisplayName("Fuel defects are detected; zero cost is fine")
    void fuelDefects() {
        assertThat(RecordDefect.of(fuel().build())).isEmpty();
        assertThat(RecordDefect.of(fuel().cost(0.0).build())).isEmpty();

        assertThat(RecordDefect.of(fuel().timestamp(null).build())).contains(RecordDefect.MISSING_TIMESTAMP);
        assertThat(RecordDefect.of(fuel().liters(0.0).build())).contains(RecordDefect.NON_POSITIVE_LITERS);
        assertThat(RecordDefect.of(fuel().liters(-2.0).build())).contains(RecordDefect.NON_POSITIVE_LITERS);
        assertThat(RecordDefect.of(fuel().liters(Double.NaN).build())).contains(RecordDefect.NON_POSITIVE_LITERS);
        assertThat(RecordDefect.of(fuel().cost(-1.0).build())).contains(RecordDefect.NEGATIVE_COST);
    }
}
