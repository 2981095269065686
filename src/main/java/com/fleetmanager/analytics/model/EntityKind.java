package com.fleetmanager.analytics.model;

/**
 * The two entity types metrics can be keyed by.
 */
public enum EntityKind {

    DRIVER {
        @Override
        public Long idOf(MovementRecord movement) {
            return movement.getDriverId();
        }

        @Override
        public Long idOf(FuelRecord fuel) {
            return fuel.getDriverId();
        }

        @Override
        public Long counterpartOf(MovementRecord movement) {
            return movement.getVehicleId();
        }
    },

    VEHICLE {
        @Override
        public Long idOf(MovementRecord movement) {
            return movement.getVehicleId();
        }

        @Override
        public Long idOf(FuelRecord fuel) {
            return fuel.getVehicleId();
        }

        @Override
        public Long counterpartOf(MovementRecord movement) {
            return movement.getDriverId();
        }
    };

    public abstract Long idOf(MovementRecord movement);

    /** May be null: fuel records do not always name a driver. */
    public abstract Long idOf(FuelRecord fuel);

    /** The vehicle of a driver's movement, or the driver of a vehicle's movement. */
    public abstract Long counterpartOf(MovementRecord movement);
}
