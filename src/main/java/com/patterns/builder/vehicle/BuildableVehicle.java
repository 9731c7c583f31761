package com.patterns.builder.vehicle;

/**
 * Terminal stage of {@link VehicleBuilder}.
 */
public interface BuildableVehicle {
    Vehicle build();
}
