package com.patterns.builder.vehicle;

/**
 * Stage 2 of {@link VehicleBuilder}: wheel size, validated against the
 * category chosen in stage 1.
 */
public interface SpecifyingWheelSize {
    /**
     * @param size Wheel size in inches.
     * @return The terminal stage.
     * @throws IllegalArgumentException if the size is outside the category's
     *                                  allowed range.
     */
    BuildableVehicle withWheels(int size);
}
