package com.patterns.builder.vehicle;

/**
 * Stage 1 of {@link VehicleBuilder}: the category must be chosen first.
 */
public interface SpecifyingCategory {
    SpecifyingWheelSize ofType(VehicleCategory category);
}
