package com.patterns.builder.vehicle;

/**
 * Finished vehicle. {@link VehicleBuilder} only produces instances whose
 * wheel size fits the category; the record constructor itself does not check.
 */
public record Vehicle(VehicleCategory category, int wheelSize) {
}
