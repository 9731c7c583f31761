package com.patterns.builder.vehicle;

import lombok.extern.log4j.Log4j2;

/**
 * Stepwise Builder -- enforces construction order through the type system.
 *
 * Each call returns a different capability interface exposing only the next
 * legal operation:
 *
 * SpecifyingCategory --ofType--> SpecifyingWheelSize --withWheels--> BuildableVehicle --build--> Vehicle
 *
 * A single private implementation backs all three stages. Calling
 * {@code withWheels} before {@code ofType} cannot be expressed, so no runtime
 * ordering check exists. Every {@code ofType} call starts a new instance, so a
 * retained first-stage handle cannot change the category of a vehicle whose
 * wheels were already validated.
 */
@Log4j2
public final class VehicleBuilder {

    private VehicleBuilder() {
        // Entry point only
    }

    public static SpecifyingCategory create() {
        return new Impl(null);
    }

    private static final class Impl implements SpecifyingCategory, SpecifyingWheelSize, BuildableVehicle {
        private final VehicleCategory category;
        private int wheelSize;

        private Impl(VehicleCategory category) {
            this.category = category;
        }

        @Override
        public SpecifyingWheelSize ofType(VehicleCategory category) {
            if (category == null)
                throw new IllegalArgumentException("category must not be null");
            return new Impl(category);
        }

        @Override
        public BuildableVehicle withWheels(int size) {
            if (!category.accepts(size))
                throw new IllegalArgumentException(String.format("Wrong size of wheel for %s: %d (allowed %d..%d)",
                        category, size, category.minWheelSize(), category.maxWheelSize()));
            this.wheelSize = size;
            return this;
        }

        @Override
        public Vehicle build() {
            log.debug("Built {} on {}-inch wheels", category, wheelSize);
            return new Vehicle(category, wheelSize);
        }
    }
}
