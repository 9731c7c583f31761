package com.patterns.builder.vehicle;

/**
 * Vehicle body styles, each with its inclusive range of allowed wheel sizes
 * (inches).
 */
public enum VehicleCategory {
    SEDAN(15, 17),
    CROSSOVER(17, 20);

    private final int minWheelSize;
    private final int maxWheelSize;

    VehicleCategory(int minWheelSize, int maxWheelSize) {
        this.minWheelSize = minWheelSize;
        this.maxWheelSize = maxWheelSize;
    }

    public int minWheelSize() {
        return minWheelSize;
    }

    public int maxWheelSize() {
        return maxWheelSize;
    }

    public boolean accepts(int wheelSize) {
        return wheelSize >= minWheelSize && wheelSize <= maxWheelSize;
    }
}
