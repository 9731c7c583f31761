package com.patterns.builder.vehicle;

import org.junit.Test;

import static org.junit.Assert.*;

public class VehicleBuilderTest {

    @Test
    public void testSedanWithinRange() {
        Vehicle v = VehicleBuilder.create()
                .ofType(VehicleCategory.SEDAN)
                .withWheels(16)
                .build();

        assertEquals(new Vehicle(VehicleCategory.SEDAN, 16), v);
    }

    @Test
    public void testCrossoverWithinRange() {
        Vehicle v = VehicleBuilder.create()
                .ofType(VehicleCategory.CROSSOVER)
                .withWheels(18)
                .build();

        assertEquals(VehicleCategory.CROSSOVER, v.category());
        assertEquals(18, v.wheelSize());
    }

    @Test
    public void testSedanOversizeRejected() {
        SpecifyingWheelSize stage = VehicleBuilder.create().ofType(VehicleCategory.SEDAN);
        try {
            stage.withWheels(18);
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("SEDAN"));
        }
    }

    @Test
    public void testCrossoverUndersizeRejected() {
        try {
            VehicleBuilder.create().ofType(VehicleCategory.CROSSOVER).withWheels(10);
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("CROSSOVER"));
        }
    }

    @Test
    public void testBoundariesInclusive() {
        for (VehicleCategory c : VehicleCategory.values()) {
            assertEquals(c.minWheelSize(),
                    VehicleBuilder.create().ofType(c).withWheels(c.minWheelSize()).build().wheelSize());
            assertEquals(c.maxWheelSize(),
                    VehicleBuilder.create().ofType(c).withWheels(c.maxWheelSize()).build().wheelSize());

            assertFalse(c.accepts(c.minWheelSize() - 1));
            assertFalse(c.accepts(c.maxWheelSize() + 1));
        }
    }

    @Test
    public void testSeventeenFitsBothCategories() {
        assertTrue(VehicleCategory.SEDAN.accepts(17));
        assertTrue(VehicleCategory.CROSSOVER.accepts(17));
    }

    @Test
    public void testRejectedSizeCanBeRetried() {
        SpecifyingWheelSize stage = VehicleBuilder.create().ofType(VehicleCategory.SEDAN);
        try {
            stage.withWheels(21);
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException expected) {
            // fall through to a valid size on the same stage
        }
        assertEquals(15, stage.withWheels(15).build().wheelSize());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullCategoryRejected() {
        VehicleBuilder.create().ofType(null);
    }

    @Test
    public void testRetainedFirstStageCannotChangeBuiltCategory() {
        SpecifyingCategory start = VehicleBuilder.create();
        BuildableVehicle sedan = start.ofType(VehicleCategory.SEDAN).withWheels(15);

        // Choosing another category from the same handle starts a new vehicle
        SpecifyingWheelSize crossover = start.ofType(VehicleCategory.CROSSOVER);

        Vehicle v = sedan.build();
        assertEquals(VehicleCategory.SEDAN, v.category());
        assertTrue(v.category().accepts(v.wheelSize()));

        try {
            crossover.withWheels(15);
            fail("Should have thrown IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("CROSSOVER"));
        }
    }
}
