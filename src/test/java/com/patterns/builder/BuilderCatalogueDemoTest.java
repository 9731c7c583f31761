package com.patterns.builder;

import com.patterns.builder.vehicle.Vehicle;
import com.patterns.builder.vehicle.VehicleCategory;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class BuilderCatalogueDemoTest {

    @Test
    public void testDemoPrintsEverySection() {
        var buffer = new ByteArrayOutputStream();
        BuilderCatalogueDemo.run(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        String out = buffer.toString(StandardCharsets.UTF_8);

        assertTrue(out.contains("<ul>\n  <li>\n    hello\n  </li>\n  <li>\n    world\n  </li>\n</ul>\n"));
        assertTrue(out.contains("Name: Mykola, Position: quant"));
        assertTrue(out.contains(new Vehicle(VehicleCategory.CROSSOVER, 18).toString()));
        assertTrue(out.contains("name=Sarah"));
        assertTrue(out.contains("position=Developer"));
        assertTrue(out.contains("streetAddress=123 London Road"));
        assertTrue(out.contains("annualIncome=3000"));
    }

    @Test
    public void testEntryPointsReturnFreshBuilders() {
        assertNotSame(Builders.member(), Builders.member());
        assertNotSame(Builders.worker(), Builders.worker());
        assertNotSame(Builders.person(), Builders.person());
        assertEquals("ol", Builders.markup("ol").root().name());
        assertEquals(VehicleCategory.SEDAN,
                Builders.vehicle().ofType(VehicleCategory.SEDAN).withWheels(15).build().category());
    }
}
