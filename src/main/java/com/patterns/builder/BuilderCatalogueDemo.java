package com.patterns.builder;

import static com.patterns.builder.fn.WorkerBuilders.worksAs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.patterns.builder.fn.Worker;
import com.patterns.builder.member.Member;
import com.patterns.builder.person.Person;
import com.patterns.builder.vehicle.Vehicle;
import com.patterns.builder.vehicle.VehicleCategory;

import java.io.PrintStream;

/**
 * Runs every builder in the catalogue once and prints what it produced.
 */
public class BuilderCatalogueDemo {
    private static final Logger log = LogManager.getLogger(BuilderCatalogueDemo.class);

    public static void main(String[] args) {
        run(System.out);
    }

    public static void run(PrintStream out) {
        log.info("Start -> Builder");

        // 1. Fluent
        var markup = Builders.markup("ul");
        markup.addChild("li", "hello")
                .addChild("li", "world");
        out.println("--- Fluent Builder ---");
        out.print(markup.render());

        // 2. Recursive generics
        Person me = Builders.person()
                .called("Mykola")
                .worksAsA("quant")
                .build();
        out.println("--- Recursive Generic Builder ---");
        out.println(me);

        // 3. Stepwise
        Vehicle vehicle = Builders.vehicle() // SpecifyingCategory
                .ofType(VehicleCategory.CROSSOVER) // SpecifyingWheelSize
                .withWheels(18) // BuildableVehicle
                .build();
        out.println("--- Stepwise Builder ---");
        out.println(vehicle);

        // 4. Functional
        Worker worker = worksAs(Builders.worker().called("Sarah"), "Developer")
                .build();
        out.println("--- Functional Builder ---");
        out.println(worker);

        // 5. Faceted
        Member member = Builders.member()
                .address().at("123 London Road")
                        .in("London")
                        .withPostcode("SW12AC")
                .works().at("Company Name")
                        .asA("Position Name")
                        .earning(3000)
                .build();
        out.println("--- Faceted Builder ---");
        out.println(member);

        log.info("End -> Builder");
    }
}
