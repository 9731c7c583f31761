package com.patterns.builder;

import com.patterns.builder.fn.WorkerBuilder;
import com.patterns.builder.markup.MarkupBuilder;
import com.patterns.builder.member.MemberBuilder;
import com.patterns.builder.person.Person;
import com.patterns.builder.vehicle.SpecifyingCategory;
import com.patterns.builder.vehicle.VehicleBuilder;

/**
 * Builder Catalogue -- five shapes of the Builder pattern.
 *
 * <ul>
 * <li><b>Fluent</b> ({@link MarkupBuilder}): every mutator returns the builder
 * itself.</li>
 * <li><b>Recursive generics</b> ({@link Person.Builder}): inherited mutators
 * return the most-derived builder type.</li>
 * <li><b>Stepwise</b> ({@link VehicleBuilder}): each step returns an interface
 * exposing only the next legal step.</li>
 * <li><b>Functional</b> ({@link WorkerBuilder}): steps are queued as functions
 * and folded over a fresh subject on build.</li>
 * <li><b>Faceted</b> ({@link MemberBuilder}): several facades write to one
 * shared object.</li>
 * </ul>
 */
public final class Builders {

    private Builders() {
        // Prevent instantiation of utility class
    }

    public static MarkupBuilder markup(String rootName) {
        return MarkupBuilder.create(rootName);
    }

    public static Person.Builder person() {
        return Person.newBuilder();
    }

    public static SpecifyingCategory vehicle() {
        return VehicleBuilder.create();
    }

    public static WorkerBuilder worker() {
        return new WorkerBuilder();
    }

    public static MemberBuilder member() {
        return new MemberBuilder();
    }
}
