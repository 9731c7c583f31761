package com.patterns.builder.person;

import lombok.Data;

/**
 * Flat value object assembled by {@link Person.Builder}.
 */
@Data
public class Person {
    private String name;
    private String position;

    /** Concrete end of the builder chain; SELF is bound here. */
    public static final class Builder extends PersonJobBuilder<Builder> {
    }

    /** Entry point: a ready-to-chain builder. */
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Name: " + name + ", Position: " + position;
    }
}
