package com.patterns.builder.person;

/**
 * First stage: personal details.
 *
 * @param <SELF> the most-derived builder type, returned from every mutator
 */
public abstract class PersonInfoBuilder<SELF extends PersonInfoBuilder<SELF>> extends PersonBuilder {

    public SELF called(String name) {
        person.setName(name);
        return self();
    }

    @SuppressWarnings("unchecked")
    protected final SELF self() {
        return (SELF) this;
    }
}
