package com.patterns.builder.person;

/**
 * Root of the person builder hierarchy. Owns the target instance.
 */
public abstract class PersonBuilder {
    protected final Person person = new Person();

    public Person build() {
        return person;
    }
}
