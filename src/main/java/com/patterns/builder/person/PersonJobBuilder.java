package com.patterns.builder.person;

/**
 * Second stage: employment details. Inherits {@link #called(String)} without
 * losing the concrete return type.
 *
 * @param <SELF> the most-derived builder type
 */
public abstract class PersonJobBuilder<SELF extends PersonJobBuilder<SELF>> extends PersonInfoBuilder<SELF> {

    public SELF worksAsA(String position) {
        person.setPosition(position);
        return self();
    }
}
