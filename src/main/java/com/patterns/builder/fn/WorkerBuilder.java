package com.patterns.builder.fn;

/**
 * Functional builder for {@link Worker}. Further vocabulary lives in
 * {@link WorkerBuilders}.
 */
public final class WorkerBuilder extends FunctionalBuilder<Worker, WorkerBuilder> {

    public WorkerBuilder() {
        super(Worker::new);
    }

    public WorkerBuilder called(String name) {
        return with(w -> w.setName(name));
    }
}
