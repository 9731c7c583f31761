package com.patterns.builder.fn;

/**
 * Extra {@link WorkerBuilder} steps defined outside the builder class.
 * Each one only queues a step through the public {@code with} hook, so new
 * vocabulary never requires editing or subclassing the builder.
 */
public final class WorkerBuilders {

    private WorkerBuilders() {
        // Utility class
    }

    public static WorkerBuilder worksAs(WorkerBuilder builder, String position) {
        return builder.with(w -> w.setPosition(position));
    }
}
