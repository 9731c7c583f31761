package com.patterns.builder.fn;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Functional Builder -- records construction as a list of deferred steps.
 *
 * Nothing touches the subject until {@link #build()}, which creates a fresh
 * instance and folds every step over it in insertion order. Later steps see
 * (and may overwrite) the effects of earlier ones.
 *
 * Subclasses add vocabulary by wrapping {@link #with(Consumer)}:
 *
 * <pre>
 * public WorkerBuilder called(String name) {
 *     return with(w -&gt; w.setName(name));
 * }
 * </pre>
 *
 * @param <S>    subject type
 * @param <SELF> concrete builder type returned from every chaining call
 */
public abstract class FunctionalBuilder<S, SELF extends FunctionalBuilder<S, SELF>> {
    private static final Logger log = LogManager.getLogger(FunctionalBuilder.class);

    private final Supplier<S> factory;
    private final List<UnaryOperator<S>> steps = new ArrayList<>();

    protected FunctionalBuilder(Supplier<S> factory) {
        if (factory == null)
            throw new IllegalArgumentException("factory must not be null");
        this.factory = factory;
    }

    /**
     * Queues an in-place mutation of the subject.
     */
    public SELF with(Consumer<S> action) {
        if (action == null)
            throw new IllegalArgumentException("action must not be null");
        return map(s -> {
            action.accept(s);
            return s;
        });
    }

    /**
     * Queues a step that may return a different subject instance.
     */
    public SELF map(UnaryOperator<S> step) {
        if (step == null)
            throw new IllegalArgumentException("step must not be null");
        steps.add(step);
        return self();
    }

    /**
     * Applies all queued steps, left to right, to a fresh subject. May be
     * called repeatedly; each call starts over.
     */
    public S build() {
        S subject = factory.get();
        for (UnaryOperator<S> step : steps)
            subject = step.apply(subject);
        log.debug("Built {} from {} steps", subject, steps.size());
        return subject;
    }

    public int stepCount() {
        return steps.size();
    }

    @SuppressWarnings("unchecked")
    protected final SELF self() {
        return (SELF) this;
    }
}
