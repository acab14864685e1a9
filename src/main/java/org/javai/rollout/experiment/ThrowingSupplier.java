package org.javai.rollout.experiment;

/**
 * A supplier that may throw a checked exception.
 * Used for the control and candidate code paths of an {@link Experiment}.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
