package org.javai.rollout.experiment;

import org.javai.rollout.Observation;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Decides whether a candidate observation agrees with the control observation.
 *
 * <p>Comparators see the raw values, before any clean transform is applied.
 *
 * @param <T> the value type
 */
@FunctionalInterface
public interface ObservationComparator<T> {

    boolean matches(Observation<T> control, Observation<T> candidate);

    /**
     * The default comparison. When both sides succeeded their values must be equal
     * per {@link Objects#equals}. When both failed they agree. When exactly one
     * failed they disagree.
     */
    static <T> ObservationComparator<T> standard() {
        return byValue(Objects::equals);
    }

    /**
     * Compares successful values with the given predicate and falls back to
     * error symmetry whenever either side failed.
     *
     * <pre>{@code
     * ObservationComparator<Order> sameTotal =
     *     ObservationComparator.byValue((a, b) -> a.total().compareTo(b.total()) == 0);
     * }</pre>
     */
    static <T> ObservationComparator<T> byValue(BiPredicate<? super T, ? super T> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return (control, candidate) -> {
            if (control.failed() || candidate.failed()) {
                return control.failed() && candidate.failed();
            }
            return predicate.test(control.value(), candidate.value());
        };
    }

    /**
     * Like {@link #standard()}, but two failures only agree when they are of the same
     * exception class.
     */
    static <T> ObservationComparator<T> strictErrors() {
        return (control, candidate) -> {
            if (control.failed() && candidate.failed()) {
                return control.error().get().sameTypeAs(candidate.error().get());
            }
            return ObservationComparator.<T>standard().matches(control, candidate);
        };
    }
}
