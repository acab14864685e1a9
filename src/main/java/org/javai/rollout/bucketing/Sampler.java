package org.javai.rollout.bucketing;

import java.util.Random;

/**
 * Samples a percentage of calls with no regard to who is calling.
 *
 * <p>Unlike {@link Bucketing}, repeated calls with the same input may disagree. Use it
 * only where per-subject consistency does not matter, e.g. shadowing a fraction of
 * anonymous traffic.
 */
@FunctionalInterface
public interface Sampler {

    /**
     * Draws once and returns whether this call is sampled.
     *
     * @param percentage share of calls sampled; {@code <= 0} samples none, {@code >= 100} samples all
     */
    boolean sample(int percentage);

    /**
     * A sampler over one shared stream, seeded when it is created.
     * {@link Random} is thread-safe, so the instance may be shared across requests.
     */
    static Sampler shared() {
        return fromRandom(new Random());
    }

    /**
     * A sampler over a stream with a fixed seed. Useful for testing.
     */
    static Sampler seeded(long seed) {
        return fromRandom(new Random(seed));
    }

    private static Sampler fromRandom(Random random) {
        return percentage -> {
            if (percentage <= 0) {
                return false;
            }
            if (percentage >= 100) {
                return true;
            }
            return random.nextInt(100) < percentage;
        };
    }
}
