package org.javai.rollout.bucketing;

import java.util.Random;

/**
 * Deterministic percentage membership keyed by subject identity.
 *
 * <p>Each call builds a fresh {@link Random} seeded only with the subject id and draws
 * one integer in [0, 100). {@code java.util.Random} fixes its algorithm in its
 * contract, so the same subject lands on the same side of the gate in every call,
 * thread and replica. No generator state is shared between calls.
 */
public final class Bucketing {

    private Bucketing() {
        // Utility class
    }

    /**
     * Returns whether the subject falls inside the given percentage.
     *
     * @param subjectId the subject whose id seeds the draw
     * @param percentage share of subjects admitted; {@code <= 0} admits none, {@code >= 100} admits all
     */
    public static boolean inBucket(long subjectId, int percentage) {
        if (percentage <= 0) {
            return false;
        }
        if (percentage >= 100) {
            return true;
        }
        return bucketOf(subjectId) < percentage;
    }

    /**
     * Returns the subject's bucket in [0, 100).
     */
    public static int bucketOf(long subjectId) {
        return new Random(subjectId).nextInt(100);
    }
}
