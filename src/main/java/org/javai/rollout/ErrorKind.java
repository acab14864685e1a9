package org.javai.rollout;

import java.util.Objects;

/**
 * Describes an error raised by a control or candidate, in a form fit for publishing.
 *
 * @param type The exception class name
 * @param fingerprint A stable identifier for deduplication (simple name plus throwing frame)
 * @param message The exception message (may be null)
 */
public record ErrorKind(String type, String fingerprint, String message) {

    public ErrorKind {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
    }

    public static ErrorKind fromThrowable(Throwable t) {
        Objects.requireNonNull(t, "throwable must not be null");
        return new ErrorKind(t.getClass().getName(), computeFingerprint(t), t.getMessage());
    }

    /**
     * Returns whether both errors are of the same exception class.
     */
    public boolean sameTypeAs(ErrorKind other) {
        return other != null && type.equals(other.type);
    }

    private static String computeFingerprint(Throwable t) {
        StackTraceElement[] stack = t.getStackTrace();
        if (stack.length == 0) {
            return t.getClass().getSimpleName();
        }
        StackTraceElement top = stack[0];
        return t.getClass().getSimpleName() + "@" + top.getClassName() + ":" + top.getLineNumber();
    }
}
