package org.javai.rollout;

/**
 * Base class for errors raised by the rollout library itself.
 * Errors raised by control or candidate code are never wrapped in this type.
 */
public class RolloutException extends RuntimeException {

    public RolloutException(String message) {
        super(message);
    }

    public RolloutException(String message, Throwable cause) {
        super(message, cause);
    }
}
