package org.javai.rollout;

import java.util.Objects;

/**
 * An eligibility decision. The reason is diagnostic text for logs and is never parsed.
 *
 * @param eligible whether the subject may take part in the comparison
 * @param reason why
 */
public record Verdict(boolean eligible, String reason) {

    public Verdict {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public static Verdict eligible(String reason) {
        return new Verdict(true, reason);
    }

    public static Verdict ineligible(String reason) {
        return new Verdict(false, reason);
    }
}
