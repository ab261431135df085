package gcra.core.model;

import java.time.Duration;

/**
 * Outcome of a single GCRA check.
 *
 * A REJECT is a routine result, not an error: {@code retryAfterNanos} is the minimum wait
 * before the identical request would be admitted, assuming no other admissions in between.
 * ALLOW always carries zero.
 */
public record GcraResult(
    Decision decision,
    long retryAfterNanos
) {
    private static final GcraResult ALLOWED = new GcraResult(Decision.ALLOW, 0L);

    public GcraResult {
        if (decision == null) throw new IllegalArgumentException("decision cannot be null");
        if (retryAfterNanos < 0) throw new IllegalArgumentException("retryAfterNanos < 0");
    }

    public static GcraResult allow() {
        return ALLOWED;
    }

    public static GcraResult notAllowed(long retryAfterNanos) {
        return new GcraResult(Decision.REJECT, Math.max(0L, retryAfterNanos));
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public Duration retryAfter() {
        return Duration.ofNanos(retryAfterNanos);
    }
}
