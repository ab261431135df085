package gcra.core.clock;

/**
 * Monotonic time source, in nanoseconds.
 *
 * Values are only meaningful relative to each other (same contract as
 * {@link System#nanoTime()}): compare instants by subtraction, never by sign.
 */
public interface Clock {
    long nowNanos();
}
