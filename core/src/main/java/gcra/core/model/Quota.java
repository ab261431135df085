package gcra.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable rate limit: up to {@code maxBurst} units at once, replenished over {@code period}.
 *
 * <p>Derived values:
 * <ul>
 *   <li>emission interval: {@code period / maxBurst}, floored to whole nanoseconds</li>
 *   <li>burst tolerance: {@code emissionInterval * maxBurst}, how far ahead of now an
 *       admission may push the schedule. Equal to {@code period} whenever {@code maxBurst}
 *       divides it; otherwise shorter by less than {@code maxBurst} nanoseconds, so a burst
 *       never exceeds {@code maxBurst}.</li>
 * </ul>
 *
 * <p>Thread-safety: immutable, share freely.
 */
public final class Quota {

    private final int maxBurst;
    private final Duration period;
    private final long periodNanos;
    private final long emissionIntervalNanos;

    /**
     * @param maxBurst units admissible instantaneously, must be >= 1
     * @param period time for {@code maxBurst} units to replenish, must be > 0
     * @throws InvalidQuotaException if either constraint is violated, or the period is too
     *         short to give every unit at least one nanosecond
     */
    public Quota(int maxBurst, Duration period) {
        if (maxBurst < 1) {
            throw new InvalidQuotaException("maxBurst must be >= 1, got: " + maxBurst);
        }
        if (period == null) {
            throw new InvalidQuotaException("period cannot be null");
        }
        if (period.isZero() || period.isNegative()) {
            throw new InvalidQuotaException("period must be > 0, got: " + period);
        }

        long nanos;
        try {
            nanos = period.toNanos();
        } catch (ArithmeticException e) {
            throw new InvalidQuotaException("period too long to express in nanoseconds: " + period, e);
        }

        long interval = nanos / maxBurst;
        if (interval == 0) {
            throw new InvalidQuotaException(
                "period " + period + " is shorter than one nanosecond per unit of maxBurst " + maxBurst);
        }

        this.maxBurst = maxBurst;
        this.period = period;
        this.periodNanos = nanos;
        this.emissionIntervalNanos = interval;
    }

    public static Quota perSecond(int maxBurst) {
        return new Quota(maxBurst, Duration.ofSeconds(1));
    }

    public static Quota perMinute(int maxBurst) {
        return new Quota(maxBurst, Duration.ofMinutes(1));
    }

    public static Quota perHour(int maxBurst) {
        return new Quota(maxBurst, Duration.ofHours(1));
    }

    public int maxBurst() {
        return maxBurst;
    }

    public Duration period() {
        return period;
    }

    public long periodNanos() {
        return periodNanos;
    }

    public Duration emissionInterval() {
        return Duration.ofNanos(emissionIntervalNanos);
    }

    public long emissionIntervalNanos() {
        return emissionIntervalNanos;
    }

    public long burstToleranceNanos() {
        return emissionIntervalNanos * maxBurst;
    }

    /**
     * Virtual time consumed by a request of the given cost. Callers validate {@code cost}
     * against {@link #maxBurst()} first; within that range the product cannot overflow.
     */
    public long incrementIntervalNanos(int cost) {
        return emissionIntervalNanos * cost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quota)) return false;
        Quota other = (Quota) o;
        return maxBurst == other.maxBurst && periodNanos == other.periodNanos;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxBurst, periodNanos);
    }

    @Override
    public String toString() {
        return "Quota{maxBurst=" + maxBurst + ", period=" + period
            + ", emissionInterval=" + emissionInterval() + "}";
    }
}
