package gcra.core.state;

import gcra.core.clock.Clock;
import gcra.core.model.CostExceedsCapacityException;
import gcra.core.model.GcraResult;
import gcra.core.model.Quota;

import java.util.OptionalLong;

/**
 * GCRA (virtual scheduling) state for one rate-limited resource:
 * - tat: theoretical arrival time, the instant at which the schedule is next idle
 * - unset tat: never used, full burst available
 *
 * Pros: O(1) memory (a single timestamp), exact retry-after, no refill loop.
 * Cons: the quota travels with each call, so switching quotas on one state can step
 * admission up or down abruptly.
 *
 * Thread-safety: NONE. Concurrent calls on the same instance are a data race; guard it with a
 * lock (see GcraLimiter / RateLimiterEngine) or confine it to one thread.
 *
 * Instants are nanoseconds on the caller's {@link Clock} time line and are compared by
 * subtraction, so {@link System#nanoTime()} values work as the JDK prescribes.
 */
public final class GcraState {
    private boolean hasTat;
    private long tat;

    public GcraState() {
    }

    /**
     * Restores a state from a previously observed theoretical arrival time.
     */
    public static GcraState at(long tatNanos) {
        GcraState state = new GcraState();
        state.hasTat = true;
        state.tat = tatNanos;
        return state;
    }

    public GcraResult checkAndModify(Quota quota, int cost, Clock clock) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        return checkAndModify(quota, cost, clock.nowNanos());
    }

    /**
     * Admits {@code cost} units at {@code nowNanos} if the quota allows it, advancing the
     * theoretical arrival time. A rejection leaves the state untouched.
     *
     * <p>Admitted iff {@code max(tat, now) + cost * emissionInterval - burstTolerance <= now}.
     * The tolerance is {@link Quota#burstToleranceNanos()} rather than the raw period: the two
     * are equal when {@code maxBurst} divides the period in nanoseconds, otherwise the floored
     * tolerance keeps an instantaneous burst from exceeding {@code maxBurst}.
     *
     * @return ALLOW, or REJECT with the wait after which this exact cost would be admitted
     * @throws IllegalArgumentException if quota is null or cost < 1
     * @throws CostExceedsCapacityException if cost > quota.maxBurst()
     */
    public GcraResult checkAndModify(Quota quota, int cost, long nowNanos) {
        long increment = validate(quota, cost);

        long base = (hasTat && tat - nowNanos > 0) ? tat : nowNanos;
        long newTat = base + increment;
        long allowAt = newTat - quota.burstToleranceNanos();

        if (allowAt - nowNanos <= 0) {
            tat = newTat;
            hasTat = true;
            return GcraResult.allow();
        }
        return GcraResult.notAllowed(allowAt - nowNanos);
    }

    public void revert(Quota quota, int cost, Clock clock) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        revert(quota, cost, clock.nowNanos());
    }

    /**
     * Gives back {@code cost} units from an earlier admission, e.g. when the guarded work
     * never ran. If the schedule already drained before {@code nowNanos} the state is reset.
     */
    public void revert(Quota quota, int cost, long nowNanos) {
        long increment = validate(quota, cost);
        if (!hasTat) {
            return;
        }
        if (tat - nowNanos < 0) {
            reset();
        } else {
            tat -= increment;
        }
    }

    /**
     * Units that could be admitted at {@code nowNanos}. Partially replenished units count as
     * consumed (ceiling), so the result never promises an admission that would be rejected.
     */
    public int remainingResources(Quota quota, long nowNanos) {
        if (quota == null) throw new IllegalArgumentException("quota cannot be null");
        if (!hasTat || tat - nowNanos <= 0) {
            return quota.maxBurst();
        }

        long interval = quota.emissionIntervalNanos();
        long untilTat = tat - nowNanos;
        long consumed = (untilTat + interval - 1) / interval;
        return (int) Math.max(0L, quota.maxBurst() - consumed);
    }

    public int remainingResources(Quota quota, Clock clock) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        return remainingResources(quota, clock.nowNanos());
    }

    public void reset() {
        hasTat = false;
        tat = 0L;
    }

    public OptionalLong theoreticalArrivalTime() {
        return hasTat ? OptionalLong.of(tat) : OptionalLong.empty();
    }

    private static long validate(Quota quota, int cost) {
        if (quota == null) throw new IllegalArgumentException("quota cannot be null");
        if (cost <= 0) throw new IllegalArgumentException("cost must be > 0, got: " + cost);
        if (cost > quota.maxBurst()) throw new CostExceedsCapacityException(cost, quota.maxBurst());
        return quota.incrementIntervalNanos(cost);
    }

    @Override
    public String toString() {
        return hasTat ? "GcraState{tat=" + tat + "}" : "GcraState{tat=unset}";
    }
}
