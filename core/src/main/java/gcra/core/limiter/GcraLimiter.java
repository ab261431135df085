package gcra.core.limiter;

import gcra.core.clock.Clock;
import gcra.core.model.GcraResult;
import gcra.core.model.Quota;
import gcra.core.state.GcraState;

/**
 * One rate-limited resource with its quota and clock bound in.
 *
 * Same algorithm as {@link GcraState}; this only saves callers from passing the quota and the
 * current time on every call.
 *
 * Thread-safety: synchronized para soportar acceso concurrente.
 */
public final class GcraLimiter {
    private final Clock clock;
    private final Quota quota;
    private final GcraState state = new GcraState();

    public GcraLimiter(Clock clock, Quota quota) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (quota == null) throw new IllegalArgumentException("quota cannot be null");
        this.clock = clock;
        this.quota = quota;
    }

    public synchronized GcraResult tryAcquire(int permits) {
        return state.checkAndModify(quota, permits, clock.nowNanos());
    }

    public synchronized void release(int permits) {
        state.revert(quota, permits, clock.nowNanos());
    }

    public synchronized int remaining() {
        return state.remainingResources(quota, clock.nowNanos());
    }

    public synchronized void reset() {
        state.reset();
    }

    public Quota quota() {
        return quota;
    }
}
