package gcra.core.clock;

import java.time.Duration;

/**
 * Clock that only moves when told to. Not thread-safe; meant for single-threaded tests.
 */
public final class ManualClock implements Clock {
    private long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public void setNanos(long value) {
        now = value;
    }
}
