package gcra.core.clock;

/**
 * Real system clock - uses System.nanoTime().
 * Use this in production; tests inject {@link ManualClock} instead.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
