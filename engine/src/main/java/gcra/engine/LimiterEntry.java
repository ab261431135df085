package gcra.engine;

import gcra.core.state.GcraState;

import java.util.concurrent.locks.ReentrantLock;

/**
 * One key's GCRA state bundled with the lock that guards it.
 *
 * GcraState is not thread-safe: the lock must be held for every access to {@link #getState()}.
 */
final class LimiterEntry {

    private final GcraState state;
    private final ReentrantLock lock;

    LimiterEntry() {
        this.state = new GcraState();
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    /**
     * MUST be called while holding the lock.
     */
    GcraState getState() {
        return state;
    }

    ReentrantLock getLock() {
        return lock;
    }
}
