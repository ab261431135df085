package gcra.engine;

import gcra.core.clock.Clock;
import gcra.core.model.CostExceedsCapacityException;
import gcra.core.model.GcraResult;
import gcra.core.model.Quota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe GCRA rate limiter for many keys in one process.
 *
 * Features:
 * - One GcraState per key (user, API key, IP...), created lazily on first use
 * - ReentrantLock per key: contention only between calls for the same key
 * - LRU eviction bounded by maxKeys; an evicted key comes back with a full burst
 * - Default quota from config, or a quota supplied per call
 * - Clock injection for deterministic tests
 *
 * Usage example:
 * <pre>
 * RateLimiterConfig config = RateLimiterConfig.of(100, Duration.ofMinutes(1));
 * RateLimiterEngine engine = new RateLimiterEngine(SystemClock.instance(), config);
 *
 * GcraResult result = engine.tryAcquire("user:123", 1);
 * if (result.isAllowed()) {
 *     // Process request
 * } else {
 *     // Reject with retry-after: result.retryAfter()
 * }
 * </pre>
 */
public final class RateLimiterEngine {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final Clock clock;
    private final RateLimiterConfig config;
    private final LRUCache<String, LimiterEntry> limiters;

    /**
     * @param clock Time source (injected for testability)
     * @param config Default quota and key bound
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateLimiterEngine(Clock clock, RateLimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.config = config;
        this.limiters = new LRUCache<>(config.maxKeys(), (key, entry) ->
            log.debug("Evicting rate limit state for key '{}' (maxKeys={})", key, config.maxKeys()));
    }

    /**
     * Attempts to admit {@code permits} units for {@code key} under the default quota.
     *
     * @throws IllegalArgumentException if key is null or permits <= 0
     * @throws CostExceedsCapacityException if permits exceed the quota's burst
     */
    public GcraResult tryAcquire(String key, int permits) {
        return tryAcquire(key, config.quota(), permits);
    }

    /**
     * Same as {@link #tryAcquire(String, int)} with a caller-supplied quota. The key's state is
     * shared across quotas, so switching quotas for a key can change admission abruptly.
     */
    public GcraResult tryAcquire(String key, Quota quota, int permits) {
        validate(key, quota, permits);

        LimiterEntry entry = limiters.getOrCreate(key, this::newEntry);
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            return entry.getState().checkAndModify(quota, permits, clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gives back {@code permits} units previously admitted for {@code key} under the default
     * quota. Unknown keys are left untracked.
     */
    public void revert(String key, int permits) {
        revert(key, config.quota(), permits);
    }

    /**
     * Same as {@link #revert(String, int)} for a key admitted under a caller-supplied quota.
     * Pass the quota the units were admitted with: the rewind is one of its emission
     * intervals per unit.
     */
    public void revert(String key, Quota quota, int permits) {
        validate(key, quota, permits);

        LimiterEntry entry = limiters.get(key);
        if (entry == null) {
            return;
        }
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            entry.getState().revert(quota, permits, clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Units {@code key} could be admitted right now under the default quota.
     * Does not start tracking unknown keys.
     */
    public int remaining(String key) {
        return remaining(key, config.quota());
    }

    /**
     * Units {@code key} could be admitted right now under {@code quota}.
     * Does not start tracking unknown keys.
     */
    public int remaining(String key, Quota quota) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (quota == null) {
            throw new IllegalArgumentException("quota cannot be null");
        }

        LimiterEntry entry = limiters.get(key);
        if (entry == null) {
            return quota.maxBurst();
        }
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            return entry.getState().remainingResources(quota, clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores the full burst for {@code key}.
     */
    public void reset(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        LimiterEntry entry = limiters.get(key);
        if (entry == null) {
            return;
        }
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            entry.getState().reset();
        } finally {
            lock.unlock();
        }
    }

    public boolean isTracked(String key) {
        return limiters.containsKey(key);
    }

    public int size() {
        return limiters.size();
    }

    public int maxSize() {
        return limiters.maxSize();
    }

    /**
     * Drops every key. Primarily useful for testing.
     */
    public void clear() {
        limiters.clear();
    }

    public RateLimiterConfig getConfig() {
        return config;
    }

    private LimiterEntry newEntry(String key) {
        log.trace("Tracking new rate limit key '{}'", key);
        return new LimiterEntry();
    }

    private static void validate(String key, Quota quota, int permits) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (quota == null) {
            throw new IllegalArgumentException("quota cannot be null");
        }
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be > 0, got: " + permits);
        }
        // checked before a new key is tracked
        if (permits > quota.maxBurst()) {
            throw new CostExceedsCapacityException(permits, quota.maxBurst());
        }
    }
}
