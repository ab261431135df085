package gcra.engine;

import gcra.core.model.Quota;

import java.time.Duration;

/**
 * Configuration for a {@link RateLimiterEngine}.
 *
 * @param quota Quota applied to keys that don't pass their own
 * @param maxKeys Maximum number of keys tracked at once (LRU eviction beyond this)
 */
public record RateLimiterConfig(
    Quota quota,
    int maxKeys
) {
    public static final int DEFAULT_MAX_KEYS = 10_000;

    public RateLimiterConfig {
        if (quota == null) throw new IllegalArgumentException("quota cannot be null");
        if (maxKeys <= 0) throw new IllegalArgumentException("maxKeys must be > 0");
    }

    /**
     * @param maxBurst Units admissible at once per key
     * @param period Time for a key's full burst to replenish
     * @return Configuration tracking up to {@link #DEFAULT_MAX_KEYS} keys
     * @throws gcra.core.model.InvalidQuotaException if the quota is invalid
     */
    public static RateLimiterConfig of(int maxBurst, Duration period) {
        return new RateLimiterConfig(new Quota(maxBurst, period), DEFAULT_MAX_KEYS);
    }

    public RateLimiterConfig withMaxKeys(int maxKeys) {
        return new RateLimiterConfig(quota, maxKeys);
    }
}
