package io.redisoperator.reconcile;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-key exponential backoff: the n-th consecutive failure waits {@code initial * 2^(n-1)},
 * never more than the cap. A success resets the key.
 */
public class ExponentialBackoff<K> {

    private final long initialMillis;
    private final long maxMillis;
    private final Map<K, Integer> failures = new ConcurrentHashMap<>();

    public ExponentialBackoff(long initialMillis, long maxMillis) {
        if (initialMillis <= 0 || maxMillis < initialMillis) {
            throw new IllegalArgumentException("Invalid backoff bounds " + initialMillis + ".." + maxMillis);
        }
        this.initialMillis = initialMillis;
        this.maxMillis = maxMillis;
    }

    public Duration next(K key) {
        return next(key, maxMillis);
    }

    /**
     * Records a failure of {@code key} and returns the delay before its next attempt,
     * capped at the smaller of {@code capMillis} and the configured maximum.
     */
    public Duration next(K key, long capMillis) {
        int attempt = failures.merge(key, 1, Integer::sum);
        long cap = Math.min(capMillis, maxMillis);
        long delay = initialMillis;
        for (int i = 1; i < attempt && delay < cap; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(delay, cap));
    }

    public int failures(K key) {
        return failures.getOrDefault(key, 0);
    }

    public void forget(K key) {
        failures.remove(key);
    }
}
