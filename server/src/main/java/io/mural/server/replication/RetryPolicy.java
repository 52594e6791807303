package io.mural.server.replication;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for push retries.
 * <p>
 * The delay before attempt {@code n + 1} (after {@code n} failed attempts) is
 * {@code min(base * 2^(n-1), max)}. No retry is scheduled once maxAttempts
 * attempts have failed.
 *
 * @param base        delay after the first failure
 * @param max         upper bound for any single delay
 * @param maxAttempts total attempts per push, the first one included
 */
public record RetryPolicy(Duration base, Duration max, int maxAttempts) {

    public RetryPolicy {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (base.isNegative() || base.isZero()) throw new IllegalArgumentException("base must be > 0");
        if (max.compareTo(base) < 0) throw new IllegalArgumentException("max must be >= base");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
    }

    /** 200 ms doubling up to 5 s, five attempts. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofMillis(200), Duration.ofSeconds(5), 5);
    }

    /**
     * @param failedAttempts number of attempts that have failed so far (>= 1)
     */
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts <= 0) throw new IllegalArgumentException("failedAttempts must be >= 1");
        long baseMs = base.toMillis();
        long maxMs = max.toMillis();
        int shift = Math.min(failedAttempts - 1, 30);
        long delay = baseMs << shift;
        if (delay <= 0 || delay > maxMs) {
            delay = maxMs;
        }
        return Duration.ofMillis(delay);
    }

    public boolean hasAttemptsLeft(int failedAttempts) {
        return failedAttempts < maxAttempts;
    }
}
